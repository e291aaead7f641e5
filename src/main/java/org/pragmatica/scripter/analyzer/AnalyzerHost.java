package org.pragmatica.scripter.analyzer;

import org.pragmatica.scripter.error.AnalysisError;
import org.pragmatica.scripter.error.AnalysisException;
import org.pragmatica.scripter.syntax.SourceFile;
import org.pragmatica.scripter.syntax.SourceProvider;
import org.pragmatica.scripter.tree.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for analyzing the files of a parsed program.
 *
 * <p>The host owns the {@link SourceRegistry}, so every path maps to one {@link Source} root
 * for the lifetime of the host, and repeated analysis of a path fills that root only once.
 *
 * <p>Not thread-safe.
 */
public final class AnalyzerHost {
    private static final Logger LOG = LoggerFactory.getLogger(AnalyzerHost.class);

    private final SourceProvider provider;
    private final AnalyzerConfig config;
    private final SourceRegistry registry = new SourceRegistry();

    public AnalyzerHost(SourceProvider provider) {
        this(provider, AnalyzerConfig.DEFAULT);
    }

    public AnalyzerHost(SourceProvider provider, AnalyzerConfig config) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.config = Objects.requireNonNull(config, "config");
    }

    public AnalyzerConfig config() {
        return config;
    }

    public SourceRegistry registry() {
        return registry;
    }

    /**
     * Canonical root for the path. The root is created empty on first request, whether or not
     * the provider knows the file.
     */
    public Source getSource(String path) {
        return registry.resolve(path);
    }

    public Source analyze(String path) {
        return analyze(path, config.recursive());
    }

    public Source analyze(String path, boolean recursive) {
        return getAnalyzer(path, recursive).analyze();
    }

    public Source analyze(Source source) {
        return analyze(source, config.recursive());
    }

    public Source analyze(Source source, boolean recursive) {
        return getAnalyzer(source, recursive).analyze();
    }

    /**
     * Analyze every file of the provider, in the provider's order.
     */
    public List<Source> analyzeAll() {
        return analyzeAll(config.recursive());
    }

    public List<Source> analyzeAll(boolean recursive) {
        var result = new ArrayList<Source>();
        for (var file : provider.sourceFiles()) {
            result.add(analyze(file.fileName(), recursive));
        }
        LOG.debug("Analyzed {} files", result.size());
        return result;
    }

    public SourceAnalyzer getAnalyzer(String path, boolean recursive) {
        return getAnalyzer(getSource(path), recursive);
    }

    /**
     * Analyzer for an existing root, typically one obtained from {@link #getSource(String)},
     * to expand blocks lazily with {@link SourceAnalyzer#analyzeBody}.
     *
     * @throws AnalysisException with {@link AnalysisError.NullSource} when the source is
     *                           {@code null} or the provider has no file for it
     */
    public SourceAnalyzer getAnalyzer(Source source, boolean recursive) {
        if (source == null) {
            throw new AnalysisException(new AnalysisError.NullSource(null));
        }

        SourceFile file = provider.sourceFile(source.fileName())
                                  .orElseThrow(() -> new AnalysisException(new AnalysisError.NullSource(source.fileName())));

        LOG.debug("Creating {} analyzer for {}", recursive ? "recursive" : "shallow", file.fileName());
        return new SourceAnalyzer(file, source, config.withRecursive(recursive));
    }
}
