package org.pragmatica.scripter;

import org.pragmatica.scripter.analyzer.AnalysisMode;
import org.pragmatica.scripter.analyzer.AnalyzerConfig;
import org.pragmatica.scripter.analyzer.AnalyzerHost;
import org.pragmatica.scripter.syntax.SourceProvider;

/**
 * Entry point for creating analyzer hosts.
 *
 * <p>Example usage:
 * <pre>{@code
 * var host = Scripter.builder(sources)
 *                    .mode(AnalysisMode.STRICT)
 *                    .build();
 *
 * var source = host.analyze("lib/index.ts");
 * source.findChild(node -> node instanceof ClassDeclaration)
 *       .ifPresent(node -> host.getAnalyzer(source, false).analyzeBody((ClassDeclaration) node));
 * }</pre>
 */
public final class Scripter {
    private Scripter() {}

    /**
     * Host with the default configuration: lenient and shallow.
     */
    public static AnalyzerHost host(SourceProvider provider) {
        return new AnalyzerHost(provider, AnalyzerConfig.DEFAULT);
    }

    public static AnalyzerHost host(SourceProvider provider, AnalyzerConfig config) {
        return new AnalyzerHost(provider, config);
    }

    public static Builder builder(SourceProvider provider) {
        return new Builder(provider);
    }

    public static final class Builder {
        private final SourceProvider provider;
        private AnalysisMode mode = AnalyzerConfig.DEFAULT.mode();
        private boolean recursive = AnalyzerConfig.DEFAULT.recursive();

        private Builder(SourceProvider provider) {
            this.provider = provider;
        }

        public Builder mode(AnalysisMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder strict() {
            return mode(AnalysisMode.STRICT);
        }

        public Builder recursive(boolean recursive) {
            this.recursive = recursive;
            return this;
        }

        public AnalyzerHost build() {
            return new AnalyzerHost(provider, new AnalyzerConfig(mode, recursive));
        }
    }
}
