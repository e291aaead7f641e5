package org.pragmatica.scripter.analyzer;

import org.pragmatica.scripter.error.AnalysisError;
import org.pragmatica.scripter.error.AnalysisException;
import org.pragmatica.scripter.syntax.SourceFile;
import org.pragmatica.scripter.tree.Source;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical {@link Source} root per normalized file path.
 *
 * <p>Not thread-safe.
 */
public final class SourceRegistry {
    private final Map<String, Source> sources = new LinkedHashMap<>();

    /**
     * Root for the path, created empty and unanalyzed on first request.
     *
     * @throws AnalysisException with {@link AnalysisError.NullSource} when the path is {@code null}
     */
    public Source resolve(String path) {
        return sources.computeIfAbsent(key(path), Source::new);
    }

    public Optional<Source> find(String path) {
        return Optional.ofNullable(sources.get(key(path)));
    }

    /**
     * Roots in the order they were first resolved.
     */
    public List<Source> sources() {
        return List.copyOf(sources.values());
    }

    public int size() {
        return sources.size();
    }

    private static String key(String path) {
        if (path == null) {
            throw new AnalysisException(new AnalysisError.NullSource(null));
        }
        return SourceFile.normalize(path);
    }
}
