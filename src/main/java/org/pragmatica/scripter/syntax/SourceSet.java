package org.pragmatica.scripter.syntax;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory {@link SourceProvider} keeping files in insertion order.
 */
public final class SourceSet implements SourceProvider {
    private final Map<String, SourceFile> files = new LinkedHashMap<>();

    public static SourceSet of(SourceFile... files) {
        var result = new SourceSet();
        for (var file : files) {
            result.add(file);
        }
        return result;
    }

    /**
     * Register a file, replacing any previous file with the same normalized name.
     */
    public SourceSet add(SourceFile file) {
        files.put(file.fileName(), file);
        return this;
    }

    @Override
    public Optional<SourceFile> sourceFile(String path) {
        if (path == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(files.get(SourceFile.normalize(path)));
    }

    @Override
    public List<SourceFile> sourceFiles() {
        return List.copyOf(files.values());
    }
}
