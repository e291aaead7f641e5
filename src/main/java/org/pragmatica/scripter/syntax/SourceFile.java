package org.pragmatica.scripter.syntax;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A parsed file: its name and the {@link SyntaxKind#SOURCE_FILE} root element.
 */
public record SourceFile(String fileName, SyntaxElement root) {
    public SourceFile {
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(root, "root");
        if (!root.is(SyntaxKind.SOURCE_FILE)) {
            throw new IllegalArgumentException("Root of " + fileName + " must be SOURCE_FILE, got " + root.kind());
        }
        fileName = normalize(fileName);
    }

    /**
     * Full text of the file.
     */
    public String text() {
        return root.fullText();
    }

    /**
     * Normalize a path the same way for registration and lookup.
     */
    public static String normalize(String path) {
        return Path.of(path).normalize().toString();
    }
}
