package org.pragmatica.scripter.syntax;

/**
 * A position in source text (line and column, both 1-based, plus the 0-based character offset).
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    /**
     * Compute the location of an offset by counting line breaks in the given text.
     */
    public static SourceLocation of(String text, int offset) {
        if (offset < 0 || offset > text.length()) {
            throw new IllegalArgumentException("Offset " + offset + " is outside of text of length " + text.length());
        }

        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < offset; i++) {
            if (text.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new SourceLocation(line, offset - lineStart + 1, offset);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
