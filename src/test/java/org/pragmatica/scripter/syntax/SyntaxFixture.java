package org.pragmatica.scripter.syntax;

/**
 * Builds {@link ParsedElement} trees over a TypeScript snippet, standing in for a parser adapter.
 *
 * <p>Elements are located by their text. Each lookup starts at the start of the previously
 * located element, so elements must be created in source order: a parent before its
 * children, children in the order they appear. Identifier-like fragments only match whole
 * words. Leading trivia (whitespace, line and block comments) is computed from the text,
 * so the full start of every element is the end of the token before it.
 */
public final class SyntaxFixture {
    private final String text;
    private final boolean[] trivia;
    private int cursor;

    public SyntaxFixture(String text) {
        this.text = text;
        this.trivia = scanTrivia(text);
    }

    public String text() {
        return text;
    }

    public El node(SyntaxKind kind, String fragment) {
        return node(kind, fragment, 0);
    }

    /**
     * Element covering a fragment, skipping the given number of earlier matches.
     */
    public El node(SyntaxKind kind, String fragment, int skip) {
        int start = find(fragment, skip);
        cursor = start;
        return new El(kind, start, start + fragment.length());
    }

    /**
     * {@code SOURCE_FILE} root over the whole text, closed by a zero width end of file token.
     */
    public ParsedElement source(El... statements) {
        int start = 0;
        while (start < text.length() && trivia[start]) {
            start++;
        }

        var builder = ParsedElement.builder(SyntaxKind.SOURCE_FILE, text)
                                   .range(0, start, text.length());
        for (var statement : statements) {
            builder.child(Role.STATEMENTS, statement.build());
        }
        builder.child(Role.CLOSE_TOKEN, token(SyntaxKind.END_OF_FILE_TOKEN, text.length(), text.length()));
        return builder.build();
    }

    public SourceFile file(String fileName, El... statements) {
        return new SourceFile(fileName, source(statements));
    }

    private ParsedElement token(SyntaxKind kind, int start, int end) {
        return ParsedElement.builder(kind, text)
                            .range(fullStart(start), start, end)
                            .build();
    }

    private int fullStart(int start) {
        int result = start;
        while (result > 0 && trivia[result - 1]) {
            result--;
        }
        return result;
    }

    private int find(String fragment, int skip) {
        int remaining = skip;
        int index = cursor - 1;

        while (true) {
            index = text.indexOf(fragment, index + 1);
            if (index < 0) {
                throw new IllegalArgumentException("'" + fragment + "' not found after offset " + cursor);
            }
            if (trivia[index] || !wholeWord(fragment, index)) {
                continue;
            }
            if (remaining-- == 0) {
                return index;
            }
        }
    }

    private boolean wholeWord(String fragment, int index) {
        int end = index + fragment.length();
        if (isWordChar(fragment.charAt(0)) && index > 0 && isWordChar(text.charAt(index - 1))) {
            return false;
        }
        return !(isWordChar(fragment.charAt(fragment.length() - 1)) && end < text.length()
                 && isWordChar(text.charAt(end)));
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private static boolean[] scanTrivia(String text) {
        var result = new boolean[text.length()];
        int i = 0;

        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                result[i++] = true;
            } else if (text.startsWith("//", i)) {
                while (i < text.length() && text.charAt(i) != '\n') {
                    result[i++] = true;
                }
            } else if (text.startsWith("/*", i)) {
                int end = text.indexOf("*/", i + 2);
                end = end < 0 ? text.length() : end + 2;
                while (i < end) {
                    result[i++] = true;
                }
            } else if (c == '"' || c == '\'' || c == '`') {
                i++;
                while (i < text.length() && text.charAt(i) != c) {
                    i += text.charAt(i) == '\\' ? 2 : 1;
                }
                i++;
            } else {
                i++;
            }
        }
        return result;
    }

    /**
     * Element under construction. Children are attached in source order.
     */
    public final class El {
        private final ParsedElement.Builder builder;
        private final int end;
        private ParsedElement built;

        private El(SyntaxKind kind, int start, int end) {
            this.builder = ParsedElement.builder(kind, text).range(fullStart(start), start, end);
            this.end = end;
        }

        public El child(Role role, El child) {
            builder.child(role, child.build());
            return this;
        }

        public El children(Role role, El... children) {
            for (var child : children) {
                builder.child(role, child.build());
            }
            return this;
        }

        /**
         * Closing token over the last character of the element.
         */
        public El close() {
            var kind = switch (text.charAt(end - 1)) {
                case '}' -> SyntaxKind.CLOSE_BRACE_TOKEN;
                case ']' -> SyntaxKind.CLOSE_BRACKET_TOKEN;
                case ')' -> SyntaxKind.CLOSE_PAREN_TOKEN;
                default -> throw new IllegalStateException("No closing token at " + (end - 1));
            };
            builder.child(Role.CLOSE_TOKEN, token(kind, end - 1, end));
            cursor = Math.max(cursor, end - 1);
            return this;
        }

        public ParsedElement build() {
            if (built == null) {
                built = builder.build();
            }
            return built;
        }
    }
}
