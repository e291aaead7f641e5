package org.pragmatica.scripter.tree;

/**
 * Literal text between interpolations of a template. {@link #value()} holds the text with
 * backticks unescaped.
 */
public final class TemplateLiteralPiece extends CodeNode implements TemplatePart {
    private String value;

    public TemplateLiteralPiece(String value) {
        this.value = value;
    }

    public static TemplateLiteralPiece fromToken(String token) {
        return new TemplateLiteralPiece(asText(token));
    }

    public static String asToken(String value) {
        return value.replace("`", "\\`");
    }

    public static String asText(String token) {
        return token.replace("\\`", "`");
    }

    public String value() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    @Override
    protected String buildString() {
        return asToken(value);
    }
}
