package org.pragmatica.scripter.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code var}, {@code let} or {@code const} declaration with {@link Property} elements, e.g. {@code let a, b = 1}.
 */
public final class VariableDeclaration extends ExpressionBlock {
    public enum Kind {
        LET("let"),
        VAR("var"),
        CONST("const");

        private final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }

    private final List<String> modifiers;
    private Kind kind;

    public VariableDeclaration() {
        this(new ArrayList<>(), Kind.VAR);
    }

    public VariableDeclaration(List<String> modifiers, Kind kind) {
        this.modifiers = modifiers;
        this.kind = kind;
    }

    /**
     * Declaration of a single property, {@code var name = value}.
     */
    public static VariableDeclaration forProperty(Property property, List<String> modifiers, Kind kind) {
        var declaration = new VariableDeclaration(modifiers, kind);
        declaration.elements().add(property);
        return declaration;
    }

    public static VariableDeclaration forProperty(Property property) {
        return forProperty(property, new ArrayList<>(), Kind.VAR);
    }

    public List<String> modifiers() {
        return modifiers;
    }

    public Kind kind() {
        return kind;
    }

    public void setKind(Kind kind) {
        this.kind = kind;
    }

    @Override
    protected String buildString() {
        var body = super.buildString();
        if (body.isEmpty() || !Character.isWhitespace(body.charAt(0))) {
            body = " " + body;
        }
        return Render.words(modifiers, kind.keyword()) + body;
    }

    @Override
    public String statementTerminator() {
        return ";";
    }
}
