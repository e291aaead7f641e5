package org.pragmatica.scripter.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Template literal, {@code `hi ${name}`}, as alternating literal pieces and expressions.
 */
public final class TemplatePattern extends CodeNode implements Expression {
    private final List<TemplatePart> parts;

    public TemplatePattern() {
        this(new ArrayList<>());
    }

    public TemplatePattern(List<TemplatePart> parts) {
        this.parts = parts;
    }

    public List<TemplatePart> parts() {
        return parts;
    }

    @Override
    protected String buildString() {
        var sb = new StringBuilder("`");
        for (var part : parts) {
            if (part instanceof TemplateLiteralPiece) {
                sb.append(part);
            } else {
                sb.append("${").append(part).append("}");
            }
        }
        return sb.append("`").toString();
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.addAll(nodes(parts));
        return result;
    }
}
