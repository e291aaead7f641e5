package org.pragmatica.scripter.tree;

import java.util.List;

/**
 * Template preceded by a tag function, {@code i18n `hello`}.
 */
public final class TaggedTemplate extends CodeNode implements Expression {
    private Expression tag;
    private TemplatePattern template;

    public TaggedTemplate(Expression tag, TemplatePattern template) {
        this.tag = tag;
        this.template = template;
    }

    public Expression tag() {
        return tag;
    }

    public void setTag(Expression tag) {
        this.tag = tag;
    }

    public TemplatePattern template() {
        return template;
    }

    public void setTemplate(TemplatePattern template) {
        this.template = template;
    }

    @Override
    protected String buildString() {
        return tag + " " + template;
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(node(tag));
        result.add(template);
        return result;
    }
}
