package org.pragmatica.scripter.tree;

import java.util.List;

/**
 * Dot separated name used for types and modules. Each segment is its own node holding the
 * segments to its left as {@link #qualification()}.
 */
public final class QualifiedName extends CodeNode implements ModuleName {
    private String name;
    private QualifiedName qualification;

    public QualifiedName(String name) {
        this(name, null);
    }

    public QualifiedName(String name, QualifiedName qualification) {
        this.name = name;
        this.qualification = qualification;
    }

    /**
     * Build a chain from its segments, leftmost first.
     */
    public static QualifiedName of(String first, String... rest) {
        var result = new QualifiedName(first);
        for (var segment : rest) {
            result = new QualifiedName(segment, result);
        }
        return result;
    }

    public String name() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public QualifiedName qualification() {
        return qualification;
    }

    public void setQualification(QualifiedName qualification) {
        this.qualification = qualification;
    }

    /**
     * Equivalent expression ({@link Identifier} or chain of {@link PropertyAccess}) keeping origin and text.
     */
    public Expression asExpression() {
        CodeNode result = qualification == null
                          ? new Identifier(name)
                          : new PropertyAccess(qualification.asExpression(), name);
        origin().ifPresent(result::registerWithElement);
        cachedText().ifPresent(result::setText);
        return (Expression) result;
    }

    public QualifiedTypeName asTypeName() {
        return new QualifiedTypeName(this);
    }

    @Override
    protected String buildString() {
        return qualification == null ? name : qualification + "." + name;
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(qualification);
        return result;
    }
}
