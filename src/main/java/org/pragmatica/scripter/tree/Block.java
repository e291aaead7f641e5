package org.pragmatica.scripter.tree;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * A node owning an ordered sequence of elements, filled lazily by the analyzer.
 *
 * <p>A block whose body has not been analyzed has no elements. Analysis only runs on a block
 * in that pristine state, which makes repeated analysis a no-op. {@link #resetBody()} returns
 * the block to the pristine state.
 */
public abstract sealed class Block extends CodeNode permits StatementBlock, ExpressionBlock {
    private final List<CodeNode> elements = new ArrayList<>();
    private transient boolean bodyAnalyzed;

    /**
     * Live element list. Whitespace and comments between elements are {@link Trivia} entries.
     */
    public List<CodeNode> elements() {
        return elements;
    }

    public boolean isBodyAnalyzed() {
        return bodyAnalyzed;
    }

    public boolean canAnalyzeBody() {
        return !bodyAnalyzed && elements.isEmpty();
    }

    /**
     * Replace the elements with analysis output and mark the body analyzed.
     */
    public void completeBody(Collection<? extends CodeNode> analyzed) {
        elements.clear();
        elements.addAll(analyzed);
        bodyAnalyzed = true;
    }

    public void resetBody() {
        elements.clear();
        bodyAnalyzed = false;
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.addAll(elements);
        return result;
    }

    @Override
    public String statementTerminator() {
        return "";
    }

    /**
     * Each element followed by its statement terminator.
     */
    protected static String joinStatements(List<CodeNode> elements) {
        var sb = new StringBuilder();
        for (var element : elements) {
            sb.append(element.render()).append(element.statementTerminator());
        }
        return sb.toString();
    }

    /**
     * Elements separated by commas. Trivia entries never receive a comma and nothing follows
     * the last non-trivia element.
     */
    protected static String joinExpressions(List<CodeNode> elements) {
        var parts = new ArrayList<String>(elements.size());
        int lastSignificant = -1;

        for (int i = 0; i < elements.size(); i++) {
            var element = elements.get(i);
            if (element instanceof Trivia) {
                parts.add(element.render());
            } else {
                lastSignificant = i;
                parts.add(element.render() + ",");
            }
        }

        if (lastSignificant >= 0) {
            var last = parts.get(lastSignificant);
            parts.set(lastSignificant, last.substring(0, last.length() - 1));
        }
        return String.join("", parts);
    }
}
