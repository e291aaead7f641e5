package org.pragmatica.scripter.tree;

import org.pragmatica.scripter.syntax.SyntaxElement;

import java.lang.ref.WeakReference;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Base of every node in an editable source tree.
 *
 * <p>A node caches its rendering. Nodes produced by analysis start with the literal source
 * text of the element they came from; nodes built by hand start without text and render
 * themselves from their fields on first use.
 *
 * <p>The cache is never invalidated automatically. After changing a field or a child, call
 * {@link #markDirty(boolean)} on the changed node and on every ancestor whose rendering should
 * reflect the change, or call {@code markDirty(true)} on the topmost one. Until then, ancestors
 * keep rendering their previous text.
 */
public abstract class CodeNode {
    private transient WeakReference<SyntaxElement> origin;
    private transient String text;

    /**
     * Element this node was analyzed from, if it is still reachable.
     */
    public Optional<SyntaxElement> origin() {
        return origin == null ? Optional.empty() : Optional.ofNullable(origin.get());
    }

    public CodeNode registerWithElement(SyntaxElement element) {
        this.origin = element == null ? null : new WeakReference<>(element);
        return this;
    }

    public CodeNode setText(String text) {
        this.text = text;
        return this;
    }

    /**
     * Cached rendering, empty when the node must be rebuilt on the next {@link #render()}.
     */
    public Optional<String> cachedText() {
        return Optional.ofNullable(text);
    }

    /**
     * Current rendering: the cached text if present, otherwise {@link #buildString()}, which is then cached.
     */
    public final String render() {
        if (text == null) {
            text = buildString();
        }
        return text;
    }

    @Override
    public String toString() {
        return render();
    }

    /**
     * Build the rendering from fields. Children contribute through their own {@link #render()}.
     */
    protected abstract String buildString();

    /**
     * Immediate children without absent optional ones.
     */
    public List<CodeNode> children() {
        var result = buildChildren();
        result.removeIf(Objects::isNull);
        return result;
    }

    /**
     * All child slots, {@code null} for absent optional children. Returns a fresh mutable list.
     */
    protected List<CodeNode> buildChildren() {
        return new ArrayList<>();
    }

    public CodeNode markDirty() {
        return markDirty(false);
    }

    /**
     * Drop the cached text so the next {@link #render()} rebuilds it.
     *
     * @param recursive also drop the cache of every descendant
     */
    public CodeNode markDirty(boolean recursive) {
        text = null;
        if (recursive) {
            walkChildren(CodeNode::markDirty);
        }
        return this;
    }

    public Optional<CodeNode> findChild(Predicate<CodeNode> predicate) {
        return findChild(predicate, false);
    }

    /**
     * Breadth-first search over the live tree.
     *
     * @param includeSelf test this node before its children
     * @return first node accepted by the predicate
     */
    public Optional<CodeNode> findChild(Predicate<CodeNode> predicate, boolean includeSelf) {
        var queue = new ArrayDeque<CodeNode>();
        if (includeSelf) {
            queue.add(this);
        } else {
            queue.addAll(children());
        }

        while (!queue.isEmpty()) {
            var next = queue.poll();
            if (predicate.test(next)) {
                return Optional.of(next);
            }
            queue.addAll(next.children());
        }
        return Optional.empty();
    }

    public void walkChildren(Consumer<CodeNode> walker) {
        walkChildren(walker, false);
    }

    /**
     * Visit every node reachable from this one in breadth-first order.
     */
    public void walkChildren(Consumer<CodeNode> walker, boolean includeSelf) {
        findChild(node -> {
            walker.accept(node);
            return false;
        }, includeSelf);
    }

    /**
     * Text appended after this node when it is an element of a statement sequence.
     */
    public String statementTerminator() {
        return ";";
    }

    protected static CodeNode node(Object child) {
        return (CodeNode) child;
    }

    protected static List<CodeNode> nodes(Collection<?> children) {
        var result = new ArrayList<CodeNode>(children.size());
        for (var child : children) {
            result.add(node(child));
        }
        return result;
    }
}
