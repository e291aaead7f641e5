package org.pragmatica.scripter.syntax;

import java.util.List;
import java.util.Optional;

/**
 * One element of a concrete parse tree produced by an external parser.
 *
 * <p>Offsets refer to the text of the file the element belongs to. The "full" range
 * starts at {@link #fullStart()} and includes leading whitespace and comments, while
 * {@link #span()} covers only the significant tokens.
 */
public interface SyntaxElement {
    SyntaxKind kind();

    /**
     * Offset where the element's leading trivia begins.
     */
    int fullStart();

    /**
     * Range of the element without leading trivia.
     */
    SourceSpan span();

    /**
     * Literal text including leading trivia.
     */
    String fullText();

    /**
     * Literal text without leading trivia.
     */
    String text();

    /**
     * Children occupying the given slot, in source order. Never {@code null}.
     */
    List<SyntaxElement> children(Role role);

    default String leadingTrivia() {
        return fullText().substring(0, span().start().offset() - fullStart());
    }

    default Optional<SyntaxElement> child(Role role) {
        var list = children(role);
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    default boolean has(Role role) {
        return !children(role).isEmpty();
    }

    default boolean is(SyntaxKind expected) {
        return kind() == expected;
    }
}
