package org.pragmatica.scripter.tree;

/**
 * Entry of a destructuring pattern. Holes in array patterns are {@link EmptyExpression}s.
 */
public sealed interface BindingEntry permits BindingElement, EmptyExpression {
}
