package org.pragmatica.scripter.tree;

/**
 * Anything a declaration can bind: a plain name or a destructuring pattern.
 */
public sealed interface DeclarationName permits ElementName, BindingTarget {
}
