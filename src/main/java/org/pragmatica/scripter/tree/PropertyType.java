package org.pragmatica.scripter.tree;

/**
 * Annotation of a property: a type, or a literal value in ambient declarations.
 */
public sealed interface PropertyType permits TypeNode, AtomicValue {
}
