package org.pragmatica.scripter.tree;

/**
 * Dotted name of an internal module or the string name of an ambient one.
 */
public sealed interface ModuleName permits QualifiedName, AtomicValue {
}
