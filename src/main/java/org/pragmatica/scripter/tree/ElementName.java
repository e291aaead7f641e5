package org.pragmatica.scripter.tree;

/**
 * Name of a member, enum entry or object literal property.
 */
public sealed interface ElementName extends DeclarationName permits Identifier, ComputedPropertyName, AtomicValue {
}
