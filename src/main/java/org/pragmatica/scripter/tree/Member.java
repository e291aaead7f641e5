package org.pragmatica.scripter.tree;

/**
 * Members of interfaces and type literals.
 */
public sealed interface Member permits Property, IndexSignature, CallableSignature {
}
