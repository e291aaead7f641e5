package org.pragmatica.scripter.tree;

/**
 * Anonymous object type, {@code { a: number; b(): string }}. Elements are {@link Member}s and trivia.
 */
public final class TypeLiteral extends BracedBlock implements TypeNode {
}
