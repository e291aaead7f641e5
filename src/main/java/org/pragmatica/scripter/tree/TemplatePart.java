package org.pragmatica.scripter.tree;

/**
 * Piece of a template literal: literal text or an interpolated expression.
 */
public sealed interface TemplatePart permits TemplateLiteralPiece, Expression {
}
