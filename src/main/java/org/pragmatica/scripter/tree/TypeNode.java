package org.pragmatica.scripter.tree;

/**
 * Type expressions.
 */
public sealed interface TypeNode extends PropertyType
    permits ParenthesizedType, QualifiedTypeName, UnionType, CallableType, TypeLiteral, ArrayType, KeywordType,
            TupleType, TypeOf {
}
