package org.pragmatica.scripter.tree;

/**
 * Built-in type named by a keyword: {@code any}, {@code boolean}, {@code number} and so on.
 */
public final class KeywordType extends SimpleNode implements TypeNode {
    public KeywordType(String token) {
        super(token);
    }

    public static KeywordType booleanType() {
        return new KeywordType("boolean");
    }

    public static KeywordType stringType() {
        return new KeywordType("string");
    }

    public static KeywordType numberType() {
        return new KeywordType("number");
    }
}
