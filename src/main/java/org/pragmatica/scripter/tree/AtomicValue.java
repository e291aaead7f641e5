package org.pragmatica.scripter.tree;

import com.fasterxml.jackson.core.JsonProcessingException;

/**
 * Literal that cannot be decomposed further: strings, numbers, booleans, {@code null}.
 */
public final class AtomicValue extends SimpleNode implements Expression, PropertyType, ElementName, ModuleName {
    public AtomicValue(String token) {
        super(token);
    }

    public static AtomicValue of(Object value) {
        return new AtomicValue(toToken(value));
    }

    /**
     * Decoded value: {@link String}, {@link Number}, {@link Boolean} or {@code null}.
     */
    public Object value() {
        return fromToken(token());
    }

    public void setValue(Object value) {
        setToken(toToken(value));
    }

    public static String toToken(Object value) {
        if (value == null) {
            return "null";
        }
        try {
            return Json.MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value " + value + " has no literal form", e);
        }
    }

    public static Object fromToken(String token) {
        var trimmed = token.trim();
        if (trimmed.equals("undefined")) {
            return null;
        }
        if (trimmed.startsWith("0x") || trimmed.startsWith("0X")) {
            return Long.decode(trimmed);
        }
        try {
            return Json.MAPPER.readValue(trimmed, Object.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Token " + token + " is not a literal", e);
        }
    }
}
