package org.pragmatica.scripter.tree;

import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.UncheckedIOException;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structural view of a node: the variant name and the values of its persistent fields.
 *
 * <p>Fields are collected from the top of the class hierarchy down, skipping {@code static}
 * and {@code transient} ones, so origin links and cached text never appear. Nested nodes
 * become nested snapshots, collections become lists and enums are written by name.
 *
 * @param type simple class name of the node
 * @param data field name to value, in declaration order
 */
public record NodeSnapshot(String type, Map<String, Object> data) {
    public static NodeSnapshot of(CodeNode node) {
        var data = new LinkedHashMap<String, Object>();
        for (var field : persistentFields(node.getClass())) {
            data.put(field.getName(), convert(read(field, node)));
        }
        return new NodeSnapshot(node.getClass().getSimpleName(), data);
    }

    public String toJson() {
        try {
            return Json.MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static Iterable<Field> persistentFields(Class<?> type) {
        var hierarchy = new ArrayDeque<Class<?>>();
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            hierarchy.push(current);
        }

        var result = new ArrayList<Field>();
        for (var current : hierarchy) {
            for (var field : current.getDeclaredFields()) {
                int modifiers = field.getModifiers();
                if (Modifier.isStatic(modifiers) || Modifier.isTransient(modifiers) || field.isSynthetic()) {
                    continue;
                }
                result.add(field);
            }
        }
        return result;
    }

    private static Object read(Field field, CodeNode node) {
        try {
            field.setAccessible(true);
            return field.get(node);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot read " + field.getName() + " of " + node.getClass().getSimpleName(), e);
        }
    }

    private static Object convert(Object value) {
        if (value instanceof CodeNode child) {
            return of(child);
        }
        if (value instanceof Collection<?> items) {
            var result = new ArrayList<>(items.size());
            for (var item : items) {
                result.add(convert(item));
            }
            return result;
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        return value;
    }
}
