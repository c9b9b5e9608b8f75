package com.example.xlsxtpl.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable layered variable lookup.
 *
 * Layers are kept outermost first and queried innermost first, so a layer added
 * with {@link #with(Map)} shadows every name it defines. Deriving a scope copies
 * the new layer only; existing layers are shared.
 */
public final class ContextScope {

    private static final ContextScope EMPTY = new ContextScope(Collections.emptyList());

    private final List<Map<String, ?>> layers;

    private ContextScope(List<Map<String, ?>> layers) {
        this.layers = layers;
    }

    public static ContextScope empty() {
        return EMPTY;
    }

    public static ContextScope of(Map<String, ?> variables) {
        return EMPTY.with(variables);
    }

    /**
     * New scope with {@code layer} on top of this one.
     */
    public ContextScope with(Map<String, ?> layer) {
        if (layer == null || layer.isEmpty()) {
            return this;
        }
        List<Map<String, ?>> next = new ArrayList<>(layers.size() + 1);
        next.addAll(layers);
        next.add(Collections.unmodifiableMap(new LinkedHashMap<>(layer)));
        return new ContextScope(Collections.unmodifiableList(next));
    }

    /**
     * New scope binding a single name on top of this one. The value may be null.
     */
    public ContextScope with(String name, Object value) {
        Map<String, Object> layer = new HashMap<>(2);
        layer.put(name, value);
        return with(layer);
    }

    /**
     * New scope where this scope's layers sit above {@code lower}'s, so this
     * scope wins every name both define.
     */
    public ContextScope over(ContextScope lower) {
        if (lower == null || lower.layers.isEmpty()) {
            return this;
        }
        if (layers.isEmpty()) {
            return lower;
        }
        List<Map<String, ?>> next = new ArrayList<>(lower.layers.size() + layers.size());
        next.addAll(lower.layers);
        next.addAll(layers);
        return new ContextScope(Collections.unmodifiableList(next));
    }

    public boolean contains(String name) {
        for (int i = layers.size() - 1; i >= 0; i--) {
            if (layers.get(i).containsKey(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Value bound to {@code name} in the innermost layer defining it, or null.
     */
    public Object get(String name) {
        for (int i = layers.size() - 1; i >= 0; i--) {
            Map<String, ?> layer = layers.get(i);
            if (layer.containsKey(name)) {
                return layer.get(name);
            }
        }
        return null;
    }

    /**
     * Flattened view with inner layers applied last.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> flat = new LinkedHashMap<>();
        for (Map<String, ?> layer : layers) {
            flat.putAll(layer);
        }
        return flat;
    }

    @Override
    public String toString() {
        return "ContextScope" + toMap().keySet();
    }
}
