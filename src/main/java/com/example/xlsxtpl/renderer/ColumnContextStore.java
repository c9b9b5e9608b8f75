package com.example.xlsxtpl.renderer;

import com.example.xlsxtpl.core.ContextScope;

import java.util.Map;
import java.util.TreeMap;

/**
 * Scopes recorded by the column pass for columns whose cells are rendered later,
 * keyed by current 1-based column. Owned by a single sheet render.
 */
public class ColumnContextStore {

    private TreeMap<Integer, ContextScope> entries = new TreeMap<>();

    /**
     * Records {@code scope} for every column of {@code [start, end]}. A column that
     * already has a scope keeps it on top, with the new one underneath.
     */
    public void defer(int start, int end, ContextScope scope) {
        for (int column = start; column <= end; column++) {
            ContextScope existing = entries.get(column);
            entries.put(column, existing == null ? scope : existing.over(scope));
        }
    }

    /**
     * Follows a structural change at {@code at}. A positive delta moves entries at
     * or after {@code at} right; a negative delta drops {@code [at, at - delta)}
     * and moves later entries left.
     */
    public void shift(int at, int delta) {
        if (delta == 0 || entries.isEmpty()) {
            return;
        }
        TreeMap<Integer, ContextScope> shifted = new TreeMap<>();
        int removedEnd = at - delta;
        for (Map.Entry<Integer, ContextScope> entry : entries.entrySet()) {
            int column = entry.getKey();
            if (delta > 0) {
                shifted.put(column >= at ? column + delta : column, entry.getValue());
            } else if (column < at) {
                shifted.put(column, entry.getValue());
            } else if (column >= removedEnd) {
                shifted.put(column + delta, entry.getValue());
            }
        }
        entries = shifted;
    }

    /**
     * Scope for rendering a cell of {@code column}: the caller's scope over the
     * stored one, so row-loop names win over column-loop names.
     */
    public ContextScope resolve(int column, ContextScope callerScope) {
        ContextScope stored = entries.get(column);
        return stored == null ? callerScope : callerScope.over(stored);
    }

    ContextScope get(int column) {
        return entries.get(column);
    }

    int size() {
        return entries.size();
    }
}
