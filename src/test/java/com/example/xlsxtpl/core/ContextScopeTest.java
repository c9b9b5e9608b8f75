package com.example.xlsxtpl.core;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ContextScopeTest {

    @Test
    public void testInnerLayerShadowsOuter() {
        ContextScope outer = ContextScope.of(Map.of("name", "outer", "total", 10));
        ContextScope inner = outer.with("name", "inner");

        assertEquals("inner", inner.get("name"));
        assertEquals(10, inner.get("total"));
        assertEquals("outer", outer.get("name"));
    }

    @Test
    public void testNullBindingIsStillDefined() {
        ContextScope scope = ContextScope.empty().with("missing", null);
        assertTrue(scope.contains("missing"));
        assertNull(scope.get("missing"));
        assertFalse(scope.contains("other"));
    }

    @Test
    public void testLayerIsCopiedOnAdd() {
        Map<String, Object> data = new HashMap<>();
        data.put("a", 1);
        ContextScope scope = ContextScope.of(data);
        data.put("a", 2);
        assertEquals(1, scope.get("a"));
    }

    @Test
    public void testOverPutsThisScopeOnTop() {
        ContextScope row = ContextScope.of(Map.of("loop", "row-loop", "r", 1));
        ContextScope column = ContextScope.of(Map.of("loop", "col-loop", "c", 2));

        ContextScope merged = row.over(column);
        assertEquals("row-loop", merged.get("loop"));
        assertEquals(1, merged.get("r"));
        assertEquals(2, merged.get("c"));
        assertSame(row, row.over(ContextScope.empty()));
        assertSame(column, ContextScope.empty().over(column));
    }

    @Test
    public void testToMapAppliesInnerLayersLast() {
        ContextScope scope = ContextScope.of(Map.of("a", 1, "b", 2)).with("a", 3);
        Map<String, Object> flat = scope.toMap();
        assertEquals(3, flat.get("a"));
        assertEquals(2, flat.get("b"));
        assertEquals(2, flat.size());
    }

    @Test
    public void testLoopRecordFields() {
        LoopRecord first = LoopRecord.of(0, 3);
        assertEquals(1, first.getIndex());
        assertEquals(0, first.getIndex0());
        assertTrue(first.isFirst());
        assertFalse(first.isLast());
        assertEquals(3, first.getLength());
        assertEquals(3, first.getRevindex());
        assertEquals(2, first.getRevindex0());

        LoopRecord last = LoopRecord.of(2, 3);
        assertTrue(last.isLast());
        assertEquals(1, last.getRevindex());
        assertEquals(0, last.getRevindex0());
    }
}
