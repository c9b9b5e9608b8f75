package com.example.xlsxtpl.parser;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class CellTagsTest {

    @Test
    public void testPureExpressionReturnsInnerText() {
        assertEquals(Optional.of("name"), CellTags.pureExpression("{{ name }}"));
        assertEquals(Optional.of("a.b | upper"), CellTags.pureExpression("  {{a.b | upper}}  "));
        assertEquals(Optional.of("x"), CellTags.pureExpression("{{- x -}}"));
    }

    @Test
    public void testPureExpressionRejectsMixedContent() {
        assertTrue(CellTags.pureExpression("Hello {{ name }}").isEmpty());
        assertTrue(CellTags.pureExpression("{{ a }}{{ b }}").isEmpty());
        assertTrue(CellTags.pureExpression("{% if a %}").isEmpty());
        assertTrue(CellTags.pureExpression(42.0).isEmpty());
        assertTrue(CellTags.pureExpression(null).isEmpty());
    }

    @Test
    public void testHasTemplateTag() {
        assertTrue(CellTags.hasTemplateTag("Total: {{ total }}"));
        assertTrue(CellTags.hasTemplateTag("{% endfor %}"));
        assertFalse(CellTags.hasTemplateTag("plain text"));
        assertFalse(CellTags.hasTemplateTag("{ not a tag }"));
        assertFalse(CellTags.hasTemplateTag(3.5));
    }

    @Test
    public void testIsBlockTagCoversBothAxesAndUnknownKeywords() {
        assertTrue(CellTags.isBlockTag("{% for x in items %}"));
        assertTrue(CellTags.isBlockTag("  {%col endfor %} "));
        assertTrue(CellTags.isBlockTag("{% else %}"));
        assertFalse(CellTags.isBlockTag("Label {% if x %}"));
        assertFalse(CellTags.isBlockTag("{{ x }}"));
        assertFalse(CellTags.isBlockTag(Boolean.TRUE));
    }
}
