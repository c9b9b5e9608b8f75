package com.example.xlsxtpl.parser;

import com.example.xlsxtpl.exception.TemplateSyntaxException;
import com.example.xlsxtpl.model.Axis;
import com.example.xlsxtpl.model.Block;
import com.example.xlsxtpl.model.Directive;
import com.example.xlsxtpl.model.DirectiveEvent;
import com.example.xlsxtpl.model.DirectiveType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BlockMatcherTest {

    private final BlockMatcher matcher = new BlockMatcher();

    private static DirectiveEvent at(int position, Directive directive) {
        return new DirectiveEvent(position, directive);
    }

    @Test
    public void testSiblingsAreReturnedInAscendingOrder() {
        List<Block> blocks = matcher.match(List.of(
                at(5, Directive.ifOpen("b")),
                at(1, Directive.forOpen("x", "xs")),
                at(7, Directive.ifClose()),
                at(3, Directive.forClose())), Axis.ROW);

        assertEquals(2, blocks.size());
        assertEquals(DirectiveType.FOR, blocks.get(0).getType());
        assertEquals(1, blocks.get(0).getOpenPosition());
        assertEquals(3, blocks.get(0).getClosePosition());
        assertEquals(1, blocks.get(0).bodySize());
        assertEquals(DirectiveType.IF, blocks.get(1).getType());
        assertEquals(5, blocks.get(1).getOpenPosition());
    }

    @Test
    public void testNestedBlocksBecomeChildren() {
        List<Block> blocks = matcher.match(List.of(
                at(1, Directive.forOpen("g", "groups")),
                at(2, Directive.forOpen("i", "g.items")),
                at(4, Directive.forClose()),
                at(5, Directive.ifOpen("g.total")),
                at(7, Directive.ifClose()),
                at(8, Directive.forClose())), Axis.ROW);

        assertEquals(1, blocks.size());
        Block outer = blocks.get(0);
        assertEquals(2, outer.getChildren().size());
        assertEquals(2, outer.getChildren().get(0).getOpenPosition());
        assertEquals(4, outer.getChildren().get(0).getClosePosition());
        assertEquals(DirectiveType.IF, outer.getChildren().get(1).getType());
        assertEquals(6, outer.bodySize());
    }

    @Test
    public void testEmptyInputYieldsNoBlocks() {
        assertTrue(matcher.match(List.of(), Axis.ROW).isEmpty());
    }

    @Test
    public void testWrongCloserIsRejected() {
        TemplateSyntaxException e = assertThrows(TemplateSyntaxException.class, () -> matcher.match(List.of(
                at(1, Directive.forOpen("x", "xs")),
                at(3, Directive.ifClose())), Axis.ROW));
        assertEquals("Mismatched block tag at row 3: found {% endif %} but expected {% endfor %}", e.getMessage());
    }

    @Test
    public void testWrongColumnCloserNamesTheColumn() {
        TemplateSyntaxException e = assertThrows(TemplateSyntaxException.class, () -> matcher.match(List.of(
                at(2, Directive.ifOpen("x")),
                at(4, Directive.forClose())), Axis.COLUMN));
        assertEquals("Mismatched column block tag at column 4: found {%col endfor %} but expected {%col endif %}",
                e.getMessage());
    }

    @Test
    public void testStrayCloserIsRejected() {
        TemplateSyntaxException e = assertThrows(TemplateSyntaxException.class,
                () -> matcher.match(List.of(at(2, Directive.forClose())), Axis.ROW));
        assertTrue(e.getMessage().startsWith("Mismatched block tag at row 2"));
    }

    @Test
    public void testUnclosedReportsInnermostOpener() {
        TemplateSyntaxException e = assertThrows(TemplateSyntaxException.class, () -> matcher.match(List.of(
                at(1, Directive.forOpen("x", "xs")),
                at(2, Directive.ifOpen("x"))), Axis.ROW));
        assertEquals("Unclosed {% if %} at row 2", e.getMessage());

        e = assertThrows(TemplateSyntaxException.class,
                () -> matcher.match(List.of(at(3, Directive.forOpen("c", "cs"))), Axis.COLUMN));
        assertEquals("Unclosed {%col for %} at column 3", e.getMessage());
    }
}
