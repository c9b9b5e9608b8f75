package com.example.xlsxtpl.parser;

import com.example.xlsxtpl.exception.TemplateSyntaxException;
import com.example.xlsxtpl.model.Axis;
import com.example.xlsxtpl.model.Block;
import com.example.xlsxtpl.model.Directive;
import com.example.xlsxtpl.model.DirectiveEvent;
import com.example.xlsxtpl.model.DirectiveType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Pairs openers with closers along one axis and builds the block tree.
 */
public class BlockMatcher {

    /**
     * @param events directives found on the scanned lines, in any order
     * @return top-level blocks in ascending position, children populated
     * @throws TemplateSyntaxException on a mismatched, stray or unclosed tag
     */
    public List<Block> match(List<DirectiveEvent> events, Axis axis) {
        List<DirectiveEvent> ordered = new ArrayList<>(events);
        ordered.sort(Comparator.comparingInt(DirectiveEvent::getPosition));

        Deque<Frame> stack = new ArrayDeque<>();
        List<Block> topLevel = new ArrayList<>();

        for (DirectiveEvent event : ordered) {
            Directive directive = event.getDirective();
            if (directive.isOpener()) {
                stack.push(new Frame(directive, event.getPosition()));
                continue;
            }

            if (stack.isEmpty()) {
                throw new TemplateSyntaxException(String.format(
                        "Mismatched %s at %s %d: found %s but no block is open",
                        blockTagNoun(axis), axis.label(), event.getPosition(),
                        axis.tag(directive.getType().keyword())));
            }
            DirectiveType expected = stack.peek().directive.getType().closer();
            if (directive.getType() != expected) {
                throw new TemplateSyntaxException(String.format(
                        "Mismatched %s at %s %d: found %s but expected %s",
                        blockTagNoun(axis), axis.label(), event.getPosition(),
                        axis.tag(directive.getType().keyword()), axis.tag(expected.keyword())));
            }

            Frame frame = stack.pop();
            Block block = new Block(axis, frame.directive, frame.openPosition, event.getPosition(), frame.children);
            if (stack.isEmpty()) {
                topLevel.add(block);
            } else {
                stack.peek().children.add(block);
            }
        }

        if (!stack.isEmpty()) {
            Frame unclosed = stack.peek();
            throw new TemplateSyntaxException(String.format(
                    "Unclosed %s at %s %d",
                    axis.tag(unclosed.directive.getType().keyword()), axis.label(), unclosed.openPosition));
        }
        return topLevel;
    }

    private static String blockTagNoun(Axis axis) {
        return axis == Axis.COLUMN ? "column block tag" : "block tag";
    }

    private static final class Frame {
        final Directive directive;
        final int openPosition;
        final List<Block> children = new ArrayList<>();

        Frame(Directive directive, int openPosition) {
            this.directive = directive;
            this.openPosition = openPosition;
        }
    }
}
