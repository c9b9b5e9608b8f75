package com.example.xlsxtpl.model;

import lombok.Value;

import java.util.List;

/**
 * A matched opener/closer pair on one axis with its nested blocks.
 *
 * Positions are 1-based grid lines as they were when the range was scanned.
 * A block lives for one scan-and-process pass only.
 */
@Value
public class Block {
    Axis axis;
    Directive directive;
    int openPosition;
    int closePosition;
    List<Block> children;

    public Block(Axis axis, Directive directive, int openPosition, int closePosition, List<Block> children) {
        this.axis = axis;
        this.directive = directive;
        this.openPosition = openPosition;
        this.closePosition = closePosition;
        this.children = List.copyOf(children);
    }

    public DirectiveType getType() {
        return directive.getType();
    }

    public int bodyStart() {
        return openPosition + 1;
    }

    public int bodyEnd() {
        return closePosition - 1;
    }

    /**
     * Number of lines strictly between the directives; zero when they are adjacent.
     */
    public int bodySize() {
        return closePosition - openPosition - 1;
    }

    @Override
    public String toString() {
        return axis.tag(getType().keyword()) + " [" + openPosition + ".." + closePosition + "]"
                + (children.isEmpty() ? "" : " " + children);
    }
}
