package com.example.xlsxtpl.renderer;

import com.example.xlsxtpl.config.RenderProperties;
import com.example.xlsxtpl.core.ContextScope;
import com.example.xlsxtpl.core.LoopRecord;
import com.example.xlsxtpl.exception.TemplateRenderException;
import com.example.xlsxtpl.expression.ExpressionEvaluationException;
import com.example.xlsxtpl.expression.ExpressionEvaluator;
import com.example.xlsxtpl.expression.TemplateValues;
import com.example.xlsxtpl.grid.Grid;
import com.example.xlsxtpl.model.Axis;
import com.example.xlsxtpl.model.Block;
import com.example.xlsxtpl.model.Directive;
import com.example.xlsxtpl.model.DirectiveEvent;
import com.example.xlsxtpl.parser.BlockMatcher;
import com.example.xlsxtpl.parser.DirectiveParser;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Expands {@code for} and {@code if} blocks along one axis of a grid.
 *
 * A "line" is a row for the row engine and a column for the column engine; the
 * subclasses map lines onto the grid and decide what happens to a finished body.
 * Every process method returns the signed number of lines it added or removed,
 * which callers use to locate lines that moved.
 */
@Slf4j
public abstract class AbstractBlockExpander {

    protected final Grid grid;
    protected final Axis axis;
    protected final ExpressionEvaluator evaluator;
    protected final RenderProperties properties;
    private final DirectiveParser directiveParser = new DirectiveParser();
    private final BlockMatcher blockMatcher = new BlockMatcher();

    protected AbstractBlockExpander(Grid grid, Axis axis, ExpressionEvaluator evaluator, RenderProperties properties) {
        this.grid = grid;
        this.axis = axis;
        this.evaluator = evaluator;
        this.properties = properties;
    }

    /**
     * Finds the blocks of lines {@code start..end}. Each line is searched across
     * the whole cross dimension and contributes at most its first directive.
     */
    public List<Block> scan(int start, int end) {
        List<DirectiveEvent> events = new ArrayList<>();
        int crossExtent = crossExtent();
        for (int line = start; line <= end; line++) {
            for (int cross = 1; cross <= crossExtent; cross++) {
                Optional<Directive> directive = directiveParser.parse(valueAt(line, cross), axis);
                if (directive.isPresent()) {
                    events.add(new DirectiveEvent(line, directive.get()));
                    break;
                }
            }
        }
        return blockMatcher.match(events, axis);
    }

    /**
     * Processes sibling blocks from the highest position down, so expanding one
     * never moves a sibling that is still to be processed.
     */
    public int processBlocks(List<Block> blocks, ContextScope scope) {
        int delta = 0;
        for (int i = blocks.size() - 1; i >= 0; i--) {
            Block block = blocks.get(i);
            switch (block.getType()) {
                case FOR:
                    delta += processFor(block, scope);
                    break;
                case IF:
                    delta += processIf(block, scope);
                    break;
                default:
                    break;
            }
        }
        return delta;
    }

    protected int processFor(Block block, ContextScope scope) {
        Directive directive = block.getDirective();
        List<Object> items;
        try {
            items = TemplateValues.toItems(evaluator.evaluate(directive.getExpression(), scope));
        } catch (ExpressionEvaluationException e) {
            throw new TemplateRenderException(String.format("Failed to evaluate iterable '%s' at %s %d: %s",
                    directive.getExpression(), axis.label(), block.getOpenPosition(), e.getMessage()), e);
        }

        int bodySize = block.bodySize();
        if (bodySize <= 0 || items.isEmpty()) {
            log.debug("Removing {} with {} item(s)", block, items.size());
            return removeLines(block.getOpenPosition(), block.getClosePosition());
        }

        int added = duplicateBody(block, items.size());
        int childDelta = 0;
        for (int i = 0; i < items.size(); i++) {
            int iterationStart = block.bodyStart() + i * bodySize + childDelta;
            int iterationEnd = iterationStart + bodySize - 1;
            ContextScope iterationScope = loopScope(scope, directive.getVariable(), items.get(i),
                    LoopRecord.of(i, items.size()));

            int nested = processBlocks(scan(iterationStart, iterationEnd), iterationScope);
            childDelta += nested;
            completeBody(iterationStart, iterationEnd + nested, iterationScope);
        }

        int close = block.getClosePosition() + added + childDelta;
        removeLines(close, close);
        removeLines(block.getOpenPosition(), block.getOpenPosition());
        int delta = added + childDelta - 2;
        log.debug("Expanded {} over {} item(s), delta {}", block, items.size(), delta);
        return delta;
    }

    protected int processIf(Block block, ContextScope scope) {
        Directive directive = block.getDirective();
        Object condition;
        try {
            condition = evaluator.evaluate(directive.getExpression(), scope);
        } catch (ExpressionEvaluationException e) {
            throw new TemplateRenderException(String.format("Failed to evaluate condition '%s' at %s %d: %s",
                    directive.getExpression(), axis.label(), block.getOpenPosition(), e.getMessage()), e);
        }

        if (!TemplateValues.isTruthy(condition)) {
            log.debug("Dropping {}", block);
            return removeLines(block.getOpenPosition(), block.getClosePosition());
        }

        int childDelta = processBlocks(block.getChildren(), scope);
        completeBody(block.bodyStart(), block.bodyEnd() + childDelta, scope);

        int close = block.getClosePosition() + childDelta;
        removeLines(close, close);
        removeLines(block.getOpenPosition(), block.getOpenPosition());
        return childDelta - 2;
    }

    /**
     * Scope of one iteration: the loop variable and the loop record on top of
     * the enclosing scope.
     */
    protected ContextScope loopScope(ContextScope scope, String variable, Object item, LoopRecord loop) {
        Map<String, Object> layer = new LinkedHashMap<>();
        layer.put(variable, item);
        layer.put(properties.getLoopVariable(), loop);
        return scope.with(layer);
    }

    /**
     * Inserts {@code (count - 1) * bodySize} lines after the body and fills
     * them with copies of it.
     *
     * @return number of lines inserted
     */
    protected int duplicateBody(Block block, int count) {
        int bodySize = block.bodySize();
        int toInsert = (count - 1) * bodySize;
        if (toInsert <= 0) {
            return 0;
        }
        int insertAt = block.bodyEnd() + 1;
        insertLines(insertAt, toInsert);
        for (int copy = 1; copy < count; copy++) {
            for (int offset = 0; offset < bodySize; offset++) {
                copyLine(block.bodyStart() + offset, insertAt + (copy - 1) * bodySize + offset);
            }
        }
        return toInsert;
    }

    /**
     * Deletes lines {@code start..end} inclusive.
     *
     * @return the negative number of lines removed
     */
    protected int removeLines(int start, int end) {
        int count = end - start + 1;
        deleteLines(start, count);
        return -count;
    }

    /** Number of cells along a line */
    protected abstract int crossExtent();

    protected abstract Object valueAt(int line, int cross);

    protected abstract void insertLines(int at, int count);

    protected abstract void deleteLines(int at, int count);

    /**
     * Copies metadata and every cell of {@code source} onto {@code target}.
     */
    protected abstract void copyLine(int source, int target);

    /**
     * Finishes lines {@code start..end} of a kept body once its nested blocks
     * are expanded.
     */
    protected abstract void completeBody(int start, int end, ContextScope scope);
}
