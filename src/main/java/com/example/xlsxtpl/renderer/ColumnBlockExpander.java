package com.example.xlsxtpl.renderer;

import com.example.xlsxtpl.config.RenderProperties;
import com.example.xlsxtpl.core.ContextScope;
import com.example.xlsxtpl.core.LoopRecord;
import com.example.xlsxtpl.expression.ExpressionEvaluator;
import com.example.xlsxtpl.grid.Grid;
import com.example.xlsxtpl.model.Axis;

/**
 * Column engine: expands {@code {%col for %}} and {@code {%col if %}} blocks.
 *
 * Bodies are not rendered here since their cells may still sit inside row
 * blocks; the scope of each finished body is deferred into the
 * {@link ColumnContextStore}, which follows every column insert and delete.
 */
public class ColumnBlockExpander extends AbstractBlockExpander {

    private final ColumnContextStore columnContexts;

    public ColumnBlockExpander(Grid grid, ExpressionEvaluator evaluator, RenderProperties properties,
                               ColumnContextStore columnContexts) {
        super(grid, Axis.COLUMN, evaluator, properties);
        this.columnContexts = columnContexts;
    }

    /**
     * Adds the loop record under the column alias as well, so a cell inside a
     * row loop can still reach the column loop's record.
     */
    @Override
    protected ContextScope loopScope(ContextScope scope, String variable, Object item, LoopRecord loop) {
        return super.loopScope(scope, variable, item, loop).with(properties.getColumnLoopAlias(), loop);
    }

    @Override
    protected int crossExtent() {
        return grid.getMaxRow();
    }

    @Override
    protected Object valueAt(int line, int cross) {
        return grid.getValue(cross, line);
    }

    @Override
    protected void insertLines(int at, int count) {
        grid.insertColumns(at, count);
        columnContexts.shift(at, count);
    }

    @Override
    protected void deleteLines(int at, int count) {
        grid.deleteColumns(at, count);
        columnContexts.shift(at, -count);
    }

    @Override
    protected void copyLine(int source, int target) {
        grid.copyColumnMetadata(source, target);
        int maxRow = grid.getMaxRow();
        for (int row = 1; row <= maxRow; row++) {
            grid.copyCell(row, source, row, target);
        }
    }

    @Override
    protected void completeBody(int start, int end, ContextScope scope) {
        columnContexts.defer(start, end, scope);
    }
}
