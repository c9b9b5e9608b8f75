package com.example.xlsxtpl.renderer;

import com.example.xlsxtpl.config.RenderProperties;
import com.example.xlsxtpl.core.ContextScope;
import com.example.xlsxtpl.expression.ExpressionEvaluator;
import com.example.xlsxtpl.grid.Grid;
import com.example.xlsxtpl.model.Axis;

/**
 * Row engine: expands {@code {% for %}} and {@code {% if %}} blocks and renders
 * each finished body with its own scope.
 */
public class RowBlockExpander extends AbstractBlockExpander {

    private final CellRenderer cellRenderer;

    public RowBlockExpander(Grid grid, ExpressionEvaluator evaluator, RenderProperties properties,
                            CellRenderer cellRenderer) {
        super(grid, Axis.ROW, evaluator, properties);
        this.cellRenderer = cellRenderer;
    }

    @Override
    protected int crossExtent() {
        return grid.getMaxColumn();
    }

    @Override
    protected Object valueAt(int line, int cross) {
        return grid.getValue(line, cross);
    }

    @Override
    protected void insertLines(int at, int count) {
        grid.insertRows(at, count);
    }

    @Override
    protected void deleteLines(int at, int count) {
        grid.deleteRows(at, count);
    }

    @Override
    protected void copyLine(int source, int target) {
        grid.copyRowMetadata(source, target);
        int maxColumn = grid.getMaxColumn();
        for (int column = 1; column <= maxColumn; column++) {
            grid.copyCell(source, column, target, column);
        }
    }

    @Override
    protected void completeBody(int start, int end, ContextScope scope) {
        cellRenderer.renderRange(start, end, scope);
    }
}
