package com.example.xlsxtpl.renderer;

import com.example.xlsxtpl.core.ContextScope;
import com.example.xlsxtpl.exception.TemplateRenderException;
import com.example.xlsxtpl.expression.ExpressionEvaluationException;
import com.example.xlsxtpl.expression.ExpressionEvaluator;
import com.example.xlsxtpl.grid.Grid;
import com.example.xlsxtpl.parser.CellTags;
import org.apache.poi.ss.util.CellReference;

import java.util.Optional;

/**
 * Replaces the tags of expression cells with their values.
 *
 * A cell holding exactly one {@code {{ expr }}} receives the native value of the
 * expression; any other tag-bearing text is rendered to a string. Cells holding
 * a block tag are left alone.
 */
public class CellRenderer {

    private final Grid grid;
    private final ExpressionEvaluator evaluator;
    private final ColumnContextStore columnContexts;

    public CellRenderer(Grid grid, ExpressionEvaluator evaluator, ColumnContextStore columnContexts) {
        this.grid = grid;
        this.evaluator = evaluator;
        this.columnContexts = columnContexts;
    }

    /**
     * Renders rows {@code startRow..endRow} across all columns. Each cell is
     * rendered with {@code scope} layered over its column's deferred scope.
     */
    public void renderRange(int startRow, int endRow, ContextScope scope) {
        int maxColumn = grid.getMaxColumn();
        for (int row = startRow; row <= endRow; row++) {
            for (int column = 1; column <= maxColumn; column++) {
                Object value = grid.getValue(row, column);
                if (!CellTags.hasTemplateTag(value) || CellTags.isBlockTag(value)) {
                    continue;
                }
                renderCell(row, column, (String) value, columnContexts.resolve(column, scope));
            }
        }
    }

    void renderCell(int row, int column, String text, ContextScope scope) {
        Optional<String> expression = CellTags.pureExpression(text);
        if (expression.isPresent()) {
            Object result;
            try {
                result = evaluator.evaluate(expression.get(), scope);
            } catch (ExpressionEvaluationException e) {
                throw new TemplateRenderException(String.format("Failed to render expression '%s' in cell %s: %s",
                        expression.get(), coordinate(row, column), e.getMessage()), e);
            }
            grid.setValue(row, column, result);
            return;
        }
        String rendered;
        try {
            rendered = evaluator.render(text, scope);
        } catch (ExpressionEvaluationException e) {
            throw new TemplateRenderException(String.format("Failed to render cell %s: %s",
                    coordinate(row, column), e.getMessage()), e);
        }
        grid.setValue(row, column, rendered);
    }

    static String coordinate(int row, int column) {
        return CellReference.convertNumToColString(column - 1) + row;
    }
}
