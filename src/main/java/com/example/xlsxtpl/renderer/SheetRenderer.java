package com.example.xlsxtpl.renderer;

import com.example.xlsxtpl.config.RenderProperties;
import com.example.xlsxtpl.core.ContextScope;
import com.example.xlsxtpl.expression.ExpressionEvaluator;
import com.example.xlsxtpl.grid.Grid;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Renders one sheet: column blocks first, then row blocks, then every cell
 * still carrying a tag.
 *
 * Instances hold per-sheet state and are used for a single render.
 */
@Slf4j
public class SheetRenderer {

    private final Grid grid;
    private final ColumnBlockExpander columnExpander;
    private final RowBlockExpander rowExpander;
    private final CellRenderer cellRenderer;

    public SheetRenderer(Grid grid, ExpressionEvaluator evaluator, RenderProperties properties) {
        ColumnContextStore columnContexts = new ColumnContextStore();
        this.grid = grid;
        this.cellRenderer = new CellRenderer(grid, evaluator, columnContexts);
        this.columnExpander = new ColumnBlockExpander(grid, evaluator, properties, columnContexts);
        this.rowExpander = new RowBlockExpander(grid, evaluator, properties, cellRenderer);
    }

    public void render(Map<String, ?> data) {
        render(ContextScope.of(data));
    }

    public void render(ContextScope scope) {
        int columnDelta = columnExpander.processBlocks(columnExpander.scan(1, grid.getMaxColumn()), scope);
        int rowDelta = rowExpander.processBlocks(rowExpander.scan(1, grid.getMaxRow()), scope);
        log.debug("Block expansion done: {} column(s), {} row(s)", signed(columnDelta), signed(rowDelta));
        cellRenderer.renderRange(1, grid.getMaxRow(), scope);
    }

    private static String signed(int delta) {
        return delta > 0 ? "+" + delta : String.valueOf(delta);
    }
}
