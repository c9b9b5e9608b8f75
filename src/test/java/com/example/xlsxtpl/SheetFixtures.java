package com.example.xlsxtpl;

import com.example.xlsxtpl.config.RenderProperties;
import com.example.xlsxtpl.expression.FilterRegistry;
import com.example.xlsxtpl.expression.SpelExpressionEvaluator;
import com.example.xlsxtpl.expression.StandardFilters;
import com.example.xlsxtpl.grid.PoiSheetGrid;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * In-memory sheets for renderer and grid tests.
 */
public final class SheetFixtures {

    private SheetFixtures() {
    }

    /**
     * Sheet whose cells are given row by row starting at A1; null leaves a cell empty.
     */
    public static Sheet sheet(Object[]... rows) {
        Sheet sheet = new XSSFWorkbook().createSheet("Sheet1");
        PoiSheetGrid grid = new PoiSheetGrid(sheet);
        for (int r = 0; r < rows.length; r++) {
            if (rows[r] == null) {
                continue;
            }
            for (int c = 0; c < rows[r].length; c++) {
                if (rows[r][c] != null) {
                    grid.setValue(r + 1, c + 1, rows[r][c]);
                }
            }
        }
        return sheet;
    }

    public static Object[] row(Object... values) {
        return values;
    }

    /**
     * Values of one sheet row, trailing empty cells omitted.
     */
    public static List<Object> rowValues(Sheet sheet, int row) {
        PoiSheetGrid grid = new PoiSheetGrid(sheet);
        List<Object> values = new ArrayList<>();
        Row poiRow = sheet.getRow(row - 1);
        if (poiRow == null) {
            return values;
        }
        for (int c = 1; c <= poiRow.getLastCellNum(); c++) {
            values.add(grid.getValue(row, c));
        }
        while (!values.isEmpty() && values.get(values.size() - 1) == null) {
            values.remove(values.size() - 1);
        }
        return values;
    }

    /**
     * All rows from 1 to the last physical row.
     */
    public static List<List<Object>> dump(Sheet sheet) {
        List<List<Object>> rows = new ArrayList<>();
        int maxRow = new PoiSheetGrid(sheet).getMaxRow();
        for (int r = 1; r <= maxRow; r++) {
            rows.add(rowValues(sheet, r));
        }
        return rows;
    }

    public static List<Object> values(Object... values) {
        return Arrays.asList(values);
    }

    public static SpelExpressionEvaluator evaluator() {
        return evaluator(new RenderProperties());
    }

    public static SpelExpressionEvaluator evaluator(RenderProperties properties) {
        return new SpelExpressionEvaluator(properties, StandardFilters.registerAll(new FilterRegistry(), properties));
    }
}
