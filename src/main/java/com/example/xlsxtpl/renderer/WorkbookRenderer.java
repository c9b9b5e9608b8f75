package com.example.xlsxtpl.renderer;

import com.example.xlsxtpl.config.RenderProperties;
import com.example.xlsxtpl.core.ContextScope;
import com.example.xlsxtpl.expression.ExpressionEvaluator;
import com.example.xlsxtpl.grid.PoiSheetGrid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Renders every sheet of a workbook in place, in sheet order, with the same data.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkbookRenderer {

    private final ExpressionEvaluator expressionEvaluator;
    private final RenderProperties renderProperties;

    public void render(Workbook workbook, Map<String, ?> data) {
        ContextScope scope = ContextScope.of(data);
        for (Sheet sheet : workbook) {
            log.debug("Rendering sheet '{}'", sheet.getSheetName());
            new SheetRenderer(new PoiSheetGrid(sheet), expressionEvaluator, renderProperties).render(scope);
        }
        log.info("Rendered {} sheet(s)", workbook.getNumberOfSheets());
    }
}
