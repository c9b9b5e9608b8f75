package com.example.xlsxtpl.service;

import com.example.xlsxtpl.renderer.WorkbookRenderer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Workbook;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Load, render and serialise in one call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class XlsxTemplateService {

    private final TemplateLoader templateLoader;
    private final WorkbookRenderer workbookRenderer;
    private final ExcelOutputService excelOutputService;

    /**
     * Renders the template at {@code templateLocation} and returns the .xlsx bytes.
     */
    public byte[] render(String templateLocation, Map<String, ?> data) {
        try (Workbook workbook = templateLoader.loadWorkbook(templateLocation)) {
            workbookRenderer.render(workbook, data);
            return excelOutputService.toBytes(workbook);
        } catch (IOException e) {
            // only close() can get here, after the bytes were produced
            throw new IllegalStateException("Failed to close workbook " + templateLocation, e);
        }
    }

    public byte[] render(byte[] template, Map<String, ?> data) {
        try (Workbook workbook = templateLoader.loadWorkbook(template)) {
            workbookRenderer.render(workbook, data);
            return excelOutputService.toBytes(workbook);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to close workbook", e);
        }
    }

    /**
     * Renders a template with data read from {@code dataLocation} and writes the result to {@code output}.
     */
    public Path renderToFile(String templateLocation, String dataLocation, Path output) {
        Map<String, Object> data = dataLocation == null ? Map.of() : templateLoader.loadData(dataLocation);
        try (Workbook workbook = templateLoader.loadWorkbook(templateLocation)) {
            workbookRenderer.render(workbook, data);
            return excelOutputService.write(workbook, output);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to close workbook " + templateLocation, e);
        }
    }
}
