package com.example.xlsxtpl.service;

import com.example.xlsxtpl.exception.TemplateLoadingException;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

public class ExcelOutputServiceTest {

    private final ExcelOutputService outputService = new ExcelOutputService();

    @TempDir
    Path tempDir;

    @Test
    public void testWritesReadableWorkbook() throws Exception {
        try (Workbook workbook = new XSSFWorkbook()) {
            workbook.createSheet("Out").createRow(0).createCell(0).setCellValue("done");

            byte[] bytes = outputService.toBytes(workbook);
            Path file = outputService.write(workbook, tempDir.resolve("nested/dir/out.xlsx"));

            assertTrue(bytes.length > 0);
            try (Workbook reread = new XSSFWorkbook(Files.newInputStream(file))) {
                assertEquals("done", reread.getSheet("Out").getRow(0).getCell(0).getStringCellValue());
            }
        }
    }

    @Test
    public void testWriteFailureIsReported() throws Exception {
        Workbook workbook = mock(Workbook.class);
        doThrow(new IOException("disk full")).when(workbook).write(any(OutputStream.class));

        TemplateLoadingException e = assertThrows(TemplateLoadingException.class, () -> outputService.toBytes(workbook));
        assertEquals("OUTPUT_WRITE_FAILED", e.getCode());
    }
}
