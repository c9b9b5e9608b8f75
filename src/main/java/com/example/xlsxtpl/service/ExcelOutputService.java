package com.example.xlsxtpl.service;

import com.example.xlsxtpl.exception.TemplateLoadingException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Workbook;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Helper service to serialize rendered workbooks to bytes or files.
 */
@Slf4j
@Component
public class ExcelOutputService {

    public byte[] toBytes(Workbook workbook) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            workbook.write(baos);
            return baos.toByteArray();
        } catch (IOException e) {
            throw new TemplateLoadingException("OUTPUT_WRITE_FAILED", "Failed to serialize Excel workbook", e);
        }
    }

    public Path write(Workbook workbook, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(target)) {
                workbook.write(out);
            }
            log.info("Wrote rendered workbook to {}", target);
            return target;
        } catch (IOException e) {
            throw new TemplateLoadingException("OUTPUT_WRITE_FAILED", "Failed to write Excel workbook to " + target, e);
        }
    }
}
