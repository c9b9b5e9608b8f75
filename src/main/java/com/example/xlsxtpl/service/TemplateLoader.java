package com.example.xlsxtpl.service;

import com.example.xlsxtpl.exception.TemplateLoadingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Loads template workbooks and their render data.
 *
 * A location is either a file system path or a {@code classpath:} resource; a
 * plain path that does not exist on disk is also tried on the classpath. Data
 * files are JSON, or YAML when the name ends in {@code .yml} / {@code .yaml}.
 */
@Slf4j
@Component
public class TemplateLoader {
    private static final String CLASSPATH_PREFIX = "classpath:";
    private static final TypeReference<LinkedHashMap<String, Object>> DATA_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * Load an .xlsx workbook from a file path or classpath location
     */
    public Workbook loadWorkbook(String location) {
        log.info("Loading template workbook: {}", location);
        try (InputStream in = open(location, "TEMPLATE_NOT_FOUND")) {
            return new XSSFWorkbook(in);
        } catch (TemplateLoadingException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            log.error("Failed to read template workbook: {}", location, e);
            throw new TemplateLoadingException(
                "TEMPLATE_PARSE_FAILED",
                "Failed to read template workbook: " + location,
                e
            );
        }
    }

    public Workbook loadWorkbook(byte[] content) {
        if (content == null || content.length == 0) {
            throw new TemplateLoadingException("TEMPLATE_PARSE_FAILED", "Template content cannot be empty");
        }
        try (InputStream in = new ByteArrayInputStream(content)) {
            return new XSSFWorkbook(in);
        } catch (IOException | RuntimeException e) {
            throw new TemplateLoadingException(
                "TEMPLATE_PARSE_FAILED",
                "Failed to read template workbook from " + content.length + " bytes",
                e
            );
        }
    }

    /**
     * Load render data (a JSON or YAML object) from a file path or classpath location
     */
    public Map<String, Object> loadData(String location) {
        log.info("Loading render data: {}", location);
        ObjectMapper mapper = isYaml(location) ? yamlMapper : jsonMapper;
        try (InputStream in = open(location, "DATA_NOT_FOUND")) {
            Map<String, Object> data = mapper.readValue(in, DATA_TYPE);
            return data == null ? new LinkedHashMap<>() : data;
        } catch (TemplateLoadingException e) {
            throw e;
        } catch (IOException e) {
            log.error("Failed to parse render data: {}", location, e);
            throw new TemplateLoadingException(
                "DATA_PARSE_FAILED",
                "Failed to parse render data: " + location,
                e
            );
        }
    }

    /**
     * Parse render data held in memory; {@code yaml} selects the YAML parser.
     */
    public Map<String, Object> parseData(String content, boolean yaml) {
        try {
            Map<String, Object> data = (yaml ? yamlMapper : jsonMapper).readValue(content, DATA_TYPE);
            return data == null ? new LinkedHashMap<>() : data;
        } catch (IOException e) {
            throw new TemplateLoadingException("DATA_PARSE_FAILED", "Failed to parse render data", e);
        }
    }

    private InputStream open(String location, String notFoundCode) throws IOException {
        if (location == null || location.isBlank()) {
            throw new TemplateLoadingException(notFoundCode, "Location cannot be null or empty");
        }
        if (location.startsWith(CLASSPATH_PREFIX)) {
            return openClasspath(location.substring(CLASSPATH_PREFIX.length()), location, notFoundCode);
        }
        File file = new File(location);
        if (file.isFile()) {
            return new FileInputStream(file);
        }
        log.debug("Not found on the file system, trying classpath: {}", location);
        return openClasspath(location, location, notFoundCode);
    }

    private InputStream openClasspath(String path, String location, String notFoundCode) throws IOException {
        ClassPathResource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            throw new TemplateLoadingException(notFoundCode, "Nothing found at " + location);
        }
        return resource.getInputStream();
    }

    private static boolean isYaml(String location) {
        String lower = location == null ? "" : location.toLowerCase(Locale.ROOT);
        return lower.endsWith(".yml") || lower.endsWith(".yaml");
    }
}
