package com.ai.quizbot.service;

import com.ai.quizbot.entity.Question;
import com.ai.quizbot.exception.ContentUnavailableException;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the question table from a spreadsheet (.xlsx/.xls, first sheet) or a
 * CSV file. The first row holds the column headers.
 */
@Service
public class QuestionSourceLoader {

    private static final Logger log = LoggerFactory.getLogger(QuestionSourceLoader.class);

    private final ResourceLoader resourceLoader;
    private final QuestionRowMapper rowMapper;

    public QuestionSourceLoader(ResourceLoader resourceLoader, QuestionRowMapper rowMapper) {
        this.resourceLoader = resourceLoader;
        this.rowMapper = rowMapper;
    }

    /**
     * @throws ContentUnavailableException when the source is missing, unreadable,
     *                                     of an unknown format or has no usable rows
     */
    public List<Question> load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ContentUnavailableException("Question source not found: " + location);
        }
        String name = resource.getFilename() != null ? resource.getFilename().toLowerCase(Locale.ROOT) : "";

        boolean spreadsheet = name.endsWith(".xlsx") || name.endsWith(".xls");
        if (!spreadsheet && !name.endsWith(".csv")) {
            throw new ContentUnavailableException("Unsupported question source format: " + location);
        }

        List<Map<String, String>> rows;
        try (InputStream in = resource.getInputStream()) {
            rows = spreadsheet ? readWorkbook(in) : readCsv(in);
        } catch (IOException | CsvException | RuntimeException e) {
            // POI reports some corrupt files with unchecked exceptions
            throw new ContentUnavailableException("Could not read question source " + location, e);
        }

        List<Question> questions = rowMapper.map(rows);
        if (questions.isEmpty()) {
            throw new ContentUnavailableException("Question source " + location + " has no usable rows");
        }
        log.info("Loaded {} questions from {}", questions.size(), location);
        return questions;
    }

    private List<Map<String, String>> readWorkbook(InputStream in) throws IOException {
        List<Map<String, String>> rows = new ArrayList<>();
        try (Workbook workbook = WorkbookFactory.create(in)) {
            if (workbook.getNumberOfSheets() == 0) {
                return rows;
            }
            Sheet sheet = workbook.getSheetAt(0);
            DataFormatter formatter = new DataFormatter();
            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (headerRow == null || headerRow.getLastCellNum() < 0) {
                return rows;
            }
            List<String> headers = new ArrayList<>();
            for (int c = 0; c < headerRow.getLastCellNum(); c++) {
                headers.add(readCell(headerRow.getCell(c), formatter));
            }
            for (int r = sheet.getFirstRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) {
                    continue;
                }
                Map<String, String> values = new LinkedHashMap<>();
                for (int c = 0; c < headers.size(); c++) {
                    if (headers.get(c) != null) {
                        values.put(headers.get(c), readCell(row.getCell(c), formatter));
                    }
                }
                rows.add(values);
            }
        }
        return rows;
    }

    private List<Map<String, String>> readCsv(InputStream in) throws IOException, CsvException {
        List<Map<String, String>> rows = new ArrayList<>();
        try (CSVReader reader = new CSVReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            List<String[]> all = reader.readAll();
            if (all.isEmpty()) {
                return rows;
            }
            String[] headers = all.get(0);
            if (headers.length > 0 && headers[0] != null) {
                headers[0] = headers[0].replace("\uFEFF", "");
            }
            for (int i = 1; i < all.size(); i++) {
                String[] line = all.get(i);
                Map<String, String> values = new LinkedHashMap<>();
                for (int c = 0; c < headers.length; c++) {
                    String value = c < line.length ? line[c] : null;
                    values.put(headers[c].trim(), value != null && !value.isBlank() ? value.trim() : null);
                }
                rows.add(values);
            }
        }
        return rows;
    }

    private static String readCell(Cell cell, DataFormatter formatter) {
        if (cell == null) {
            return null;
        }
        String value = formatter.formatCellValue(cell);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isBlank() ? null : trimmed;
    }
}
