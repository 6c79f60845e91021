package com.dtinsight.analysis.load;

import com.dtinsight.analysis.model.Dataset;
import com.dtinsight.config.AnalysisProperties;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads a spreadsheet (.xlsx/.xls, first sheet) or a CSV file into a {@link Dataset}. The first row
 * holds the headers. An anonymous leading index column is renamed to the identifier column.
 */
@Component
public class DatasetLoader {
    private static final Logger log = LoggerFactory.getLogger(DatasetLoader.class);
    private static final Pattern NUMBER_PATTERN = Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");
    private static final Pattern INTEGER_PATTERN = Pattern.compile("[-+]?\\d+");
    private static final Set<String> MISSING_TOKENS = Set.of("", "nan", "na", "n/a", "null", "none");

    private final AnalysisProperties properties;

    public DatasetLoader(AnalysisProperties properties) {
        this.properties = properties;
    }

    public Dataset load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new DatasetLoadException("dataset file not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return load(path.getFileName().toString(), in);
        } catch (IOException e) {
            throw new DatasetLoadException("failed to read " + path + ": " + rootMessage(e), e);
        }
    }

    public Dataset load(String sourceName, InputStream in) {
        SourceFormat format = SourceFormat.fromFileName(sourceName);
        if (format == null) {
            throw new DatasetLoadException("unsupported file type: " + sourceName);
        }
        RawTable table;
        try {
            table = format == SourceFormat.CSV ? readCsv(in) : readWorkbook(in);
        } catch (IOException | RuntimeException e) {
            throw new DatasetLoadException("failed to parse " + sourceName + ": " + rootMessage(e), e);
        }
        Dataset dataset = toDataset(sourceName, table);
        log.info("Loaded dataset {}: {} records, {} columns", sourceName, dataset.size(), dataset.columns().size());
        return dataset;
    }

    private RawTable readWorkbook(InputStream in) throws IOException {
        DataFormatter formatter = new DataFormatter(Locale.ROOT);
        try (Workbook workbook = WorkbookFactory.create(in)) {
            if (workbook.getNumberOfSheets() == 0) {
                return new RawTable(List.of(), List.of());
            }
            Sheet sheet = workbook.getSheetAt(0);
            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (headerRow == null) {
                return new RawTable(List.of(), List.of());
            }
            int width = Math.max(0, headerRow.getLastCellNum());
            List<String> headers = new ArrayList<>(width);
            for (int c = 0; c < width; c++) {
                Cell cell = headerRow.getCell(c);
                headers.add(cell == null ? "" : formatter.formatCellValue(cell).trim());
            }

            List<List<Object>> rows = new ArrayList<>();
            for (int r = headerRow.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) {
                    continue;
                }
                List<Object> values = new ArrayList<>(width);
                boolean anyValue = false;
                for (int c = 0; c < width; c++) {
                    Object value = cellValue(row.getCell(c), formatter);
                    anyValue |= value != null;
                    values.add(value);
                }
                if (anyValue) {
                    rows.add(values);
                }
            }
            return new RawTable(headers, rows);
        }
    }

    private Object cellValue(Cell cell, DataFormatter formatter) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        switch (type) {
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return blankToNull(formatter.formatCellValue(cell));
                }
                double d = cell.getNumericCellValue();
                return Double.isNaN(d) ? null : d;
            case STRING:
                return textValue(cell.getStringCellValue());
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            default:
                return null;
        }
    }

    private RawTable readCsv(InputStream in) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreEmptyLines(true)
            .build();
        Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
        try (CSVParser parser = format.parse(reader)) {
            List<String> headers = null;
            List<List<Object>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                if (headers == null) {
                    headers = new ArrayList<>();
                    for (String header : record) {
                        headers.add(stripBom(header).trim());
                    }
                    continue;
                }
                List<Object> values = new ArrayList<>(headers.size());
                for (int c = 0; c < headers.size(); c++) {
                    values.add(c < record.size() ? textValue(record.get(c)) : null);
                }
                rows.add(values);
            }
            return new RawTable(headers == null ? List.of() : headers, rows);
        }
    }

    private Dataset toDataset(String sourceName, RawTable table) {
        List<String> columns = columnNames(table.headers());
        String identifierColumn = properties.getColumns().getIdentifier();
        int identifierIndex = columns.indexOf(identifierColumn);
        for (int c = 0; c < columns.size(); c++) {
            List<Object> values = columnValues(table, c);
            if (c == identifierIndex) {
                normalizeIdentifiers(values);
            } else {
                normalizeNumbers(values);
            }
            for (int r = 0; r < table.rows().size(); r++) {
                table.rows().get(r).set(c, values.get(r));
            }
        }

        List<Map<String, Object>> rows = new ArrayList<>(table.rows().size());
        for (List<Object> values : table.rows()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int c = 0; c < columns.size(); c++) {
                row.put(columns.get(c), values.get(c));
            }
            rows.add(row);
        }
        return Dataset.of(sourceName, columns, rows);
    }

    /**
     * Blank headers become {@code Unnamed: i}, duplicates get a {@code .n} suffix, and an anonymous
     * index header is renamed to the identifier column unless that column already exists.
     */
    private List<String> columnNames(List<String> headers) {
        AnalysisProperties.Columns config = properties.getColumns();
        List<String> names = new ArrayList<>(headers.size());
        Map<String, Integer> seen = new HashMap<>();
        for (int c = 0; c < headers.size(); c++) {
            String header = headers.get(c);
            String name = header == null || header.isBlank() ? "Unnamed: " + c : header;
            int occurrences = seen.merge(name, 1, Integer::sum);
            names.add(occurrences == 1 ? name : name + "." + (occurrences - 1));
        }
        if (!names.contains(config.getIdentifier())) {
            for (String anonymous : config.getAnonymousIndexNames()) {
                int index = names.indexOf(anonymous);
                if (index >= 0) {
                    log.debug("Renaming column '{}' to identifier column '{}'", anonymous, config.getIdentifier());
                    names.set(index, config.getIdentifier());
                    break;
                }
            }
        }
        return names;
    }

    private List<Object> columnValues(RawTable table, int column) {
        List<Object> values = new ArrayList<>(table.rows().size());
        for (List<Object> row : table.rows()) {
            values.add(column < row.size() ? row.get(column) : null);
        }
        return values;
    }

    /**
     * A column whose non-missing values are all numbers (or numeric text) becomes numeric; it holds
     * {@code Long}s when every value is integral, else {@code Double}s. Other columns stay as read.
     */
    private void normalizeNumbers(List<Object> values) {
        boolean numeric = true;
        boolean integral = true;
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            Double d = toDouble(value);
            if (d == null) {
                numeric = false;
                break;
            }
            integral &= d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 9.0e15;
        }
        if (!numeric) {
            for (int i = 0; i < values.size(); i++) {
                if (values.get(i) instanceof Double d) {
                    values.set(i, formatNumber(d));
                }
            }
            return;
        }
        for (int i = 0; i < values.size(); i++) {
            Double d = values.get(i) == null ? null : toDouble(values.get(i));
            values.set(i, d == null ? null : integral ? (Object) d.longValue() : (Object) d);
        }
    }

    private void normalizeIdentifiers(List<Object> values) {
        for (int i = 0; i < values.size(); i++) {
            Object value = values.get(i);
            if (value instanceof Double d && d == Math.rint(d)) {
                values.set(i, d.longValue());
            } else if (value instanceof String s && INTEGER_PATTERN.matcher(s).matches()) {
                try {
                    values.set(i, Long.parseLong(s));
                } catch (NumberFormatException e) {
                    log.debug("Identifier '{}' is out of range, kept as text", s);
                }
            }
        }
    }

    private Double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String s && NUMBER_PATTERN.matcher(s).matches()) {
            return Double.parseDouble(s);
        }
        return null;
    }

    private String formatNumber(double d) {
        if (d == Math.rint(d) && Math.abs(d) < 9.0e15) {
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }

    private Object textValue(String raw) {
        String value = blankToNull(raw);
        if (value == null || MISSING_TOKENS.contains(value.toLowerCase(Locale.ROOT))) {
            return null;
        }
        return value;
    }

    private String blankToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private String stripBom(String value) {
        if (value != null && !value.isEmpty() && value.charAt(0) == '\uFEFF') {
            return value.substring(1);
        }
        return value == null ? "" : value;
    }

    private String rootMessage(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current.getMessage() == null ? current.toString() : current.getMessage();
    }

    private record RawTable(List<String> headers, List<List<Object>> rows) {}

    private enum SourceFormat {
        XLSX,
        XLS,
        CSV;

        private static SourceFormat fromFileName(String fileName) {
            if (fileName == null) {
                return null;
            }
            String lower = fileName.trim().toLowerCase(Locale.ROOT);
            if (lower.endsWith(".xlsx")) {
                return XLSX;
            }
            if (lower.endsWith(".xls")) {
                return XLS;
            }
            if (lower.endsWith(".csv")) {
                return CSV;
            }
            return null;
        }
    }
}
