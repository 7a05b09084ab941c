package org.nullmask.io;

import org.nullmask.model.Dataset;
import org.nullmask.model.Row;
import org.nullmask.model.SchemaMismatchException;
import org.nullmask.model.Value;
import org.supercsv.io.CsvListReader;
import org.supercsv.io.ICsvListReader;
import org.supercsv.prefs.CsvPreference;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a CSV file whose first record is the header. Cells are kept as text;
 * an empty cell becomes the null marker.
 */
public class CsvDatasetReader implements DatasetReader {

    private final CsvPreference preference;

    public CsvDatasetReader() {
        this(CsvPreference.STANDARD_PREFERENCE);
    }

    public CsvDatasetReader(CsvPreference preference) {
        this.preference = preference;
    }

    @Override
    public Dataset read(Path path) throws IOException {
        try (ICsvListReader reader = new CsvListReader(Files.newBufferedReader(path, StandardCharsets.UTF_8), preference)) {
            String[] header = reader.getHeader(true);
            if (header == null || header.length == 0) {
                throw new SchemaMismatchException("CSV file has no header: " + path);
            }
            List<String> schema = Arrays.asList(header);

            List<Row> rows = new ArrayList<>();
            List<String> record;
            while ((record = reader.read()) != null) {
                if (record.size() != schema.size()) {
                    throw new SchemaMismatchException(String.format(
                            "CSV line %d has %d cells, header has %d", reader.getLineNumber(), record.size(), schema.size()));
                }
                Map<String, Value> cells = new LinkedHashMap<>();
                for (int i = 0; i < schema.size(); i++) {
                    cells.put(schema.get(i), toValue(record.get(i)));
                }
                rows.add(Row.of(cells));
            }
            return Dataset.of(schema, rows);
        }
    }

    private static Value toValue(String cell) {
        return cell == null || cell.isEmpty() ? Value.nullValue() : Value.text(cell);
    }
}
