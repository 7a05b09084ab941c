package org.nullmask.io;

import org.nullmask.model.Dataset;
import org.nullmask.model.Row;
import org.nullmask.model.Value;
import org.supercsv.io.CsvListWriter;
import org.supercsv.io.ICsvListWriter;
import org.supercsv.prefs.CsvPreference;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a header line followed by one record per row; the null marker becomes an empty cell.
 */
public class CsvDatasetWriter implements DatasetWriter {

    private final CsvPreference preference;

    public CsvDatasetWriter() {
        this(CsvPreference.STANDARD_PREFERENCE);
    }

    public CsvDatasetWriter(CsvPreference preference) {
        this.preference = preference;
    }

    @Override
    public void write(Dataset dataset, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        List<String> schema = dataset.schema();
        try (ICsvListWriter writer = new CsvListWriter(Files.newBufferedWriter(path, StandardCharsets.UTF_8), preference)) {
            writer.writeHeader(schema.toArray(new String[0]));
            for (Row row : dataset.rows()) {
                List<String> record = new ArrayList<>(schema.size());
                for (String column : schema) {
                    Value value = row.get(column);
                    record.add(value.isNull() ? null : value.canonicalText());
                }
                writer.write(record);
            }
        }
    }
}
