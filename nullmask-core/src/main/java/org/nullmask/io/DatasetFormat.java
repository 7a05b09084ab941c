package org.nullmask.io;

import java.nio.file.Path;
import java.util.Locale;

/**
 * File formats a dataset can be read from and written to, picked by file extension.
 */
public enum DatasetFormat {
    CSV(".csv"),
    JSON(".json");

    private final String extension;

    DatasetFormat(String extension) {
        this.extension = extension;
    }

    public DatasetReader reader() {
        return switch (this) {
            case CSV -> new CsvDatasetReader();
            case JSON -> new JsonDatasetReader();
        };
    }

    public DatasetWriter writer() {
        return switch (this) {
            case CSV -> new CsvDatasetWriter();
            case JSON -> new JsonDatasetWriter();
        };
    }

    /**
     * @throws IllegalArgumentException if the extension is not one of the supported formats
     */
    public static DatasetFormat fromPath(Path path) {
        Path fileName = path.getFileName();
        String name = fileName == null ? "" : fileName.toString().toLowerCase(Locale.ROOT);
        for (DatasetFormat format : values()) {
            if (name.endsWith(format.extension)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported dataset format: " + path
                + " (expected a .csv or .json file)");
    }
}
