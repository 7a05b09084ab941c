package org.nullmask.io;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.nullmask.model.Dataset;
import org.nullmask.model.Row;
import org.nullmask.model.SchemaMismatchException;
import org.nullmask.model.Value;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvDatasetIoTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("header becomes the schema and empty cells become null")
    void read_headerAndEmptyCells() throws IOException {
        Path csv = tempDir.resolve("people.csv");
        Files.writeString(csv, """
                id,name,email
                1,Alice,alice@example.com
                2,,bob@example.com
                3,"Carol, Jr.",
                """);

        Dataset dataset = new CsvDatasetReader().read(csv);

        assertThat(dataset.schema()).containsExactly("id", "name", "email");
        assertThat(dataset.size()).isEqualTo(3);
        assertThat(dataset.row(0).get("id")).isEqualTo(Value.text("1"));
        assertThat(dataset.row(1).get("name")).isSameAs(Value.nullValue());
        assertThat(dataset.row(2).get("name")).isEqualTo(Value.text("Carol, Jr."));
        assertThat(dataset.row(2).get("email")).isSameAs(Value.nullValue());
    }

    @Test
    @DisplayName("header-only file yields a dataset without rows")
    void read_headerOnly() throws IOException {
        Path csv = tempDir.resolve("empty.csv");
        Files.writeString(csv, "a,b\n");

        Dataset dataset = new CsvDatasetReader().read(csv);

        assertThat(dataset.schema()).containsExactly("a", "b");
        assertThat(dataset.size()).isZero();
    }

    @Test
    @DisplayName("empty file has no schema")
    void read_emptyFile() throws IOException {
        Path csv = tempDir.resolve("nothing.csv");
        Files.writeString(csv, "");

        assertThatThrownBy(() -> new CsvDatasetReader().read(csv)).isInstanceOf(SchemaMismatchException.class);
    }

    @Test
    @DisplayName("row with a different cell count is rejected")
    void read_unevenRow() throws IOException {
        Path csv = tempDir.resolve("uneven.csv");
        Files.writeString(csv, "a,b\n1,2\n3\n");

        assertThatThrownBy(() -> new CsvDatasetReader().read(csv))
                .isInstanceOf(SchemaMismatchException.class)
                .hasMessageContaining("header has 2");
    }

    @Test
    @DisplayName("written file reads back with nulls as empty cells")
    void write_thenRead() throws IOException {
        Map<String, Object> cells = new LinkedHashMap<>();
        cells.put("name", "Alice");
        cells.put("score", 12.5);
        cells.put("note", null);
        Dataset dataset = Dataset.of(List.of("name", "score", "note"), List.of(Row.of(cells)));
        Path csv = tempDir.resolve("out/masked.csv");

        new CsvDatasetWriter().write(dataset, csv);

        assertThat(Files.readAllLines(csv)).containsExactly("name,score,note", "Alice,12.5,");
        Dataset reread = new CsvDatasetReader().read(csv);
        assertThat(reread.row(0).get("score")).isEqualTo(Value.text("12.5"));
        assertThat(reread.row(0).get("note")).isSameAs(Value.nullValue());
    }
}
