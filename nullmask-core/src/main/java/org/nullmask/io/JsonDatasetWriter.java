package org.nullmask.io;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.nullmask.model.Dataset;
import org.nullmask.model.Row;
import org.nullmask.model.Value;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a pretty-printed JSON array with one object per row; the null marker becomes {@code null}.
 */
public class JsonDatasetWriter implements DatasetWriter {

    private final ObjectMapper objectMapper;

    public JsonDatasetWriter() {
        this.objectMapper = new ObjectMapper()
                .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);
    }

    @Override
    public void write(Dataset dataset, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        ArrayNode array = objectMapper.createArrayNode();
        for (Row row : dataset.rows()) {
            ObjectNode object = array.addObject();
            for (String column : dataset.schema()) {
                put(object, column, row.get(column));
            }
        }
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), array);
    }

    private static void put(ObjectNode object, String field, Value value) {
        switch (value.kind()) {
            case NULL -> object.putNull(field);
            case TEXT -> object.put(field, (String) value.raw());
            case BOOLEAN -> object.put(field, (Boolean) value.raw());
            case NUMBER -> putNumber(object, field, (Number) value.raw());
            case OPAQUE -> {
                if (value.raw() instanceof JsonNode node) {
                    object.set(field, node);
                } else {
                    object.putPOJO(field, value.raw());
                }
            }
        }
    }

    private static void putNumber(ObjectNode object, String field, Number n) {
        if (n instanceof BigDecimal d) object.put(field, d);
        else if (n instanceof BigInteger i) object.put(field, i);
        else if (n instanceof Double d) object.put(field, d);
        else if (n instanceof Float f) object.put(field, f);
        else if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte) {
            object.put(field, n.longValue());
        } else {
            object.put(field, new BigDecimal(n.toString()));
        }
    }
}
