package org.nullmask.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import org.nullmask.model.Dataset;
import org.nullmask.model.Row;
import org.nullmask.model.SchemaMismatchException;
import org.nullmask.model.Value;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a top-level JSON array of objects. The first object's field order is the schema.
 * Decimals are kept as BigDecimal so they are written back digit for digit.
 */
public class JsonDatasetReader implements DatasetReader {

    private final ObjectMapper objectMapper;

    public JsonDatasetReader() {
        this.objectMapper = new ObjectMapper()
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false);
    }

    @Override
    public Dataset read(Path path) throws IOException {
        JsonNode root = objectMapper.readTree(path.toFile());
        if (root == null || !root.isArray()) {
            throw new SchemaMismatchException("JSON dataset must be an array of objects: " + path);
        }
        if (root.isEmpty()) {
            throw new SchemaMismatchException("JSON dataset is empty, no schema can be derived: " + path);
        }

        List<String> schema = new ArrayList<>();
        List<Row> rows = new ArrayList<>();
        for (int i = 0; i < root.size(); i++) {
            JsonNode element = root.get(i);
            if (!element.isObject()) {
                throw new SchemaMismatchException("Element " + i + " of " + path + " is not an object");
            }
            if (i == 0) {
                element.fieldNames().forEachRemaining(schema::add);
            }
            Map<String, Value> cells = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = element.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                cells.put(field.getKey(), toValue(field.getValue()));
            }
            rows.add(Row.of(cells));
        }
        return Dataset.of(schema, rows);
    }

    static Value toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return Value.nullValue();
        if (node.isTextual()) return Value.text(node.textValue());
        if (node.isNumber()) return Value.number(node.numberValue());
        if (node.isBoolean()) return Value.bool(node.booleanValue());
        return Value.opaque(node);
    }
}
