package com.stockaid.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stockaid.model.Table;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decoder for JSON responses shaped as a list of flat records.
 *
 * The records are either the root array, the array under {@code recordsField}, or a single root
 * object treated as one record. Columns appear in order of first occurrence; missing values are
 * empty cells and nested values are kept as JSON text. No records, or records without fields, is no data.
 */
@Slf4j
public class JsonRecordsDecoder implements ResponseDecoder {

    private final ObjectMapper objectMapper;
    private final String recordsField;

    public JsonRecordsDecoder(ObjectMapper objectMapper) {
        this(objectMapper, null);
    }

    public JsonRecordsDecoder(ObjectMapper objectMapper, String recordsField) {
        this.objectMapper = objectMapper;
        this.recordsField = recordsField;
    }

    @Override
    public Optional<Table> decode(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            List<JsonNode> records = records(root);
            return tabulate(records);
        } catch (Exception e) {
            log.debug("Response is not a JSON record list: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Table of the given records: columns in order of first occurrence, missing values as empty cells.
     *
     * @return empty when no record has a field
     */
    public static Optional<Table> tabulate(List<? extends JsonNode> records) {
        Set<String> columns = new LinkedHashSet<>();
        for (JsonNode record : records) {
            record.fieldNames().forEachRemaining(columns::add);
        }
        if (columns.isEmpty()) {
            return Optional.empty();
        }

        List<List<String>> rows = new ArrayList<>(records.size());
        for (JsonNode record : records) {
            List<String> row = new ArrayList<>(columns.size());
            for (String column : columns) {
                row.add(cell(record.get(column)));
            }
            rows.add(row);
        }
        return Optional.of(Table.of(new ArrayList<>(columns), rows));
    }

    private List<JsonNode> records(JsonNode root) {
        JsonNode node = root;
        if (recordsField != null) {
            node = root.path(recordsField);
        }

        List<JsonNode> records = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode element : node) {
                if (element.isObject()) {
                    records.add(element);
                }
            }
        } else if (node.isObject() && recordsField == null) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            if (fields.hasNext()) {
                records.add(node);
            }
        }
        return records;
    }

    private static String cell(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return "";
        }
        if (value.isValueNode()) {
            return value.asText();
        }
        return value.toString();
    }
}
