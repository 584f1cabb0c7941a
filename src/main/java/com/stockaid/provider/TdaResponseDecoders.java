package com.stockaid.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stockaid.codec.JsonRecordsDecoder;
import com.stockaid.model.Table;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decoders for the TDA market data responses.
 */
@Slf4j
class TdaResponseDecoders {

    private final ObjectMapper objectMapper;

    TdaResponseDecoders(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * {@code {"ABC": {...quote...}, ...}}: one row per symbol.
     */
    Optional<Table> quote(String body) {
        Optional<JsonNode> root = parse(body);
        if (root.isEmpty() || !root.get().isObject()) {
            return Optional.empty();
        }
        List<JsonNode> records = new ArrayList<>();
        root.get().elements().forEachRemaining(node -> {
            if (node.isObject()) {
                records.add(node);
            }
        });
        return JsonRecordsDecoder.tabulate(records);
    }

    /**
     * Candles sorted by {@code datetime}. A response flagged {@code empty} is no data.
     */
    Optional<Table> history(String body) {
        Optional<JsonNode> root = parse(body);
        if (root.isEmpty() || root.get().path("empty").asBoolean(false)) {
            return Optional.empty();
        }
        JsonNode candles = root.get().path("candles");
        if (!candles.isArray()) {
            return Optional.empty();
        }
        List<JsonNode> records = new ArrayList<>();
        candles.forEach(records::add);
        records.sort(Comparator.comparingLong(candle -> candle.path("datetime").asLong()));
        return JsonRecordsDecoder.tabulate(records);
    }

    /**
     * Flattens the call and put expiration maps into one row per option contract,
     * adding {@code expDate}, {@code strike}, {@code underlying} and {@code underlyingLast}.
     */
    Optional<Table> chains(String body) {
        Optional<JsonNode> root = parse(body);
        if (root.isEmpty()) {
            return Optional.empty();
        }
        JsonNode underlying = root.get().path("underlying");
        if (!underlying.isObject()) {
            return Optional.empty();
        }
        String symbol = underlying.path("symbol").asText();
        String last = underlying.path("last").asText();

        List<JsonNode> records = new ArrayList<>();
        flatten(root.get().path("callExpDateMap"), symbol, last, records);
        flatten(root.get().path("putExpDateMap"), symbol, last, records);
        return JsonRecordsDecoder.tabulate(records);
    }

    private void flatten(JsonNode expDateMap, String symbol, String last, List<JsonNode> records) {
        Iterator<Map.Entry<String, JsonNode>> dates = expDateMap.fields();
        while (dates.hasNext()) {
            Map.Entry<String, JsonNode> date = dates.next();
            Iterator<Map.Entry<String, JsonNode>> strikes = date.getValue().fields();
            while (strikes.hasNext()) {
                Map.Entry<String, JsonNode> strike = strikes.next();
                for (JsonNode option : strike.getValue()) {
                    if (!option.isObject()) {
                        continue;
                    }
                    ObjectNode record = option.deepCopy();
                    record.put("expDate", date.getKey());
                    record.put("strike", strike.getKey());
                    record.put("underlying", symbol);
                    record.put("underlyingLast", last);
                    records.add(record);
                }
            }
        }
    }

    private Optional<JsonNode> parse(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readTree(body));
        } catch (Exception e) {
            log.debug("Unparseable TDA response: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
