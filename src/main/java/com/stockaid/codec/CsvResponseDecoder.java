package com.stockaid.codec;

import com.stockaid.model.Table;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Decoder for providers that answer with delimited text and a header row.
 */
@Slf4j
public class CsvResponseDecoder implements ResponseDecoder {

    private final TableCsvCodec codec;

    public CsvResponseDecoder(TableCsvCodec codec) {
        this.codec = codec;
    }

    @Override
    public Optional<Table> decode(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            Table table = codec.read(body);
            if (table.getColumns().isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(table);
        } catch (Exception e) {
            log.debug("Response is not valid CSV: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
