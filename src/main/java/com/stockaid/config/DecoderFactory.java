package com.stockaid.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stockaid.codec.CsvResponseDecoder;
import com.stockaid.codec.JsonRecordsDecoder;
import com.stockaid.codec.ResponseDecoder;
import com.stockaid.codec.TableCsvCodec;
import com.stockaid.exception.ApiConfigurationException;

import java.util.Locale;

/**
 * Resolves the built-in decoders that configured APIs refer to by name.
 */
public class DecoderFactory {

    private final ObjectMapper objectMapper;
    private final TableCsvCodec csvCodec;

    public DecoderFactory(ObjectMapper objectMapper, TableCsvCodec csvCodec) {
        this.objectMapper = objectMapper;
        this.csvCodec = csvCodec;
    }

    public ResponseDecoder create(StockaidProperties.ApiConfig api) {
        String name = api.getDecoder() == null ? "" : api.getDecoder().trim().toLowerCase(Locale.ROOT);
        return switch (name) {
            case StockaidProperties.DecoderNames.JSON_RECORDS -> new JsonRecordsDecoder(objectMapper, api.getRecordsField());
            case StockaidProperties.DecoderNames.CSV -> new CsvResponseDecoder(csvCodec);
            default -> throw new ApiConfigurationException("Unknown decoder: '" + api.getDecoder() + "'");
        };
    }
}
