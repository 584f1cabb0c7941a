package com.stockaid.codec;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.stockaid.model.Table;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads and writes tables as comma separated text with a header row.
 * This is the on-disk format of cache entries.
 */
public class TableCsvCodec {

    public static final String EXTENSION = "csv";

    private final CsvMapper csvMapper;

    public TableCsvCodec(CsvMapper csvMapper) {
        this.csvMapper = csvMapper;
    }

    public TableCsvCodec() {
        this(new CsvMapper());
    }

    public String write(Table table) throws IOException {
        if (table.getColumns().isEmpty()) {
            return "";
        }
        StringWriter out = new StringWriter();
        try (SequenceWriter writer = csvMapper.writer(CsvSchema.emptySchema())
                .with(CsvGenerator.Feature.ALWAYS_QUOTE_EMPTY_STRINGS)
                .writeValues(out)) {
            writer.write(table.getColumns());
            for (List<String> row : table.getRows()) {
                writer.write(row);
            }
        }
        return out.toString();
    }

    /**
     * @throws IOException if the text is not valid CSV
     * @throws IllegalArgumentException if a row does not match the header width
     */
    public Table read(String text) throws IOException {
        List<String> columns = null;
        List<List<String>> rows = new ArrayList<>();
        try (MappingIterator<String[]> it = csvMapper.readerFor(String[].class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                .readValues(text)) {
            while (it.hasNextValue()) {
                List<String> cells = Arrays.asList(it.nextValue());
                if (columns == null) {
                    columns = cells;
                } else {
                    rows.add(cells);
                }
            }
        }
        return Table.of(columns == null ? List.of() : columns, rows);
    }
}
