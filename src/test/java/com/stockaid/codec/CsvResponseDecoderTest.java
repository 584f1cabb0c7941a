package com.stockaid.codec;

import com.stockaid.model.Table;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvResponseDecoderTest {

    private final CsvResponseDecoder decoder = new CsvResponseDecoder(new TableCsvCodec());

    @Test
    void testDecodesHeaderAndRows() {
        Table table = decoder.decode("Symbol,Security\nMMM,3M\nAOS,A. O. Smith\n").orElseThrow();

        assertEquals(List.of("Symbol", "Security"), table.getColumns());
        assertEquals(List.of("MMM", "AOS"), table.column("Symbol"));
    }

    @Test
    void testBlankOrRaggedIsNoData() {
        assertTrue(decoder.decode("   ").isEmpty());
        assertTrue(decoder.decode("a,b\n1,2,3\n").isEmpty());
    }
}
