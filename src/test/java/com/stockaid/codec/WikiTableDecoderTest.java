package com.stockaid.codec;

import com.stockaid.model.Table;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class WikiTableDecoderTest {

    private final WikiTableDecoder decoder = new WikiTableDecoder();

    private static String editPage(String wikitext) {
        return "<html><body><form>"
                + "<textarea tabindex=\"1\" id=\"wpTextbox1\" cols=\"80\" rows=\"25\">"
                + wikitext
                + "</textarea></form></body></html>";
    }

    @Test
    void testReadsHeaderAndRows() {
        String wikitext = "{| class=&quot;wikitable sortable&quot; id=&quot;constituents&quot;\n"
                + "|-\n"
                + "! Symbol !! Security !! GICS Sector\n"
                + "|-\n"
                + "| {{NyseSymbol|MMM}} || [[3M]] || Industrials\n"
                + "|-\n"
                + "| {{NasdaqSymbol|AAPL}} || [[Apple Inc.|Apple]] || Information Technology\n"
                + "|-\n"
                + "| {{NyseSymbol|T}} || [[AT&amp;amp;T]] || Communication Services\n"
                + "|}\n";

        Table table = decoder.decode(editPage(wikitext)).orElseThrow();

        assertEquals(List.of("Symbol", "Security", "GICS Sector"), table.getColumns());
        assertEquals(List.of("MMM", "AAPL", "T"), table.column("Symbol"));
        assertEquals(List.of("3M", "Apple", "AT&T"), table.column("Security"));
    }

    @Test
    void testRowsAreFittedToHeaderWidth() {
        String wikitext = "{| class=&quot;wikitable&quot;\n"
                + "|-\n"
                + "! Company !! Symbol\n"
                + "|-\n"
                + "| [[Amgen]] || AMGN || extra\n"
                + "|-\n"
                + "| [[Boeing]]\n"
                + "|}";

        Table table = decoder.decode(editPage(wikitext)).orElseThrow();

        assertEquals(List.of("Amgen", "AMGN"), table.getRows().get(0));
        assertEquals(List.of("Boeing", ""), table.getRows().get(1));
    }

    @Test
    void testMarkupIsReducedToText() {
        assertEquals("Apple", WikiTableDecoder.plainText(" [[Apple Inc.|Apple]] "));
        assertEquals("3M", WikiTableDecoder.plainText("[[3M]]"));
        assertEquals("https://example.test", WikiTableDecoder.plainText("[https://example.test Example]"));
        assertEquals("MMM", WikiTableDecoder.plainText("{{NyseSymbol|MMM}}"));
        assertEquals("plain", WikiTableDecoder.plainText("plain"));
    }

    @Test
    void testPageWithoutEditBoxIsNoData() {
        assertEquals(Optional.empty(), decoder.decode("<html><body>Not found</body></html>"));
        assertEquals(Optional.empty(), decoder.decode(editPage("no table here")));
        assertEquals(Optional.empty(), decoder.decode(null));
    }
}
