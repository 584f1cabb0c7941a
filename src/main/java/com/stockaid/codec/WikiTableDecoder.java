package com.stockaid.codec;

import com.stockaid.model.Table;
import org.apache.commons.text.StringEscapeUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decoder for a MediaWiki "edit section" page: reads the wikitext table out of the edit box.
 *
 * The first row holds the column names ({@code !!} separated), the remaining rows the cells
 * ({@code ||} separated). Links, external links and templates are reduced to their text.
 */
public class WikiTableDecoder implements ResponseDecoder {

    private static final Pattern EDIT_BOX = Pattern.compile(
            "<textarea[^>]*\\bid=\"wpTextbox1\"[^>]*>(.*?)</textarea>",
            Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    private static final String ROW_SEPARATOR = "\n|-";
    private static final String TABLE_END = "\n|}";

    @Override
    public Optional<Table> decode(String body) {
        if (body == null) {
            return Optional.empty();
        }
        Matcher matcher = EDIT_BOX.matcher(body);
        if (!matcher.find()) {
            return Optional.empty();
        }
        // the edit box content is escaped, and wikitext itself may carry entities
        String text = StringEscapeUtils.unescapeHtml4(StringEscapeUtils.unescapeHtml4(matcher.group(1)));

        List<String> columns = null;
        List<List<String>> rows = new ArrayList<>();
        for (String row : rows(text)) {
            if (columns == null) {
                columns = cells(row.replace('\n', '!'), "!!");
                if (columns.isEmpty()) {
                    return Optional.empty();
                }
                continue;
            }
            List<String> cells = cells(row.replace('\n', '|'), "||");
            if (cells.isEmpty()) {
                continue;
            }
            rows.add(fit(cells, columns.size()));
        }
        if (columns == null || rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Table.of(columns, rows));
    }

    private static List<String> rows(String text) {
        int start = Math.max(text.indexOf("wikitable"), 0);
        int end = text.indexOf(TABLE_END, start);
        String table = end < 0 ? text.substring(start) : text.substring(start, end);

        List<String> rows = new ArrayList<>();
        int separator = table.indexOf(ROW_SEPARATOR);
        while (separator >= 0) {
            int from = separator + ROW_SEPARATOR.length();
            separator = table.indexOf(ROW_SEPARATOR, from);
            rows.add(separator < 0 ? table.substring(from) : table.substring(from, separator));
        }
        return rows;
    }

    /**
     * Cells between delimiters; text before the first delimiter is not a cell.
     */
    static List<String> cells(String row, String delimiter) {
        List<String> cells = new ArrayList<>();
        int end = row.indexOf(delimiter);
        while (end >= 0) {
            int start = end + delimiter.length();
            end = row.indexOf(delimiter, start);
            String cell = end < 0 ? row.substring(start) : row.substring(start, end);
            cells.add(plainText(cell));
        }
        return cells;
    }

    /**
     * {@code [[page|text]]} gives text, {@code [url text]} gives url, {@code {{template|key}}} gives key.
     */
    static String plainText(String cell) {
        String[] link = unwrap(cell, "[[", "]]", "|");
        String text = link[1].isEmpty() ? link[0] : link[1];

        text = unwrap(text, "[", "]", " ")[0];

        String[] template = unwrap(text, "{{", "}}", "|");
        text = template[1].isEmpty() ? template[0] : template[1];
        return text.strip();
    }

    private static String[] unwrap(String s, String open, String close, String split) {
        int start = s.indexOf(open);
        if (start < 0) {
            return new String[]{s, ""};
        }
        start += open.length();
        int end = s.indexOf(close, start);
        if (end < 0) {
            return new String[]{s, ""};
        }
        String inner = s.substring(start, end);
        int at = inner.indexOf(split);
        if (at < 0) {
            return new String[]{inner, ""};
        }
        return new String[]{inner.substring(0, at), inner.substring(at + split.length())};
    }

    private static List<String> fit(List<String> cells, int width) {
        if (cells.size() >= width) {
            return new ArrayList<>(cells.subList(0, width));
        }
        List<String> padded = new ArrayList<>(cells);
        while (padded.size() < width) {
            padded.add("");
        }
        return padded;
    }
}
