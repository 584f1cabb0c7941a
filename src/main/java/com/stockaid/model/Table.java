package com.stockaid.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tabular result of an API call: named columns and rows of string cells.
 * Immutable. Cells are kept as text so a table read back from the cache equals the one that was written.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Table {

    private final List<String> columns;
    private final List<List<String>> rows;

    private Table(List<String> columns, List<List<String>> rows) {
        this.columns = columns;
        this.rows = rows;
    }

    public static Table of(List<String> columns, List<? extends List<String>> rows) {
        List<String> cols = List.copyOf(columns);
        List<List<String>> copied = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            if (row.size() != cols.size()) {
                throw new IllegalArgumentException(
                        "Row has " + row.size() + " cells but table has " + cols.size() + " columns");
            }
            // List.copyOf rejects nulls; empty cells are stored as ""
            List<String> cells = new ArrayList<>(row.size());
            for (String cell : row) {
                cells.add(cell == null ? "" : cell);
            }
            copied.add(Collections.unmodifiableList(cells));
        }
        return new Table(cols, Collections.unmodifiableList(copied));
    }

    public static Builder builder(String... columns) {
        return new Builder(List.of(columns));
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int columnIndex(String column) {
        int idx = columns.indexOf(column);
        if (idx < 0) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        return idx;
    }

    public String get(int row, String column) {
        return rows.get(row).get(columnIndex(column));
    }

    public double getDouble(int row, String column) {
        return Double.parseDouble(get(row, column));
    }

    /**
     * All values of one column, top to bottom.
     */
    public List<String> column(String column) {
        int idx = columnIndex(column);
        return rows.stream().map(r -> r.get(idx)).toList();
    }

    public static final class Builder {

        private final List<String> columns;
        private final List<List<String>> rows = new ArrayList<>();

        private Builder(List<String> columns) {
            this.columns = columns;
        }

        public Builder row(Object... cells) {
            List<String> row = new ArrayList<>(cells.length);
            for (Object cell : cells) {
                row.add(cell == null ? "" : String.valueOf(cell));
            }
            rows.add(row);
            return this;
        }

        public Table build() {
            return Table.of(columns, rows);
        }
    }
}
