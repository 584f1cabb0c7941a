package com.stockaid.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Outcome of {@code call()}: a table, or the no-data marker when the decoder rejected the payload.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ApiResult {

    private static final ApiResult NO_DATA = new ApiResult(null, false);

    private final Table table;
    private final boolean cacheHit;

    public static ApiResult fetched(Table table) {
        return new ApiResult(table, false);
    }

    public static ApiResult cached(Table table) {
        return new ApiResult(table, true);
    }

    public static ApiResult noData() {
        return NO_DATA;
    }

    public boolean hasData() {
        return table != null;
    }

    public Optional<Table> asOptional() {
        return Optional.ofNullable(table);
    }

    /**
     * @throws NoSuchElementException when this is the no-data marker
     */
    public Table requireTable() {
        if (table == null) {
            throw new NoSuchElementException("API call returned no data");
        }
        return table;
    }
}
