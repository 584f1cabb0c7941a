package com.stockaid.model.dto;

import com.stockaid.model.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * JSON view of an API call result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableResponse {

    private String provider;
    private String api;
    private boolean cacheHit;
    private List<String> columns;
    private List<List<String>> rows;

    public static TableResponse of(String provider, String api, boolean cacheHit, Table table) {
        return TableResponse.builder()
                .provider(provider)
                .api(api)
                .cacheHit(cacheHit)
                .columns(table.getColumns())
                .rows(table.getRows())
                .build();
    }
}
