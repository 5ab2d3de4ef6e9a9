package com.drinkjoy.catalog.infrastructure.adapter.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Body of a values read: row-major cells, first row is the header
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ValueRangeResponse(
        String range,
        String majorDimension,
        List<List<String>> values
) {
    public boolean hasRows() {
        return values != null && values.size() > 1;
    }
}
