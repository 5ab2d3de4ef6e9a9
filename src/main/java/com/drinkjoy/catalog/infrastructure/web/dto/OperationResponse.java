package com.drinkjoy.catalog.infrastructure.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        boolean success,
        String message,
        Object data
) {
    public static OperationResponse ok(String message) {
        return new OperationResponse(true, message, null);
    }

    public static OperationResponse ok(String message, Object data) {
        return new OperationResponse(true, message, data);
    }

    public static OperationResponse failure(String message) {
        return new OperationResponse(false, message, null);
    }
}
