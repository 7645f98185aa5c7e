package com.cyberx.vpnpool.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Response envelope for the pool endpoints.
 *
 * @param <T> payload type
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
    boolean success,
    String message,
    T data
) {

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, null, data);
    }

    public static <T> ApiResponse<T> ok(String message, T data) {
        return new ApiResponse<>(true, message, data);
    }

    public static <T> ApiResponse<T> failed(String message, T data) {
        return new ApiResponse<>(false, message, data);
    }
}
