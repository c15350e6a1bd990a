package com.example.paytracker.common;

import java.util.Collections;
import java.util.Map;

/**
 * Envelope returned by every REST endpoint.
 * <p>
 * {@code meta} carries side information that is not part of the payload itself,
 * for example the reference paycheck a computation was based on or whether the
 * result is flagged as unreliable.
 */
public record ApiResponse<T>(boolean success, String message, T data, Map<String, Object> meta) {

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, null, data, Collections.emptyMap());
    }

    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(true, message, data, Collections.emptyMap());
    }

    public static <T> ApiResponse<T> success(String message, T data, Map<String, Object> meta) {
        return new ApiResponse<>(true, message, data, meta == null ? Collections.emptyMap() : Map.copyOf(meta));
    }
}
