package com.example.dutyroster.common;

import java.util.Collections;
import java.util.Map;

/**
 * 共通APIレスポンスラッパー。
 * <p>
 * 成功時は全エンドポイントでこの形に揃える。失敗時は
 * {@link com.example.dutyroster.exception.GlobalExceptionHandler} が返す。
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
