package com.aistudio.orchestrator.service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one independent batch item: a value or an error, never both.
 *
 * @param item 1-based position of the item in the batch
 */
public record ItemResult<T>(int item, T value, String error, String errorType) {

    public static <T> ItemResult<T> success(int item, T value) {
        return new ItemResult<>(item, value, null, null);
    }

    public static <T> ItemResult<T> failure(int item, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new ItemResult<>(item, null, message, cause.getClass().getSimpleName());
    }

    public boolean isSuccess() {
        return error == null;
    }

    /** Wire form: {@code {item, output}} or {@code {item, error, errorType}}. */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("item", item);
        if (isSuccess()) {
            map.put("output", value);
        } else {
            map.put("error", error);
            map.put("errorType", errorType);
        }
        return map;
    }
}
