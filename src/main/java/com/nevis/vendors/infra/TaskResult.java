package com.nevis.vendors.infra;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record TaskResult<T>(String key, T value, Exception error, int attempts) {

    public static <T> TaskResult<T> success(String key, T value, int attempts) {
        return new TaskResult<>(key, value, null, attempts);
    }

    public static <T> TaskResult<T> failure(String key, Exception error, int attempts) {
        return new TaskResult<>(key, null, error, attempts);
    }

    /**
     * Indexes a batch by unit key, keeping submission order.
     */
    public static <T> Map<String, TaskResult<T>> byKey(List<TaskResult<T>> results) {
        Map<String, TaskResult<T>> indexed = new LinkedHashMap<>();
        results.forEach(result -> indexed.putIfAbsent(result.key(), result));
        return indexed;
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T getOrThrow() {
        if (error == null) {
            return value;
        }
        if (error instanceof RuntimeException runtime) {
            throw runtime;
        }
        throw new IllegalStateException(errorMessage(), error);
    }

    public String errorMessage() {
        if (error == null) {
            return null;
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
