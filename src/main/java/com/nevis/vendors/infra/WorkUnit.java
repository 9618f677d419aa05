package com.nevis.vendors.infra;

import java.util.concurrent.Callable;

public record WorkUnit<T>(String key, int cost, Callable<T> task) {

    public WorkUnit {
        if (key == null) {
            throw new IllegalArgumentException("Work unit key cannot be null");
        }
        if (cost < 1) {
            throw new IllegalArgumentException("Work unit cost must be positive, got " + cost);
        }
        if (task == null) {
            throw new IllegalArgumentException("Work unit task cannot be null");
        }
    }

    public static <T> WorkUnit<T> of(String key, Callable<T> task) {
        return new WorkUnit<>(key, 1, task);
    }
}
