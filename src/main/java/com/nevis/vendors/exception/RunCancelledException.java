package com.nevis.vendors.exception;

import lombok.Getter;

@Getter
public class RunCancelledException extends RuntimeException {
    private final String key;

    public RunCancelledException(String key) {
        super("Cancelled before completion: " + key);
        this.key = key;
    }
}
