package com.nevis.vendors.exception;

public class WrongQueryException extends IllegalArgumentException {

    public WrongQueryException(String message) {
        super(message);
    }
}
