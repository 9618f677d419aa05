package com.nevis.vendors.exception;

public class InvalidVectorException extends IllegalArgumentException {

    public InvalidVectorException(String message) {
        super(message);
    }
}
