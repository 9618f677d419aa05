package com.nevis.vendors.model;

public enum RunStatus {
    RUNNING,
    COMPLETED,
    CANCELLED,
    FAILED
}
