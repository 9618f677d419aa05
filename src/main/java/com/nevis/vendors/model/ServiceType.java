package com.nevis.vendors.model;

public enum ServiceType {
    QUERY_GENERATION("query-generation"),
    EMBEDDING("embedding"),
    PLACE_SEARCH("place-search"),
    PLACE_DETAILS("place-details");

    private final String id;

    ServiceType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
