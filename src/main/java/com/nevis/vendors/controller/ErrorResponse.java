package com.nevis.vendors.controller;

public record ErrorResponse(String message, int status, long timestamp) {}
