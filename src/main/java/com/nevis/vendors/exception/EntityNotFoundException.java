package com.nevis.vendors.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class EntityNotFoundException extends RuntimeException {
    private final UUID entityId;

    public EntityNotFoundException(UUID entityId) {
        super("Run not found: " + entityId);
        this.entityId = entityId;
    }
}
