package com.nevis.vendors.exception;

import com.nevis.vendors.model.ServiceType;
import lombok.Getter;

@Getter
public abstract class ExternalServiceException extends RuntimeException {
    private final ServiceType service;

    protected ExternalServiceException(ServiceType service, String message, Throwable cause) {
        super(service.id() + ": " + message, cause);
        this.service = service;
    }
}
