package com.nevis.vendors.exception;

import com.nevis.vendors.model.ServiceType;

public class PermanentServiceException extends ExternalServiceException {

    public PermanentServiceException(ServiceType service, String message) {
        super(service, message, null);
    }

    public PermanentServiceException(ServiceType service, String message, Throwable cause) {
        super(service, message, cause);
    }
}
