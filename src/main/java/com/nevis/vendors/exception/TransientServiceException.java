package com.nevis.vendors.exception;

import com.nevis.vendors.model.ServiceType;

public class TransientServiceException extends ExternalServiceException {

    public TransientServiceException(ServiceType service, String message) {
        super(service, message, null);
    }

    public TransientServiceException(ServiceType service, String message, Throwable cause) {
        super(service, message, cause);
    }
}
