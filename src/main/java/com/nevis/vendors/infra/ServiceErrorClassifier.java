package com.nevis.vendors.infra;

import com.nevis.vendors.exception.ExternalServiceException;
import com.nevis.vendors.exception.PermanentServiceException;
import com.nevis.vendors.exception.RunCancelledException;
import com.nevis.vendors.exception.TransientServiceException;
import com.nevis.vendors.model.ServiceType;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.exception.RetriableException;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

public final class ServiceErrorClassifier {

    private ServiceErrorClassifier() {
    }

    public static Exception classify(ServiceType service, String key, Exception error) {
        if (error instanceof ExternalServiceException
            || error instanceof RunCancelledException
            || error instanceof InterruptedException) {
            return error;
        }

        String message = "call " + key + " failed: " + error.getMessage();
        if (isTransient(error)) {
            return new TransientServiceException(service, message, error);
        }
        return new PermanentServiceException(service, message, error);
    }

    static boolean isTransient(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof NonRetriableException) {
                return false;
            }
            if (t instanceof HttpClientErrorException clientError) {
                return clientError.getStatusCode().value() == 429;
            }
            if (t instanceof RetriableException
                || t instanceof HttpServerErrorException
                || t instanceof ResourceAccessException
                || t instanceof TimeoutException
                || t instanceof IOException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
