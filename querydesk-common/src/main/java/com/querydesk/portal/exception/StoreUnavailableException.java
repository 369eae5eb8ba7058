package com.querydesk.portal.exception;

import org.springframework.http.HttpStatus;

public class StoreUnavailableException extends PortalException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.SERVICE_UNAVAILABLE;
    }

    @Override
    public String getErrorName() {
        return "StoreUnavailable";
    }
}
