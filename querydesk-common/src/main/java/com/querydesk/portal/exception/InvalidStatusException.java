package com.querydesk.portal.exception;

import org.springframework.http.HttpStatus;

public class InvalidStatusException extends PortalException {

    public InvalidStatusException(String message) {
        super(message);
    }

    public InvalidStatusException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_REQUEST;
    }

    @Override
    public String getErrorName() {
        return "InvalidStatus";
    }
}
