package com.querydesk.portal.exception;

import org.springframework.http.HttpStatus;

public class ValidationException extends PortalException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_REQUEST;
    }

    @Override
    public String getErrorName() {
        return "ValidationError";
    }
}
