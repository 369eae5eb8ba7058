package com.querydesk.portal.exception;

import org.springframework.http.HttpStatus;

public class ForbiddenException extends PortalException {

    public ForbiddenException(String message) {
        super(message);
    }

    public ForbiddenException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.FORBIDDEN;
    }

    @Override
    public String getErrorName() {
        return "Forbidden";
    }
}
