package com.querydesk.portal.exception;

import org.springframework.http.HttpStatus;

/**
 * Base type for every failure the portal reports to its callers. Each subclass carries the
 * HTTP status and the error name it is rendered with.
 */
public abstract class PortalException extends RuntimeException {

    protected PortalException(String message) {
        super(message);
    }

    protected PortalException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract HttpStatus getStatus();

    public abstract String getErrorName();
}
