package com.querydesk.portal.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.querydesk.portal.exception.InvalidStatusException;

import java.util.Locale;

public enum QueryStatus {
    PENDING("pending"),
    IN_PROGRESS("in-progress"),
    RESOLVED("resolved");

    private final String value;

    QueryStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolves a wire value. Accepts "in-progress", "in_progress" and "in progress" for the
     * middle state, case-insensitively.
     *
     * @throws InvalidStatusException when the value names no known status
     */
    @JsonCreator
    public static QueryStatus fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidStatusException("Status is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-').replace(' ', '-');
        for (QueryStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        throw new InvalidStatusException("Unknown status: " + raw);
    }
}
