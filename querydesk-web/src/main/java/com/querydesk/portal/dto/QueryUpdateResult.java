package com.querydesk.portal.dto;

import com.querydesk.portal.model.Query;

/**
 * Outcome of an admin update. {@code responded} is true when the update stored a new admin
 * response.
 */
public record QueryUpdateResult(Query query, boolean responded) {
}
