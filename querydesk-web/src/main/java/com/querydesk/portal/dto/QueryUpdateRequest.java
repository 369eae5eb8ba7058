package com.querydesk.portal.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update of a query. A null field is left untouched; a blank {@code adminResponse}
 * clears the stored response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryUpdateRequest {
    private String status;
    private String adminResponse;
}
