package com.querydesk.portal.dto;

import com.querydesk.portal.model.QueryStatus;

public record SubmissionReceipt(Long id, QueryStatus status) {
}
