package com.querydesk.portal.dto;

import java.time.LocalDate;

public record TimeseriesPoint(LocalDate date, long count) {
}
