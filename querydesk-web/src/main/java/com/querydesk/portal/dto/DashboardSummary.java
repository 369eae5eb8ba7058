package com.querydesk.portal.dto;

import java.util.List;

public record DashboardSummary(StatusCounts counts, List<TimeseriesPoint> timeseries, List<RecentQuery> recent) {
}
