package com.querydesk.portal.endpoint;

import com.querydesk.portal.dto.DashboardSummary;
import com.querydesk.portal.dto.Granularity;
import com.querydesk.portal.dto.StatusCounts;
import com.querydesk.portal.dto.TimeseriesPoint;
import com.querydesk.portal.service.DashboardService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/admin/dashboard")
@RequiredArgsConstructor
public class AdminDashboardController {

    private final DashboardService dashboardService;

    @GetMapping
    public DashboardSummary getDashboard() {
        return dashboardService.summary();
    }

    @GetMapping("/counts")
    public StatusCounts getCounts() {
        return dashboardService.counts();
    }

    @GetMapping("/timeseries")
    public List<TimeseriesPoint> getTimeseries(
            @RequestParam(defaultValue = "day") String granularity,
            @RequestParam(required = false) Integer buckets) {
        Granularity g = Granularity.fromValue(granularity);
        return buckets != null ? dashboardService.timeseries(g, buckets) : dashboardService.timeseries(g);
    }
}
