package com.querydesk.portal.service;

import com.querydesk.portal.dto.DashboardSummary;
import com.querydesk.portal.dto.Granularity;
import com.querydesk.portal.dto.RecentQuery;
import com.querydesk.portal.dto.StatusCounts;
import com.querydesk.portal.dto.TimeseriesPoint;
import com.querydesk.portal.exception.StoreUnavailableException;
import com.querydesk.portal.exception.ValidationException;
import com.querydesk.portal.model.QueryStatus;
import com.querydesk.portal.repository.QueryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Aggregate statistics for the admin dashboard. Counts cover the whole store; the time series
 * buckets submissions by {@code createdAt} in the configured dashboard zone.
 */
@Service
@Slf4j
public class DashboardService {

    static final int MAX_BUCKETS = 366;

    private final QueryRepository queryRepository;
    private final Clock clock;
    private final ZoneId zone;
    private final int defaultBuckets;
    private final int recentLimit;

    public DashboardService(QueryRepository queryRepository,
                            Clock clock,
                            @Value("${app.dashboard.zone:UTC}") String zone,
                            @Value("${app.dashboard.default-buckets:30}") int defaultBuckets,
                            @Value("${app.dashboard.recent-limit:10}") int recentLimit) {
        this.queryRepository = queryRepository;
        this.clock = clock;
        this.zone = ZoneId.of(zone);
        this.defaultBuckets = defaultBuckets;
        this.recentLimit = recentLimit;
    }

    public StatusCounts counts() {
        return fromStore(() -> {
            long pending = queryRepository.countByStatus(QueryStatus.PENDING);
            long inProgress = queryRepository.countByStatus(QueryStatus.IN_PROGRESS);
            long resolved = queryRepository.countByStatus(QueryStatus.RESOLVED);
            return new StatusCounts(pending + inProgress + resolved, pending, inProgress, resolved);
        });
    }

    public List<TimeseriesPoint> timeseries(Granularity granularity) {
        return timeseries(granularity, defaultBuckets);
    }

    /**
     * Submission counts for the {@code buckets} most recent buckets, oldest first, ending with the
     * bucket that contains today. Buckets without submissions are reported with count 0.
     */
    public List<TimeseriesPoint> timeseries(Granularity granularity, int buckets) {
        if (buckets < 1 || buckets > MAX_BUCKETS) {
            throw new ValidationException("buckets must be between 1 and " + MAX_BUCKETS);
        }
        LocalDate today = LocalDate.now(clock.withZone(zone));
        LocalDate current = granularity.bucketStart(today);
        LocalDate first = granularity.plus(current, -(buckets - 1));
        LocalDate end = granularity.plus(current, 1);

        List<LocalDateTime> createdAts = fromStore(() ->
                queryRepository.findCreatedAtBetween(toStoreTime(first), toStoreTime(end)));

        Map<LocalDate, Long> counts = new HashMap<>();
        for (LocalDateTime createdAt : createdAts) {
            LocalDate local = createdAt.atOffset(ZoneOffset.UTC).atZoneSameInstant(zone).toLocalDate();
            counts.merge(granularity.bucketStart(local), 1L, Long::sum);
        }

        List<TimeseriesPoint> series = new ArrayList<>(buckets);
        for (int i = 0; i < buckets; i++) {
            LocalDate bucket = granularity.plus(first, i);
            series.add(new TimeseriesPoint(bucket, counts.getOrDefault(bucket, 0L)));
        }
        return series;
    }

    public List<RecentQuery> recent(int limit) {
        if (limit < 1) {
            throw new ValidationException("limit must be at least 1");
        }
        return fromStore(() -> queryRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, limit))
                .map(RecentQuery::from)
                .getContent());
    }

    public DashboardSummary summary() {
        return new DashboardSummary(counts(), timeseries(Granularity.DAY), recent(recentLimit));
    }

    // Bucket boundaries are local midnights; stored timestamps are UTC wall-clock time
    private LocalDateTime toStoreTime(LocalDate date) {
        return date.atStartOfDay(zone).withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
    }

    private <T> T fromStore(Supplier<T> read) {
        try {
            return read.get();
        } catch (DataAccessException e) {
            log.warn("Dashboard aggregation failed: {}", e.getMessage());
            throw new StoreUnavailableException("Dashboard data is currently unavailable", e);
        }
    }
}
