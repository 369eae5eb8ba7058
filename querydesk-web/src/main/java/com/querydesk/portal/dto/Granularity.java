package com.querydesk.portal.dto;

import com.querydesk.portal.exception.ValidationException;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * Bucket width of the submission time series. A bucket is identified by the date it starts on:
 * the day itself, the Monday of its ISO week, or the first of its month.
 */
public enum Granularity {
    DAY {
        @Override
        public LocalDate bucketStart(LocalDate date) {
            return date;
        }

        @Override
        public LocalDate plus(LocalDate bucketStart, long buckets) {
            return bucketStart.plusDays(buckets);
        }
    },
    WEEK {
        @Override
        public LocalDate bucketStart(LocalDate date) {
            return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        }

        @Override
        public LocalDate plus(LocalDate bucketStart, long buckets) {
            return bucketStart.plusWeeks(buckets);
        }
    },
    MONTH {
        @Override
        public LocalDate bucketStart(LocalDate date) {
            return date.withDayOfMonth(1);
        }

        @Override
        public LocalDate plus(LocalDate bucketStart, long buckets) {
            return bucketStart.plusMonths(buckets);
        }
    };

    public abstract LocalDate bucketStart(LocalDate date);

    public abstract LocalDate plus(LocalDate bucketStart, long buckets);

    public static Granularity fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return DAY;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown granularity: " + raw);
        }
    }
}
