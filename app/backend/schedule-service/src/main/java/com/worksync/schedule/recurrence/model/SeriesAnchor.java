package com.worksync.schedule.recurrence.model;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * 시리즈 기준 회차의 벽시계 시각과 길이
 *
 * 모든 회차는 기준 회차의 현지 시작 시각과 길이를 그대로 유지한다.
 */
public record SeriesAnchor(LocalTime startTime, Duration duration, ZoneId zone) {

    public static SeriesAnchor of(Instant start, Instant end, ZoneId zone) {
        return new SeriesAnchor(
                ZonedDateTime.ofInstant(start, zone).toLocalTime(),
                Duration.between(start, end),
                zone
        );
    }

    public Instant startOn(LocalDate date) {
        return ZonedDateTime.of(date, startTime, zone).toInstant();
    }

    public Instant endOn(LocalDate date) {
        return startOn(date).plus(duration);
    }
}
