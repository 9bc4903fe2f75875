package com.worksync.schedule.recurrence.model;

import com.worksync.schedule.common.entity.ScheduleEntry;

import java.time.Instant;
import java.time.LocalDate;

/**
 * 전개된 회차 하나
 *
 * detached 가 있으면 해당 날짜를 대체하는 분리된 예외 행이고, 없으면 가상 회차다.
 */
public record Occurrence(LocalDate anchorDate, Instant start, Instant end, ScheduleEntry detached) {

    public static Occurrence virtual(LocalDate anchorDate, Instant start, Instant end) {
        return new Occurrence(anchorDate, start, end, null);
    }

    public static Occurrence detached(LocalDate anchorDate, ScheduleEntry entry) {
        return new Occurrence(anchorDate, entry.getScheduledStart(), entry.getScheduledEnd(), entry);
    }

    public boolean isDetached() {
        return detached != null;
    }
}
