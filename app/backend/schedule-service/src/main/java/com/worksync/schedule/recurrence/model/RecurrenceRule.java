package com.worksync.schedule.recurrence.model;

import java.time.LocalDate;
import java.util.Set;

/**
 * 전개용 반복 규칙 (영속 엔티티와 분리된 불변 값)
 *
 * @param frequency 주기별 규칙
 * @param interval N 주기마다 반복 (1 이상)
 * @param startDate 시리즈 기준일 (0번째 회차)
 * @param endDate 종료일 (포함, optional)
 * @param count 총 회차 수 (optional)
 * @param exceptions 취소된 회차 날짜
 * @param anchorDay 월/연 반복의 기준 일자. 분할된 시리즈는 말일 보정 전 원래 일자를 유지한다. (null 이면 기준일의 일자)
 */
public record RecurrenceRule(
        FrequencyRule frequency,
        int interval,
        LocalDate startDate,
        LocalDate endDate,
        Integer count,
        Set<LocalDate> exceptions,
        Integer anchorDay
) {

    public RecurrenceRule {
        exceptions = exceptions == null ? Set.of() : Set.copyOf(exceptions);
        if (anchorDay == null) {
            anchorDay = startDate.getDayOfMonth();
        }
    }

    public RecurrenceRule(FrequencyRule frequency, int interval, LocalDate startDate,
                          LocalDate endDate, Integer count, Set<LocalDate> exceptions) {
        this(frequency, interval, startDate, endDate, count, exceptions, null);
    }

    public boolean isCancelled(LocalDate date) {
        return exceptions.contains(date);
    }
}
