package com.worksync.schedule.recurrence.algorithm;

import com.worksync.schedule.common.entity.ScheduleEntry;
import com.worksync.schedule.recurrence.exception.RangeTooLargeException;
import com.worksync.schedule.recurrence.model.BoundarySplit;
import com.worksync.schedule.recurrence.model.FrequencyRule;
import com.worksync.schedule.recurrence.model.Occurrence;
import com.worksync.schedule.recurrence.model.RecurrenceRule;
import com.worksync.schedule.recurrence.model.SeriesAnchor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 반복 규칙 전개 알고리즘
 *
 * 주요 기능:
 * 1. Candidate Generation: 기준일로부터 k·interval 단위로 후보 날짜 생성 (월/연 초과 일자는 말일로 보정)
 * 2. Bounding: 반복 횟수, 종료일, 조회 기간, 전개 상한 적용
 * 3. Override Merge: 취소 날짜 제외, 분리된 예외 행으로 가상 회차 대체
 *
 * 상태를 갖지 않으며 같은 입력에 항상 같은 결과를 반환한다.
 */
@Component
@Slf4j
public class PatternExpander {

    private final int maxOccurrences;
    private final int maxWindowDays;

    public PatternExpander(
            @Value("${schedule.expansion.max-occurrences:5000}") int maxOccurrences,
            @Value("${schedule.expansion.max-window-days:400}") int maxWindowDays
    ) {
        this.maxOccurrences = maxOccurrences;
        this.maxWindowDays = maxWindowDays;
    }

    /**
     * 조회 기간이 전개 상한을 넘는지 확인
     */
    public void validateWindow(Instant windowStart, Instant windowEnd) {
        if (Duration.between(windowStart, windowEnd).toDays() > maxWindowDays) {
            throw new RangeTooLargeException(
                    "조회 기간은 최대 " + maxWindowDays + "일까지 가능합니다: " + windowStart + " ~ " + windowEnd);
        }
    }

    /**
     * 반복 규칙 전개 메인 메서드
     *
     * @param rule 반복 규칙
     * @param anchor 기준 회차의 시작 시각, 길이, 시간대
     * @param windowStart 조회 시작 (포함)
     * @param windowEnd 조회 종료 (제외)
     * @param overrides 회차 날짜별 분리된 예외 행
     * @param holidays 평일 전용 규칙에서 제외할 휴일
     * @return 시작 시각 순으로 정렬된 회차 목록
     */
    public List<Occurrence> expand(
            RecurrenceRule rule,
            SeriesAnchor anchor,
            Instant windowStart,
            Instant windowEnd,
            Map<LocalDate, ScheduleEntry> overrides,
            Set<LocalDate> holidays
    ) {
        validateWindow(windowStart, windowEnd);

        // 기간 시작 이전에 시작해 기간 안으로 이어지는 회차까지 포함하도록 하루 여유
        LocalDate firstDate = LocalDate.ofInstant(windowStart.minus(anchor.duration()), anchor.zone()).minusDays(1);
        LocalDate lastDate = LocalDate.ofInstant(windowEnd, anchor.zone());

        List<Occurrence> occurrences = new ArrayList<>();
        int[] candidates = {0};

        walk(rule, holidays, firstDate, lastDate, date -> {
            candidates[0]++;
            if (date.isBefore(firstDate)) {
                return true;
            }

            Occurrence occurrence;
            ScheduleEntry detached = overrides.get(date);
            if (detached != null) {
                occurrence = Occurrence.detached(date, detached);
            } else if (rule.isCancelled(date)) {
                return true;
            } else {
                occurrence = Occurrence.virtual(date, anchor.startOn(date), anchor.endOn(date));
            }

            if (occurrence.start().isBefore(windowEnd) && occurrence.end().isAfter(windowStart)) {
                if (occurrences.size() >= maxOccurrences) {
                    throw new RangeTooLargeException(
                            "전개 회차 수가 상한(" + maxOccurrences + ")을 넘었습니다: " + rule.startDate() + " 시리즈");
                }
                occurrences.add(occurrence);
            }
            return true;
        });

        occurrences.sort(Comparator.comparing(Occurrence::start).thenComparing(Occurrence::anchorDate));
        log.debug("반복 전개 완료 - 기준일: {}, 기간: {} ~ {}, 후보: {}, 회차: {}",
                rule.startDate(), firstDate, lastDate, candidates[0], occurrences.size());
        return occurrences;
    }

    /**
     * 주어진 날짜가 규칙상 회차 날짜인지 확인 (취소 여부와 무관)
     */
    public boolean occursOn(RecurrenceRule rule, LocalDate date, Set<LocalDate> holidays) {
        if (date.isBefore(rule.startDate())) {
            return false;
        }
        boolean[] found = {false};
        walk(rule, holidays, date, date, candidate -> {
            if (candidate.equals(date)) {
                found[0] = true;
                return false;
            }
            return true;
        });
        return found[0];
    }

    /**
     * 시리즈의 첫 회차 날짜
     */
    public Optional<LocalDate> firstOccurrence(RecurrenceRule rule, Set<LocalDate> holidays) {
        LocalDate[] first = {null};
        walk(rule, holidays, rule.startDate(), rule.startDate().plusYears(rule.interval()), candidate -> {
            first[0] = candidate;
            return false;
        });
        return Optional.ofNullable(first[0]);
    }

    /**
     * 경계 날짜 이전에 생성되는 회차 수와 마지막 날짜
     */
    public BoundarySplit splitBefore(RecurrenceRule rule, LocalDate boundary, Set<LocalDate> holidays) {
        if (!boundary.isAfter(rule.startDate())) {
            return new BoundarySplit(0, null);
        }
        int[] count = {0};
        LocalDate[] last = {null};
        walk(rule, holidays, rule.startDate(), boundary.minusDays(1), candidate -> {
            count[0]++;
            last[0] = candidate;
            return true;
        });
        return new BoundarySplit(count[0], last[0]);
    }

    /**
     * 후보 날짜를 오름차순으로 방문
     *
     * 반복 횟수 슬롯은 평일 필터를 통과한 후보마다 하나씩 소비된다. (취소된 날짜 포함)
     * visitor 가 false 를 반환하면 중단한다.
     */
    private void walk(
            RecurrenceRule rule,
            Set<LocalDate> holidays,
            LocalDate from,
            LocalDate until,
            Predicate<LocalDate> visitor
    ) {
        LocalDate limit = rule.endDate() != null && rule.endDate().isBefore(until) ? rule.endDate() : until;
        long remaining = rule.count() == null ? Long.MAX_VALUE : rule.count();
        // 횟수 제한이 있으면 앞선 회차를 모두 세어야 하므로 처음부터 순회
        long step = rule.count() == null ? skipAhead(rule, from) : 0;

        while (remaining > 0) {
            LocalDate periodStart = periodStart(rule, step++);
            if (periodStart.isAfter(limit)) {
                return;
            }
            for (LocalDate date : candidatesIn(rule, periodStart, holidays)) {
                if (date.isAfter(limit)) {
                    return;
                }
                if (!visitor.test(date)) {
                    return;
                }
                if (--remaining == 0) {
                    return;
                }
            }
        }
    }

    private LocalDate periodStart(RecurrenceRule rule, long step) {
        long units = step * rule.interval();
        LocalDate start = rule.startDate();
        FrequencyRule frequency = rule.frequency();

        if (frequency instanceof FrequencyRule.Daily) {
            return start.plusDays(units);
        }
        if (frequency instanceof FrequencyRule.Weekly) {
            return mondayOf(start).plusWeeks(units);
        }
        // 항상 기준 일자에서 계산하므로 말일 보정이 누적되지 않음 (1/31 -> 2/29 -> 3/31)
        if (frequency instanceof FrequencyRule.Monthly) {
            return clampToAnchorDay(start.plusMonths(units), rule.anchorDay());
        }
        return clampToAnchorDay(start.plusYears(units), rule.anchorDay());
    }

    private LocalDate clampToAnchorDay(LocalDate date, int anchorDay) {
        return date.withDayOfMonth(Math.min(anchorDay, date.lengthOfMonth()));
    }

    private List<LocalDate> candidatesIn(RecurrenceRule rule, LocalDate periodStart, Set<LocalDate> holidays) {
        FrequencyRule frequency = rule.frequency();

        if (frequency instanceof FrequencyRule.Daily daily) {
            if (daily.workdaysOnly() && !isWorkday(periodStart, holidays)) {
                return List.of();
            }
            return List.of(periodStart);
        }

        if (frequency instanceof FrequencyRule.Weekly weekly) {
            List<LocalDate> dates = new ArrayList<>();
            weekly.daysOfWeek().stream()
                    .sorted()
                    .map(day -> periodStart.plusDays(day.getValue() - 1L))
                    .filter(date -> !date.isBefore(rule.startDate()))
                    .forEach(dates::add);
            return dates;
        }

        return List.of(periodStart);
    }

    /**
     * 조회 시작일 직전 주기로 건너뛰기 (횟수 제한이 없는 규칙 전용)
     */
    private long skipAhead(RecurrenceRule rule, LocalDate from) {
        LocalDate start = rule.startDate();
        if (!from.isAfter(start)) {
            return 0;
        }
        FrequencyRule frequency = rule.frequency();
        long units;
        if (frequency instanceof FrequencyRule.Daily) {
            units = ChronoUnit.DAYS.between(start, from);
        } else if (frequency instanceof FrequencyRule.Weekly) {
            units = ChronoUnit.WEEKS.between(mondayOf(start), mondayOf(from));
        } else if (frequency instanceof FrequencyRule.Monthly) {
            units = ChronoUnit.MONTHS.between(start.withDayOfMonth(1), from.withDayOfMonth(1));
        } else {
            units = from.getYear() - start.getYear();
        }
        return Math.max(0, units / rule.interval());
    }

    private boolean isWorkday(LocalDate date, Set<LocalDate> holidays) {
        DayOfWeek day = date.getDayOfWeek();
        return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY && !holidays.contains(date);
    }

    private LocalDate mondayOf(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }
}
