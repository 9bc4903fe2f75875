package com.worksync.schedule.schedules.service;

import com.worksync.schedule.common.entity.RecurrencePattern;
import com.worksync.schedule.common.entity.ScheduleEntry;
import com.worksync.schedule.holidays.service.HolidayCalendar;
import com.worksync.schedule.holidays.service.TenantTimeZoneResolver;
import com.worksync.schedule.recurrence.model.FrequencyRule;
import com.worksync.schedule.recurrence.model.Occurrence;
import com.worksync.schedule.recurrence.model.RecurrenceRule;
import com.worksync.schedule.recurrence.model.SeriesAnchor;
import com.worksync.schedule.schedules.model.EntryInstance;
import com.worksync.schedule.schedules.model.EntryKey;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Set;

/**
 * 저장된 행과 전개된 회차를 조회 결과 모양(EntryInstance)으로 변환
 */
@Component
@RequiredArgsConstructor
public class SeriesProjector {

    private final TenantTimeZoneResolver timeZoneResolver;
    private final HolidayCalendar holidayCalendar;

    public ZoneId zoneOf(String tenantId) {
        return timeZoneResolver.zoneOf(tenantId);
    }

    public LocalDate localDateOf(String tenantId, Instant instant) {
        return LocalDate.ofInstant(instant, zoneOf(tenantId));
    }

    public SeriesAnchor anchorOf(ScheduleEntry master) {
        return SeriesAnchor.of(master.getScheduledStart(), master.getScheduledEnd(), zoneOf(master.getTenantId()));
    }

    /**
     * 평일 전용 매일 반복에만 휴일이 필요하다
     */
    public Set<LocalDate> holidaysFor(String tenantId, RecurrenceRule rule, LocalDate until) {
        if (rule.frequency() instanceof FrequencyRule.Daily daily && daily.workdaysOnly()) {
            return holidayCalendar.holidaysBetween(tenantId, rule.startDate(), until);
        }
        return Set.of();
    }

    /**
     * 단독 일정, 분리된 예외, 마스터 행 자체
     *
     * @param seriesPattern 행이 속한 시리즈의 반복 규칙 (없으면 null)
     */
    public EntryInstance fromRow(ScheduleEntry row, RecurrencePattern seriesPattern) {
        Long seriesId = row.isMaster() ? row.getEntryId() : row.getOriginalEntryId();
        return baseOf(row)
                .key(EntryKey.persisted(row.getEntryId()))
                .seriesId(seriesId)
                .occurrenceDate(row.getOccurrenceDate())
                .virtual(false)
                .start(row.getScheduledStart())
                .end(row.getScheduledEnd())
                .pattern(seriesId != null ? seriesPattern : null)
                .build();
    }

    /**
     * 전개된 회차 (분리된 예외면 그 행, 아니면 마스터 값으로 만든 가상 회차)
     */
    public EntryInstance fromOccurrence(ScheduleEntry master, RecurrencePattern pattern, Occurrence occurrence) {
        if (occurrence.isDetached()) {
            return fromRow(occurrence.detached(), pattern);
        }
        return baseOf(master)
                .key(EntryKey.occurrence(master.getEntryId(), occurrence.anchorDate()))
                .seriesId(master.getEntryId())
                .occurrenceDate(occurrence.anchorDate())
                .virtual(true)
                .start(occurrence.start())
                .end(occurrence.end())
                .pattern(pattern)
                .build();
    }

    private EntryInstance.EntryInstanceBuilder baseOf(ScheduleEntry row) {
        return EntryInstance.builder()
                .tenantId(row.getTenantId())
                .title(row.getTitle())
                .notes(row.getNotes())
                .status(row.getStatus())
                .workItemType(row.getWorkItemType())
                .workItemId(row.getWorkItemId())
                .assignedUserIds(new ArrayList<>(row.getAssignedUserIds()))
                .conflictsWith(new ArrayList<>());
    }
}
