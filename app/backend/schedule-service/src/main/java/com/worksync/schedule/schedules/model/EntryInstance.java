package com.worksync.schedule.schedules.model;

import com.worksync.schedule.common.entity.RecurrencePattern;
import com.worksync.schedule.common.entity.ScheduleEntry.EntryStatus;
import com.worksync.schedule.common.entity.ScheduleEntry.WorkItemType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * 조회 결과의 한 항목 (단독 일정, 가상 회차, 분리된 예외를 같은 모양으로 표현)
 */
@Getter
@Builder
@AllArgsConstructor
public class EntryInstance {

    private final EntryKey key;

    /**
     * 소속 시리즈(마스터) ID, 단독 일정은 null
     */
    private final Long seriesId;

    /**
     * 시리즈 내 회차 날짜, 단독 일정은 null
     */
    private final LocalDate occurrenceDate;

    private final boolean virtual;

    private final String tenantId;
    private final String title;
    private final String notes;
    private final EntryStatus status;
    private final WorkItemType workItemType;
    private final String workItemId;
    private final Instant start;
    private final Instant end;
    private final List<String> assignedUserIds;

    /**
     * 소속 시리즈의 반복 규칙 (시리즈가 아니면 null)
     */
    private final RecurrencePattern pattern;

    @Builder.Default
    private final List<EntryKey> conflictsWith = new ArrayList<>();

    public boolean isPartOfSeries() {
        return seriesId != null;
    }

    public boolean sharesAssigneeWith(EntryInstance other) {
        return assignedUserIds.stream().anyMatch(other.assignedUserIds::contains);
    }
}
