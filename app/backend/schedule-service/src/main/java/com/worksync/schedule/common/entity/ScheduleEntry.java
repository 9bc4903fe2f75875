package com.worksync.schedule.common.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 일정 엔트리
 *
 * 하나의 테이블에 세 종류의 행을 저장한다.
 * - 단독 일정: recurring = false, originalEntryId = null
 * - 반복 마스터: recurring = true (반복 규칙은 recurrence_patterns 테이블)
 * - 분리된 예외: originalEntryId + occurrenceDate 로 마스터의 특정 회차를 대체
 */
@Entity
@Table(name = "schedule_entries", indexes = {
    @Index(name = "idx_entry_tenant_start", columnList = "tenant_id, scheduled_start"),
    @Index(name = "idx_entry_tenant_end", columnList = "tenant_id, scheduled_end"),
    @Index(name = "idx_entry_series_occurrence", columnList = "tenant_id, original_entry_id, occurrence_date"),
    @Index(name = "idx_entry_split_from", columnList = "tenant_id, split_from_entry_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduleEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "entry_id")
    private Long entryId;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(nullable = false, length = 255)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "scheduled_start", nullable = false)
    private Instant scheduledStart;

    @Column(name = "scheduled_end", nullable = false)
    private Instant scheduledEnd;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private EntryStatus status = EntryStatus.SCHEDULED;

    @Enumerated(EnumType.STRING)
    @Column(name = "work_item_type", nullable = false, length = 20)
    @Builder.Default
    private WorkItemType workItemType = WorkItemType.AD_HOC;

    @Column(name = "work_item_id", length = 64)
    private String workItemId;

    @Column(name = "is_recurring", nullable = false)
    @Builder.Default
    private Boolean recurring = false;

    /**
     * 분리된 예외인 경우 대상 시리즈(마스터) ID
     */
    @Column(name = "original_entry_id")
    private Long originalEntryId;

    /**
     * 분리된 예외가 대체하는 회차의 기준 날짜 (테넌트 시간대 기준)
     */
    @Column(name = "occurrence_date")
    private LocalDate occurrenceDate;

    /**
     * "이후 모든 일정" 수정으로 생성된 마스터인 경우 원래 시리즈 ID
     */
    @Column(name = "split_from_entry_id")
    private Long splitFromEntryId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "schedule_entry_assignees", joinColumns = @JoinColumn(name = "entry_id"))
    @OrderColumn(name = "assignee_order")
    @Column(name = "user_id", nullable = false, length = 64)
    @Builder.Default
    private List<String> assignedUserIds = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public boolean isMaster() {
        return Boolean.TRUE.equals(recurring);
    }

    public boolean isDetachedException() {
        return originalEntryId != null;
    }

    public boolean isStandalone() {
        return !isMaster() && !isDetachedException();
    }

    public enum EntryStatus {
        SCHEDULED, IN_PROGRESS, COMPLETED, CANCELLED
    }

    public enum WorkItemType {
        TICKET, PROJECT_TASK, AD_HOC
    }
}
