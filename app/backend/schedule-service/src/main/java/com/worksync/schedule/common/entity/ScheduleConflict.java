package com.worksync.schedule.common.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 일정 충돌 기록 (참고용, 변경 작업을 막지 않음)
 *
 * 가상 회차는 (entryId, occurrenceDate), 저장된 행은 occurrenceDate = null 로 식별한다.
 */
@Entity
@Table(name = "schedule_conflicts", indexes = {
    @Index(name = "idx_conflict_entry_1", columnList = "tenant_id, entry_id_1"),
    @Index(name = "idx_conflict_entry_2", columnList = "tenant_id, entry_id_2"),
    @Index(name = "idx_conflict_resolved", columnList = "tenant_id, resolved")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduleConflict {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "conflict_id")
    private Long conflictId;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "entry_id_1", nullable = false)
    private Long entryId1;

    @Column(name = "occurrence_date_1")
    private LocalDate occurrenceDate1;

    @Column(name = "entry_id_2", nullable = false)
    private Long entryId2;

    @Column(name = "occurrence_date_2")
    private LocalDate occurrenceDate2;

    @Enumerated(EnumType.STRING)
    @Column(name = "conflict_type", nullable = false, length = 30)
    private ConflictType conflictType;

    @Column(nullable = false)
    @Builder.Default
    private Boolean resolved = false;

    @Column(name = "resolution_notes", columnDefinition = "TEXT")
    private String resolutionNotes;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public enum ConflictType {
        ASSIGNEE_OVERLAP
    }
}
