package com.worksync.schedule.common.entity;

import com.worksync.schedule.recurrence.model.FrequencyRule;
import com.worksync.schedule.recurrence.model.RecurrenceRule;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;

/**
 * 반복 규칙 (마스터 엔트리와 1:1, 마스터 ID를 키로 사용)
 */
@Entity
@Table(name = "recurrence_patterns", indexes = {
    @Index(name = "idx_pattern_tenant_end_date", columnList = "tenant_id, end_date")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RecurrencePattern {

    @Id
    @Column(name = "entry_id")
    private Long entryId;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private Frequency frequency;

    @Column(name = "repeat_interval", nullable = false)
    @Builder.Default
    private Integer interval = 1;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date")
    private LocalDate endDate;

    @Column(name = "occurrence_count")
    private Integer occurrenceCount;

    /**
     * 월/연 반복의 기준 일자 (분할로 생긴 시리즈가 원래 시리즈의 일자를 이어받을 때만 설정)
     */
    @Column(name = "anchor_day")
    private Integer anchorDay;

    @Column(name = "workdays_only", nullable = false)
    @Builder.Default
    private Boolean workdaysOnly = false;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "recurrence_pattern_days", joinColumns = @JoinColumn(name = "entry_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week", nullable = false, length = 10)
    @Builder.Default
    private Set<DayOfWeek> daysOfWeek = new HashSet<>();

    /**
     * 취소된 회차 날짜 (시리즈 기준, 분리된 예외가 있으면 예외가 우선)
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "recurrence_pattern_exceptions", joinColumns = @JoinColumn(name = "entry_id"))
    @Column(name = "exception_date", nullable = false)
    @Builder.Default
    private Set<LocalDate> exceptions = new HashSet<>();

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 전개용 불변 규칙으로 변환 (주간 요일이 비어 있으면 기준일 요일)
     */
    public RecurrenceRule toRule() {
        FrequencyRule rule = switch (frequency) {
            case DAILY -> new FrequencyRule.Daily(Boolean.TRUE.equals(workdaysOnly));
            case WEEKLY -> new FrequencyRule.Weekly(daysOfWeek == null || daysOfWeek.isEmpty()
                    ? EnumSet.of(startDate.getDayOfWeek())
                    : daysOfWeek);
            case MONTHLY -> new FrequencyRule.Monthly();
            case YEARLY -> new FrequencyRule.Yearly();
        };
        return new RecurrenceRule(rule, interval, startDate, endDate, occurrenceCount, exceptions, anchorDay);
    }

    public enum Frequency {
        DAILY, WEEKLY, MONTHLY, YEARLY
    }
}
