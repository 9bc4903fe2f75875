package com.worksync.schedule.schedules.dto;

import com.worksync.schedule.common.entity.RecurrencePattern;
import com.worksync.schedule.common.entity.RecurrencePattern.Frequency;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "반복 규칙")
public class RecurrencePatternDto {

    @NotNull(message = "Frequency is required")
    @Schema(description = "반복 주기", example = "WEEKLY", requiredMode = Schema.RequiredMode.REQUIRED,
            allowableValues = {"DAILY", "WEEKLY", "MONTHLY", "YEARLY"})
    private Frequency frequency;

    @Schema(description = "반복 간격 (N 주기마다)", example = "1")
    @Builder.Default
    private Integer interval = 1;

    @Schema(description = "시리즈 기준일 (응답 전용, 시작 일시의 테넌트 현지 날짜)", example = "2024-01-01",
            accessMode = Schema.AccessMode.READ_ONLY)
    private LocalDate startDate;

    @Schema(description = "반복 종료일 (포함, 반복 횟수와 동시 지정 불가)", example = "2024-06-30")
    private LocalDate endDate;

    @Schema(description = "총 반복 횟수 (종료일과 동시 지정 불가)", example = "5")
    private Integer occurrenceCount;

    @Schema(description = "평일만 (매일 반복 전용, 주말과 휴일 제외)", example = "false")
    @Builder.Default
    private Boolean workdaysOnly = false;

    @Schema(description = "반복 요일 (매주 반복 전용, 기본값은 시작일 요일)", example = "[\"MONDAY\", \"WEDNESDAY\"]")
    private Set<DayOfWeek> daysOfWeek;

    @Schema(description = "취소된 회차 날짜 (응답 전용)", accessMode = Schema.AccessMode.READ_ONLY)
    private Set<LocalDate> exceptions;

    /**
     * 새 반복 규칙 엔티티 (저장 전, 기준일은 호출 측에서 지정)
     */
    public RecurrencePattern toEntity(String tenantId, LocalDate startDate) {
        return RecurrencePattern.builder()
                .tenantId(tenantId)
                .frequency(frequency)
                .interval(interval)
                .startDate(startDate)
                .endDate(endDate)
                .occurrenceCount(occurrenceCount)
                .workdaysOnly(Boolean.TRUE.equals(workdaysOnly))
                .daysOfWeek(daysOfWeek != null ? new HashSet<>(daysOfWeek) : new HashSet<>())
                .build();
    }

    public static RecurrencePatternDto from(RecurrencePattern pattern) {
        return RecurrencePatternDto.builder()
                .frequency(pattern.getFrequency())
                .interval(pattern.getInterval())
                .startDate(pattern.getStartDate())
                .endDate(pattern.getEndDate())
                .occurrenceCount(pattern.getOccurrenceCount())
                .workdaysOnly(pattern.getWorkdaysOnly())
                .daysOfWeek(new TreeSet<>(pattern.getDaysOfWeek()))
                .exceptions(new TreeSet<>(pattern.getExceptions()))
                .build();
    }
}
