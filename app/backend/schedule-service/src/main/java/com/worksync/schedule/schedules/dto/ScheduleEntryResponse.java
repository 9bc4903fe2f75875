package com.worksync.schedule.schedules.dto;

import com.worksync.schedule.schedules.model.EntryInstance;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "일정 엔트리 응답 (단독 일정, 가상 회차, 분리된 회차)")
public class ScheduleEntryResponse {

    @Schema(description = "엔트리 ID (가상 회차는 시리즈 ID)", example = "12")
    private Long entryId;

    @Schema(description = "회차 날짜 (시리즈 회차만)", example = "2024-01-15")
    private LocalDate occurrenceDate;

    @Schema(description = "소속 시리즈 ID (단독 일정은 null)", example = "12")
    private Long seriesId;

    @Schema(description = "저장되지 않은 가상 회차 여부", example = "true")
    private Boolean virtual;

    @Schema(description = "반복 시리즈 소속 여부", example = "true")
    private Boolean recurring;

    @Schema(description = "일정 제목", example = "야간 당직")
    private String title;

    @Schema(description = "메모", example = "서버실 점검 포함")
    private String notes;

    @Schema(description = "일정 상태", example = "SCHEDULED")
    private String status;

    @Schema(description = "작업 항목 유형", example = "TICKET")
    private String workItemType;

    @Schema(description = "작업 항목 ID", example = "TCK-1042")
    private String workItemId;

    @Schema(description = "시작 일시", example = "2024-01-15T09:00:00Z")
    private Instant scheduledStart;

    @Schema(description = "종료 일시", example = "2024-01-15T10:00:00Z")
    private Instant scheduledEnd;

    @Schema(description = "담당자 ID 목록", example = "[\"user-1\"]")
    private List<String> assignedUserIds;

    @Schema(description = "소속 시리즈의 반복 규칙")
    private RecurrencePatternDto recurrencePattern;

    @Schema(description = "담당자가 겹치는 엔트리 (참고용)")
    private List<EntryRefResponse> conflicts;

    public static ScheduleEntryResponse from(EntryInstance instance) {
        return ScheduleEntryResponse.builder()
                .entryId(instance.getKey().entryId())
                .occurrenceDate(instance.getOccurrenceDate())
                .seriesId(instance.getSeriesId())
                .virtual(instance.isVirtual())
                .recurring(instance.isPartOfSeries())
                .title(instance.getTitle())
                .notes(instance.getNotes())
                .status(instance.getStatus().name())
                .workItemType(instance.getWorkItemType().name())
                .workItemId(instance.getWorkItemId())
                .scheduledStart(instance.getStart())
                .scheduledEnd(instance.getEnd())
                .assignedUserIds(instance.getAssignedUserIds())
                .recurrencePattern(instance.getPattern() != null ? RecurrencePatternDto.from(instance.getPattern()) : null)
                .conflicts(instance.getConflictsWith().stream().map(EntryRefResponse::from).collect(Collectors.toList()))
                .build();
    }
}
