package com.worksync.schedule.conflicts.dto;

import com.worksync.schedule.common.entity.ScheduleConflict;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "일정 충돌 기록")
public class ConflictResponse {

    @Schema(description = "충돌 ID", example = "3")
    private Long conflictId;

    @Schema(description = "첫 번째 엔트리 ID (가상 회차는 시리즈 ID)", example = "12")
    private Long entryId1;

    @Schema(description = "첫 번째 엔트리 회차 날짜 (가상 회차만)", example = "2024-01-15")
    private LocalDate occurrenceDate1;

    @Schema(description = "두 번째 엔트리 ID", example = "15")
    private Long entryId2;

    @Schema(description = "두 번째 엔트리 회차 날짜 (가상 회차만)", example = "null")
    private LocalDate occurrenceDate2;

    @Schema(description = "충돌 유형", example = "ASSIGNEE_OVERLAP")
    private String conflictType;

    @Schema(description = "해결 여부", example = "false")
    private Boolean resolved;

    @Schema(description = "해결 메모", example = "user-1 교대 근무로 조정")
    private String resolutionNotes;

    @Schema(description = "생성 일시", example = "2024-01-10T10:30:00")
    private LocalDateTime createdAt;

    @Schema(description = "수정 일시", example = "2024-01-10T10:30:00")
    private LocalDateTime updatedAt;

    public static ConflictResponse from(ScheduleConflict conflict) {
        return ConflictResponse.builder()
                .conflictId(conflict.getConflictId())
                .entryId1(conflict.getEntryId1())
                .occurrenceDate1(conflict.getOccurrenceDate1())
                .entryId2(conflict.getEntryId2())
                .occurrenceDate2(conflict.getOccurrenceDate2())
                .conflictType(conflict.getConflictType().name())
                .resolved(conflict.getResolved())
                .resolutionNotes(conflict.getResolutionNotes())
                .createdAt(conflict.getCreatedAt())
                .updatedAt(conflict.getUpdatedAt())
                .build();
    }
}
