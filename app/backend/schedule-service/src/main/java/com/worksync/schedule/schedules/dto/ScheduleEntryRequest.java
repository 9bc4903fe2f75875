package com.worksync.schedule.schedules.dto;

import com.worksync.schedule.common.entity.ScheduleEntry.EntryStatus;
import com.worksync.schedule.common.entity.ScheduleEntry.WorkItemType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "일정 생성 요청")
public class ScheduleEntryRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 255, message = "Title must be at most 255 characters")
    @Schema(description = "일정 제목", example = "야간 당직", requiredMode = Schema.RequiredMode.REQUIRED)
    private String title;

    @Schema(description = "메모", example = "서버실 점검 포함")
    private String notes;

    @NotNull(message = "Scheduled start is required")
    @Schema(description = "시작 일시 (ISO-8601)", example = "2024-01-01T09:00:00Z", requiredMode = Schema.RequiredMode.REQUIRED)
    private Instant scheduledStart;

    @NotNull(message = "Scheduled end is required")
    @Schema(description = "종료 일시 (ISO-8601)", example = "2024-01-01T10:00:00Z", requiredMode = Schema.RequiredMode.REQUIRED)
    private Instant scheduledEnd;

    @Schema(description = "담당자 ID 목록 (1명 이상, 중복은 제거)", example = "[\"user-1\", \"user-2\"]",
            requiredMode = Schema.RequiredMode.REQUIRED)
    private List<String> assignedUserIds;

    @Schema(description = "일정 상태", example = "SCHEDULED",
            allowableValues = {"SCHEDULED", "IN_PROGRESS", "COMPLETED", "CANCELLED"})
    private EntryStatus status;

    @Schema(description = "작업 항목 유형", example = "TICKET", allowableValues = {"TICKET", "PROJECT_TASK", "AD_HOC"})
    private WorkItemType workItemType;

    @Schema(description = "작업 항목 ID (AD_HOC 이면 무시)", example = "TCK-1042")
    private String workItemId;

    @Valid
    @Schema(description = "반복 규칙 (단독 일정이면 null)")
    private RecurrencePatternDto recurrencePattern;
}
