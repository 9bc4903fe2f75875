package com.worksync.schedule.schedules.dto;

import com.worksync.schedule.common.entity.ScheduleEntry.EntryStatus;
import com.worksync.schedule.common.entity.ScheduleEntry.WorkItemType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * 부분 수정 요청 (null 필드는 변경하지 않음)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "일정 수정 요청 (지정한 필드만 변경)")
public class ScheduleEntryUpdateRequest {

    @Size(min = 1, max = 255, message = "Title must be 1 to 255 characters")
    @Schema(description = "일정 제목", example = "야간 당직 (교대)")
    private String title;

    @Schema(description = "메모", example = "인수인계 30분 포함")
    private String notes;

    @Schema(description = "시작 일시 (ISO-8601)", example = "2024-01-16T14:00:00Z")
    private Instant scheduledStart;

    @Schema(description = "종료 일시 (ISO-8601)", example = "2024-01-16T15:00:00Z")
    private Instant scheduledEnd;

    @Schema(description = "담당자 ID 목록", example = "[\"user-1\"]")
    private List<String> assignedUserIds;

    @Schema(description = "일정 상태", example = "IN_PROGRESS",
            allowableValues = {"SCHEDULED", "IN_PROGRESS", "COMPLETED", "CANCELLED"})
    private EntryStatus status;

    @Schema(description = "작업 항목 유형", example = "PROJECT_TASK", allowableValues = {"TICKET", "PROJECT_TASK", "AD_HOC"})
    private WorkItemType workItemType;

    @Schema(description = "작업 항목 ID", example = "PRJ-7")
    private String workItemId;

    @Valid
    @Schema(description = "새 반복 규칙 (단독 일정에 지정하면 반복 일정으로 전환)")
    private RecurrencePatternDto recurrencePattern;

    @Schema(description = "반복 해제 (ALL 범위 전용, 분리된 회차는 단독 일정으로 남음)", example = "false")
    private Boolean removeRecurrence;

    public boolean changesTime() {
        return scheduledStart != null || scheduledEnd != null;
    }

    public boolean isRemovingRecurrence() {
        return Boolean.TRUE.equals(removeRecurrence);
    }
}
