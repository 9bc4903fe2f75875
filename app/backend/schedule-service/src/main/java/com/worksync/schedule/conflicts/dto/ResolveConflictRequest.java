package com.worksync.schedule.conflicts.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "충돌 해결 기록 요청")
public class ResolveConflictRequest {

    @NotBlank(message = "Resolution notes are required")
    @Schema(description = "해결 메모", example = "user-1 교대 근무로 조정", requiredMode = Schema.RequiredMode.REQUIRED)
    private String resolutionNotes;
}
