package com.worksync.schedule.schedules.dto;

import com.worksync.schedule.schedules.model.EntryKey;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "엔트리 참조 (가상 회차는 시리즈 ID + 회차 날짜)")
public class EntryRefResponse {

    @Schema(description = "엔트리 ID 또는 시리즈 ID", example = "12")
    private Long entryId;

    @Schema(description = "회차 날짜 (가상 회차만)", example = "2024-01-22")
    private LocalDate occurrenceDate;

    public static EntryRefResponse from(EntryKey key) {
        return new EntryRefResponse(key.entryId(), key.occurrenceDate());
    }
}
