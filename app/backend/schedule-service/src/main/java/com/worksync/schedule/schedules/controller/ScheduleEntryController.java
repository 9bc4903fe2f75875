package com.worksync.schedule.schedules.controller;

import com.worksync.schedule.schedules.dto.ScheduleEntryRequest;
import com.worksync.schedule.schedules.dto.ScheduleEntryResponse;
import com.worksync.schedule.schedules.dto.ScheduleEntryUpdateRequest;
import com.worksync.schedule.schedules.model.EditScope;
import com.worksync.schedule.schedules.service.ScheduleEntryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/v1/schedule-entries")
@RequiredArgsConstructor
@Tag(name = "Schedule Entry", description = "근무 배정 일정 API (단독/반복)")
public class ScheduleEntryController {

    private final ScheduleEntryService scheduleEntryService;

    @GetMapping
    @Operation(summary = "기간 내 일정 조회",
            description = "단독 일정, 반복 일정의 가상 회차, 분리된 회차를 시작 시각 순으로 조회합니다. 담당자가 겹치는 엔트리는 conflicts 에 표시됩니다.")
    public ResponseEntity<List<ScheduleEntryResponse>> getEntries(
            @Parameter(hidden = true) @RequestHeader("X-Tenant-Id") String tenantId,
            @Parameter(description = "조회 시작 (ISO-8601, 포함)") @RequestParam Instant start,
            @Parameter(description = "조회 종료 (ISO-8601, 제외)") @RequestParam Instant end
    ) {
        return ResponseEntity.ok(scheduleEntryService.getEntries(tenantId, start, end));
    }

    @GetMapping("/earliest")
    @Operation(summary = "가장 이른 일정 조회")
    public ResponseEntity<ScheduleEntryResponse> getEarliestEntry(
            @Parameter(hidden = true) @RequestHeader("X-Tenant-Id") String tenantId
    ) {
        return ResponseEntity.ok(scheduleEntryService.getEarliestEntry(tenantId));
    }

    @GetMapping("/{entryId}")
    @Operation(summary = "일정 상세 조회", description = "occurrenceDate 를 지정하면 시리즈의 해당 회차를 조회합니다.")
    public ResponseEntity<ScheduleEntryResponse> getEntry(
            @PathVariable Long entryId,
            @Parameter(hidden = true) @RequestHeader("X-Tenant-Id") String tenantId,
            @Parameter(description = "회차 날짜 (선택)") @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate occurrenceDate
    ) {
        return ResponseEntity.ok(scheduleEntryService.getEntry(tenantId, entryId, occurrenceDate));
    }

    @PostMapping
    @Operation(summary = "일정 생성", description = "recurrencePattern 이 있으면 반복 일정으로 생성합니다. 담당자 충돌은 생성을 막지 않고 conflicts 로 반환됩니다.")
    public ResponseEntity<ScheduleEntryResponse> createEntry(
            @Parameter(hidden = true) @RequestHeader("X-Tenant-Id") String tenantId,
            @Valid @RequestBody ScheduleEntryRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(scheduleEntryService.createEntry(tenantId, request));
    }

    @PutMapping("/{entryId}")
    @Operation(summary = "일정 수정",
            description = "반복 일정은 scope(SINGLE, FUTURE, ALL)가 필수이며, 단독 일정에는 scope 를 지정할 수 없습니다.")
    public ResponseEntity<ScheduleEntryResponse> updateEntry(
            @PathVariable Long entryId,
            @Parameter(hidden = true) @RequestHeader("X-Tenant-Id") String tenantId,
            @Parameter(description = "회차 날짜 (선택)") @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate occurrenceDate,
            @Parameter(description = "수정 범위 (반복 일정 전용)") @RequestParam(required = false) EditScope scope,
            @Valid @RequestBody ScheduleEntryUpdateRequest request
    ) {
        return ResponseEntity.ok(scheduleEntryService.updateEntry(tenantId, entryId, occurrenceDate, scope, request));
    }

    @DeleteMapping("/{entryId}")
    @Operation(summary = "일정 삭제",
            description = "반복 일정은 scope(SINGLE, FUTURE, ALL)가 필수이며, 단독 일정에는 scope 를 지정할 수 없습니다.")
    public ResponseEntity<Void> deleteEntry(
            @PathVariable Long entryId,
            @Parameter(hidden = true) @RequestHeader("X-Tenant-Id") String tenantId,
            @Parameter(description = "회차 날짜 (선택)") @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate occurrenceDate,
            @Parameter(description = "삭제 범위 (반복 일정 전용)") @RequestParam(required = false) EditScope scope
    ) {
        scheduleEntryService.deleteEntry(tenantId, entryId, occurrenceDate, scope);
        return ResponseEntity.noContent().build();
    }
}
