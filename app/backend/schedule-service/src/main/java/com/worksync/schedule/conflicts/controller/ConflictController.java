package com.worksync.schedule.conflicts.controller;

import com.worksync.schedule.conflicts.dto.ConflictResponse;
import com.worksync.schedule.conflicts.dto.ResolveConflictRequest;
import com.worksync.schedule.conflicts.service.ConflictService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/v1/schedule-conflicts")
@RequiredArgsConstructor
@Tag(name = "Schedule Conflict", description = "담당자 중복 배정 충돌 기록 API")
public class ConflictController {

    private final ConflictService conflictService;

    @GetMapping
    @Operation(summary = "충돌 기록 목록 조회", description = "resolved 를 지정하면 해결/미해결 기록만 조회합니다.")
    public ResponseEntity<List<ConflictResponse>> getConflicts(
            @Parameter(hidden = true) @RequestHeader("X-Tenant-Id") String tenantId,
            @Parameter(description = "해결 여부 (선택)") @RequestParam(required = false) Boolean resolved
    ) {
        return ResponseEntity.ok(conflictService.getConflicts(tenantId, resolved));
    }

    @PatchMapping("/{conflictId}/resolution")
    @Operation(summary = "충돌 해결 기록", description = "해결 메모를 남기고 해결됨으로 표시합니다. 일정은 변경하지 않습니다.")
    public ResponseEntity<ConflictResponse> resolveConflict(
            @PathVariable Long conflictId,
            @Parameter(hidden = true) @RequestHeader("X-Tenant-Id") String tenantId,
            @Valid @RequestBody ResolveConflictRequest request
    ) {
        return ResponseEntity.ok(conflictService.resolve(tenantId, conflictId, request));
    }
}
