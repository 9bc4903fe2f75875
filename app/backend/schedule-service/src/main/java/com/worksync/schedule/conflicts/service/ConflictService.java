package com.worksync.schedule.conflicts.service;

import com.worksync.schedule.common.entity.ScheduleConflict;
import com.worksync.schedule.common.repository.ScheduleConflictRepository;
import com.worksync.schedule.conflicts.algorithm.DetectedConflict;
import com.worksync.schedule.conflicts.dto.ConflictResponse;
import com.worksync.schedule.conflicts.dto.ResolveConflictRequest;
import com.worksync.schedule.conflicts.exception.ConflictNotFoundException;
import com.worksync.schedule.schedules.model.EntryKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 충돌 기록 관리 (저장, 정리, 조회, 해결 메모)
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConflictService {

    private final ScheduleConflictRepository conflictRepository;

    /**
     * 감지된 충돌 중 아직 기록되지 않은 쌍만 저장
     */
    @Transactional
    public List<ScheduleConflict> record(String tenantId, List<DetectedConflict> detected) {
        if (detected.isEmpty()) {
            return List.of();
        }

        Set<Long> entryIds = new HashSet<>();
        detected.forEach(conflict -> {
            entryIds.add(conflict.first().entryId());
            entryIds.add(conflict.second().entryId());
        });

        Set<DetectedConflict> known = conflictRepository.findInvolving(tenantId, entryIds).stream()
                .map(this::toDetected)
                .collect(Collectors.toSet());

        List<ScheduleConflict> saved = new ArrayList<>();
        for (DetectedConflict conflict : new HashSet<>(detected)) {
            if (known.contains(conflict)) {
                continue;
            }
            saved.add(conflictRepository.save(ScheduleConflict.builder()
                    .tenantId(tenantId)
                    .entryId1(conflict.first().entryId())
                    .occurrenceDate1(conflict.first().occurrenceDate())
                    .entryId2(conflict.second().entryId())
                    .occurrenceDate2(conflict.second().occurrenceDate())
                    .conflictType(conflict.type())
                    .build()));
        }

        log.info("충돌 기록 - tenantId: {}, 감지: {}, 신규 저장: {}", tenantId, detected.size(), saved.size());
        return saved;
    }

    /**
     * 삭제된 행이 관련된 충돌 기록 정리 (해당 행의 모든 회차 포함)
     */
    @Transactional
    public void purgeEntries(String tenantId, Collection<Long> entryIds) {
        if (entryIds.isEmpty()) {
            return;
        }
        purge(tenantId, entryIds, conflict -> true);
    }

    /**
     * 시리즈의 from 이후 회차(가상 회차 키)가 관련된 충돌 기록 정리, from 이 null 이면 모든 회차
     */
    @Transactional
    public void purgeOccurrences(String tenantId, Long seriesId, LocalDate from) {
        purgeOccurrencesMatching(tenantId, seriesId, date -> from == null || !date.isBefore(from));
    }

    /**
     * 시리즈의 특정 회차가 관련된 충돌 기록 정리
     */
    @Transactional
    public void purgeOccurrence(String tenantId, Long seriesId, LocalDate occurrenceDate) {
        purgeOccurrencesMatching(tenantId, seriesId, occurrenceDate::equals);
    }

    /**
     * 수정된 엔트리의 미해결 충돌 기록 정리 (재계산 전)
     */
    @Transactional
    public void purgeUnresolved(String tenantId, Long entryId) {
        purge(tenantId, List.of(entryId), conflict -> !Boolean.TRUE.equals(conflict.getResolved()));
    }

    @Transactional(readOnly = true)
    public List<ConflictResponse> getConflicts(String tenantId, Boolean resolved) {
        log.info("충돌 목록 조회 - tenantId: {}, resolved: {}", tenantId, resolved);

        List<ScheduleConflict> conflicts = resolved == null
                ? conflictRepository.findByTenantIdOrderByCreatedAtDesc(tenantId)
                : conflictRepository.findByTenantIdAndResolvedOrderByCreatedAtDesc(tenantId, resolved);

        return conflicts.stream()
                .map(ConflictResponse::from)
                .collect(Collectors.toList());
    }

    /**
     * 해결 메모 기록 (기록만 하며 일정은 변경하지 않음)
     */
    @Transactional
    public ConflictResponse resolve(String tenantId, Long conflictId, ResolveConflictRequest request) {
        log.info("충돌 해결 기록 - tenantId: {}, conflictId: {}", tenantId, conflictId);

        ScheduleConflict conflict = conflictRepository.findByTenantIdAndConflictId(tenantId, conflictId)
                .orElseThrow(() -> new ConflictNotFoundException("충돌 기록을 찾을 수 없습니다. ID: " + conflictId));

        conflict.setResolved(true);
        conflict.setResolutionNotes(request.getResolutionNotes());

        ScheduleConflict saved = conflictRepository.save(conflict);
        log.info("충돌 해결 기록 완료 - conflictId: {}", saved.getConflictId());
        return ConflictResponse.from(saved);
    }

    private void purge(String tenantId, Collection<Long> entryIds, Predicate<ScheduleConflict> filter) {
        List<ScheduleConflict> targets = conflictRepository.findInvolving(tenantId, entryIds).stream()
                .filter(filter)
                .collect(Collectors.toList());
        if (targets.isEmpty()) {
            return;
        }
        conflictRepository.deleteAll(targets);
        log.debug("충돌 기록 정리 - tenantId: {}, entryIds: {}, 삭제: {}", tenantId, entryIds, targets.size());
    }

    private void purgeOccurrencesMatching(String tenantId, Long seriesId, Predicate<LocalDate> dates) {
        purge(tenantId, List.of(seriesId), conflict ->
                isOccurrenceOf(conflict.getEntryId1(), conflict.getOccurrenceDate1(), seriesId, dates)
                        || isOccurrenceOf(conflict.getEntryId2(), conflict.getOccurrenceDate2(), seriesId, dates));
    }

    private boolean isOccurrenceOf(Long entryId, LocalDate occurrenceDate, Long seriesId, Predicate<LocalDate> dates) {
        return seriesId.equals(entryId) && occurrenceDate != null && dates.test(occurrenceDate);
    }

    private DetectedConflict toDetected(ScheduleConflict conflict) {
        return DetectedConflict.between(
                new EntryKey(conflict.getEntryId1(), conflict.getOccurrenceDate1()),
                new EntryKey(conflict.getEntryId2(), conflict.getOccurrenceDate2()),
                conflict.getConflictType());
    }
}
