package com.worksync.schedule.schedules.service;

import com.worksync.schedule.common.entity.RecurrencePattern;
import com.worksync.schedule.common.entity.ScheduleEntry;
import com.worksync.schedule.common.entity.ScheduleEntry.EntryStatus;
import com.worksync.schedule.common.entity.ScheduleEntry.WorkItemType;
import com.worksync.schedule.common.repository.RecurrencePatternRepository;
import com.worksync.schedule.common.repository.ScheduleEntryRepository;
import com.worksync.schedule.conflicts.algorithm.ConflictDetector;
import com.worksync.schedule.conflicts.algorithm.DetectedConflict;
import com.worksync.schedule.conflicts.service.ConflictService;
import com.worksync.schedule.recurrence.algorithm.PatternExpander;
import com.worksync.schedule.recurrence.algorithm.PatternValidator;
import com.worksync.schedule.recurrence.model.Occurrence;
import com.worksync.schedule.recurrence.model.RecurrenceRule;
import com.worksync.schedule.recurrence.model.SeriesAnchor;
import com.worksync.schedule.schedules.dto.ScheduleEntryRequest;
import com.worksync.schedule.schedules.dto.ScheduleEntryResponse;
import com.worksync.schedule.schedules.dto.ScheduleEntryUpdateRequest;
import com.worksync.schedule.schedules.exception.InvalidScheduleException;
import com.worksync.schedule.schedules.exception.OccurrenceNotFoundException;
import com.worksync.schedule.schedules.exception.ScheduleEntryNotFoundException;
import com.worksync.schedule.schedules.exception.TransactionFailedException;
import com.worksync.schedule.schedules.model.EditOutcome;
import com.worksync.schedule.schedules.model.EditScope;
import com.worksync.schedule.schedules.model.EntryInstance;
import com.worksync.schedule.schedules.model.EntryKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 일정 서비스 (조회, 생성, 수정, 삭제)
 *
 * 조회는 저장된 단독 일정과 분리된 회차, 반복 마스터를 전개한 가상 회차를 합쳐 시작 시각 순으로 돌려준다.
 * 수정/삭제는 EditScopeResolver 에 위임하고, 생성/수정 후 영향 범위의 충돌을 다시 계산해 기록한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduleEntryService {

    private final ScheduleEntryRepository entryRepository;
    private final RecurrencePatternRepository patternRepository;
    private final PatternExpander patternExpander;
    private final PatternValidator patternValidator;
    private final ConflictDetector conflictDetector;
    private final ConflictService conflictService;
    private final EditScopeResolver editScopeResolver;
    private final SeriesProjector projector;
    private final EntryValidator entryValidator;

    @Value("${schedule.conflicts.scan-window-days:31}")
    private int scanWindowDays;

    /**
     * 기간 내 일정 조회 (가상 회차 포함, 충돌 표시)
     */
    @Transactional(readOnly = true)
    public List<ScheduleEntryResponse> getEntries(String tenantId, Instant start, Instant end) {
        log.info("일정 조회 요청 - tenantId: {}, 기간: {} ~ {}", tenantId, start, end);

        List<EntryInstance> instances = loadInstances(tenantId, start, end);
        List<DetectedConflict> conflicts = conflictDetector.detectAll(instances);
        annotate(instances, conflicts);

        log.info("일정 조회 완료 - tenantId: {}, 엔트리: {}, 충돌: {}", tenantId, instances.size(), conflicts.size());
        return instances.stream()
                .map(ScheduleEntryResponse::from)
                .collect(Collectors.toList());
    }

    /**
     * 엔트리 하나 또는 시리즈의 회차 하나 조회
     */
    @Transactional(readOnly = true)
    public ScheduleEntryResponse getEntry(String tenantId, Long entryId, LocalDate occurrenceDate) {
        ScheduleEntry row = findEntry(tenantId, entryId);

        if (occurrenceDate == null) {
            return ScheduleEntryResponse.from(projector.fromRow(row, seriesPatternOf(row)));
        }

        if (!row.isMaster()) {
            if (row.isDetachedException() && occurrenceDate.equals(row.getOccurrenceDate())) {
                return ScheduleEntryResponse.from(projector.fromRow(row, seriesPatternOf(row)));
            }
            throw new OccurrenceNotFoundException("반복 시리즈가 아닙니다. ID: " + entryId + ", 날짜: " + occurrenceDate);
        }

        RecurrencePattern pattern = seriesPatternOf(row);
        ScheduleEntry detached = entryRepository
                .findByTenantIdAndOriginalEntryIdAndOccurrenceDate(tenantId, entryId, occurrenceDate)
                .orElse(null);
        if (detached != null) {
            return ScheduleEntryResponse.from(projector.fromRow(detached, pattern));
        }

        RecurrenceRule rule = pattern.toRule();
        boolean occurs = !rule.isCancelled(occurrenceDate)
                && patternExpander.occursOn(rule, occurrenceDate, projector.holidaysFor(tenantId, rule, occurrenceDate));
        if (!occurs) {
            throw new OccurrenceNotFoundException("해당 날짜에 회차가 없습니다. 시리즈 ID: " + entryId + ", 날짜: " + occurrenceDate);
        }

        SeriesAnchor anchor = projector.anchorOf(row);
        Occurrence occurrence = Occurrence.virtual(occurrenceDate, anchor.startOn(occurrenceDate), anchor.endOn(occurrenceDate));
        return ScheduleEntryResponse.from(projector.fromOccurrence(row, pattern, occurrence));
    }

    /**
     * 가장 이른 저장된 엔트리
     */
    @Transactional(readOnly = true)
    public ScheduleEntryResponse getEarliestEntry(String tenantId) {
        ScheduleEntry row = entryRepository.findFirstByTenantIdOrderByScheduledStartAsc(tenantId)
                .orElseThrow(() -> new ScheduleEntryNotFoundException("등록된 일정이 없습니다. tenantId: " + tenantId));
        return ScheduleEntryResponse.from(projector.fromRow(row, seriesPatternOf(row)));
    }

    /**
     * 일정 생성 (반복 규칙이 있으면 마스터로 저장)
     */
    @Transactional
    public ScheduleEntryResponse createEntry(String tenantId, ScheduleEntryRequest request) {
        log.info("일정 생성 요청 - tenantId: {}, title: {}, recurring: {}",
                tenantId, request.getTitle(), request.getRecurrencePattern() != null);

        entryValidator.validateTimes(request.getScheduledStart(), request.getScheduledEnd());
        List<String> assignees = entryValidator.normalizeAssignees(tenantId, request.getAssignedUserIds());

        WorkItemType workItemType = request.getWorkItemType() != null ? request.getWorkItemType() : WorkItemType.AD_HOC;
        ScheduleEntry entry = ScheduleEntry.builder()
                .tenantId(tenantId)
                .title(request.getTitle())
                .notes(request.getNotes())
                .status(request.getStatus() != null ? request.getStatus() : EntryStatus.SCHEDULED)
                .workItemType(workItemType)
                .workItemId(workItemType == WorkItemType.AD_HOC ? null : request.getWorkItemId())
                .scheduledStart(request.getScheduledStart())
                .scheduledEnd(request.getScheduledEnd())
                .assignedUserIds(assignees)
                .build();

        // 규칙 검증은 저장 전에 끝낸다
        RecurrencePattern pattern = null;
        if (request.getRecurrencePattern() != null) {
            pattern = request.getRecurrencePattern()
                    .toEntity(tenantId, projector.localDateOf(tenantId, request.getScheduledStart()));
            patternValidator.validate(pattern);
            entry.setRecurring(true);
        }

        ScheduleEntry saved;
        RecurrencePattern savedPattern = null;
        try {
            saved = entryRepository.save(entry);
            if (pattern != null) {
                pattern.setEntryId(saved.getEntryId());
                savedPattern = patternRepository.save(pattern);
            }
            entryRepository.flush();
        } catch (DataAccessException e) {
            log.error("일정 저장 실패 - tenantId: {}, error: {}", tenantId, e.getMessage(), e);
            throw new TransactionFailedException("일정 저장에 실패했습니다", e);
        }

        EntryInstance created = projector.fromRow(saved, savedPattern);
        EditOutcome outcome = savedPattern == null
                ? EditOutcome.single(created, saved.getEntryId())
                : EditOutcome.series(created, saved.getEntryId(), saved.getScheduledStart());
        recordConflicts(tenantId, outcome);

        log.info("일정 생성 완료 - entryId: {}, 충돌: {}", saved.getEntryId(), created.getConflictsWith().size());
        return ScheduleEntryResponse.from(created);
    }

    /**
     * 일정 수정
     *
     * @param occurrenceDate 시리즈 회차를 가리킬 때의 회차 날짜 (optional)
     * @param scope 반복 일정 수정 범위, 단독 일정이면 null
     */
    @Transactional
    public ScheduleEntryResponse updateEntry(String tenantId, Long entryId, LocalDate occurrenceDate,
                                             EditScope scope, ScheduleEntryUpdateRequest request) {
        EditOutcome outcome;
        try {
            outcome = editScopeResolver.update(tenantId, new EntryKey(entryId, occurrenceDate), scope, request);
        } catch (DataAccessException e) {
            log.error("일정 수정 실패 - tenantId: {}, entryId: {}, scope: {}, error: {}",
                    tenantId, entryId, scope, e.getMessage(), e);
            throw new TransactionFailedException("일정 수정에 실패했습니다. 변경 사항은 적용되지 않았습니다", e);
        }

        recordConflicts(tenantId, outcome);
        return ScheduleEntryResponse.from(outcome.entry());
    }

    /**
     * 일정 삭제
     */
    @Transactional
    public void deleteEntry(String tenantId, Long entryId, LocalDate occurrenceDate, EditScope scope) {
        try {
            editScopeResolver.delete(tenantId, new EntryKey(entryId, occurrenceDate), scope);
        } catch (DataAccessException e) {
            log.error("일정 삭제 실패 - tenantId: {}, entryId: {}, scope: {}, error: {}",
                    tenantId, entryId, scope, e.getMessage(), e);
            throw new TransactionFailedException("일정 삭제에 실패했습니다. 변경 사항은 적용되지 않았습니다", e);
        }
    }

    /**
     * 기간 내 엔트리 병합
     *
     * 1. 단독 일정, 기간 내 분리된 회차, 기간에 걸칠 수 있는 마스터 조회
     * 2. 마스터별 반복 전개 (분리된 회차가 같은 날짜의 가상 회차를 대체)
     * 3. 키 기준 중복 제거 후 시작 시각, 키 순 정렬
     */
    private List<EntryInstance> loadInstances(String tenantId, Instant start, Instant end) {
        if (start == null || end == null || !end.isAfter(start)) {
            throw new InvalidScheduleException("조회 종료 일시는 시작 일시 이후여야 합니다: " + start + " ~ " + end);
        }
        patternExpander.validateWindow(start, end);

        LocalDate firstDate = projector.localDateOf(tenantId, start).minusDays(1);
        LocalDate lastDate = projector.localDateOf(tenantId, end);

        List<ScheduleEntry> standalone = entryRepository.findStandaloneInRange(tenantId, start, end);
        List<ScheduleEntry> detachedInRange = entryRepository.findDetachedInRange(tenantId, start, end);
        List<ScheduleEntry> masters = entryRepository.findMastersActiveInRange(tenantId, firstDate, end);

        Set<Long> masterIds = masters.stream().map(ScheduleEntry::getEntryId).collect(Collectors.toSet());
        Set<Long> seriesIds = new HashSet<>(masterIds);
        detachedInRange.forEach(row -> seriesIds.add(row.getOriginalEntryId()));

        Map<Long, RecurrencePattern> patterns = seriesIds.isEmpty()
                ? Map.of()
                : patternRepository.findByTenantIdAndEntryIdIn(tenantId, seriesIds).stream()
                        .collect(Collectors.toMap(RecurrencePattern::getEntryId, Function.identity()));

        Map<Long, Map<LocalDate, ScheduleEntry>> overrides = masterIds.isEmpty()
                ? Map.of()
                : entryRepository.findByTenantIdAndOriginalEntryIdIn(tenantId, masterIds).stream()
                        .collect(Collectors.groupingBy(
                                ScheduleEntry::getOriginalEntryId,
                                Collectors.toMap(ScheduleEntry::getOccurrenceDate, Function.identity(), (a, b) -> a)));

        Map<EntryKey, EntryInstance> merged = new LinkedHashMap<>();
        standalone.forEach(row -> merged.put(EntryKey.persisted(row.getEntryId()), projector.fromRow(row, null)));

        for (ScheduleEntry master : masters) {
            RecurrencePattern pattern = patterns.get(master.getEntryId());
            if (pattern == null) {
                log.warn("반복 규칙이 없는 마스터 - entryId: {}", master.getEntryId());
                continue;
            }
            RecurrenceRule rule = pattern.toRule();
            List<Occurrence> occurrences = patternExpander.expand(
                    rule,
                    projector.anchorOf(master),
                    start,
                    end,
                    overrides.getOrDefault(master.getEntryId(), Map.of()),
                    projector.holidaysFor(tenantId, rule, lastDate));

            for (Occurrence occurrence : occurrences) {
                EntryInstance instance = projector.fromOccurrence(master, pattern, occurrence);
                merged.putIfAbsent(instance.getKey(), instance);
            }
        }

        for (ScheduleEntry row : detachedInRange) {
            merged.putIfAbsent(EntryKey.persisted(row.getEntryId()),
                    projector.fromRow(row, patterns.get(row.getOriginalEntryId())));
        }

        List<EntryInstance> result = new ArrayList<>(merged.values());
        result.sort(Comparator.comparing(EntryInstance::getStart).thenComparing(EntryInstance::getKey));

        log.debug("일정 병합 완료 - 단독: {}, 마스터: {}, 분리된 회차: {}, 결과: {}",
                standalone.size(), masters.size(), detachedInRange.size(), result.size());
        return result;
    }

    /**
     * 영향 범위의 충돌 재계산 후 신규 쌍 기록, 응답 엔트리에 충돌 상대 표시
     */
    private void recordConflicts(String tenantId, EditOutcome outcome) {
        Instant from = outcome.affectedFrom();
        Instant scanUntil = from.plus(scanWindowDays, ChronoUnit.DAYS);
        Instant until = outcome.affectedUntil() == null || outcome.affectedUntil().isAfter(scanUntil)
                ? scanUntil
                : outcome.affectedUntil();

        Long affectedId = outcome.affectedEntryId();
        List<EntryInstance> window = loadInstances(tenantId, from, until);
        List<EntryInstance> targets = window.stream()
                .filter(instance -> affectedId.equals(instance.getKey().entryId()) || affectedId.equals(instance.getSeriesId()))
                .collect(Collectors.toList());

        Set<DetectedConflict> detected = new LinkedHashSet<>();
        targets.forEach(target -> detected.addAll(conflictDetector.detect(target, window)));
        conflictService.record(tenantId, new ArrayList<>(detected));

        Set<EntryKey> targetKeys = targets.stream().map(EntryInstance::getKey).collect(Collectors.toSet());
        List<EntryKey> others = outcome.entry().getConflictsWith();
        for (DetectedConflict conflict : detected) {
            EntryKey other = targetKeys.contains(conflict.first()) ? conflict.second() : conflict.first();
            if (!targetKeys.contains(other) && !others.contains(other)) {
                others.add(other);
            }
        }

        log.debug("충돌 재계산 - entryId: {}, 기간: {} ~ {}, 대상 회차: {}, 충돌: {}",
                affectedId, from, until, targets.size(), detected.size());
    }

    private void annotate(List<EntryInstance> instances, List<DetectedConflict> conflicts) {
        Map<EntryKey, EntryInstance> byKey = instances.stream()
                .collect(Collectors.toMap(EntryInstance::getKey, Function.identity()));
        for (DetectedConflict conflict : conflicts) {
            byKey.get(conflict.first()).getConflictsWith().add(conflict.second());
            byKey.get(conflict.second()).getConflictsWith().add(conflict.first());
        }
    }

    private RecurrencePattern seriesPatternOf(ScheduleEntry row) {
        if (row.isStandalone()) {
            return null;
        }
        Long seriesId = row.isMaster() ? row.getEntryId() : row.getOriginalEntryId();
        return patternRepository.findByTenantIdAndEntryId(row.getTenantId(), seriesId).orElse(null);
    }

    private ScheduleEntry findEntry(String tenantId, Long entryId) {
        return entryRepository.findByTenantIdAndEntryId(tenantId, entryId)
                .orElseThrow(() -> new ScheduleEntryNotFoundException("일정을 찾을 수 없습니다. ID: " + entryId));
    }
}
