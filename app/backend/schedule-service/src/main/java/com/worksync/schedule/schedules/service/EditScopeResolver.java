package com.worksync.schedule.schedules.service;

import com.worksync.schedule.common.entity.RecurrencePattern;
import com.worksync.schedule.common.entity.ScheduleEntry;
import com.worksync.schedule.common.entity.ScheduleEntry.WorkItemType;
import com.worksync.schedule.common.repository.RecurrencePatternRepository;
import com.worksync.schedule.common.repository.ScheduleEntryRepository;
import com.worksync.schedule.conflicts.service.ConflictService;
import com.worksync.schedule.recurrence.algorithm.PatternExpander;
import com.worksync.schedule.recurrence.algorithm.PatternValidator;
import com.worksync.schedule.recurrence.exception.InvalidPatternException;
import com.worksync.schedule.recurrence.model.BoundarySplit;
import com.worksync.schedule.recurrence.model.RecurrenceRule;
import com.worksync.schedule.recurrence.model.SeriesAnchor;
import com.worksync.schedule.schedules.dto.ScheduleEntryUpdateRequest;
import com.worksync.schedule.schedules.exception.InvalidScopeException;
import com.worksync.schedule.schedules.exception.OccurrenceNotFoundException;
import com.worksync.schedule.schedules.exception.ScheduleEntryNotFoundException;
import com.worksync.schedule.schedules.model.EditOutcome;
import com.worksync.schedule.schedules.model.EditScope;
import com.worksync.schedule.schedules.model.EntryKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 반복 일정 수정/삭제 범위(SINGLE, FUTURE, ALL) 처리
 *
 * 마스터 행, 반복 규칙, 분리된 예외 행을 조작하며 모든 변경은 하나의 트랜잭션으로 커밋된다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EditScopeResolver {

    private final ScheduleEntryRepository entryRepository;
    private final RecurrencePatternRepository patternRepository;
    private final PatternExpander patternExpander;
    private final PatternValidator patternValidator;
    private final SeriesProjector projector;
    private final EntryValidator entryValidator;
    private final ConflictService conflictService;

    /**
     * 수정 대상
     *
     * 단독 일정이면 master 가 null 이고, 시리즈 회차면 date 가 회차 날짜, detached 가 그 날짜의 분리된 행(없으면 null)이다.
     */
    private record Target(ScheduleEntry row, ScheduleEntry master, RecurrencePattern pattern,
                          RecurrenceRule rule, LocalDate date, ScheduleEntry detached) {

        boolean isStandalone() {
            return master == null;
        }
    }

    /**
     * 시리즈 시간 변경량 (기준 회차 시작 대비 이동량, 새 길이)
     */
    private record Retiming(Duration shift, Duration duration) {
    }

    @Transactional
    public EditOutcome update(String tenantId, EntryKey ref, EditScope scope, ScheduleEntryUpdateRequest changes) {
        log.info("일정 수정 요청 - tenantId: {}, ref: {}, scope: {}", tenantId, ref, scope);

        Target target = resolve(tenantId, ref, scope);
        EditOutcome outcome;
        if (target.isStandalone()) {
            outcome = updateStandalone(tenantId, target.row(), changes);
        } else {
            outcome = switch (scope) {
                case SINGLE -> updateSingle(tenantId, target, changes);
                case FUTURE -> updateFuture(tenantId, target, changes);
                case ALL -> updateAll(tenantId, target, changes);
            };
        }
        entryRepository.flush();

        log.info("일정 수정 완료 - tenantId: {}, 결과: {}", tenantId, outcome.entry().getKey());
        return outcome;
    }

    @Transactional
    public void delete(String tenantId, EntryKey ref, EditScope scope) {
        log.info("일정 삭제 요청 - tenantId: {}, ref: {}, scope: {}", tenantId, ref, scope);

        Target target = resolve(tenantId, ref, scope);
        if (target.isStandalone()) {
            entryRepository.delete(target.row());
            conflictService.purgeEntries(tenantId, List.of(target.row().getEntryId()));
        } else {
            switch (scope) {
                case SINGLE -> deleteSingle(tenantId, target);
                case FUTURE -> deleteFuture(tenantId, target);
                case ALL -> deleteSeries(tenantId, target.master(), target.pattern());
            }
        }
        entryRepository.flush();

        log.info("일정 삭제 완료 - tenantId: {}, ref: {}", tenantId, ref);
    }

    // ===== 대상 확인 =====

    private Target resolve(String tenantId, EntryKey ref, EditScope scope) {
        ScheduleEntry row = findEntry(tenantId, ref.entryId());

        if (row.isStandalone()) {
            if (ref.isOccurrence()) {
                throw new OccurrenceNotFoundException(
                        "반복 일정이 아닌 엔트리에는 회차 날짜를 지정할 수 없습니다. ID: " + row.getEntryId());
            }
            if (scope != null) {
                log.warn("단독 일정에 수정 범위 지정 - entryId: {}, scope: {}", row.getEntryId(), scope);
                throw new InvalidScopeException(
                        "반복 일정이 아닌 엔트리에는 수정 범위(" + scope + ")를 지정할 수 없습니다. ID: " + row.getEntryId());
            }
            return new Target(row, null, null, null, null, null);
        }

        if (scope == null) {
            log.warn("반복 일정에 수정 범위 누락 - entryId: {}", row.getEntryId());
            throw new InvalidScopeException(
                    "반복 일정은 수정 범위(SINGLE, FUTURE, ALL)를 지정해야 합니다. ID: " + row.getEntryId());
        }

        if (row.isDetachedException()) {
            if (ref.isOccurrence() && !ref.occurrenceDate().equals(row.getOccurrenceDate())) {
                throw new OccurrenceNotFoundException(
                        "분리된 회차의 날짜가 일치하지 않습니다. ID: " + row.getEntryId() + ", 날짜: " + ref.occurrenceDate());
            }
            ScheduleEntry master = findEntry(tenantId, row.getOriginalEntryId());
            RecurrencePattern pattern = findPattern(tenantId, master.getEntryId());
            return new Target(row, master, pattern, pattern.toRule(), row.getOccurrenceDate(), row);
        }

        RecurrencePattern pattern = findPattern(tenantId, row.getEntryId());
        RecurrenceRule rule = pattern.toRule();
        LocalDate date = ref.isOccurrence()
                ? ref.occurrenceDate()
                : patternExpander.firstOccurrence(rule, projector.holidaysFor(tenantId, rule,
                                rule.startDate().plusYears(rule.interval())))
                        .orElseThrow(() -> new OccurrenceNotFoundException(
                                "시리즈에 회차가 없습니다. 시리즈 ID: " + row.getEntryId()));

        Optional<ScheduleEntry> detached = entryRepository
                .findByTenantIdAndOriginalEntryIdAndOccurrenceDate(tenantId, row.getEntryId(), date);

        // ALL 범위는 기준 날짜를 시간 이동 기준으로만 쓰므로 취소된 날짜도 허용
        if (detached.isEmpty() && scope != EditScope.ALL) {
            boolean occurs = !rule.isCancelled(date)
                    && patternExpander.occursOn(rule, date, projector.holidaysFor(tenantId, rule, date));
            if (!occurs) {
                throw new OccurrenceNotFoundException(
                        "해당 날짜에 회차가 없습니다. 시리즈 ID: " + row.getEntryId() + ", 날짜: " + date);
            }
        }
        return new Target(row, row, pattern, rule, date, detached.orElse(null));
    }

    // ===== 수정 =====

    private EditOutcome updateStandalone(String tenantId, ScheduleEntry row, ScheduleEntryUpdateRequest changes) {
        if (changes.isRemovingRecurrence()) {
            throw new InvalidScopeException("반복 일정이 아닌 엔트리는 반복을 해제할 수 없습니다. ID: " + row.getEntryId());
        }

        applyFields(tenantId, row, changes);
        applyTimes(row, changes);

        RecurrencePattern pattern = null;
        if (changes.getRecurrencePattern() != null) {
            pattern = changes.getRecurrencePattern()
                    .toEntity(tenantId, projector.localDateOf(tenantId, row.getScheduledStart()));
            patternValidator.validate(pattern);
            row.setRecurring(true);
        }

        ScheduleEntry saved = entryRepository.save(row);
        conflictService.purgeUnresolved(tenantId, saved.getEntryId());

        if (pattern == null) {
            return EditOutcome.single(projector.fromRow(saved, null), saved.getEntryId());
        }

        pattern.setEntryId(saved.getEntryId());
        RecurrencePattern savedPattern = patternRepository.save(pattern);
        log.info("단독 일정을 반복 일정으로 전환 - entryId: {}, frequency: {}", saved.getEntryId(), savedPattern.getFrequency());
        return EditOutcome.series(projector.fromRow(saved, savedPattern), saved.getEntryId(), saved.getScheduledStart());
    }

    /**
     * 이 회차만 수정: 가상 회차는 분리된 행으로 만들고, 이미 분리된 행은 그대로 수정
     */
    private EditOutcome updateSingle(String tenantId, Target target, ScheduleEntryUpdateRequest changes) {
        if (changes.getRecurrencePattern() != null || changes.isRemovingRecurrence()) {
            throw new InvalidScopeException("SINGLE 범위에서는 반복 규칙을 변경할 수 없습니다");
        }

        ScheduleEntry row = target.detached();
        if (row == null) {
            row = materialize(target);
            target.pattern().getExceptions().add(target.date());
            patternRepository.save(target.pattern());
            conflictService.purgeOccurrence(tenantId, target.master().getEntryId(), target.date());
            log.info("가상 회차 분리 - seriesId: {}, 날짜: {}", target.master().getEntryId(), target.date());
        }

        applyFields(tenantId, row, changes);
        applyTimes(row, changes);

        ScheduleEntry saved = entryRepository.save(row);
        conflictService.purgeUnresolved(tenantId, saved.getEntryId());
        return EditOutcome.single(projector.fromRow(saved, target.pattern()), saved.getEntryId());
    }

    /**
     * 이 회차 및 이후 수정: 기존 시리즈를 경계 이전으로 자르고 경계부터 새 시리즈 생성
     */
    private EditOutcome updateFuture(String tenantId, Target target, ScheduleEntryUpdateRequest changes) {
        ScheduleEntry master = target.master();
        RecurrencePattern pattern = target.pattern();
        LocalDate boundary = target.date();

        BoundarySplit split = patternExpander.splitBefore(
                target.rule(), boundary, projector.holidaysFor(tenantId, target.rule(), boundary));
        if (split.isEmpty()) {
            log.info("첫 회차 기준 FUTURE 수정 - 시리즈 전체 수정으로 처리: seriesId={}", master.getEntryId());
            return updateAll(tenantId, target, changes);
        }
        if (changes.isRemovingRecurrence()) {
            throw new InvalidScopeException("반복 해제는 ALL 범위에서만 가능합니다");
        }

        Retiming timing = retime(target, changes);
        SeriesAnchor anchor = projector.anchorOf(master);
        Instant successorStart = anchor.startOn(boundary).plus(timing.shift());
        Instant successorEnd = successorStart.plus(timing.duration());
        LocalDate successorDate = projector.localDateOf(tenantId, successorStart);
        long dayOffset = ChronoUnit.DAYS.between(boundary, successorDate);

        // 1. 새 시리즈 규칙 (잘리기 전 규칙 기준)
        RecurrencePattern successorPattern = changes.getRecurrencePattern() != null
                ? changes.getRecurrencePattern().toEntity(tenantId, successorDate)
                : continuationOf(pattern, split, successorDate, dayOffset);
        pattern.getExceptions().stream()
                .filter(date -> !date.isBefore(boundary))
                .map(date -> date.plusDays(dayOffset))
                .forEach(successorPattern.getExceptions()::add);
        patternValidator.validate(successorPattern);

        // 2. 기존 시리즈 절단
        pattern.getExceptions().removeIf(date -> !date.isBefore(boundary));
        truncate(pattern, split);
        patternRepository.save(pattern);

        // 3. 새 마스터 저장
        ScheduleEntry successor = copyOf(master);
        successor.setRecurring(true);
        successor.setSplitFromEntryId(master.getEntryId());
        successor.setScheduledStart(successorStart);
        successor.setScheduledEnd(successorEnd);
        applyFields(tenantId, successor, changes);
        ScheduleEntry savedSuccessor = entryRepository.save(successor);

        successorPattern.setEntryId(savedSuccessor.getEntryId());
        RecurrencePattern savedSuccessorPattern = patternRepository.save(successorPattern);

        // 4. 경계 이후 분리된 행을 새 시리즈로 이동
        List<ScheduleEntry> later = entryRepository.findByTenantIdAndOriginalEntryIdAndOccurrenceDateGreaterThanEqual(
                tenantId, master.getEntryId(), boundary);
        for (ScheduleEntry row : later) {
            row.setOriginalEntryId(savedSuccessor.getEntryId());
            row.setOccurrenceDate(row.getOccurrenceDate().plusDays(dayOffset));
            if (target.detached() != null && row.getEntryId().equals(target.detached().getEntryId())) {
                applyFields(tenantId, row, changes);
                applyTimes(row, changes);
            }
        }
        entryRepository.saveAll(later);

        conflictService.purgeOccurrences(tenantId, master.getEntryId(), boundary);

        log.info("시리즈 분할 완료 - 기존 seriesId: {} (경계 이전 {}회), 새 seriesId: {}, 이동한 분리 회차: {}",
                master.getEntryId(), split.countBefore(), savedSuccessor.getEntryId(), later.size());
        return EditOutcome.series(
                projector.fromRow(savedSuccessor, savedSuccessorPattern), savedSuccessor.getEntryId(), successorStart);
    }

    /**
     * 모든 회차 수정: 마스터와 규칙을 직접 변경 (분리된 행은 날짜 기준만 이동)
     */
    private EditOutcome updateAll(String tenantId, Target target, ScheduleEntryUpdateRequest changes) {
        ScheduleEntry master = target.master();
        RecurrencePattern pattern = target.pattern();

        if (changes.isRemovingRecurrence() && changes.getRecurrencePattern() != null) {
            throw new InvalidPatternException("반복 해제와 새 반복 규칙은 함께 지정할 수 없습니다");
        }

        Retiming timing = changes.changesTime() ? retime(target, changes) : null;
        applyFields(tenantId, master, changes);

        long dayOffset = 0;
        if (timing != null) {
            Instant start = master.getScheduledStart().plus(timing.shift());
            dayOffset = ChronoUnit.DAYS.between(
                    projector.localDateOf(tenantId, master.getScheduledStart()),
                    projector.localDateOf(tenantId, start));
            master.setScheduledStart(start);
            master.setScheduledEnd(start.plus(timing.duration()));
        }

        List<ScheduleEntry> detachedRows = entryRepository.findByTenantIdAndOriginalEntryId(tenantId, master.getEntryId());

        if (changes.isRemovingRecurrence()) {
            return removeRecurrence(tenantId, master, pattern, detachedRows);
        }

        if (dayOffset != 0) {
            shiftSeriesDates(pattern, detachedRows, dayOffset);
        }
        if (changes.getRecurrencePattern() != null) {
            replaceRule(pattern, changes.getRecurrencePattern()
                    .toEntity(tenantId, projector.localDateOf(tenantId, master.getScheduledStart())));
            patternValidator.validate(pattern);
        }

        ScheduleEntry saved = entryRepository.save(master);
        RecurrencePattern savedPattern = patternRepository.save(pattern);
        entryRepository.saveAll(detachedRows);
        conflictService.purgeUnresolved(tenantId, saved.getEntryId());

        Instant from = projector.anchorOf(saved).startOn(target.date().plusDays(dayOffset));
        log.info("시리즈 전체 수정 완료 - seriesId: {}, 날짜 이동: {}일", saved.getEntryId(), dayOffset);
        return EditOutcome.series(projector.fromRow(saved, savedPattern), saved.getEntryId(), from);
    }

    /**
     * 반복 해제: 마스터는 단독 일정으로, 분리된 회차도 단독 일정으로 남긴다
     */
    private EditOutcome removeRecurrence(String tenantId, ScheduleEntry master, RecurrencePattern pattern,
                                         List<ScheduleEntry> detachedRows) {
        master.setRecurring(false);
        patternRepository.delete(pattern);

        for (ScheduleEntry row : detachedRows) {
            row.setOriginalEntryId(null);
            row.setOccurrenceDate(null);
        }
        entryRepository.saveAll(detachedRows);
        ScheduleEntry saved = entryRepository.save(master);

        conflictService.purgeOccurrences(tenantId, saved.getEntryId(), null);
        conflictService.purgeUnresolved(tenantId, saved.getEntryId());

        log.info("반복 해제 완료 - entryId: {}, 단독 전환된 분리 회차: {}", saved.getEntryId(), detachedRows.size());
        return EditOutcome.single(projector.fromRow(saved, null), saved.getEntryId());
    }

    // ===== 삭제 =====

    private void deleteSingle(String tenantId, Target target) {
        RecurrencePattern pattern = target.pattern();
        pattern.getExceptions().add(target.date());
        patternRepository.save(pattern);

        if (target.detached() != null) {
            entryRepository.delete(target.detached());
            conflictService.purgeEntries(tenantId, List.of(target.detached().getEntryId()));
        }
        conflictService.purgeOccurrence(tenantId, target.master().getEntryId(), target.date());
    }

    private void deleteFuture(String tenantId, Target target) {
        ScheduleEntry master = target.master();
        RecurrencePattern pattern = target.pattern();
        LocalDate boundary = target.date();

        BoundarySplit split = patternExpander.splitBefore(
                target.rule(), boundary, projector.holidaysFor(tenantId, target.rule(), boundary));
        if (split.isEmpty()) {
            log.info("첫 회차 기준 FUTURE 삭제 - 시리즈 전체 삭제로 처리: seriesId={}", master.getEntryId());
            deleteSuccessorsFrom(tenantId, master.getEntryId(), boundary);
            deleteSeries(tenantId, master, pattern);
            return;
        }

        pattern.getExceptions().removeIf(date -> !date.isBefore(boundary));
        truncate(pattern, split);
        patternRepository.save(pattern);

        List<ScheduleEntry> later = entryRepository.findByTenantIdAndOriginalEntryIdAndOccurrenceDateGreaterThanEqual(
                tenantId, master.getEntryId(), boundary);
        entryRepository.deleteAll(later);
        conflictService.purgeEntries(tenantId, later.stream().map(ScheduleEntry::getEntryId).collect(Collectors.toList()));
        conflictService.purgeOccurrences(tenantId, master.getEntryId(), boundary);

        int successors = deleteSuccessorsFrom(tenantId, master.getEntryId(), boundary);
        log.info("시리즈 이후 회차 삭제 완료 - seriesId: {}, 남은 회차: {}, 삭제한 분리 회차: {}, 삭제한 후속 시리즈: {}",
                master.getEntryId(), split.countBefore(), later.size(), successors);
    }

    /**
     * 분할로 생긴 후속 시리즈 중 경계 이후에 시작하는 것을 재귀적으로 삭제
     */
    private int deleteSuccessorsFrom(String tenantId, Long seriesId, LocalDate boundary) {
        int deleted = 0;
        for (ScheduleEntry successor : entryRepository.findByTenantIdAndSplitFromEntryId(tenantId, seriesId)) {
            if (!successor.isMaster()) {
                continue;
            }
            Optional<RecurrencePattern> pattern = patternRepository.findByTenantIdAndEntryId(tenantId, successor.getEntryId());
            if (pattern.isEmpty() || pattern.get().getStartDate().isBefore(boundary)) {
                continue;
            }
            deleted += deleteSuccessorsFrom(tenantId, successor.getEntryId(), boundary);
            deleteSeries(tenantId, successor, pattern.get());
            deleted++;
        }
        return deleted;
    }

    private void deleteSeries(String tenantId, ScheduleEntry master, RecurrencePattern pattern) {
        List<ScheduleEntry> detachedRows = entryRepository.findByTenantIdAndOriginalEntryId(tenantId, master.getEntryId());

        List<Long> removedIds = new ArrayList<>();
        detachedRows.forEach(row -> removedIds.add(row.getEntryId()));
        removedIds.add(master.getEntryId());

        entryRepository.deleteAll(detachedRows);
        patternRepository.delete(pattern);
        entryRepository.delete(master);
        conflictService.purgeEntries(tenantId, removedIds);

        log.info("시리즈 삭제 - seriesId: {}, 분리 회차: {}", master.getEntryId(), detachedRows.size());
    }

    // ===== 보조 =====

    private ScheduleEntry findEntry(String tenantId, Long entryId) {
        return entryRepository.findByTenantIdAndEntryId(tenantId, entryId)
                .orElseThrow(() -> new ScheduleEntryNotFoundException("일정을 찾을 수 없습니다. ID: " + entryId));
    }

    private RecurrencePattern findPattern(String tenantId, Long seriesId) {
        return patternRepository.findByTenantIdAndEntryId(tenantId, seriesId)
                .orElseThrow(() -> new ScheduleEntryNotFoundException("반복 규칙을 찾을 수 없습니다. 시리즈 ID: " + seriesId));
    }

    /**
     * 가상 회차를 분리된 행으로 생성 (마스터 값 + 회차 시각)
     */
    private ScheduleEntry materialize(Target target) {
        SeriesAnchor anchor = projector.anchorOf(target.master());
        ScheduleEntry row = copyOf(target.master());
        row.setRecurring(false);
        row.setOriginalEntryId(target.master().getEntryId());
        row.setOccurrenceDate(target.date());
        row.setScheduledStart(anchor.startOn(target.date()));
        row.setScheduledEnd(anchor.endOn(target.date()));
        return row;
    }

    private ScheduleEntry copyOf(ScheduleEntry source) {
        return ScheduleEntry.builder()
                .tenantId(source.getTenantId())
                .title(source.getTitle())
                .notes(source.getNotes())
                .status(source.getStatus())
                .workItemType(source.getWorkItemType())
                .workItemId(source.getWorkItemId())
                .scheduledStart(source.getScheduledStart())
                .scheduledEnd(source.getScheduledEnd())
                .assignedUserIds(new ArrayList<>(source.getAssignedUserIds()))
                .build();
    }

    private void applyFields(String tenantId, ScheduleEntry entry, ScheduleEntryUpdateRequest changes) {
        if (changes.getTitle() != null) {
            entry.setTitle(changes.getTitle());
        }
        if (changes.getNotes() != null) {
            entry.setNotes(changes.getNotes());
        }
        if (changes.getStatus() != null) {
            entry.setStatus(changes.getStatus());
        }
        if (changes.getWorkItemType() != null) {
            entry.setWorkItemType(changes.getWorkItemType());
        }
        if (changes.getWorkItemId() != null) {
            entry.setWorkItemId(changes.getWorkItemId());
        }
        if (entry.getWorkItemType() == WorkItemType.AD_HOC) {
            entry.setWorkItemId(null);
        }
        if (changes.getAssignedUserIds() != null) {
            List<String> assignees = entryValidator.normalizeAssignees(tenantId, changes.getAssignedUserIds());
            entry.getAssignedUserIds().clear();
            entry.getAssignedUserIds().addAll(assignees);
        }
    }

    private void applyTimes(ScheduleEntry entry, ScheduleEntryUpdateRequest changes) {
        Instant start = changes.getScheduledStart() != null ? changes.getScheduledStart() : entry.getScheduledStart();
        Instant end = changes.getScheduledEnd() != null ? changes.getScheduledEnd() : entry.getScheduledEnd();
        entryValidator.validateTimes(start, end);
        entry.setScheduledStart(start);
        entry.setScheduledEnd(end);
    }

    /**
     * 기준 회차의 현재 시작(분리된 행이면 그 행의 시작) 대비 이동량과 새 길이
     *
     * 종료 일시를 지정하지 않으면 시리즈 길이를 유지한다.
     */
    private Retiming retime(Target target, ScheduleEntryUpdateRequest changes) {
        SeriesAnchor anchor = projector.anchorOf(target.master());
        Instant referenceStart = target.detached() != null
                ? target.detached().getScheduledStart()
                : anchor.startOn(target.date());

        Instant start = changes.getScheduledStart() != null ? changes.getScheduledStart() : referenceStart;
        Instant end = changes.getScheduledEnd() != null ? changes.getScheduledEnd() : start.plus(anchor.duration());
        entryValidator.validateTimes(start, end);

        return new Retiming(Duration.between(referenceStart, start), Duration.between(start, end));
    }

    private RecurrencePattern continuationOf(RecurrencePattern pattern, BoundarySplit split,
                                             LocalDate startDate, long dayOffset) {
        RecurrencePattern next = RecurrencePattern.builder()
                .tenantId(pattern.getTenantId())
                .frequency(pattern.getFrequency())
                .interval(pattern.getInterval())
                .startDate(startDate)
                .endDate(pattern.getEndDate() != null ? pattern.getEndDate().plusDays(dayOffset) : null)
                .occurrenceCount(pattern.getOccurrenceCount() != null
                        ? pattern.getOccurrenceCount() - split.countBefore()
                        : null)
                .workdaysOnly(pattern.getWorkdaysOnly())
                .daysOfWeek(shiftDays(pattern.getDaysOfWeek(), dayOffset))
                .build();

        // 날짜 이동이 없으면 말일 보정 전 기준 일자를 이어받음 (1/31 시리즈를 2/29 에서 분할해도 3/31 유지)
        int anchorDay = pattern.toRule().anchorDay();
        if (dayOffset == 0 && anchorDay != startDate.getDayOfMonth()) {
            next.setAnchorDay(anchorDay);
        }

        // 종료일이 새 기준일과 같으면 남은 회차는 하나
        if (next.getEndDate() != null && !next.getEndDate().isAfter(startDate)) {
            next.setEndDate(null);
            next.setOccurrenceCount(1);
        }
        return next;
    }

    /**
     * 경계 이전 회차만 남도록 종료 조건 변경
     */
    private void truncate(RecurrencePattern pattern, BoundarySplit split) {
        if (pattern.getOccurrenceCount() != null) {
            pattern.setOccurrenceCount(split.countBefore());
        } else if (split.lastBefore().isAfter(pattern.getStartDate())) {
            pattern.setEndDate(split.lastBefore());
        } else {
            // 종료일이 기준일과 같은 규칙은 허용되지 않으므로 횟수 1회로 표현
            pattern.setEndDate(null);
            pattern.setOccurrenceCount(1);
        }
    }

    private void shiftSeriesDates(RecurrencePattern pattern, List<ScheduleEntry> detachedRows, long dayOffset) {
        pattern.setStartDate(pattern.getStartDate().plusDays(dayOffset));
        if (dayOffset != 0) {
            pattern.setAnchorDay(null);
        }
        if (pattern.getEndDate() != null) {
            pattern.setEndDate(pattern.getEndDate().plusDays(dayOffset));
        }

        Set<DayOfWeek> days = shiftDays(pattern.getDaysOfWeek(), dayOffset);
        pattern.getDaysOfWeek().clear();
        pattern.getDaysOfWeek().addAll(days);

        Set<LocalDate> exceptions = pattern.getExceptions().stream()
                .map(date -> date.plusDays(dayOffset))
                .collect(Collectors.toSet());
        pattern.getExceptions().clear();
        pattern.getExceptions().addAll(exceptions);

        detachedRows.forEach(row -> row.setOccurrenceDate(row.getOccurrenceDate().plusDays(dayOffset)));
    }

    private void replaceRule(RecurrencePattern pattern, RecurrencePattern replacement) {
        pattern.setFrequency(replacement.getFrequency());
        pattern.setInterval(replacement.getInterval());
        pattern.setStartDate(replacement.getStartDate());
        pattern.setAnchorDay(replacement.getAnchorDay());
        pattern.setEndDate(replacement.getEndDate());
        pattern.setOccurrenceCount(replacement.getOccurrenceCount());
        pattern.setWorkdaysOnly(replacement.getWorkdaysOnly());
        pattern.getDaysOfWeek().clear();
        pattern.getDaysOfWeek().addAll(replacement.getDaysOfWeek());
    }

    private Set<DayOfWeek> shiftDays(Set<DayOfWeek> days, long dayOffset) {
        return days.stream()
                .map(day -> day.plus(dayOffset))
                .collect(Collectors.toCollection(HashSet::new));
    }
}
