package com.worksync.schedule.schedules.service;

import com.worksync.schedule.common.config.TimeZoneProperties;
import com.worksync.schedule.common.entity.RecurrencePattern;
import com.worksync.schedule.common.entity.RecurrencePattern.Frequency;
import com.worksync.schedule.common.entity.ScheduleEntry;
import com.worksync.schedule.common.repository.RecurrencePatternRepository;
import com.worksync.schedule.common.repository.ScheduleEntryRepository;
import com.worksync.schedule.conflicts.algorithm.ConflictDetector;
import com.worksync.schedule.conflicts.algorithm.DetectedConflict;
import com.worksync.schedule.conflicts.service.ConflictService;
import com.worksync.schedule.holidays.service.TenantTimeZoneResolver;
import com.worksync.schedule.recurrence.algorithm.PatternExpander;
import com.worksync.schedule.recurrence.algorithm.PatternValidator;
import com.worksync.schedule.recurrence.exception.InvalidPatternException;
import com.worksync.schedule.recurrence.exception.RangeTooLargeException;
import com.worksync.schedule.schedules.dto.EntryRefResponse;
import com.worksync.schedule.schedules.dto.RecurrencePatternDto;
import com.worksync.schedule.schedules.dto.ScheduleEntryRequest;
import com.worksync.schedule.schedules.dto.ScheduleEntryResponse;
import com.worksync.schedule.schedules.dto.ScheduleEntryUpdateRequest;
import com.worksync.schedule.schedules.exception.InvalidScheduleException;
import com.worksync.schedule.schedules.exception.OccurrenceNotFoundException;
import com.worksync.schedule.schedules.exception.ScheduleEntryNotFoundException;
import com.worksync.schedule.schedules.exception.TransactionFailedException;
import com.worksync.schedule.schedules.model.EditScope;
import com.worksync.schedule.schedules.model.EntryKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ScheduleEntryService 테스트")
class ScheduleEntryServiceTest {

    private static final String TENANT_ID = "tenant-a";
    private static final Long SERIES_ID = 1L;

    @Mock
    private ScheduleEntryRepository entryRepository;

    @Mock
    private RecurrencePatternRepository patternRepository;

    @Mock
    private ConflictService conflictService;

    @Mock
    private EditScopeResolver editScopeResolver;

    @Mock
    private EntryValidator entryValidator;

    private ScheduleEntryService scheduleEntryService;

    private ScheduleEntry master;
    private RecurrencePattern pattern;

    @BeforeEach
    void setUp() {
        SeriesProjector projector = new SeriesProjector(
                new TenantTimeZoneResolver(new TimeZoneProperties()), (tenantId, from, to) -> Set.of());
        scheduleEntryService = new ScheduleEntryService(entryRepository, patternRepository,
                new PatternExpander(5000, 400), new PatternValidator(10000), new ConflictDetector(),
                conflictService, editScopeResolver, projector, entryValidator);
        ReflectionTestUtils.setField(scheduleEntryService, "scanWindowDays", 31);

        master = ScheduleEntry.builder()
                .entryId(SERIES_ID)
                .tenantId(TENANT_ID)
                .title("주간 점검")
                .scheduledStart(Instant.parse("2024-01-01T09:00:00Z"))
                .scheduledEnd(Instant.parse("2024-01-01T10:00:00Z"))
                .recurring(true)
                .assignedUserIds(new ArrayList<>(List.of("alice")))
                .build();
        pattern = RecurrencePattern.builder()
                .entryId(SERIES_ID)
                .tenantId(TENANT_ID)
                .frequency(Frequency.WEEKLY)
                .startDate(LocalDate.of(2024, 1, 1))
                .occurrenceCount(5)
                .daysOfWeek(new HashSet<>(EnumSet.of(DayOfWeek.MONDAY)))
                .build();

        when(entryValidator.normalizeAssignees(eq(TENANT_ID), anyList()))
                .thenAnswer(invocation -> new ArrayList<>(invocation.<List<String>>getArgument(1)));
    }

    // =======================================================================
    // 조회
    // =======================================================================

    @Test
    @DisplayName("기간 조회 - 단독 일정과 가상 회차를 시작 시각 순으로 병합하고 충돌 표시")
    void getEntries_mergesAndAnnotates() {
        // given
        ScheduleEntry standalone = standalone(100L, "2024-01-15T09:30:00Z", "2024-01-15T10:30:00Z", "alice");
        stubWindow(List.of(standalone), List.of(), List.of(master), List.of());

        // when
        List<ScheduleEntryResponse> responses = scheduleEntryService.getEntries(
                TENANT_ID, Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-02-01T00:00:00Z"));

        // then
        assertThat(responses).hasSize(6);
        assertThat(responses).extracting(ScheduleEntryResponse::getScheduledStart).isSorted();
        assertThat(responses).filteredOn(response -> Boolean.TRUE.equals(response.getVirtual())).hasSize(5);

        ScheduleEntryResponse standaloneResponse = responses.get(3);
        assertThat(standaloneResponse.getEntryId()).isEqualTo(100L);
        assertThat(standaloneResponse.getRecurring()).isFalse();
        assertThat(standaloneResponse.getConflicts())
                .containsExactly(new EntryRefResponse(SERIES_ID, LocalDate.of(2024, 1, 15)));

        ScheduleEntryResponse occurrence = responses.get(2);
        assertThat(occurrence.getOccurrenceDate()).isEqualTo(LocalDate.of(2024, 1, 15));
        assertThat(occurrence.getRecurrencePattern().getOccurrenceCount()).isEqualTo(5);
        assertThat(occurrence.getConflicts()).containsExactly(new EntryRefResponse(100L, null));
    }

    @Test
    @DisplayName("기간 조회 - 분리된 회차가 가상 회차를 대체하고 중복되지 않음")
    void getEntries_detachedReplacesVirtual() {
        ScheduleEntry detached = ScheduleEntry.builder()
                .entryId(10L)
                .tenantId(TENANT_ID)
                .title("주간 점검 (이동)")
                .originalEntryId(SERIES_ID)
                .occurrenceDate(LocalDate.of(2024, 1, 15))
                .scheduledStart(Instant.parse("2024-01-16T14:00:00Z"))
                .scheduledEnd(Instant.parse("2024-01-16T15:00:00Z"))
                .assignedUserIds(new ArrayList<>(List.of("alice")))
                .build();
        pattern.getExceptions().add(LocalDate.of(2024, 1, 15));
        stubWindow(List.of(), List.of(detached), List.of(master), List.of(detached));

        List<ScheduleEntryResponse> responses = scheduleEntryService.getEntries(
                TENANT_ID, Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-02-01T00:00:00Z"));

        assertThat(responses).hasSize(5);
        assertThat(responses).extracting(ScheduleEntryResponse::getEntryId).containsOnlyOnce(10L);
        ScheduleEntryResponse moved = responses.get(2);
        assertThat(moved.getEntryId()).isEqualTo(10L);
        assertThat(moved.getVirtual()).isFalse();
        assertThat(moved.getSeriesId()).isEqualTo(SERIES_ID);
        assertThat(moved.getScheduledStart()).isEqualTo(Instant.parse("2024-01-16T14:00:00Z"));
    }

    @Test
    @DisplayName("기간 조회 - 종료가 시작 이전이면 InvalidScheduleException")
    void getEntries_invertedWindow() {
        assertThrows(InvalidScheduleException.class, () -> scheduleEntryService.getEntries(
                TENANT_ID, Instant.parse("2024-02-01T00:00:00Z"), Instant.parse("2024-01-01T00:00:00Z")));
        verifyNoInteractions(entryRepository);
    }

    @Test
    @DisplayName("기간 조회 - 상한을 넘는 기간이면 RangeTooLargeException")
    void getEntries_windowTooLarge() {
        assertThrows(RangeTooLargeException.class, () -> scheduleEntryService.getEntries(
                TENANT_ID, Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2026-01-01T00:00:00Z")));
    }

    @Test
    @DisplayName("회차 조회 - 가상 회차")
    void getEntry_virtualOccurrence() {
        when(entryRepository.findByTenantIdAndEntryId(TENANT_ID, SERIES_ID)).thenReturn(Optional.of(master));
        when(patternRepository.findByTenantIdAndEntryId(TENANT_ID, SERIES_ID)).thenReturn(Optional.of(pattern));

        ScheduleEntryResponse response = scheduleEntryService.getEntry(TENANT_ID, SERIES_ID, LocalDate.of(2024, 1, 15));

        assertThat(response.getVirtual()).isTrue();
        assertThat(response.getEntryId()).isEqualTo(SERIES_ID);
        assertThat(response.getScheduledStart()).isEqualTo(Instant.parse("2024-01-15T09:00:00Z"));
    }

    @Test
    @DisplayName("회차 조회 - 회차가 아닌 날짜면 OccurrenceNotFoundException")
    void getEntry_notAnOccurrence() {
        when(entryRepository.findByTenantIdAndEntryId(TENANT_ID, SERIES_ID)).thenReturn(Optional.of(master));
        when(patternRepository.findByTenantIdAndEntryId(TENANT_ID, SERIES_ID)).thenReturn(Optional.of(pattern));

        assertThrows(OccurrenceNotFoundException.class,
                () -> scheduleEntryService.getEntry(TENANT_ID, SERIES_ID, LocalDate.of(2024, 2, 5)));
    }

    @Test
    @DisplayName("조회 - 존재하지 않는 엔트리면 ScheduleEntryNotFoundException")
    void getEntry_notFound() {
        when(entryRepository.findByTenantIdAndEntryId(TENANT_ID, 999L)).thenReturn(Optional.empty());

        assertThrows(ScheduleEntryNotFoundException.class,
                () -> scheduleEntryService.getEntry(TENANT_ID, 999L, null));
    }

    @Test
    @DisplayName("가장 이른 일정 - 일정이 없으면 ScheduleEntryNotFoundException")
    void getEarliestEntry_empty() {
        when(entryRepository.findFirstByTenantIdOrderByScheduledStartAsc(TENANT_ID)).thenReturn(Optional.empty());

        assertThrows(ScheduleEntryNotFoundException.class, () -> scheduleEntryService.getEarliestEntry(TENANT_ID));
    }

    // =======================================================================
    // 생성
    // =======================================================================

    @Test
    @DisplayName("단독 일정 생성 - 담당자 충돌은 생성을 막지 않고 기록")
    void createEntry_recordsConflicts() {
        // given
        ScheduleEntry other = standalone(200L, "2024-01-10T09:30:00Z", "2024-01-10T10:30:00Z", "alice");
        AtomicReference<ScheduleEntry> saved = new AtomicReference<>();
        when(entryRepository.save(any(ScheduleEntry.class))).thenAnswer(invocation -> {
            ScheduleEntry entry = invocation.getArgument(0);
            entry.setEntryId(100L);
            saved.set(entry);
            return entry;
        });
        when(entryRepository.findStandaloneInRange(eq(TENANT_ID), any(), any()))
                .thenAnswer(invocation -> List.of(saved.get(), other));

        ScheduleEntryRequest request = ScheduleEntryRequest.builder()
                .title("장비 점검")
                .scheduledStart(Instant.parse("2024-01-10T09:00:00Z"))
                .scheduledEnd(Instant.parse("2024-01-10T10:00:00Z"))
                .assignedUserIds(List.of("alice"))
                .build();

        // when
        ScheduleEntryResponse response = scheduleEntryService.createEntry(TENANT_ID, request);

        // then
        assertThat(response.getEntryId()).isEqualTo(100L);
        assertThat(response.getStatus()).isEqualTo("SCHEDULED");
        assertThat(response.getWorkItemType()).isEqualTo("AD_HOC");
        assertThat(response.getConflicts()).containsExactly(new EntryRefResponse(200L, null));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<DetectedConflict>> captor = ArgumentCaptor.forClass(List.class);
        verify(conflictService).record(eq(TENANT_ID), captor.capture());
        assertThat(captor.getValue()).hasSize(1);
        assertThat(captor.getValue().get(0).involves(EntryKey.persisted(100L))).isTrue();
        verify(patternRepository, never()).save(any());
    }

    @Test
    @DisplayName("반복 일정 생성 - 규칙은 시작 시각의 테넌트 날짜를 기준일로 저장")
    void createEntry_recurring() {
        when(entryRepository.save(any(ScheduleEntry.class))).thenAnswer(invocation -> {
            ScheduleEntry entry = invocation.getArgument(0);
            entry.setEntryId(SERIES_ID);
            return entry;
        });
        when(patternRepository.save(any(RecurrencePattern.class))).thenAnswer(invocation -> invocation.getArgument(0));

        ScheduleEntryRequest request = ScheduleEntryRequest.builder()
                .title("주간 점검")
                .scheduledStart(Instant.parse("2024-01-01T09:00:00Z"))
                .scheduledEnd(Instant.parse("2024-01-01T10:00:00Z"))
                .assignedUserIds(List.of("alice"))
                .recurrencePattern(RecurrencePatternDto.builder().frequency(Frequency.WEEKLY).occurrenceCount(5).build())
                .build();

        ScheduleEntryResponse response = scheduleEntryService.createEntry(TENANT_ID, request);

        ArgumentCaptor<RecurrencePattern> captor = ArgumentCaptor.forClass(RecurrencePattern.class);
        verify(patternRepository).save(captor.capture());
        assertThat(captor.getValue().getEntryId()).isEqualTo(SERIES_ID);
        assertThat(captor.getValue().getStartDate()).isEqualTo(LocalDate.of(2024, 1, 1));
        assertThat(response.getRecurring()).isTrue();
        assertThat(response.getRecurrencePattern().getFrequency()).isEqualTo(Frequency.WEEKLY);
    }

    @Test
    @DisplayName("반복 일정 생성 - 잘못된 규칙이면 아무것도 저장하지 않음")
    void createEntry_invalidPattern() {
        ScheduleEntryRequest request = ScheduleEntryRequest.builder()
                .title("주간 점검")
                .scheduledStart(Instant.parse("2024-01-01T09:00:00Z"))
                .scheduledEnd(Instant.parse("2024-01-01T10:00:00Z"))
                .assignedUserIds(List.of("alice"))
                .recurrencePattern(RecurrencePatternDto.builder().frequency(Frequency.DAILY).interval(0).build())
                .build();

        assertThrows(InvalidPatternException.class, () -> scheduleEntryService.createEntry(TENANT_ID, request));
        verify(entryRepository, never()).save(any());
        verify(patternRepository, never()).save(any());
    }

    @Test
    @DisplayName("생성 - 저장 실패 시 TransactionFailedException")
    void createEntry_storageFailure() {
        when(entryRepository.save(any(ScheduleEntry.class))).thenThrow(new DataIntegrityViolationException("duplicate"));

        ScheduleEntryRequest request = ScheduleEntryRequest.builder()
                .title("장비 점검")
                .scheduledStart(Instant.parse("2024-01-10T09:00:00Z"))
                .scheduledEnd(Instant.parse("2024-01-10T10:00:00Z"))
                .assignedUserIds(List.of("alice"))
                .build();

        assertThrows(TransactionFailedException.class, () -> scheduleEntryService.createEntry(TENANT_ID, request));
        verifyNoInteractions(conflictService);
    }

    // =======================================================================
    // 수정 / 삭제
    // =======================================================================

    @Test
    @DisplayName("수정 - 저장소 오류는 TransactionFailedException 으로 변환")
    void updateEntry_storageFailure() {
        ScheduleEntryUpdateRequest request = ScheduleEntryUpdateRequest.builder().title("변경").build();
        when(editScopeResolver.update(TENANT_ID, EntryKey.occurrence(SERIES_ID, LocalDate.of(2024, 1, 15)),
                EditScope.FUTURE, request)).thenThrow(new DataIntegrityViolationException("lock"));

        assertThrows(TransactionFailedException.class, () -> scheduleEntryService.updateEntry(
                TENANT_ID, SERIES_ID, LocalDate.of(2024, 1, 15), EditScope.FUTURE, request));
        verifyNoInteractions(conflictService);
    }

    @Test
    @DisplayName("삭제 - 참조와 범위를 그대로 위임")
    void deleteEntry_delegates() {
        scheduleEntryService.deleteEntry(TENANT_ID, SERIES_ID, LocalDate.of(2024, 1, 22), EditScope.FUTURE);

        verify(editScopeResolver).delete(TENANT_ID, EntryKey.occurrence(SERIES_ID, LocalDate.of(2024, 1, 22)), EditScope.FUTURE);
    }

    // =======================================================================
    // 헬퍼
    // =======================================================================

    private void stubWindow(List<ScheduleEntry> standalone, List<ScheduleEntry> detachedInRange,
                            List<ScheduleEntry> masters, List<ScheduleEntry> overrides) {
        when(entryRepository.findStandaloneInRange(eq(TENANT_ID), any(), any())).thenReturn(standalone);
        when(entryRepository.findDetachedInRange(eq(TENANT_ID), any(), any())).thenReturn(detachedInRange);
        when(entryRepository.findMastersActiveInRange(eq(TENANT_ID), any(), any())).thenReturn(masters);
        when(entryRepository.findByTenantIdAndOriginalEntryIdIn(eq(TENANT_ID), anyCollection())).thenReturn(overrides);
        when(patternRepository.findByTenantIdAndEntryIdIn(eq(TENANT_ID), anyCollection())).thenReturn(List.of(pattern));
    }

    private ScheduleEntry standalone(Long entryId, String start, String end, String... assignees) {
        return ScheduleEntry.builder()
                .entryId(entryId)
                .tenantId(TENANT_ID)
                .title("단독 작업 " + entryId)
                .scheduledStart(Instant.parse(start))
                .scheduledEnd(Instant.parse(end))
                .assignedUserIds(new ArrayList<>(List.of(assignees)))
                .build();
    }
}
