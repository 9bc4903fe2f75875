package com.worksync.schedule.common.repository;

import com.worksync.schedule.common.entity.RecurrencePattern;
import com.worksync.schedule.common.entity.RecurrencePattern.Frequency;
import com.worksync.schedule.common.entity.ScheduleEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@DisplayName("ScheduleEntryRepository 테스트")
class ScheduleEntryRepositoryTest {

    private static final String TENANT_ID = "tenant-a";

    @Autowired
    private ScheduleEntryRepository entryRepository;

    @Autowired
    private RecurrencePatternRepository patternRepository;

    @Test
    @DisplayName("담당자 순서와 반복 규칙 컬렉션 저장 및 조회")
    void saveAndRetrieveCollections() {
        // Given
        ScheduleEntry master = entryRepository.save(entry("2024-01-01T09:00:00Z", "2024-01-01T10:00:00Z", true,
                "carol", "alice", "bob"));
        patternRepository.save(RecurrencePattern.builder()
                .entryId(master.getEntryId())
                .tenantId(TENANT_ID)
                .frequency(Frequency.WEEKLY)
                .startDate(LocalDate.of(2024, 1, 1))
                .occurrenceCount(5)
                .daysOfWeek(new HashSet<>(EnumSet.of(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY)))
                .exceptions(new HashSet<>(List.of(LocalDate.of(2024, 1, 15))))
                .build());
        entryRepository.flush();

        // When
        ScheduleEntry found = entryRepository.findByTenantIdAndEntryId(TENANT_ID, master.getEntryId()).orElseThrow();
        RecurrencePattern pattern = patternRepository.findByTenantIdAndEntryId(TENANT_ID, master.getEntryId()).orElseThrow();

        // Then
        assertThat(found.getAssignedUserIds()).containsExactly("carol", "alice", "bob");
        assertThat(found.isMaster()).isTrue();
        assertThat(found.getCreatedAt()).isNotNull();
        assertThat(pattern.getDaysOfWeek()).containsExactlyInAnyOrder(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY);
        assertThat(pattern.getExceptions()).containsExactly(LocalDate.of(2024, 1, 15));
        assertThat(pattern.getInterval()).isEqualTo(1);
    }

    @Test
    @DisplayName("단독 일정 기간 조회 - 반개구간 경계")
    void findStandaloneInRange_halfOpen() {
        // Given
        entryRepository.save(entry("2024-01-10T08:00:00Z", "2024-01-10T09:00:00Z", false, "alice"));
        ScheduleEntry inside = entryRepository.save(entry("2024-01-10T09:30:00Z", "2024-01-10T10:30:00Z", false, "alice"));
        entryRepository.save(entry("2024-01-10T11:00:00Z", "2024-01-10T12:00:00Z", false, "alice"));
        entryRepository.save(entry("2024-01-10T09:30:00Z", "2024-01-10T10:30:00Z", true, "alice"));

        // When
        List<ScheduleEntry> found = entryRepository.findStandaloneInRange(TENANT_ID,
                Instant.parse("2024-01-10T09:00:00Z"), Instant.parse("2024-01-10T11:00:00Z"));

        // Then
        assertThat(found).extracting(ScheduleEntry::getEntryId).containsExactly(inside.getEntryId());
    }

    @Test
    @DisplayName("활성 마스터 조회 - 종료일이 지난 시리즈 제외")
    void findMastersActiveInRange_excludesEnded() {
        // Given
        ScheduleEntry open = entryRepository.save(entry("2024-01-01T09:00:00Z", "2024-01-01T10:00:00Z", true, "alice"));
        patternRepository.save(pattern(open.getEntryId(), null));
        ScheduleEntry ended = entryRepository.save(entry("2024-01-01T09:00:00Z", "2024-01-01T10:00:00Z", true, "bob"));
        patternRepository.save(pattern(ended.getEntryId(), LocalDate.of(2024, 1, 31)));
        ScheduleEntry future = entryRepository.save(entry("2024-06-01T09:00:00Z", "2024-06-01T10:00:00Z", true, "carol"));
        patternRepository.save(pattern(future.getEntryId(), null));

        // When
        List<ScheduleEntry> found = entryRepository.findMastersActiveInRange(TENANT_ID,
                LocalDate.of(2024, 2, 29), Instant.parse("2024-04-01T00:00:00Z"));

        // Then
        assertThat(found).extracting(ScheduleEntry::getEntryId).containsExactly(open.getEntryId());
    }

    @Test
    @DisplayName("분리된 회차 조회 - 시리즈와 날짜 기준")
    void findDetachedByOccurrenceDate() {
        // Given
        ScheduleEntry master = entryRepository.save(entry("2024-01-01T09:00:00Z", "2024-01-01T10:00:00Z", true, "alice"));
        ScheduleEntry early = entryRepository.save(detached(master.getEntryId(), LocalDate.of(2024, 1, 8)));
        ScheduleEntry late = entryRepository.save(detached(master.getEntryId(), LocalDate.of(2024, 1, 22)));

        // When & Then
        assertThat(entryRepository.findByTenantIdAndOriginalEntryIdAndOccurrenceDate(
                TENANT_ID, master.getEntryId(), LocalDate.of(2024, 1, 8))).contains(early);
        assertThat(entryRepository.findByTenantIdAndOriginalEntryIdAndOccurrenceDateGreaterThanEqual(
                TENANT_ID, master.getEntryId(), LocalDate.of(2024, 1, 15)))
                .extracting(ScheduleEntry::getEntryId).containsExactly(late.getEntryId());
        assertThat(entryRepository.findByTenantIdAndOriginalEntryIdAndOccurrenceDate(
                "tenant-b", master.getEntryId(), LocalDate.of(2024, 1, 8))).isEmpty();
    }

    private ScheduleEntry entry(String start, String end, boolean recurring, String... assignees) {
        return ScheduleEntry.builder()
                .tenantId(TENANT_ID)
                .title("작업")
                .scheduledStart(Instant.parse(start))
                .scheduledEnd(Instant.parse(end))
                .recurring(recurring)
                .assignedUserIds(new ArrayList<>(List.of(assignees)))
                .build();
    }

    private ScheduleEntry detached(Long seriesId, LocalDate occurrenceDate) {
        ScheduleEntry entry = entry("2024-01-01T09:00:00Z", "2024-01-01T10:00:00Z", false, "alice");
        entry.setOriginalEntryId(seriesId);
        entry.setOccurrenceDate(occurrenceDate);
        entry.setScheduledStart(occurrenceDate.atTime(9, 0).toInstant(ZoneOffset.UTC));
        entry.setScheduledEnd(occurrenceDate.atTime(10, 0).toInstant(ZoneOffset.UTC));
        return entry;
    }

    private RecurrencePattern pattern(Long entryId, LocalDate endDate) {
        return RecurrencePattern.builder()
                .entryId(entryId)
                .tenantId(TENANT_ID)
                .frequency(Frequency.DAILY)
                .startDate(LocalDate.of(2024, 1, 1))
                .endDate(endDate)
                .build();
    }
}
