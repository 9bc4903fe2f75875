package com.worksync.schedule.common.repository;

import com.worksync.schedule.common.entity.ScheduleEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ScheduleEntryRepository extends JpaRepository<ScheduleEntry, Long> {

    Optional<ScheduleEntry> findByTenantIdAndEntryId(String tenantId, Long entryId);

    // 단독 일정 중 기간과 겹치는 것 ([start, end) 반개구간)
    @Query("SELECT e FROM ScheduleEntry e WHERE e.tenantId = :tenantId " +
           "AND e.recurring = false AND e.originalEntryId IS NULL " +
           "AND e.scheduledStart < :end AND e.scheduledEnd > :start " +
           "ORDER BY e.scheduledStart")
    List<ScheduleEntry> findStandaloneInRange(
        @Param("tenantId") String tenantId,
        @Param("start") Instant start,
        @Param("end") Instant end
    );

    // 분리된 예외 중 기간과 겹치는 것
    @Query("SELECT e FROM ScheduleEntry e WHERE e.tenantId = :tenantId " +
           "AND e.originalEntryId IS NOT NULL " +
           "AND e.scheduledStart < :end AND e.scheduledEnd > :start " +
           "ORDER BY e.scheduledStart")
    List<ScheduleEntry> findDetachedInRange(
        @Param("tenantId") String tenantId,
        @Param("start") Instant start,
        @Param("end") Instant end
    );

    // 기간 안에 회차가 생길 수 있는 반복 마스터 (종료일이 기간 시작 이후이거나 없음)
    @Query("SELECT e FROM ScheduleEntry e, RecurrencePattern p " +
           "WHERE p.entryId = e.entryId AND e.tenantId = :tenantId " +
           "AND e.recurring = true AND e.scheduledStart < :end " +
           "AND (p.endDate IS NULL OR p.endDate >= :startDate) " +
           "ORDER BY e.scheduledStart")
    List<ScheduleEntry> findMastersActiveInRange(
        @Param("tenantId") String tenantId,
        @Param("startDate") LocalDate startDate,
        @Param("end") Instant end
    );

    // 마스터의 특정 회차를 대체하는 분리된 예외
    Optional<ScheduleEntry> findByTenantIdAndOriginalEntryIdAndOccurrenceDate(
        String tenantId, Long originalEntryId, LocalDate occurrenceDate);

    List<ScheduleEntry> findByTenantIdAndOriginalEntryId(String tenantId, Long originalEntryId);

    List<ScheduleEntry> findByTenantIdAndOriginalEntryIdAndOccurrenceDateGreaterThanEqual(
        String tenantId, Long originalEntryId, LocalDate occurrenceDate);

    List<ScheduleEntry> findByTenantIdAndOriginalEntryIdIn(String tenantId, Collection<Long> originalEntryIds);

    // 분할로 생성된 후속 마스터
    List<ScheduleEntry> findByTenantIdAndSplitFromEntryId(String tenantId, Long splitFromEntryId);

    Optional<ScheduleEntry> findFirstByTenantIdOrderByScheduledStartAsc(String tenantId);
}
