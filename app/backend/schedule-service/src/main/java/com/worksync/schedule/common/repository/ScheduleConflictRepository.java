package com.worksync.schedule.common.repository;

import com.worksync.schedule.common.entity.ScheduleConflict;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ScheduleConflictRepository extends JpaRepository<ScheduleConflict, Long> {

    Optional<ScheduleConflict> findByTenantIdAndConflictId(String tenantId, Long conflictId);

    List<ScheduleConflict> findByTenantIdOrderByCreatedAtDesc(String tenantId);

    List<ScheduleConflict> findByTenantIdAndResolvedOrderByCreatedAtDesc(String tenantId, Boolean resolved);

    // 주어진 엔트리(또는 그 회차)가 한쪽에라도 포함된 충돌
    @Query("SELECT c FROM ScheduleConflict c WHERE c.tenantId = :tenantId " +
           "AND (c.entryId1 IN :entryIds OR c.entryId2 IN :entryIds)")
    List<ScheduleConflict> findInvolving(
        @Param("tenantId") String tenantId,
        @Param("entryIds") Collection<Long> entryIds
    );
}
