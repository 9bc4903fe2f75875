package com.worksync.schedule.common.repository;

import com.worksync.schedule.common.entity.RecurrencePattern;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface RecurrencePatternRepository extends JpaRepository<RecurrencePattern, Long> {

    Optional<RecurrencePattern> findByTenantIdAndEntryId(String tenantId, Long entryId);

    List<RecurrencePattern> findByTenantIdAndEntryIdIn(String tenantId, Collection<Long> entryIds);
}
