package com.worksync.schedule.common.repository;

import com.worksync.schedule.common.entity.Holiday;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface HolidayRepository extends JpaRepository<Holiday, Long> {

    @Query("SELECT h.holidayDate FROM Holiday h WHERE h.tenantId = :tenantId " +
           "AND h.holidayDate BETWEEN :from AND :to")
    List<LocalDate> findDatesBetween(
        @Param("tenantId") String tenantId,
        @Param("from") LocalDate from,
        @Param("to") LocalDate to
    );
}
