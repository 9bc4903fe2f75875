package com.worksync.schedule.holidays.service;

import com.worksync.schedule.common.repository.HolidayRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.Set;

@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class JpaHolidayCalendar implements HolidayCalendar {

    private final HolidayRepository holidayRepository;

    @Override
    public Set<LocalDate> holidaysBetween(String tenantId, LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            return Set.of();
        }
        Set<LocalDate> holidays = new HashSet<>(holidayRepository.findDatesBetween(tenantId, from, to));
        log.debug("휴일 조회 - tenantId: {}, 기간: {} ~ {}, 휴일 수: {}", tenantId, from, to, holidays.size());
        return holidays;
    }
}
