package com.worksync.schedule.holidays.service;

import java.time.LocalDate;
import java.util.Set;

/**
 * 테넌트별 휴일 캘린더
 */
public interface HolidayCalendar {

    /**
     * 기간 내 휴일 (양 끝 포함)
     */
    Set<LocalDate> holidaysBetween(String tenantId, LocalDate from, LocalDate to);
}
