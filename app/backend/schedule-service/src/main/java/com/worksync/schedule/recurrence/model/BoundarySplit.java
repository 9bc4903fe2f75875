package com.worksync.schedule.recurrence.model;

import java.time.LocalDate;

/**
 * 경계 날짜 이전의 회차 요약 (시리즈 분할용)
 *
 * @param countBefore 경계 이전에 생성된 회차 수 (취소된 날짜 포함)
 * @param lastBefore 경계 이전 마지막 회차 날짜, 없으면 null
 */
public record BoundarySplit(int countBefore, LocalDate lastBefore) {

    public boolean isEmpty() {
        return countBefore == 0;
    }
}
