package com.worksync.schedule.recurrence.algorithm;

import com.worksync.schedule.common.entity.RecurrencePattern;
import com.worksync.schedule.common.entity.RecurrencePattern.Frequency;
import com.worksync.schedule.recurrence.exception.InvalidPatternException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 반복 규칙 불변식 검증
 *
 * 저장 전에 호출되며, 위반 시 아무것도 저장되지 않는다.
 */
@Component
@Slf4j
public class PatternValidator {

    private final int maxOccurrenceCount;

    public PatternValidator(@Value("${schedule.expansion.max-occurrence-count:10000}") int maxOccurrenceCount) {
        this.maxOccurrenceCount = maxOccurrenceCount;
    }

    public void validate(RecurrencePattern pattern) {
        if (pattern.getFrequency() == null) {
            reject("반복 주기는 필수입니다");
        }
        if (pattern.getStartDate() == null) {
            reject("반복 시작일은 필수입니다");
        }
        if (pattern.getInterval() == null || pattern.getInterval() < 1) {
            reject("반복 간격은 1 이상이어야 합니다");
        }
        if (pattern.getEndDate() != null && pattern.getOccurrenceCount() != null) {
            reject("종료일과 반복 횟수는 동시에 지정할 수 없습니다");
        }
        if (pattern.getEndDate() != null && !pattern.getEndDate().isAfter(pattern.getStartDate())) {
            reject("반복 종료일은 시작일 이후여야 합니다");
        }
        if (pattern.getOccurrenceCount() != null) {
            if (pattern.getOccurrenceCount() < 1) {
                reject("반복 횟수는 1 이상이어야 합니다");
            }
            if (pattern.getOccurrenceCount() > maxOccurrenceCount) {
                reject("반복 횟수는 " + maxOccurrenceCount + "회를 넘을 수 없습니다");
            }
        }
        if (Boolean.TRUE.equals(pattern.getWorkdaysOnly()) && pattern.getFrequency() != Frequency.DAILY) {
            reject("평일 전용 옵션은 매일 반복에만 사용할 수 있습니다");
        }

        boolean hasDays = pattern.getDaysOfWeek() != null && !pattern.getDaysOfWeek().isEmpty();
        if (hasDays && pattern.getFrequency() != Frequency.WEEKLY) {
            reject("요일 지정은 매주 반복에만 사용할 수 있습니다");
        }
        if (hasDays && !pattern.getDaysOfWeek().contains(pattern.getStartDate().getDayOfWeek())) {
            reject("반복 요일에 시작일의 요일(" + pattern.getStartDate().getDayOfWeek() + ")이 포함되어야 합니다");
        }
    }

    private void reject(String message) {
        log.warn("잘못된 반복 규칙: {}", message);
        throw new InvalidPatternException(message);
    }
}
