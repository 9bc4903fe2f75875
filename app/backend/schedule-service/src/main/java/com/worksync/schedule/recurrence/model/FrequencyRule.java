package com.worksync.schedule.recurrence.model;

import java.time.DayOfWeek;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 반복 주기별 규칙
 *
 * 주기마다 의미 있는 추가 정보만 가진다. (평일 전용은 DAILY, 요일 집합은 WEEKLY)
 */
public sealed interface FrequencyRule
        permits FrequencyRule.Daily, FrequencyRule.Weekly, FrequencyRule.Monthly, FrequencyRule.Yearly {

    record Daily(boolean workdaysOnly) implements FrequencyRule {
    }

    record Weekly(Set<DayOfWeek> daysOfWeek) implements FrequencyRule {
        public Weekly {
            daysOfWeek = Collections.unmodifiableSet(EnumSet.copyOf(daysOfWeek));
        }
    }

    record Monthly() implements FrequencyRule {
    }

    record Yearly() implements FrequencyRule {
    }
}
