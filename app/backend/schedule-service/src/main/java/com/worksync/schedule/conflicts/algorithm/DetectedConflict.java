package com.worksync.schedule.conflicts.algorithm;

import com.worksync.schedule.common.entity.ScheduleConflict.ConflictType;
import com.worksync.schedule.schedules.model.EntryKey;

/**
 * 감지된 충돌 한 쌍 (first < second 로 정규화)
 */
public record DetectedConflict(EntryKey first, EntryKey second, ConflictType type) {

    public static DetectedConflict between(EntryKey a, EntryKey b, ConflictType type) {
        return a.compareTo(b) <= 0 ? new DetectedConflict(a, b, type) : new DetectedConflict(b, a, type);
    }

    public boolean involves(EntryKey key) {
        return first.equals(key) || second.equals(key);
    }
}
