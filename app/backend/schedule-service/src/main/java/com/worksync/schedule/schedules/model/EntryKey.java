package com.worksync.schedule.schedules.model;

import java.time.LocalDate;
import java.util.Comparator;

/**
 * 엔트리 식별자
 *
 * 저장된 행은 (entryId, null), 가상 회차는 (시리즈 ID, 회차 날짜)로 식별한다.
 * 수정/삭제 요청에서는 시리즈의 특정 회차를 가리키는 참조로도 쓰인다.
 */
public record EntryKey(Long entryId, LocalDate occurrenceDate) implements Comparable<EntryKey> {

    private static final Comparator<EntryKey> ORDER = Comparator
            .comparing(EntryKey::entryId)
            .thenComparing(EntryKey::occurrenceDate, Comparator.nullsFirst(Comparator.naturalOrder()));

    public static EntryKey persisted(Long entryId) {
        return new EntryKey(entryId, null);
    }

    public static EntryKey occurrence(Long seriesId, LocalDate occurrenceDate) {
        return new EntryKey(seriesId, occurrenceDate);
    }

    public boolean isOccurrence() {
        return occurrenceDate != null;
    }

    @Override
    public int compareTo(EntryKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return occurrenceDate == null ? String.valueOf(entryId) : entryId + "@" + occurrenceDate;
    }
}
