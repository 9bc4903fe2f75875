package com.worksync.schedule.schedules.model;

import java.time.Instant;

/**
 * 생성/수정 결과와 충돌 재계산 범위
 *
 * @param entry 응답으로 돌려줄 엔트리
 * @param affectedEntryId 충돌을 다시 계산할 행 ID (시리즈면 마스터 ID)
 * @param affectedFrom 재계산 시작 시각
 * @param affectedUntil 재계산 종료 시각, 시리즈면 null (설정된 검사 기간 적용)
 */
public record EditOutcome(EntryInstance entry, Long affectedEntryId, Instant affectedFrom, Instant affectedUntil) {

    public static EditOutcome single(EntryInstance entry, Long entryId) {
        return new EditOutcome(entry, entryId, entry.getStart(), entry.getEnd());
    }

    public static EditOutcome series(EntryInstance entry, Long seriesId, Instant from) {
        return new EditOutcome(entry, seriesId, from, null);
    }
}
