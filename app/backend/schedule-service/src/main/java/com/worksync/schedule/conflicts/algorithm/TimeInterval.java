package com.worksync.schedule.conflicts.algorithm;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

/**
 * 반개구간 [start, end) (알고리즘용)
 */
@Data
@AllArgsConstructor
public class TimeInterval {
    private Instant start;
    private Instant end;

    /**
     * 두 구간이 겹치는지 확인 (끝과 시작이 맞닿으면 겹치지 않음)
     */
    public boolean overlaps(TimeInterval other) {
        return this.start.isBefore(other.end) && other.start.isBefore(this.end);
    }

    /**
     * 주어진 시각 이전에 끝나는지 확인
     */
    public boolean endsBy(Instant instant) {
        return !end.isAfter(instant);
    }
}
