package com.worksync.schedule.conflicts.algorithm;

import com.worksync.schedule.common.entity.ScheduleConflict.ConflictType;
import com.worksync.schedule.schedules.model.EntryInstance;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * 담당자 중복 배정 감지 알고리즘
 *
 * 두 엔트리가 담당자를 하나 이상 공유하고 [start, end) 구간이 겹치면 충돌이다.
 * 결과는 참고용이며 어떤 변경도 막지 않는다.
 */
@Component
@Slf4j
public class ConflictDetector {

    /**
     * 후보 엔트리와 다른 엔트리들 사이의 충돌
     */
    public List<DetectedConflict> detect(EntryInstance candidate, List<EntryInstance> others) {
        TimeInterval candidateInterval = intervalOf(candidate);
        List<DetectedConflict> conflicts = new ArrayList<>();

        for (EntryInstance other : others) {
            if (other.getKey().equals(candidate.getKey())) {
                continue;
            }
            if (candidateInterval.overlaps(intervalOf(other)) && candidate.sharesAssigneeWith(other)) {
                conflicts.add(DetectedConflict.between(
                        candidate.getKey(), other.getKey(), ConflictType.ASSIGNEE_OVERLAP));
            }
        }

        log.debug("충돌 감지 - 후보: {}, 비교 대상: {}, 충돌: {}", candidate.getKey(), others.size(), conflicts.size());
        return conflicts;
    }

    /**
     * 목록 전체의 충돌 (각 쌍은 한 번만 보고)
     *
     * 시작 시각 순으로 정렬한 뒤, 현재 엔트리 시작 전에 끝난 구간을 활성 목록에서 제거하며 훑는다.
     */
    public List<DetectedConflict> detectAll(List<EntryInstance> entries) {
        List<EntryInstance> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparing(EntryInstance::getStart).thenComparing(EntryInstance::getKey));

        List<EntryInstance> active = new ArrayList<>();
        List<DetectedConflict> conflicts = new ArrayList<>();

        for (EntryInstance current : sorted) {
            Iterator<EntryInstance> iterator = active.iterator();
            while (iterator.hasNext()) {
                if (intervalOf(iterator.next()).endsBy(current.getStart())) {
                    iterator.remove();
                }
            }

            for (EntryInstance other : active) {
                if (!other.getKey().equals(current.getKey()) && current.sharesAssigneeWith(other)) {
                    conflicts.add(DetectedConflict.between(
                            other.getKey(), current.getKey(), ConflictType.ASSIGNEE_OVERLAP));
                }
            }
            active.add(current);
        }

        log.debug("전체 충돌 감지 완료 - 엔트리: {}, 충돌: {}", entries.size(), conflicts.size());
        return conflicts;
    }

    private TimeInterval intervalOf(EntryInstance entry) {
        return new TimeInterval(entry.getStart(), entry.getEnd());
    }
}
