package com.worksync.schedule.schedules.service;

import com.worksync.schedule.internal.client.AssigneeDirectoryClient;
import com.worksync.schedule.schedules.exception.InvalidScheduleException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 엔트리 필드 검증 (시간 순서, 담당자)
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EntryValidator {

    private final AssigneeDirectoryClient assigneeDirectoryClient;

    public void validateTimes(Instant start, Instant end) {
        if (start == null || end == null) {
            throw new InvalidScheduleException("시작 일시와 종료 일시는 필수입니다");
        }
        if (!end.isAfter(start)) {
            log.warn("잘못된 일정 시간 - start: {}, end: {}", start, end);
            throw new InvalidScheduleException("종료 일시는 시작 일시 이후여야 합니다: " + start + " ~ " + end);
        }
    }

    /**
     * 담당자 목록 정리 (공백 제거, 첫 등장 순서 유지한 중복 제거) 후 디렉터리 검증
     */
    public List<String> normalizeAssignees(String tenantId, List<String> userIds) {
        Set<String> unique = new LinkedHashSet<>();
        if (userIds != null) {
            userIds.stream()
                    .filter(id -> id != null && !id.isBlank())
                    .map(String::trim)
                    .forEach(unique::add);
        }
        if (unique.isEmpty()) {
            throw new InvalidScheduleException("담당자는 1명 이상 지정해야 합니다");
        }

        List<String> assignees = new ArrayList<>(unique);
        Set<String> unknown = assigneeDirectoryClient.findUnknownUserIds(tenantId, assignees);
        if (!unknown.isEmpty()) {
            log.warn("확인되지 않은 담당자 - tenantId: {}, userIds: {}", tenantId, unknown);
            throw new InvalidScheduleException("확인되지 않은 담당자입니다: " + unknown);
        }
        return assignees;
    }
}
