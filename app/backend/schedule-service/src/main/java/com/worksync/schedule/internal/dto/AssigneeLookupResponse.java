package com.worksync.schedule.internal.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 담당자 디렉터리 조회 결과 (요청한 ID 중 존재하는 것만)
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AssigneeLookupResponse {
    private List<String> knownUserIds;
}
