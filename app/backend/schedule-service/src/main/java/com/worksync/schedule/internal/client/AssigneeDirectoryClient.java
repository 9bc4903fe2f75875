package com.worksync.schedule.internal.client;

import com.worksync.schedule.internal.dto.AssigneeLookupRequest;
import com.worksync.schedule.internal.dto.AssigneeLookupResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 담당자 디렉터리 Internal API 클라이언트
 *
 * 담당자 ID 검증에만 사용한다. 비활성화 시 모든 ID를 유효한 것으로 본다.
 */
@Component
@Slf4j
public class AssigneeDirectoryClient {

    private final RestTemplate restTemplate;
    private final String directoryUrl;
    private final boolean enabled;

    public AssigneeDirectoryClient(
            RestTemplate restTemplate,
            @Value("${services.assignee-directory.url:}") String directoryUrl,
            @Value("${services.assignee-directory.enabled:false}") boolean enabled
    ) {
        this.restTemplate = restTemplate;
        this.directoryUrl = directoryUrl;
        this.enabled = enabled;
    }

    /**
     * 디렉터리에 없는 담당자 ID 조회
     *
     * @param tenantId 테넌트 ID
     * @param userIds  검증할 담당자 ID
     * @return 확인되지 않은 ID (조회 실패 시 전체를 미확인으로 처리)
     */
    public Set<String> findUnknownUserIds(String tenantId, List<String> userIds) {
        if (!enabled || userIds.isEmpty()) {
            return Collections.emptySet();
        }

        String url = directoryUrl + "/api/internal/users/lookup";
        Set<String> unknown = new HashSet<>(userIds);

        try {
            log.debug("담당자 디렉터리 조회: tenantId={}, userCount={}", tenantId, userIds.size());
            AssigneeLookupResponse response = restTemplate.postForObject(
                    url,
                    AssigneeLookupRequest.builder().tenantId(tenantId).userIds(userIds).build(),
                    AssigneeLookupResponse.class
            );

            if (response == null || response.getKnownUserIds() == null) {
                log.warn("담당자 디렉터리 응답 null: tenantId={}", tenantId);
                return unknown;
            }

            unknown.removeAll(response.getKnownUserIds());
            log.debug("담당자 디렉터리 조회 결과: tenantId={}, unknownCount={}", tenantId, unknown.size());
            return unknown;
        } catch (RestClientException e) {
            log.error("담당자 디렉터리 조회 실패: tenantId={}, error={}", tenantId, e.getMessage());
            return unknown;
        }
    }
}
