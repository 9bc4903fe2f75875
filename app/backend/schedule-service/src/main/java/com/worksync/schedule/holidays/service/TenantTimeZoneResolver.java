package com.worksync.schedule.holidays.service;

import com.worksync.schedule.common.config.TimeZoneProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.ZoneId;

/**
 * 테넌트 시간대 조회 (설정된 테넌트별 시간대, 없으면 기본 시간대)
 *
 * 반복 일정의 날짜 계산은 모두 이 시간대에서 이루어진다.
 */
@Component
@RequiredArgsConstructor
public class TenantTimeZoneResolver {

    private final TimeZoneProperties timeZoneProperties;

    public ZoneId zoneOf(String tenantId) {
        String zone = timeZoneProperties.getTenants().get(tenantId);
        return ZoneId.of(zone != null ? zone : timeZoneProperties.getDefaultZone());
    }
}
