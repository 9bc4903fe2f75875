package com.worksync.schedule.common.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.HashMap;
import java.util.Map;

/**
 * 테넌트 시간대 설정 프로퍼티
 *
 * application.yml의 schedule.time-zone 설정을 바인딩합니다.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "schedule.time-zone")
public class TimeZoneProperties {

    /**
     * 기본 시간대 (IANA ID)
     * 환경 변수: SCHEDULE_DEFAULT_TIME_ZONE
     */
    @NotBlank(message = "schedule.time-zone.default-zone must be configured.")
    private String defaultZone = "UTC";

    /**
     * 테넌트별 시간대 (tenantId -> IANA ID)
     */
    private Map<String, String> tenants = new HashMap<>();
}
