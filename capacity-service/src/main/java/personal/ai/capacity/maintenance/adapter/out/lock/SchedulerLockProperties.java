package personal.ai.capacity.maintenance.adapter.out.lock;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Scheduler Lock 설정 Properties
 *
 * 설정 예시:
 * scheduler:
 *   lock:
 *     strategy: cluster # none | cluster
 *     ttl-seconds: 300  # 락 TTL (초)
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "scheduler.lock")
public class SchedulerLockProperties {

    /**
     * 락 전략
     * - none: 락 사용 안 함 (로컬 개발)
     * - cluster: Redis 분산 락 (운영)
     */
    private String strategy = "none";

    /**
     * 락 TTL (초)
     * 전체 슬롯 보정의 최대 실행 시간보다 길게 설정
     */
    private int ttlSeconds = 300;
}
