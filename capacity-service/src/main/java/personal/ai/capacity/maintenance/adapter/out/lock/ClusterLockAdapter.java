package personal.ai.capacity.maintenance.adapter.out.lock;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import personal.ai.capacity.maintenance.application.port.out.SchedulerLockPort;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Cluster Lock Adapter
 * Redis SET NX PX 기반 작업별 분산 락
 * <p>
 * 해제는 Lua 스크립트로 소유자 확인 후 삭제 (TTL 만료 후 다른 인스턴스가 잡은 락을 지우지 않음)
 */
@Slf4j
@RequiredArgsConstructor
public class ClusterLockAdapter implements SchedulerLockPort {

    private static final String UNLOCK_SCRIPT = """
            if redis.call('get', KEYS[1]) == ARGV[1] then
                return redis.call('del', KEYS[1])
            end
            return 0
            """;

    private final StringRedisTemplate redisTemplate;
    private final Duration lockTtl;

    // 인스턴스 고유 ID (락 소유자 식별용)
    private final String instanceId = UUID.randomUUID().toString();

    @Override
    public boolean tryAcquire(String jobName) {
        String lockKey = buildLockKey(jobName);

        try {
            boolean acquired = Boolean.TRUE.equals(
                    redisTemplate.opsForValue().setIfAbsent(lockKey, instanceId, lockTtl));

            if (acquired) {
                log.debug("[ClusterLock] Lock acquired: key={}, instanceId={}", lockKey, instanceId);
            } else {
                log.debug("[ClusterLock] Lock not acquired (already held): key={}", lockKey);
            }
            return acquired;
        } catch (Exception e) {
            // Redis 장애 시 이번 주기는 건너뜀 (다음 주기에 재시도)
            log.error("[ClusterLock] Failed to acquire lock: key={}", lockKey, e);
            return false;
        }
    }

    @Override
    public void release(String jobName) {
        String lockKey = buildLockKey(jobName);

        try {
            Long released = redisTemplate.execute(
                    new DefaultRedisScript<>(UNLOCK_SCRIPT, Long.class),
                    List.of(lockKey),
                    instanceId);

            if (released != null && released > 0) {
                log.debug("[ClusterLock] Lock released: key={}", lockKey);
            } else {
                log.debug("[ClusterLock] Lock not released (not owner or expired): key={}", lockKey);
            }
        } catch (Exception e) {
            // TTL로 자동 해제되므로 예외를 전파하지 않음
            log.error("[ClusterLock] Failed to release lock: key={}", lockKey, e);
        }
    }

    @Override
    public String getStrategyName() {
        return "cluster";
    }

    private String buildLockKey(String jobName) {
        return String.format("capacity:scheduler:lock:%s", jobName);
    }
}
