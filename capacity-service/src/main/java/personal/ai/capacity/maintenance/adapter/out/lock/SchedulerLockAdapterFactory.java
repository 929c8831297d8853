package personal.ai.capacity.maintenance.adapter.out.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import personal.ai.capacity.maintenance.application.port.out.SchedulerLockPort;

import java.time.Duration;

/**
 * Scheduler Lock Adapter Factory
 * 설정에 따라 SchedulerLockPort 구현체를 생성
 *
 * 설정:
 * - scheduler.lock.strategy=none → NoLockAdapter (기본값)
 * - scheduler.lock.strategy=cluster → ClusterLockAdapter
 */
@Slf4j
@Configuration
public class SchedulerLockAdapterFactory {

    @Bean
    @ConditionalOnProperty(name = "scheduler.lock.strategy", havingValue = "none", matchIfMissing = true)
    public SchedulerLockPort noLockAdapter() {
        log.info("Creating NoLockAdapter - No distributed lock will be used");
        return new NoLockAdapter();
    }

    @Bean
    @ConditionalOnProperty(name = "scheduler.lock.strategy", havingValue = "cluster")
    public SchedulerLockPort clusterLockAdapter(
            StringRedisTemplate redisTemplate,
            SchedulerLockProperties properties) {

        log.info("Creating ClusterLockAdapter - TTL: {}s", properties.getTtlSeconds());
        return new ClusterLockAdapter(
                redisTemplate,
                Duration.ofSeconds(properties.getTtlSeconds()));
    }
}
