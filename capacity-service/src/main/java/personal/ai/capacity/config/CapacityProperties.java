package personal.ai.capacity.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Capacity 설정 Properties
 * application.yml의 capacity.* 설정을 바인딩 (0 이하 값은 기동 시 거절)
 */
@Validated
@ConfigurationProperties(prefix = "capacity")
public record CapacityProperties(
        @Valid @DefaultValue Lock lock,
        @Valid @DefaultValue Schedule schedule,
        @Valid @DefaultValue Reconciliation reconciliation,
        @Valid @DefaultValue Maintenance maintenance
) {
    public record Lock(
            @Positive @DefaultValue("120") int defaultTtlSeconds,
            @Positive @DefaultValue("900") int maxTtlSeconds,
            @Positive @DefaultValue("3000") long rowLockTimeoutMs  // jakarta.persistence.lock.timeout 으로 전달
    ) {
        public Duration defaultTtl() {
            return Duration.ofSeconds(defaultTtlSeconds);
        }
    }

    public record Schedule(
            @Positive @DefaultValue("366") int maxRangeDays
    ) {}

    public record Reconciliation(
            @Positive @DefaultValue("500") int batchSize
    ) {}

    public record Maintenance(
            @Positive @DefaultValue("60000") long sweepIntervalMs,
            @Positive @DefaultValue("600000") long reconcileIntervalMs,
            @DefaultValue("true") boolean reconcileEnabled
    ) {}
}
