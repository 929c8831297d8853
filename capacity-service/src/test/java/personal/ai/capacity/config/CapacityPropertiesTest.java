package personal.ai.capacity.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CapacityProperties 바인딩 테스트")
class CapacityPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesConfig.class);

    @Configuration
    @EnableConfigurationProperties(CapacityProperties.class)
    static class PropertiesConfig {
    }

    @Test
    @DisplayName("설정이 없으면 기본값으로 바인딩된다")
    void defaults() {
        contextRunner.run(context -> {
            CapacityProperties properties = context.getBean(CapacityProperties.class);
            assertThat(properties.lock().defaultTtlSeconds()).isEqualTo(120);
            assertThat(properties.lock().maxTtlSeconds()).isEqualTo(900);
            assertThat(properties.reconciliation().batchSize()).isEqualTo(500);
            assertThat(properties.maintenance().reconcileEnabled()).isTrue();
        });
    }

    @Test
    @DisplayName("보정 배치 크기가 0이면 기동에 실패한다")
    void zeroBatchSize_FailsStartup() {
        contextRunner.withPropertyValues("capacity.reconciliation.batch-size=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("음수 TTL 이나 전개 기간도 기동에 실패한다")
    void negativeValues_FailStartup() {
        contextRunner.withPropertyValues("capacity.lock.default-ttl-seconds=-1")
                .run(context -> assertThat(context).hasFailed());
        contextRunner.withPropertyValues("capacity.schedule.max-range-days=0")
                .run(context -> assertThat(context).hasFailed());
    }
}
