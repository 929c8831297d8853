package personal.ai.capacity.acceptance.support;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.context.annotation.Bean;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Testcontainers 설정 클래스
 * 실제 MySQL(용량 원장), Redis(스케줄러 분산 락) 컨테이너로 인수 테스트 수행
 */
@TestConfiguration(proxyBeanMethods = false)
public class TestContainersConfiguration {

    /**
     * MySQL 컨테이너
     * @ServiceConnection으로 DataSource 자동 설정
     */
    @Bean
    @ServiceConnection
    MySQLContainer<?> mysqlContainer() {
        return new MySQLContainer<>(DockerImageName.parse("mysql:8.0.36"))
                .withDatabaseName("capacity_db")
                .withUsername("test_user")
                .withPassword("test_password")
                .withReuse(true);
    }

    /**
     * Redis 컨테이너
     * cluster 전략 스케줄러 락이 사용
     */
    @Bean
    @ServiceConnection(name = "redis")
    GenericContainer<?> redisContainer() {
        return new GenericContainer<>(DockerImageName.parse("redis:7.2-alpine"))
                .withExposedPorts(6379)
                .withReuse(true);
    }
}
