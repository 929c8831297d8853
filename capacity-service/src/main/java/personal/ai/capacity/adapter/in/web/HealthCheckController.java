package personal.ai.capacity.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.ai.common.dto.ApiResponse;
import personal.ai.common.dto.HealthCheckResponse;
import personal.ai.common.health.HealthCheckService;

import javax.sql.DataSource;

/**
 * Health Check API Controller
 * 데이터베이스와 Redis 연결 상태를 확인하는 엔드포인트
 * <p>
 * 용량 원장은 데이터베이스에만 있으므로 Redis 장애는 스케줄러 분산 락에만 영향을 준다.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class HealthCheckController {

    private final DataSource dataSource;
    private final HealthCheckService healthCheckService;

    /**
     * Health Check 엔드포인트
     *
     * @return ApiResponse with health check data
     */
    @GetMapping("/health")
    public ResponseEntity<ApiResponse<HealthCheckResponse>> healthCheck() {
        log.debug("Health check requested");

        String databaseStatus = healthCheckService.checkDatabase(dataSource);
        String redisStatus = healthCheckService.checkRedis();

        HealthCheckResponse data = new HealthCheckResponse(databaseStatus, redisStatus);

        boolean allHealthy = "UP".equals(databaseStatus) && "UP".equals(redisStatus);

        if (allHealthy) {
            return ResponseEntity.ok(
                    ApiResponse.success("Application is healthy", data)
            );
        } else {
            return ResponseEntity.ok(
                    ApiResponse.error("Some components are unhealthy", data)
            );
        }
    }
}
