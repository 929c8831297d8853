package personal.ai.capacity;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Capacity Service Application
 * 스케줄 전개, 슬롯 용량 원장, 예약 홀드, 용량 정합성 보정을 담당하는 서비스
 */
@EnableScheduling  // 만료 홀드 정리 / 용량 보정 스케줄러 활성화
@ConfigurationPropertiesScan
@SpringBootApplication(
    scanBasePackages = {
        "personal.ai.capacity",
        "personal.ai.common"  // common 모듈의 GlobalExceptionHandler 등을 스캔
    }
)
public class CapacityServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(CapacityServiceApplication.class, args);
    }
}
