package personal.ai.capacity.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 시간 소스 설정
 * 홀드 만료 판정은 모두 이 Clock 기준 (테스트에서 고정/이동 가능)
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
