package personal.ai.capacity.maintenance.adapter.out.lock;

import lombok.extern.slf4j.Slf4j;
import personal.ai.capacity.maintenance.application.port.out.SchedulerLockPort;

/**
 * NoLock Adapter
 * 락 없이 항상 실행을 허용하는 어댑터
 * <p>
 * 홀드 정리와 보정은 여러 인스턴스가 동시에 실행해도 결과가 같지만 DB 부하가 중복된다.
 * 다중 인스턴스 운영 환경에서는 cluster 전략 사용
 */
@Slf4j
public class NoLockAdapter implements SchedulerLockPort {

    @Override
    public boolean tryAcquire(String jobName) {
        log.debug("[NoLock] Always allow: job={}", jobName);
        return true;
    }

    @Override
    public void release(String jobName) {
        // 해제할 락 없음
    }

    @Override
    public String getStrategyName() {
        return "none";
    }
}
