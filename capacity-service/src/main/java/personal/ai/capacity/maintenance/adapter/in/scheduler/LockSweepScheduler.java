package personal.ai.capacity.maintenance.adapter.in.scheduler;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.ai.capacity.lock.application.port.in.SweepExpiredLocksUseCase;
import personal.ai.capacity.maintenance.application.port.out.SchedulerLockPort;

/**
 * Lock Sweep Scheduler
 * 만료된 예약 홀드를 주기적으로 삭제
 * <p>
 * 만료 홀드는 정리 전에도 모든 조회에서 무시되므로 이 작업은 저장 공간 정리 용도이다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LockSweepScheduler {

    static final String JOB_NAME = "lock-sweep";

    private final SweepExpiredLocksUseCase sweepExpiredLocksUseCase;
    private final SchedulerLockPort schedulerLockPort;
    private final MeterRegistry meterRegistry;

    /**
     * 주기: capacity.maintenance.sweep-interval-ms (기본 60초)
     */
    @Scheduled(fixedDelayString = "${capacity.maintenance.sweep-interval-ms:60000}")
    public void sweepExpiredLocks() {
        if (!schedulerLockPort.tryAcquire(JOB_NAME)) {
            Counter.builder("scheduler.lock.acquire.failures")
                    .tag("scheduler_type", JOB_NAME)
                    .description("Number of lock acquisition failures (another instance processing)")
                    .register(meterRegistry)
                    .increment();
            log.debug("Skipping lock sweep (another instance is processing)");
            return;
        }

        try {
            int removed = sweepExpiredLocksUseCase.sweepExpiredLocks();

            Counter.builder("capacity.locks.swept")
                    .description("Number of expired reservation locks deleted")
                    .register(meterRegistry)
                    .increment(removed);
        } catch (Exception e) {
            log.error("Lock sweep failed", e);
        } finally {
            schedulerLockPort.release(JOB_NAME);
        }
    }
}
