package personal.ai.capacity.maintenance.adapter.in.scheduler;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.ai.capacity.maintenance.application.port.out.SchedulerLockPort;
import personal.ai.capacity.reconciliation.application.port.in.ReconcileCapacitiesUseCase;
import personal.ai.capacity.reconciliation.domain.model.ReconciliationResult;

/**
 * Reconciliation Scheduler
 * 전체 슬롯 용량을 주기적으로 보정
 * capacity.maintenance.reconcile-enabled=false 이면 빈으로 등록되지 않음
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "capacity.maintenance.reconcile-enabled", havingValue = "true", matchIfMissing = true)
public class ReconciliationScheduler {

    static final String JOB_NAME = "reconcile";

    private final ReconcileCapacitiesUseCase reconcileCapacitiesUseCase;
    private final SchedulerLockPort schedulerLockPort;
    private final MeterRegistry meterRegistry;

    /**
     * 주기: capacity.maintenance.reconcile-interval-ms (기본 10분)
     */
    @Scheduled(fixedDelayString = "${capacity.maintenance.reconcile-interval-ms:600000}",
            initialDelayString = "${capacity.maintenance.reconcile-interval-ms:600000}")
    public void reconcileCapacities() {
        if (!schedulerLockPort.tryAcquire(JOB_NAME)) {
            Counter.builder("scheduler.lock.acquire.failures")
                    .tag("scheduler_type", JOB_NAME)
                    .description("Number of lock acquisition failures (another instance processing)")
                    .register(meterRegistry)
                    .increment();
            log.debug("Skipping reconciliation (another instance is processing)");
            return;
        }

        try {
            log.debug("Starting reconciliation with strategy: {}", schedulerLockPort.getStrategyName());
            Timer.Sample sample = Timer.start(meterRegistry);

            ReconciliationResult result = reconcileCapacitiesUseCase.reconcile(null);

            sample.stop(Timer.builder("capacity.reconciliation.duration")
                    .description("Time taken to reconcile all slot capacities")
                    .register(meterRegistry));

            Counter.builder("capacity.reconciliation.corrected")
                    .description("Number of slots whose capacity counters were corrected")
                    .register(meterRegistry)
                    .increment(result.corrections().size());

            if (!result.corrections().isEmpty() || !result.failedSlotIds().isEmpty()) {
                log.warn("Capacity drift detected: inspected={}, corrected={}, failed={}",
                        result.inspected(), result.corrections().size(), result.failedSlotIds().size());
            }
        } catch (Exception e) {
            log.error("Reconciliation failed", e);
        } finally {
            schedulerLockPort.release(JOB_NAME);
        }
    }
}
