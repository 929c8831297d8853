package personal.ai.capacity.maintenance.application.port.out;

/**
 * 스케줄러 락 Port
 * 여러 인스턴스 중 한 곳에서만 주기 작업을 실행하도록 제어
 *
 * 구현체:
 * - NoLockAdapter: 락 없이 항상 실행 (로컬 개발, 단일 인스턴스)
 * - ClusterLockAdapter: Redis 분산 락 (운영, 다중 인스턴스)
 */
public interface SchedulerLockPort {

    /**
     * 작업 실행 전 락 획득 시도
     *
     * @param jobName 작업 이름 (예: "lock-sweep", "reconcile")
     * @return true: 실행 가능, false: 스킵 (다른 인스턴스가 처리 중)
     */
    boolean tryAcquire(String jobName);

    /**
     * 작업 실행 후 락 해제
     */
    void release(String jobName);

    /**
     * 전략 이름 반환 (로깅/모니터링용)
     */
    String getStrategyName();
}
