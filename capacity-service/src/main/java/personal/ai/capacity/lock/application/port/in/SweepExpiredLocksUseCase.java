package personal.ai.capacity.lock.application.port.in;

/**
 * Sweep Expired Locks UseCase (Input Port)
 * 만료된 홀드 일괄 삭제
 */
public interface SweepExpiredLocksUseCase {

    /**
     * @return 삭제된 홀드 수
     */
    int sweepExpiredLocks();
}
