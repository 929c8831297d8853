package personal.ai.capacity.lock.application.port.in;

import java.util.UUID;

/**
 * Release Lock UseCase (Input Port)
 * 보유자가 체크아웃을 포기할 때 홀드 해제
 */
public interface ReleaseLockUseCase {

    /**
     * @return 해제 시점에 아직 유효했던 홀드면 true, 이미 만료되어 정리만 된 경우 false
     */
    boolean releaseLock(UUID lockId, String holderId);
}
