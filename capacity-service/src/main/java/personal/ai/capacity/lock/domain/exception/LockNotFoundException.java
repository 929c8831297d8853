package personal.ai.capacity.lock.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.util.UUID;

/**
 * Lock Not Found Exception
 * 홀드를 찾을 수 없을 때 발생하는 예외 (이미 해제/정리된 경우 포함)
 */
public class LockNotFoundException extends BusinessException {
    public LockNotFoundException(UUID lockId) {
        super(ErrorCode.LOCK_NOT_FOUND, String.format("Reservation lock not found: lockId=%s", lockId));
    }
}
