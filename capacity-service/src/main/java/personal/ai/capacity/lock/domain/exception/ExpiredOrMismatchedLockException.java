package personal.ai.capacity.lock.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.util.UUID;

/**
 * Expired Or Mismatched Lock Exception
 * 홀드가 만료되었거나, 보유자/슬롯/수량이 맞지 않을 때 발생하는 예외
 * 클라이언트에는 "홀드 만료, 다시 시도" 로만 안내
 */
public class ExpiredOrMismatchedLockException extends BusinessException {
    public ExpiredOrMismatchedLockException(UUID lockId) {
        super(ErrorCode.LOCK_EXPIRED_OR_MISMATCHED,
                String.format("Reservation lock expired or mismatched: lockId=%s", lockId));
    }
}
