package personal.ai.capacity.lock.application.port.in;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * Acquire Lock Command
 * 홀드 획득 커맨드
 *
 * @param ttlSeconds null이면 기본 TTL 사용
 */
public record AcquireLockCommand(
        Long slotId,
        String holderId,
        int quantity,
        Integer ttlSeconds
) {
    public AcquireLockCommand {
        if (slotId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot ID cannot be null");
        }
        if (holderId == null || holderId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Holder ID cannot be null or blank");
        }
        if (quantity < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Quantity must be positive");
        }
    }
}
