package personal.ai.capacity.booking.application.port.in;

import personal.ai.capacity.booking.domain.model.BookingStatus;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.util.UUID;

/**
 * Create Booking Command
 * 예약 생성 커맨드
 *
 * @param status   null이면 PENDING
 * @param lockId   체크아웃 중 획득한 홀드 (선택, 지정 시 holderId 필수)
 * @param holderId 홀드 보유자 / 체크아웃 세션
 */
public record CreateBookingCommand(
        Long slotId,
        int quantity,
        BookingStatus status,
        UUID lockId,
        String holderId
) {
    public CreateBookingCommand {
        if (slotId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot ID cannot be null");
        }
        if (quantity < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Quantity must be positive");
        }
        if (lockId != null && (holderId == null || holderId.isBlank())) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Holder ID is required when a lock is supplied");
        }
    }

    public BookingStatus resolvedStatus() {
        return status == null ? BookingStatus.PENDING : status;
    }
}
