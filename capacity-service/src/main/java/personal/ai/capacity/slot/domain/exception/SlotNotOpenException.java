package personal.ai.capacity.slot.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * Slot Not Open Exception
 * 닫힌 슬롯에 홀드/예약을 시도할 때 발생하는 예외
 */
public class SlotNotOpenException extends BusinessException {
    public SlotNotOpenException(Long slotId) {
        super(ErrorCode.SLOT_NOT_OPEN, String.format("Slot is not open: slotId=%d", slotId));
    }
}
