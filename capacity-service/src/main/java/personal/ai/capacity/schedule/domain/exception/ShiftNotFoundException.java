package personal.ai.capacity.schedule.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * Shift Not Found Exception
 * 근무 일정을 찾을 수 없을 때 발생하는 예외
 */
public class ShiftNotFoundException extends BusinessException {
    public ShiftNotFoundException(Long shiftId) {
        super(ErrorCode.SHIFT_NOT_FOUND, String.format("Shift not found: shiftId=%d", shiftId));
    }
}
