package personal.ai.capacity.schedule.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * Slots Have Bookings Exception
 * 재전개 기간의 슬롯에 예약이 남아 있어 슬롯을 지울 수 없을 때 발생하는 예외
 */
public class SlotsHaveBookingsException extends BusinessException {
    public SlotsHaveBookingsException(Long shiftId, LocalDate startDate, LocalDate endDate) {
        super(ErrorCode.SLOTS_HAVE_BOOKINGS,
                String.format("Slots in range still have bookings: shiftId=%d, start=%s, end=%s",
                        shiftId, startDate, endDate));
    }
}
