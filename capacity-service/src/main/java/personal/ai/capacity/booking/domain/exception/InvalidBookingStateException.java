package personal.ai.capacity.booking.domain.exception;

import personal.ai.capacity.booking.domain.model.BookingStatus;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * Invalid Booking State Exception
 * 현재 예약 상태에서 허용되지 않는 변경을 시도할 때 발생하는 예외
 */
public class InvalidBookingStateException extends BusinessException {
    public InvalidBookingStateException(Long bookingId, BookingStatus status, String action) {
        super(ErrorCode.INVALID_BOOKING_STATE,
                String.format("Cannot %s booking in %s status: bookingId=%d", action, status, bookingId));
    }
}
