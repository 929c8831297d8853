package personal.ai.capacity.booking.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * Booking Not Found Exception
 * 예약을 찾을 수 없을 때 발생하는 예외
 */
public class BookingNotFoundException extends BusinessException {
    public BookingNotFoundException(Long bookingId) {
        super(ErrorCode.BOOKING_NOT_FOUND, String.format("Booking not found: bookingId=%d", bookingId));
    }
}
