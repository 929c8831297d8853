package personal.ai.capacity.booking.application.port.in;

import personal.ai.capacity.booking.domain.model.Booking;
import personal.ai.capacity.booking.domain.model.BookingStatus;

/**
 * Change Booking Status UseCase (Input Port)
 * 예약 상태 변경 (확정, 체크인, 완료, 취소 등)
 */
public interface ChangeBookingStatusUseCase {

    Booking changeStatus(Long bookingId, BookingStatus newStatus);
}
