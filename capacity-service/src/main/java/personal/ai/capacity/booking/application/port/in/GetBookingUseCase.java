package personal.ai.capacity.booking.application.port.in;

import personal.ai.capacity.booking.domain.model.Booking;

/**
 * Get Booking UseCase (Input Port)
 */
public interface GetBookingUseCase {

    Booking getBooking(Long bookingId);
}
