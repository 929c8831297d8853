package personal.ai.capacity.booking.application.port.in;

import personal.ai.capacity.booking.domain.model.Booking;

/**
 * Create Booking UseCase (Input Port)
 * 예약 생성 (홀드가 있으면 홀드를 소비)
 */
public interface CreateBookingUseCase {

    Booking createBooking(CreateBookingCommand command);
}
