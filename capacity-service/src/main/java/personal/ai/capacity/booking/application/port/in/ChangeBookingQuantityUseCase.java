package personal.ai.capacity.booking.application.port.in;

import personal.ai.capacity.booking.domain.model.Booking;

/**
 * Change Booking Quantity UseCase (Input Port)
 * 예약 인원 변경
 */
public interface ChangeBookingQuantityUseCase {

    Booking changeQuantity(Long bookingId, int newQuantity);
}
