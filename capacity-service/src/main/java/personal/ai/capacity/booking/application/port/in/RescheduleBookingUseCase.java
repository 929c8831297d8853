package personal.ai.capacity.booking.application.port.in;

import personal.ai.capacity.booking.domain.model.Booking;

/**
 * Reschedule Booking UseCase (Input Port)
 * 같은 서비스의 다른 슬롯으로 예약 이동
 */
public interface RescheduleBookingUseCase {

    Booking reschedule(Long bookingId, Long newSlotId);
}
