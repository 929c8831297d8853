package personal.ai.capacity.booking.application.port.out;

import personal.ai.capacity.slot.domain.model.CapacityCharge;

/**
 * Booking Capacity Port (Output Port)
 * 예약 쓰기 직후 슬롯 용량 원장 반영
 */
public interface BookingCapacityPort {

    void applyCapacityChange(Long bookingId, CapacityCharge previous, CapacityCharge current);
}
