package personal.ai.capacity.booking.adapter.out.capacity;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.ai.capacity.booking.application.port.out.BookingCapacityPort;
import personal.ai.capacity.slot.domain.model.CapacityCharge;
import personal.ai.capacity.slot.domain.service.CapacityMutationTrigger;

/**
 * Booking Capacity Adapter
 * BookingCapacityPort 구현체, 슬롯 도메인의 CapacityMutationTrigger에 위임
 */
@Component
@RequiredArgsConstructor
public class BookingCapacityAdapter implements BookingCapacityPort {

    private final CapacityMutationTrigger capacityMutationTrigger;

    @Override
    public void applyCapacityChange(Long bookingId, CapacityCharge previous, CapacityCharge current) {
        capacityMutationTrigger.onBookingWritten(bookingId, previous, current);
    }
}
