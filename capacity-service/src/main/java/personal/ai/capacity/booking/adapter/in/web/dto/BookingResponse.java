package personal.ai.capacity.booking.adapter.in.web.dto;

import personal.ai.capacity.booking.domain.model.Booking;
import personal.ai.capacity.booking.domain.model.BookingStatus;

import java.time.Instant;

/**
 * 예약 조회/생성 응답 DTO
 */
public record BookingResponse(
        Long bookingId,
        Long slotId,
        int quantity,
        BookingStatus status,
        String holderId,
        Instant createdAt,
        Instant updatedAt
) {
    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.id(),
                booking.slotId(),
                booking.quantity(),
                booking.status(),
                booking.holderId(),
                booking.createdAt(),
                booking.updatedAt()
        );
    }
}
