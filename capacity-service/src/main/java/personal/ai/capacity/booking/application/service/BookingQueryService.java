package personal.ai.capacity.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.ai.capacity.booking.application.port.in.GetBookingUseCase;
import personal.ai.capacity.booking.application.port.out.BookingRepository;
import personal.ai.capacity.booking.domain.exception.BookingNotFoundException;
import personal.ai.capacity.booking.domain.model.Booking;

/**
 * Booking Query Service (SRP)
 * 단일 책임: 예약 조회
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingQueryService implements GetBookingUseCase {

    private final BookingRepository bookingRepository;

    @Override
    @Transactional(readOnly = true)
    public Booking getBooking(Long bookingId) {
        return bookingRepository.findById(bookingId)
                .orElseThrow(() -> {
                    log.warn("Booking not found: bookingId={}", bookingId);
                    return new BookingNotFoundException(bookingId);
                });
    }
}
