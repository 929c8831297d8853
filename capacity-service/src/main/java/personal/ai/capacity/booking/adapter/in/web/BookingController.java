package personal.ai.capacity.booking.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.ai.capacity.booking.adapter.in.web.dto.*;
import personal.ai.capacity.booking.application.port.in.*;
import personal.ai.capacity.booking.domain.model.Booking;
import personal.ai.common.dto.ApiResponse;

/**
 * Booking API Controller
 * 예약 생성 및 변경 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final CreateBookingUseCase createBookingUseCase;
    private final ChangeBookingStatusUseCase changeBookingStatusUseCase;
    private final ChangeBookingQuantityUseCase changeBookingQuantityUseCase;
    private final RescheduleBookingUseCase rescheduleBookingUseCase;
    private final GetBookingUseCase getBookingUseCase;

    /**
     * 예약 생성
     * POST /api/v1/bookings
     */
    @PostMapping
    public ResponseEntity<ApiResponse<BookingResponse>> createBooking(
            @Valid @RequestBody CreateBookingRequest request,
            @RequestHeader(value = "X-Holder-Id", required = false) String holderId
    ) {
        log.info("Create booking: slotId={}, quantity={}, lockId={}, holderId={}",
                request.slotId(), request.quantity(), request.lockId(), holderId);

        Booking booking = createBookingUseCase.createBooking(request.toCommand(holderId));

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Booking created", BookingResponse.from(booking)));
    }

    /**
     * 예약 조회
     * GET /api/v1/bookings/{bookingId}
     */
    @GetMapping("/{bookingId}")
    public ResponseEntity<ApiResponse<BookingResponse>> getBooking(@PathVariable Long bookingId) {
        Booking booking = getBookingUseCase.getBooking(bookingId);
        return ResponseEntity.ok(ApiResponse.success("Booking retrieved", BookingResponse.from(booking)));
    }

    /**
     * 예약 상태 변경
     * PATCH /api/v1/bookings/{bookingId}/status
     */
    @PatchMapping("/{bookingId}/status")
    public ResponseEntity<ApiResponse<BookingResponse>> changeStatus(
            @PathVariable Long bookingId,
            @Valid @RequestBody ChangeBookingStatusRequest request
    ) {
        log.info("Change booking status: bookingId={}, status={}", bookingId, request.status());

        Booking booking = changeBookingStatusUseCase.changeStatus(bookingId, request.status());

        return ResponseEntity.ok(ApiResponse.success("Booking status changed", BookingResponse.from(booking)));
    }

    /**
     * 예약 인원 변경
     * PATCH /api/v1/bookings/{bookingId}/quantity
     */
    @PatchMapping("/{bookingId}/quantity")
    public ResponseEntity<ApiResponse<BookingResponse>> changeQuantity(
            @PathVariable Long bookingId,
            @Valid @RequestBody ChangeBookingQuantityRequest request
    ) {
        log.info("Change booking quantity: bookingId={}, quantity={}", bookingId, request.quantity());

        Booking booking = changeBookingQuantityUseCase.changeQuantity(bookingId, request.quantity());

        return ResponseEntity.ok(ApiResponse.success("Booking quantity changed", BookingResponse.from(booking)));
    }

    /**
     * 예약 일정 변경
     * PATCH /api/v1/bookings/{bookingId}/slot
     */
    @PatchMapping("/{bookingId}/slot")
    public ResponseEntity<ApiResponse<BookingResponse>> reschedule(
            @PathVariable Long bookingId,
            @Valid @RequestBody RescheduleBookingRequest request
    ) {
        log.info("Reschedule booking: bookingId={}, newSlotId={}", bookingId, request.slotId());

        Booking booking = rescheduleBookingUseCase.reschedule(bookingId, request.slotId());

        return ResponseEntity.ok(ApiResponse.success("Booking rescheduled", BookingResponse.from(booking)));
    }
}
