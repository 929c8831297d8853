package personal.ai.capacity.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import personal.ai.capacity.booking.domain.model.BookingStatus;

/**
 * 예약 상태 변경 요청 DTO
 */
public record ChangeBookingStatusRequest(
        @NotNull(message = "상태는 필수입니다.")
        BookingStatus status
) {}
