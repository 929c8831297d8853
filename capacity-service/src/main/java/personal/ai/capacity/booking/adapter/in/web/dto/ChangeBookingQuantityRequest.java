package personal.ai.capacity.booking.adapter.in.web.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * 예약 인원 변경 요청 DTO
 */
public record ChangeBookingQuantityRequest(
        @NotNull(message = "인원은 필수입니다.")
        @Min(value = 1, message = "인원은 1 이상이어야 합니다.")
        Integer quantity
) {}
