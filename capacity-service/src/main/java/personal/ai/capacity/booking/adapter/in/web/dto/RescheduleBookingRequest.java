package personal.ai.capacity.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;

/**
 * 예약 일정 변경 요청 DTO
 */
public record RescheduleBookingRequest(
        @NotNull(message = "변경할 슬롯 ID는 필수입니다.")
        Long slotId
) {}
