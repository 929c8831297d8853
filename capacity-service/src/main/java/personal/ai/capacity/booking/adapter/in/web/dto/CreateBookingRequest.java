package personal.ai.capacity.booking.adapter.in.web.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import personal.ai.capacity.booking.application.port.in.CreateBookingCommand;
import personal.ai.capacity.booking.domain.model.BookingStatus;

import java.util.UUID;

/**
 * 예약 생성 요청 DTO
 */
public record CreateBookingRequest(
        @NotNull(message = "슬롯 ID는 필수입니다.")
        Long slotId,

        @NotNull(message = "인원은 필수입니다.")
        @Min(value = 1, message = "인원은 1 이상이어야 합니다.")
        Integer quantity,

        BookingStatus status,

        UUID lockId
) {
    public CreateBookingCommand toCommand(String holderId) {
        return new CreateBookingCommand(slotId, quantity, status, lockId, holderId);
    }
}
