package personal.ai.capacity.lock.adapter.in.web.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import personal.ai.capacity.lock.application.port.in.AcquireLockCommand;

/**
 * 홀드 획득 요청 DTO
 */
public record AcquireLockRequest(
        @NotNull(message = "수량은 필수입니다.")
        @Min(value = 1, message = "수량은 1 이상이어야 합니다.")
        Integer quantity,

        @Min(value = 1, message = "TTL은 1초 이상이어야 합니다.")
        Integer ttlSeconds
) {
    public AcquireLockCommand toCommand(Long slotId, String holderId) {
        return new AcquireLockCommand(slotId, holderId, quantity, ttlSeconds);
    }
}
