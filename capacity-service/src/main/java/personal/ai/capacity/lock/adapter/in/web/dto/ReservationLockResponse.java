package personal.ai.capacity.lock.adapter.in.web.dto;

import personal.ai.capacity.lock.domain.model.ReservationLock;

import java.time.Instant;
import java.util.UUID;

/**
 * 홀드 획득 응답 DTO
 */
public record ReservationLockResponse(
        UUID lockId,
        Long slotId,
        String holderId,
        int quantity,
        Instant createdAt,
        Instant expiresAt
) {
    public static ReservationLockResponse from(ReservationLock lock) {
        return new ReservationLockResponse(
                lock.id(),
                lock.slotId(),
                lock.holderId(),
                lock.quantity(),
                lock.createdAt(),
                lock.expiresAt()
        );
    }
}
