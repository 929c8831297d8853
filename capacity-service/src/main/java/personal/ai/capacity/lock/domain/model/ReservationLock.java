package personal.ai.capacity.lock.domain.model;

import personal.ai.capacity.lock.domain.exception.ExpiredOrMismatchedLockException;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Reservation Lock Domain Model
 * 결제 등 다단계 체크아웃 동안 슬롯 용량을 잠시 붙잡아 두는 홀드 (불변)
 * <p>
 * 슬롯의 available_capacity를 줄이지 않고 유효 가용량 계산에서만 빠진다.
 * expiresAt <= now 이면 만료로 간주하며, 정리 전이라도 모든 조회에서 무시된다.
 */
public record ReservationLock(
        UUID id,
        Long slotId,
        String holderId,
        int quantity,
        Instant createdAt,
        Instant expiresAt
) {
    private static final int MAX_HOLDER_ID_LENGTH = 128;

    public ReservationLock {
        if (id == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Lock ID cannot be null");
        }
        if (slotId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot ID cannot be null");
        }
        if (holderId == null || holderId.isBlank() || holderId.length() > MAX_HOLDER_ID_LENGTH) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Holder ID must be 1-128 characters");
        }
        if (quantity < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Lock quantity must be positive");
        }
        if (createdAt == null || expiresAt == null || !expiresAt.isAfter(createdAt)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Lock must expire after it is created");
        }
    }

    /**
     * 새 홀드 생성 (expiresAt = now + ttl)
     */
    public static ReservationLock create(Long slotId, String holderId, int quantity, Duration ttl, Instant now) {
        return new ReservationLock(UUID.randomUUID(), slotId, holderId, quantity, now, now.plus(ttl));
    }

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public boolean isHeldBy(String holderId) {
        return this.holderId.equals(holderId);
    }

    /**
     * 주어진 보유자 기준으로 아직 유효한 홀드인지
     */
    public boolean isValidFor(String holderId, Instant now) {
        return isHeldBy(holderId) && !isExpired(now);
    }

    /**
     * 예약 생성 시 이 홀드로 해당 슬롯/수량을 덮을 수 있는지 검증
     */
    public void ensureCovers(String holderId, Long slotId, int quantity, Instant now) {
        if (!isValidFor(holderId, now) || !this.slotId.equals(slotId) || this.quantity < quantity) {
            throw new ExpiredOrMismatchedLockException(id);
        }
    }

    /**
     * 보유자 본인인지 검증 (해제 시)
     */
    public void ensureHeldBy(String holderId) {
        if (!isHeldBy(holderId)) {
            throw new ExpiredOrMismatchedLockException(id);
        }
    }
}
