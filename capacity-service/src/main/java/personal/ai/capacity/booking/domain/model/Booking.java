package personal.ai.capacity.booking.domain.model;

import personal.ai.capacity.booking.domain.exception.InvalidBookingStateException;
import personal.ai.capacity.slot.domain.model.CapacityCharge;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.Instant;

/**
 * Booking Domain Model
 * 예약 도메인 모델 (불변)
 * <p>
 * 용량 엔진이 다루는 속성만 가진다. 슬롯 용량 반영은 저장 시점에 CapacityMutationTrigger가 수행한다.
 */
public record Booking(
        Long id,
        Long slotId,
        int quantity,
        BookingStatus status,
        String holderId,      // 체크아웃 세션 식별자 (선택)
        Instant createdAt,
        Instant updatedAt
) {
    public Booking {
        if (slotId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot ID cannot be null");
        }
        if (quantity < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking quantity must be positive");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking status cannot be null");
        }
        if (createdAt == null || updatedAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking timestamps cannot be null");
        }
    }

    /**
     * 예약 생성 (정적 팩토리 메서드)
     */
    public static Booking create(Long slotId, int quantity, BookingStatus status, String holderId, Instant now) {
        return new Booking(null, slotId, quantity, status, holderId, now, now);
    }

    public boolean consumesCapacity() {
        return status.consumesCapacity();
    }

    /**
     * 슬롯 용량에 부과하는 수량 (비소비 상태면 없음)
     */
    public CapacityCharge capacityCharge() {
        return consumesCapacity() ? new CapacityCharge(slotId, quantity) : CapacityCharge.none();
    }

    public Booking changeStatus(BookingStatus newStatus, Instant now) {
        return new Booking(id, slotId, quantity, newStatus, holderId, createdAt, now);
    }

    /**
     * 인원 변경 (이용 완료된 예약은 불가)
     */
    public Booking changeQuantity(int newQuantity, Instant now) {
        if (status == BookingStatus.COMPLETED) {
            throw new InvalidBookingStateException(id, status, "change quantity");
        }
        return new Booking(id, slotId, newQuantity, status, holderId, createdAt, now);
    }

    /**
     * 다른 슬롯으로 일정 변경 (취소/완료된 예약은 불가)
     */
    public Booking moveTo(Long newSlotId, Instant now) {
        ensureReschedulable();
        return new Booking(id, newSlotId, quantity, status, holderId, createdAt, now);
    }

    public void ensureReschedulable() {
        if (status == BookingStatus.CANCELLED || status == BookingStatus.COMPLETED) {
            throw new InvalidBookingStateException(id, status, "reschedule");
        }
    }
}
