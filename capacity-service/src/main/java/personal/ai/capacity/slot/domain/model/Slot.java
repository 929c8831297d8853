package personal.ai.capacity.slot.domain.model;

import personal.ai.capacity.slot.domain.exception.CapacityExceededException;
import personal.ai.capacity.slot.domain.exception.SlotNotOpenException;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Slot Domain Model
 * 예약 가능한 시간대와 용량 원장 (불변)
 * <p>
 * 정상 상태: 0 <= committedCount <= totalCapacity, availableCapacity == totalCapacity - committedCount.
 * 저장된 값이 어긋난 슬롯도 보정을 위해 로딩할 수 있어야 하므로 생성자에서는 카운터 일관성을 강제하지 않는다.
 */
public record Slot(
        Long id,
        Long tenantId,
        Long serviceId,
        Long shiftId,
        Long staffId,          // 담당자 없는 타일링이면 null
        LocalDate slotDate,
        LocalTime startTime,
        LocalTime endTime,
        Instant startsAt,
        Instant endsAt,
        int totalCapacity,
        int availableCapacity,
        int committedCount,
        boolean open
) {
    public Slot {
        if (tenantId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant ID cannot be null");
        }
        if (serviceId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Service ID cannot be null");
        }
        if (shiftId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Shift ID cannot be null");
        }
        if (slotDate == null || startTime == null || endTime == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot date and local times cannot be null");
        }
        if (startsAt == null || endsAt == null || !endsAt.isAfter(startsAt)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Slot must end after it starts: startsAt=%s, endsAt=%s", startsAt, endsAt));
        }
        if (totalCapacity < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Total capacity cannot be negative");
        }
    }

    /**
     * 스케줄 전개 시 새 슬롯 생성 (committed 0, 전량 가용, 오픈 상태)
     */
    public static Slot create(Long tenantId, Long serviceId, Long shiftId, Long staffId,
                              LocalDate slotDate, LocalTime startTime, LocalTime endTime,
                              Instant startsAt, Instant endsAt, int capacity) {
        if (capacity < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot capacity must be positive");
        }
        return new Slot(null, tenantId, serviceId, shiftId, staffId, slotDate, startTime, endTime,
                startsAt, endsAt, capacity, capacity, 0, true);
    }

    /**
     * 카운터 일관성 여부
     */
    public boolean isConsistent() {
        return committedCount >= 0
                && committedCount <= totalCapacity
                && availableCapacity == totalCapacity - committedCount;
    }

    /**
     * 신규 홀드/예약을 받을 수 있는 상태인지 검증
     */
    public void ensureOpen() {
        if (!open) {
            throw new SlotNotOpenException(id);
        }
    }

    /**
     * 유효 가용 용량 (원장 가용량 - 미만료 홀드 수량, 0 미만은 0)
     */
    public int effectiveAvailable(int heldQuantity) {
        return Math.max(0, availableCapacity - heldQuantity);
    }

    /**
     * 요청 수량을 유효 가용 용량으로 수용할 수 있는지 검증
     * 실패 시 현재 유효 가용 수량을 담아 예외 발생
     */
    public void ensureCanReserve(int quantity, int heldQuantity) {
        int effective = effectiveAvailable(heldQuantity);
        if (quantity > effective) {
            throw new CapacityExceededException(id, quantity, effective);
        }
    }

    /**
     * 용량 차감 (committed += q, available -= q)
     * [0, total] 범위를 벗어나면 잘라내고 실제 반영량을 돌려준다.
     */
    public CapacityChange charge(int quantity) {
        return applyCommittedDelta(quantity);
    }

    /**
     * 용량 반환 (committed -= q, available += q)
     */
    public CapacityChange release(int quantity) {
        return applyCommittedDelta(-quantity);
    }

    private CapacityChange applyCommittedDelta(int delta) {
        int newCommitted = clamp(committedCount + delta);
        Slot after = withCounters(newCommitted);
        return new CapacityChange(this, after, delta, newCommitted - committedCount);
    }

    /**
     * 실제 소비 예약 수량 합계로 카운터 재계산 (보정용)
     * 합계가 총 용량을 넘으면 committed = total, available = 0 으로 고정
     */
    public Slot recount(long consumingQuantity) {
        int committed = (int) Math.max(0, Math.min(consumingQuantity, totalCapacity));
        return withCounters(committed);
    }

    /**
     * 오픈/마감 전환 (카운터 유지)
     */
    public Slot withOpen(boolean open) {
        return new Slot(id, tenantId, serviceId, shiftId, staffId, slotDate, startTime, endTime,
                startsAt, endsAt, totalCapacity, availableCapacity, committedCount, open);
    }

    private Slot withCounters(int committed) {
        return new Slot(id, tenantId, serviceId, shiftId, staffId, slotDate, startTime, endTime,
                startsAt, endsAt, totalCapacity, totalCapacity - committed, committed, open);
    }

    private int clamp(int committed) {
        return Math.max(0, Math.min(committed, totalCapacity));
    }
}
