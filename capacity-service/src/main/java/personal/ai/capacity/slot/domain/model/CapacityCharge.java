package personal.ai.capacity.slot.domain.model;

/**
 * 예약 한 건이 슬롯 용량에 부과하는 수량
 * 용량을 소비하지 않는 상태(취소 등)의 예약은 quantity 0
 */
public record CapacityCharge(
        Long slotId,
        int quantity
) {
    private static final CapacityCharge NONE = new CapacityCharge(null, 0);

    public static CapacityCharge none() {
        return NONE;
    }

    public boolean isEmpty() {
        return slotId == null || quantity == 0;
    }
}
