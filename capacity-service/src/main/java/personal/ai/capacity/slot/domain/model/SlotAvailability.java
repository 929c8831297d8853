package personal.ai.capacity.slot.domain.model;

/**
 * 슬롯 가용량 조회 결과
 * 원장 값과 미만료 홀드를 반영한 유효 가용량을 함께 제공
 */
public record SlotAvailability(
        Slot slot,
        int heldQuantity
) {
    public int effectiveAvailable() {
        return slot.effectiveAvailable(heldQuantity);
    }
}
