package personal.ai.capacity.slot.domain.model;

/**
 * 용량 원장 변경 결과
 *
 * @param before    변경 전 슬롯
 * @param after     변경 후 슬롯
 * @param requested 요청된 committed 증감량 (차감 +, 반환 -)
 * @param applied   실제 반영된 증감량 (범위 초과 시 잘린 값)
 */
public record CapacityChange(
        Slot before,
        Slot after,
        int requested,
        int applied
) {
    public boolean clamped() {
        return requested != applied;
    }
}
