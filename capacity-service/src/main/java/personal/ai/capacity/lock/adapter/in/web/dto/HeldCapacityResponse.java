package personal.ai.capacity.lock.adapter.in.web.dto;

import java.util.List;
import java.util.Map;

/**
 * 슬롯별 홀드 수량 응답 DTO
 */
public record HeldCapacityResponse(
        Long slotId,
        int heldQuantity
) {
    public static List<HeldCapacityResponse> from(Map<Long, Integer> heldBySlot) {
        return heldBySlot.entrySet().stream()
                .map(entry -> new HeldCapacityResponse(entry.getKey(), entry.getValue()))
                .toList();
    }
}
