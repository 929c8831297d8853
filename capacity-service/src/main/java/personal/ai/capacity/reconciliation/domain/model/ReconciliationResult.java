package personal.ai.capacity.reconciliation.domain.model;

import java.util.List;

/**
 * Reconciliation Result
 * 보정 배치 결과 (검사 슬롯 수, 보정 내역, 실패 슬롯)
 */
public record ReconciliationResult(
        int inspected,
        List<CapacityCorrection> corrections,
        List<Long> failedSlotIds
) {
    public ReconciliationResult {
        corrections = List.copyOf(corrections);
        failedSlotIds = List.copyOf(failedSlotIds);
    }
}
