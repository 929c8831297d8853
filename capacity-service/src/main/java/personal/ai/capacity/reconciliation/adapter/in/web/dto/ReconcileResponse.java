package personal.ai.capacity.reconciliation.adapter.in.web.dto;

import personal.ai.capacity.reconciliation.domain.model.CapacityCorrection;
import personal.ai.capacity.reconciliation.domain.model.ReconciliationResult;

import java.util.List;

/**
 * 용량 보정 결과 DTO
 */
public record ReconcileResponse(
        int inspected,
        int corrected,
        List<CapacityCorrection> corrections,
        List<Long> failedSlotIds
) {
    public static ReconcileResponse from(ReconciliationResult result) {
        return new ReconcileResponse(
                result.inspected(),
                result.corrections().size(),
                result.corrections(),
                result.failedSlotIds()
        );
    }
}
