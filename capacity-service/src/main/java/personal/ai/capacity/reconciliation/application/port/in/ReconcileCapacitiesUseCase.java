package personal.ai.capacity.reconciliation.application.port.in;

import personal.ai.capacity.reconciliation.domain.model.ReconciliationResult;

import java.util.List;

/**
 * Reconcile Capacities UseCase (Input Port)
 * 슬롯 카운터를 실제 소비 예약 합계와 다시 맞춤
 */
public interface ReconcileCapacitiesUseCase {

    /**
     * @param slotIds 대상 슬롯 (null 또는 비어 있으면 전체 슬롯)
     */
    ReconciliationResult reconcile(List<Long> slotIds);
}
