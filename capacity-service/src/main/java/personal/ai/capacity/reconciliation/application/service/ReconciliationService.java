package personal.ai.capacity.reconciliation.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.ai.capacity.config.CapacityProperties;
import personal.ai.capacity.reconciliation.application.port.in.ReconcileCapacitiesUseCase;
import personal.ai.capacity.reconciliation.domain.model.CapacityCorrection;
import personal.ai.capacity.reconciliation.domain.model.ReconciliationResult;
import personal.ai.capacity.reconciliation.domain.service.SlotReconciler;
import personal.ai.capacity.slot.application.port.out.SlotRepository;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Reconciliation Service
 * 슬롯별 보정을 순서대로 실행 (트랜잭션은 슬롯 단위로 SlotReconciler가 연다)
 * 전체 보정은 id 오름차순 배치로 순회
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationService implements ReconcileCapacitiesUseCase {

    private final SlotReconciler slotReconciler;
    private final SlotRepository slotRepository;
    private final CapacityProperties capacityProperties;

    @Override
    public ReconciliationResult reconcile(List<Long> slotIds) {
        List<CapacityCorrection> corrections = new ArrayList<>();
        List<Long> failed = new ArrayList<>();
        int inspected;

        if (slotIds == null || slotIds.isEmpty()) {
            inspected = reconcileAll(corrections, failed);
        } else {
            List<Long> distinct = List.copyOf(new LinkedHashSet<>(slotIds));
            distinct.forEach(slotId -> reconcileOne(slotId, corrections, failed));
            inspected = distinct.size();
        }

        log.info("Reconciliation finished: inspected={}, corrected={}, failed={}",
                inspected, corrections.size(), failed.size());
        return new ReconciliationResult(inspected, corrections, failed);
    }

    private int reconcileAll(List<CapacityCorrection> corrections, List<Long> failed) {
        int batchSize = capacityProperties.reconciliation().batchSize();
        int inspected = 0;
        long lastId = 0L;

        while (true) {
            List<Long> batch = slotRepository.findIdsAfter(lastId, batchSize);
            if (batch.isEmpty()) {
                return inspected;
            }
            batch.forEach(slotId -> reconcileOne(slotId, corrections, failed));
            inspected += batch.size();
            lastId = batch.get(batch.size() - 1);
        }
    }

    private void reconcileOne(Long slotId, List<CapacityCorrection> corrections, List<Long> failed) {
        try {
            slotReconciler.reconcile(slotId).ifPresent(corrections::add);
        } catch (Exception e) {
            // 한 슬롯 실패는 기록만 하고 배치는 계속
            failed.add(slotId);
            log.error("Failed to reconcile slot: slotId={}", slotId, e);
        }
    }
}
