package personal.ai.capacity.reconciliation.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.ai.capacity.reconciliation.adapter.in.web.dto.ReconcileRequest;
import personal.ai.capacity.reconciliation.adapter.in.web.dto.ReconcileResponse;
import personal.ai.capacity.reconciliation.application.port.in.ReconcileCapacitiesUseCase;
import personal.ai.common.dto.ApiResponse;

import java.util.List;

/**
 * Reconciliation Admin API Controller
 * 운영자 수동 용량 보정
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/admin/capacity")
@RequiredArgsConstructor
public class ReconciliationController {

    private final ReconcileCapacitiesUseCase reconcileCapacitiesUseCase;

    /**
     * 용량 보정 실행
     * POST /api/v1/admin/capacity/reconcile
     */
    @PostMapping("/reconcile")
    public ResponseEntity<ApiResponse<ReconcileResponse>> reconcile(
            @Valid @RequestBody(required = false) ReconcileRequest request
    ) {
        List<Long> slotIds = request == null ? null : request.slotIds();
        log.info("Reconcile capacities requested: slotIds={}", slotIds == null ? "ALL" : slotIds);

        ReconcileResponse response = ReconcileResponse.from(reconcileCapacitiesUseCase.reconcile(slotIds));

        return ResponseEntity.ok(ApiResponse.success("Reconciliation completed", response));
    }
}
