package personal.ai.capacity.lock.adapter.in.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.ai.capacity.lock.adapter.in.web.dto.*;
import personal.ai.capacity.lock.application.port.in.*;
import personal.ai.capacity.lock.domain.model.ReservationLock;
import personal.ai.common.dto.ApiResponse;

import java.util.List;
import java.util.UUID;

/**
 * Reservation Lock API Controller
 * 체크아웃 중 용량 홀드 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ReservationLockController {

    private static final String HOLDER_HEADER = "X-Holder-Id";

    private final AcquireLockUseCase acquireLockUseCase;
    private final ValidateLockUseCase validateLockUseCase;
    private final ReleaseLockUseCase releaseLockUseCase;
    private final QueryHeldCapacityUseCase queryHeldCapacityUseCase;
    private final SweepExpiredLocksUseCase sweepExpiredLocksUseCase;

    /**
     * 홀드 획득
     * POST /api/v1/slots/{slotId}/locks
     */
    @PostMapping("/slots/{slotId}/locks")
    public ResponseEntity<ApiResponse<ReservationLockResponse>> acquireLock(
            @PathVariable Long slotId,
            @RequestHeader(HOLDER_HEADER) String holderId,
            @Valid @RequestBody AcquireLockRequest request
    ) {
        log.info("Acquire lock: slotId={}, holderId={}, quantity={}", slotId, holderId, request.quantity());

        ReservationLock lock = acquireLockUseCase.acquireLock(request.toCommand(slotId, holderId));

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Lock acquired", ReservationLockResponse.from(lock)));
    }

    /**
     * 홀드 유효성 확인
     * GET /api/v1/locks/{lockId}/validity
     */
    @GetMapping("/locks/{lockId}/validity")
    public ResponseEntity<ApiResponse<LockValidityResponse>> validateLock(
            @PathVariable UUID lockId,
            @RequestHeader(HOLDER_HEADER) String holderId
    ) {
        boolean valid = validateLockUseCase.validateLock(lockId, holderId);

        return ResponseEntity.ok(
                ApiResponse.success("Lock validity checked", new LockValidityResponse(lockId, valid)));
    }

    /**
     * 홀드 해제
     * DELETE /api/v1/locks/{lockId}
     */
    @DeleteMapping("/locks/{lockId}")
    public ResponseEntity<ApiResponse<LockReleaseResponse>> releaseLock(
            @PathVariable UUID lockId,
            @RequestHeader(HOLDER_HEADER) String holderId
    ) {
        log.info("Release lock: lockId={}, holderId={}", lockId, holderId);

        boolean released = releaseLockUseCase.releaseLock(lockId, holderId);

        return ResponseEntity.ok(
                ApiResponse.success("Lock released", new LockReleaseResponse(lockId, released)));
    }

    /**
     * 슬롯별 홀드 수량 조회
     * GET /api/v1/locks/held?slotIds=1,2,3
     */
    @GetMapping("/locks/held")
    public ResponseEntity<ApiResponse<List<HeldCapacityResponse>>> queryHeldCapacity(
            @RequestParam @Size(min = 1, max = 500, message = "슬롯 ID는 1~500개까지 조회할 수 있습니다.")
            List<Long> slotIds
    ) {
        List<HeldCapacityResponse> response = HeldCapacityResponse.from(
                queryHeldCapacityUseCase.queryHeldCapacity(slotIds));

        return ResponseEntity.ok(ApiResponse.success("Held capacity retrieved", response));
    }

    /**
     * 만료 홀드 수동 정리 (운영자용)
     * POST /api/v1/admin/locks/sweep
     */
    @PostMapping("/admin/locks/sweep")
    public ResponseEntity<ApiResponse<SweepResponse>> sweepExpiredLocks() {
        int removed = sweepExpiredLocksUseCase.sweepExpiredLocks();

        return ResponseEntity.ok(ApiResponse.success("Expired locks swept", new SweepResponse(removed)));
    }
}
