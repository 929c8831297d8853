package personal.ai.capacity.schedule.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.ai.capacity.schedule.adapter.in.web.dto.ExpandScheduleRequest;
import personal.ai.capacity.schedule.adapter.in.web.dto.ExpandScheduleResponse;
import personal.ai.capacity.schedule.adapter.in.web.dto.RegisterShiftRequest;
import personal.ai.capacity.schedule.adapter.in.web.dto.ShiftResponse;
import personal.ai.capacity.schedule.application.port.in.ExpandScheduleUseCase;
import personal.ai.capacity.schedule.application.port.in.GetShiftUseCase;
import personal.ai.capacity.schedule.application.port.in.RegisterShiftUseCase;
import personal.ai.capacity.schedule.domain.model.Shift;
import personal.ai.common.dto.ApiResponse;

/**
 * Shift API Controller
 * 근무 일정 등록 및 슬롯 전개 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/shifts")
@RequiredArgsConstructor
public class ShiftController {

    private final RegisterShiftUseCase registerShiftUseCase;
    private final GetShiftUseCase getShiftUseCase;
    private final ExpandScheduleUseCase expandScheduleUseCase;

    /**
     * 근무 일정 등록
     * POST /api/v1/shifts
     */
    @PostMapping
    public ResponseEntity<ApiResponse<ShiftResponse>> registerShift(@Valid @RequestBody RegisterShiftRequest request) {
        log.info("Register shift: serviceId={}, days={}", request.serviceId(), request.daysOfWeek());

        Shift shift = registerShiftUseCase.registerShift(request.toCommand());

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Shift registered", ShiftResponse.from(shift)));
    }

    /**
     * 근무 일정 조회
     * GET /api/v1/shifts/{shiftId}
     */
    @GetMapping("/{shiftId}")
    public ResponseEntity<ApiResponse<ShiftResponse>> getShift(@PathVariable Long shiftId) {
        Shift shift = getShiftUseCase.getShift(shiftId);
        return ResponseEntity.ok(ApiResponse.success("Shift retrieved", ShiftResponse.from(shift)));
    }

    /**
     * 기간 내 슬롯 전개 (같은 기간 재실행 시 재생성)
     * POST /api/v1/shifts/{shiftId}/slots/expand
     */
    @PostMapping("/{shiftId}/slots/expand")
    public ResponseEntity<ApiResponse<ExpandScheduleResponse>> expandSchedule(
            @PathVariable Long shiftId,
            @Valid @RequestBody ExpandScheduleRequest request
    ) {
        log.info("Expand schedule: shiftId={}, start={}, end={}", shiftId, request.startDate(), request.endDate());

        int created = expandScheduleUseCase.expandSchedule(request.toCommand(shiftId));

        return ResponseEntity.ok(
                ApiResponse.success("Slots generated", new ExpandScheduleResponse(shiftId, created)));
    }
}
