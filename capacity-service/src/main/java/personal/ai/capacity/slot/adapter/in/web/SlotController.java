package personal.ai.capacity.slot.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.ai.capacity.slot.adapter.in.web.dto.ChangeSlotOpenRequest;
import personal.ai.capacity.slot.adapter.in.web.dto.SlotResponse;
import personal.ai.capacity.slot.application.port.in.ChangeSlotOpenUseCase;
import personal.ai.capacity.slot.application.port.in.GetSlotAvailabilityUseCase;
import personal.ai.capacity.slot.domain.model.Slot;
import personal.ai.common.dto.ApiResponse;

import java.time.LocalDate;
import java.util.List;

/**
 * Slot API Controller
 * 슬롯 가용량 조회 및 오픈/마감 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class SlotController {

    private final GetSlotAvailabilityUseCase getSlotAvailabilityUseCase;
    private final ChangeSlotOpenUseCase changeSlotOpenUseCase;

    /**
     * 근무 일정의 기간별 슬롯 목록 조회
     * GET /api/v1/shifts/{shiftId}/slots?from=&to=
     */
    @GetMapping("/shifts/{shiftId}/slots")
    public ResponseEntity<ApiResponse<List<SlotResponse>>> listSlots(
            @PathVariable Long shiftId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        log.debug("List slots: shiftId={}, from={}, to={}", shiftId, from, to);

        List<SlotResponse> response = getSlotAvailabilityUseCase.listSlots(shiftId, from, to)
                .stream()
                .map(SlotResponse::from)
                .toList();

        return ResponseEntity.ok(ApiResponse.success("Slots retrieved", response));
    }

    /**
     * 슬롯 단건 조회
     * GET /api/v1/slots/{slotId}
     */
    @GetMapping("/slots/{slotId}")
    public ResponseEntity<ApiResponse<SlotResponse>> getSlot(@PathVariable Long slotId) {
        SlotResponse response = SlotResponse.from(getSlotAvailabilityUseCase.getSlot(slotId));
        return ResponseEntity.ok(ApiResponse.success("Slot retrieved", response));
    }

    /**
     * 슬롯 오픈/마감
     * PATCH /api/v1/slots/{slotId}/open
     */
    @PatchMapping("/slots/{slotId}/open")
    public ResponseEntity<ApiResponse<SlotResponse>> changeOpen(
            @PathVariable Long slotId,
            @Valid @RequestBody ChangeSlotOpenRequest request
    ) {
        log.info("Change slot open state: slotId={}, open={}", slotId, request.open());

        Slot slot = changeSlotOpenUseCase.changeOpen(slotId, request.open());

        return ResponseEntity.ok(ApiResponse.success("Slot updated", SlotResponse.from(slot)));
    }
}
