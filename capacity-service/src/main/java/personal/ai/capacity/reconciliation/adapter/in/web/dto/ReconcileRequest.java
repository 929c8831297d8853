package personal.ai.capacity.reconciliation.adapter.in.web.dto;

import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * 용량 보정 요청 DTO (slotIds 생략 시 전체 슬롯)
 */
public record ReconcileRequest(
        @Size(max = 1000, message = "한 번에 1000개 슬롯까지 지정할 수 있습니다.")
        List<Long> slotIds
) {}
