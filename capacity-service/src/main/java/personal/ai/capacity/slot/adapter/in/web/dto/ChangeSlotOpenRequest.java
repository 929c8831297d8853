package personal.ai.capacity.slot.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;

/**
 * 슬롯 오픈/마감 요청 DTO
 */
public record ChangeSlotOpenRequest(
        @NotNull(message = "오픈 여부는 필수입니다.")
        Boolean open
) {}
