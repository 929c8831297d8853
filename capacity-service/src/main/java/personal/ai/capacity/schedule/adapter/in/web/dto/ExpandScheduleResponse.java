package personal.ai.capacity.schedule.adapter.in.web.dto;

/**
 * 슬롯 전개 결과 DTO
 */
public record ExpandScheduleResponse(
        Long shiftId,
        int slotsCreated
) {}
