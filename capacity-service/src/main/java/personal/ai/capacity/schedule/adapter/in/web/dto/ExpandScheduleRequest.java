package personal.ai.capacity.schedule.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import personal.ai.capacity.schedule.application.port.in.ExpandScheduleCommand;

import java.time.LocalDate;

/**
 * 슬롯 전개 요청 DTO
 */
public record ExpandScheduleRequest(
        @NotNull(message = "시작일은 필수입니다.")
        LocalDate startDate,

        @NotNull(message = "종료일은 필수입니다.")
        LocalDate endDate
) {
    public ExpandScheduleCommand toCommand(Long shiftId) {
        return new ExpandScheduleCommand(shiftId, startDate, endDate);
    }
}
