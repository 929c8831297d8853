package personal.ai.capacity.schedule.application.port.in;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * Expand Schedule Command
 * 근무 일정 슬롯 전개 커맨드 (startDate, endDate 모두 포함)
 */
public record ExpandScheduleCommand(
        Long shiftId,
        LocalDate startDate,
        LocalDate endDate
) {
    public ExpandScheduleCommand {
        if (shiftId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Shift ID cannot be null");
        }
        if (startDate == null || endDate == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Start and end date cannot be null");
        }
        if (startDate.isAfter(endDate)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Start date must not be after end date: start=%s, end=%s", startDate, endDate));
        }
    }
}
