package personal.ai.capacity.schedule.adapter.in.web.dto;

import personal.ai.capacity.schedule.domain.model.Shift;
import personal.ai.capacity.schedule.domain.model.StaffAssignment;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.List;

/**
 * 근무 일정 응답 DTO
 */
public record ShiftResponse(
        Long shiftId,
        Long tenantId,
        Long serviceId,
        List<DayOfWeek> daysOfWeek,
        LocalTime startTime,
        LocalTime endTime,
        String timeZone,
        int unitDurationMinutes,
        int capacityPerSlot,
        List<StaffAssignment> assignments
) {
    public static ShiftResponse from(Shift shift) {
        return new ShiftResponse(
                shift.id(),
                shift.tenantId(),
                shift.serviceId(),
                shift.daysOfWeek().stream().sorted().toList(),
                shift.startTime(),
                shift.endTime(),
                shift.zoneId().getId(),
                shift.unitDurationMinutes(),
                shift.capacityPerSlot(),
                shift.assignments()
        );
    }
}
