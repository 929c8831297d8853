package personal.ai.capacity.schedule.application.port.in;

import personal.ai.capacity.schedule.domain.model.StaffAssignment;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;

/**
 * Register Shift Command
 * 근무 일정 등록 커맨드 (값 검증은 Shift 생성 시 수행)
 */
public record RegisterShiftCommand(
        Long tenantId,
        Long serviceId,
        Set<DayOfWeek> daysOfWeek,
        LocalTime startTime,
        LocalTime endTime,
        String timeZone,
        int unitDurationMinutes,
        int capacityPerSlot,
        List<StaffAssignment> assignments
) {}
