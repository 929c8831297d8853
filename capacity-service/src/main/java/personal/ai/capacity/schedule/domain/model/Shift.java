package personal.ai.capacity.schedule.domain.model;

import personal.ai.capacity.slot.domain.model.Slot;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.*;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Shift Domain Model
 * 반복 근무 일정 (요일, 시간 창, 시간대, 기본 단위 시간/용량, 담당자 배정) (불변)
 * <p>
 * 종료 시각이 시작 시각보다 늦지 않으면 다음 날 종료되는 야간 근무로 본다.
 */
public record Shift(
        Long id,
        Long tenantId,
        Long serviceId,
        Set<DayOfWeek> daysOfWeek,
        LocalTime startTime,
        LocalTime endTime,
        ZoneId zoneId,
        int unitDurationMinutes,
        int capacityPerSlot,
        List<StaffAssignment> assignments
) {
    private static final long MINUTES_PER_DAY = 24 * 60;

    public Shift {
        if (tenantId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant ID cannot be null");
        }
        if (serviceId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Service ID cannot be null");
        }
        if (daysOfWeek == null || daysOfWeek.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "At least one weekday is required");
        }
        if (startTime == null || endTime == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Shift start/end time cannot be null");
        }
        if (zoneId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Time zone cannot be null");
        }
        if (unitDurationMinutes < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Unit duration must be positive");
        }
        if (capacityPerSlot < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Capacity per slot must be positive");
        }
        daysOfWeek = Set.copyOf(EnumSet.copyOf(daysOfWeek));
        assignments = assignments == null ? List.of() : List.copyOf(assignments);
    }

    public boolean runsOn(LocalDate date) {
        return daysOfWeek.contains(date.getDayOfWeek());
    }

    /**
     * 시간 창 길이 (분). 야간 근무면 자정을 넘겨 계산
     */
    public long windowMinutes() {
        long minutes = Duration.between(startTime, endTime).toMinutes();
        return minutes > 0 ? minutes : minutes + MINUTES_PER_DAY;
    }

    /**
     * 하루치 슬롯 타일링
     * 담당자마다 한 줄씩 (배정이 없으면 담당자 없는 한 줄), 단위 시간 간격으로 빈틈없이 채우고
     * 창 끝을 넘는 마지막 조각은 버린다.
     */
    public List<Slot> tile(LocalDate date) {
        if (!runsOn(date)) {
            return List.of();
        }

        List<Slot> slots = new ArrayList<>();
        if (assignments.isEmpty()) {
            tileRow(date, null, unitDurationMinutes, capacityPerSlot, slots);
            return slots;
        }

        for (StaffAssignment assignment : assignments) {
            int duration = assignment.unitDurationMinutes() != null
                    ? assignment.unitDurationMinutes() : unitDurationMinutes;
            int capacity = assignment.capacityPerSlot() != null
                    ? assignment.capacityPerSlot() : capacityPerSlot;
            tileRow(date, assignment.staffId(), duration, capacity, slots);
        }
        return slots;
    }

    private void tileRow(LocalDate date, Long staffId, int duration, int capacity, List<Slot> sink) {
        LocalDateTime windowStart = LocalDateTime.of(date, startTime);
        long window = windowMinutes();

        for (long offset = 0; offset + duration <= window; offset += duration) {
            LocalDateTime localStart = windowStart.plusMinutes(offset);
            LocalDateTime localEnd = localStart.plusMinutes(duration);
            Instant startsAt = localStart.atZone(zoneId).toInstant();
            Instant endsAt = localEnd.atZone(zoneId).toInstant();
            // 서머타임 전환으로 사라지는 구간의 타일은 건너뜀
            if (!endsAt.isAfter(startsAt)) {
                continue;
            }
            sink.add(Slot.create(
                    tenantId,
                    serviceId,
                    id,
                    staffId,
                    date,
                    localStart.toLocalTime(),
                    localEnd.toLocalTime(),
                    startsAt,
                    endsAt,
                    capacity));
        }
    }
}
