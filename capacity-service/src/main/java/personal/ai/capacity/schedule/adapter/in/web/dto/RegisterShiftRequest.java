package personal.ai.capacity.schedule.adapter.in.web.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import personal.ai.capacity.schedule.application.port.in.RegisterShiftCommand;
import personal.ai.capacity.schedule.domain.model.StaffAssignment;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;

/**
 * 근무 일정 등록 요청 DTO
 */
public record RegisterShiftRequest(
        @NotNull(message = "테넌트 ID는 필수입니다.")
        Long tenantId,

        @NotNull(message = "서비스 ID는 필수입니다.")
        Long serviceId,

        @NotEmpty(message = "요일은 하나 이상 지정해야 합니다.")
        Set<DayOfWeek> daysOfWeek,

        @NotNull(message = "시작 시각은 필수입니다.")
        LocalTime startTime,

        @NotNull(message = "종료 시각은 필수입니다.")
        LocalTime endTime,

        @NotBlank(message = "시간대는 필수입니다.")
        String timeZone,

        @NotNull(message = "단위 시간은 필수입니다.")
        @Min(value = 1, message = "단위 시간은 1분 이상이어야 합니다.")
        Integer unitDurationMinutes,

        @NotNull(message = "슬롯당 용량은 필수입니다.")
        @Min(value = 1, message = "슬롯당 용량은 1 이상이어야 합니다.")
        Integer capacityPerSlot,

        @Valid
        List<Assignment> assignments
) {
    public record Assignment(
            @NotNull(message = "담당자 ID는 필수입니다.")
            Long staffId,

            @Min(value = 1, message = "단위 시간은 1분 이상이어야 합니다.")
            Integer unitDurationMinutes,

            @Min(value = 1, message = "슬롯당 용량은 1 이상이어야 합니다.")
            Integer capacityPerSlot
    ) {}

    public RegisterShiftCommand toCommand() {
        List<StaffAssignment> staff = assignments == null ? List.of() : assignments.stream()
                .map(a -> new StaffAssignment(a.staffId(), a.unitDurationMinutes(), a.capacityPerSlot()))
                .toList();
        return new RegisterShiftCommand(tenantId, serviceId, daysOfWeek, startTime, endTime, timeZone,
                unitDurationMinutes, capacityPerSlot, staff);
    }
}
