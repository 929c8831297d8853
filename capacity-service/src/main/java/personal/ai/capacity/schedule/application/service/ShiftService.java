package personal.ai.capacity.schedule.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.ai.capacity.schedule.application.port.in.GetShiftUseCase;
import personal.ai.capacity.schedule.application.port.in.RegisterShiftCommand;
import personal.ai.capacity.schedule.application.port.in.RegisterShiftUseCase;
import personal.ai.capacity.schedule.application.port.out.ShiftRepository;
import personal.ai.capacity.schedule.domain.exception.ShiftNotFoundException;
import personal.ai.capacity.schedule.domain.model.Shift;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Shift Service
 * 근무 일정 등록/조회
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ShiftService implements RegisterShiftUseCase, GetShiftUseCase {

    private final ShiftRepository shiftRepository;

    @Override
    @Transactional
    public Shift registerShift(RegisterShiftCommand command) {
        Shift shift = new Shift(
                null,
                command.tenantId(),
                command.serviceId(),
                command.daysOfWeek(),
                command.startTime(),
                command.endTime(),
                parseZone(command.timeZone()),
                command.unitDurationMinutes(),
                command.capacityPerSlot(),
                command.assignments()
        );

        Shift saved = shiftRepository.save(shift);
        log.info("Shift registered: shiftId={}, serviceId={}, days={}, window={}~{} {}, assignments={}",
                saved.id(), saved.serviceId(), saved.daysOfWeek(), saved.startTime(), saved.endTime(),
                saved.zoneId(), saved.assignments().size());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public Shift getShift(Long shiftId) {
        return shiftRepository.findById(shiftId)
                .orElseThrow(() -> new ShiftNotFoundException(shiftId));
    }

    private ZoneId parseZone(String timeZone) {
        if (timeZone == null || timeZone.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Time zone cannot be blank");
        }
        try {
            return ZoneId.of(timeZone);
        } catch (DateTimeException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Unknown time zone: " + timeZone);
        }
    }
}
