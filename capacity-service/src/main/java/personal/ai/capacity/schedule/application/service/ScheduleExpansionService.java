package personal.ai.capacity.schedule.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.ai.capacity.booking.application.port.out.BookingRepository;
import personal.ai.capacity.config.CapacityProperties;
import personal.ai.capacity.lock.application.port.out.ReservationLockRepository;
import personal.ai.capacity.schedule.application.port.in.ExpandScheduleCommand;
import personal.ai.capacity.schedule.application.port.in.ExpandScheduleUseCase;
import personal.ai.capacity.schedule.application.port.out.ShiftRepository;
import personal.ai.capacity.schedule.domain.exception.ShiftNotFoundException;
import personal.ai.capacity.schedule.domain.exception.SlotsHaveBookingsException;
import personal.ai.capacity.schedule.domain.model.Shift;
import personal.ai.capacity.slot.application.port.out.SlotRepository;
import personal.ai.capacity.slot.domain.model.Slot;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Schedule Expansion Service
 * 근무 일정을 기간 내 슬롯으로 전개
 * <p>
 * 기간 단위로 멱등: 해당 근무 일정의 기간 내 기존 슬롯(및 그 슬롯의 홀드)을 지우고 다시 생성한다.
 * 삭제와 생성은 한 트랜잭션으로 묶인다. 기간 내 슬롯에 예약이 하나라도 걸려 있으면 아무것도 쓰지 않고 거절한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleExpansionService implements ExpandScheduleUseCase {

    private final ShiftRepository shiftRepository;
    private final SlotRepository slotRepository;
    private final ReservationLockRepository lockRepository;
    private final BookingRepository bookingRepository;
    private final CapacityProperties capacityProperties;

    @Override
    @Transactional
    public int expandSchedule(ExpandScheduleCommand command) {
        validateRange(command);

        // 1. 근무 일정 조회 (없으면 아무것도 쓰지 않음)
        Shift shift = shiftRepository.findById(command.shiftId())
                .orElseThrow(() -> new ShiftNotFoundException(command.shiftId()));

        // 2. 기존 슬롯과 홀드 삭제 (예약이 걸린 슬롯이 있으면 거절)
        purgeExistingSlots(shift.id(), command);

        // 3. 날짜별 타일링 후 일괄 저장
        List<Slot> slots = command.startDate()
                .datesUntil(command.endDate().plusDays(1))
                .flatMap(date -> shift.tile(date).stream())
                .toList();
        slotRepository.saveAll(slots);

        log.info("Slots generated: shiftId={}, start={}, end={}, created={}",
                shift.id(), command.startDate(), command.endDate(), slots.size());
        return slots.size();
    }

    private void purgeExistingSlots(Long shiftId, ExpandScheduleCommand command) {
        List<Slot> existing = slotRepository.findByShiftIdAndDateRange(shiftId, command.startDate(), command.endDate());
        if (existing.isEmpty()) {
            return;
        }

        List<Long> slotIds = existing.stream().map(Slot::id).toList();
        if (bookingRepository.existsBySlotIds(slotIds)) {
            log.warn("Expansion rejected, slots still have bookings: shiftId={}, start={}, end={}",
                    shiftId, command.startDate(), command.endDate());
            throw new SlotsHaveBookingsException(shiftId, command.startDate(), command.endDate());
        }

        int locksRemoved = lockRepository.deleteBySlotIds(slotIds);
        int slotsRemoved = slotRepository.deleteByIds(slotIds);
        log.debug("Existing slots purged: shiftId={}, slots={}, locks={}", shiftId, slotsRemoved, locksRemoved);
    }

    private void validateRange(ExpandScheduleCommand command) {
        long days = ChronoUnit.DAYS.between(command.startDate(), command.endDate()) + 1;
        int maxRangeDays = capacityProperties.schedule().maxRangeDays();
        if (days > maxRangeDays) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Expansion range too long: days=%d, max=%d", days, maxRangeDays));
        }
    }
}
