package personal.ai.capacity.slot.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.ai.capacity.lock.application.port.out.ReservationLockRepository;
import personal.ai.capacity.slot.application.port.in.GetSlotAvailabilityUseCase;
import personal.ai.capacity.slot.application.port.out.SlotRepository;
import personal.ai.capacity.slot.domain.exception.SlotNotFoundException;
import personal.ai.capacity.slot.domain.model.Slot;
import personal.ai.capacity.slot.domain.model.SlotAvailability;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Slot Query Service
 * 예약 화면용 슬롯 가용량 조회 (락 없는 읽기)
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SlotQueryService implements GetSlotAvailabilityUseCase {

    private final SlotRepository slotRepository;
    private final ReservationLockRepository lockRepository;
    private final Clock clock;

    @Override
    public List<SlotAvailability> listSlots(Long shiftId, LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("from must not be after to: from=%s, to=%s", from, to));
        }

        List<Slot> slots = slotRepository.findByShiftIdAndDateRange(shiftId, from, to);
        if (slots.isEmpty()) {
            return List.of();
        }

        Map<Long, Integer> held = lockRepository.sumActiveQuantityBySlotIds(
                slots.stream().map(Slot::id).toList(), clock.instant());

        log.debug("Slots listed: shiftId={}, from={}, to={}, count={}", shiftId, from, to, slots.size());

        return slots.stream()
                .map(slot -> new SlotAvailability(slot, held.getOrDefault(slot.id(), 0)))
                .toList();
    }

    @Override
    public SlotAvailability getSlot(Long slotId) {
        Slot slot = slotRepository.findById(slotId)
                .orElseThrow(() -> new SlotNotFoundException(slotId));

        int held = lockRepository.sumActiveQuantity(slotId, clock.instant());
        return new SlotAvailability(slot, held);
    }
}
