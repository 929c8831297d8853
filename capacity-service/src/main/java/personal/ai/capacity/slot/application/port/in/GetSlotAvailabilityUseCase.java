package personal.ai.capacity.slot.application.port.in;

import personal.ai.capacity.slot.domain.model.SlotAvailability;

import java.time.LocalDate;
import java.util.List;

/**
 * Get Slot Availability UseCase (Input Port)
 * 슬롯 원장 값과 유효 가용량 조회
 */
public interface GetSlotAvailabilityUseCase {

    List<SlotAvailability> listSlots(Long shiftId, LocalDate from, LocalDate to);

    SlotAvailability getSlot(Long slotId);
}
