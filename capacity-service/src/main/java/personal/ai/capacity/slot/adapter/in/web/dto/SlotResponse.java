package personal.ai.capacity.slot.adapter.in.web.dto;

import personal.ai.capacity.slot.domain.model.Slot;
import personal.ai.capacity.slot.domain.model.SlotAvailability;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 슬롯 조회 응답 DTO
 * 원장 값(availableCapacity, committedCount)과 홀드 반영 유효 가용량을 함께 제공
 */
public record SlotResponse(
        Long slotId,
        Long serviceId,
        Long shiftId,
        Long staffId,
        LocalDate slotDate,
        LocalTime startTime,
        LocalTime endTime,
        Instant startsAt,
        Instant endsAt,
        int totalCapacity,
        int availableCapacity,
        int committedCount,
        int heldQuantity,
        int effectiveAvailable,
        boolean open
) {
    public static SlotResponse from(SlotAvailability availability) {
        Slot slot = availability.slot();
        return new SlotResponse(
                slot.id(),
                slot.serviceId(),
                slot.shiftId(),
                slot.staffId(),
                slot.slotDate(),
                slot.startTime(),
                slot.endTime(),
                slot.startsAt(),
                slot.endsAt(),
                slot.totalCapacity(),
                slot.availableCapacity(),
                slot.committedCount(),
                availability.heldQuantity(),
                availability.effectiveAvailable(),
                slot.open()
        );
    }

    public static SlotResponse from(Slot slot) {
        return from(new SlotAvailability(slot, 0));
    }
}
