package personal.ai.capacity.slot.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import personal.ai.capacity.slot.application.port.out.SlotRepository;
import personal.ai.capacity.slot.domain.model.Slot;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Slot Persistence Adapter
 * JPA를 사용한 슬롯 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SlotPersistenceAdapter implements SlotRepository {

    private final JpaSlotRepository jpaSlotRepository;

    @Override
    public Optional<Slot> findById(Long slotId) {
        log.debug("Finding slot by id: {}", slotId);
        return jpaSlotRepository.findById(slotId)
                .map(SlotEntity::toDomain);
    }

    @Override
    public Optional<Slot> findByIdForUpdate(Long slotId) {
        log.debug("Locking slot row: slotId={}", slotId);
        return jpaSlotRepository.findByIdForUpdate(slotId)
                .map(SlotEntity::toDomain);
    }

    @Override
    public List<Slot> findByShiftIdAndDateRange(Long shiftId, LocalDate from, LocalDate to) {
        log.debug("Finding slots: shiftId={}, from={}, to={}", shiftId, from, to);
        return jpaSlotRepository.findByShiftIdAndDateRange(shiftId, from, to)
                .stream()
                .map(SlotEntity::toDomain)
                .toList();
    }

    @Override
    public List<Long> findIdsAfter(Long afterId, int limit) {
        return jpaSlotRepository.findIdsAfter(afterId, PageRequest.of(0, limit));
    }

    @Override
    public int deleteByIds(List<Long> slotIds) {
        if (slotIds.isEmpty()) {
            return 0;
        }
        return jpaSlotRepository.deleteByIdIn(slotIds);
    }

    @Override
    public Slot save(Slot slot) {
        log.debug("Saving slot: slotId={}, available={}, committed={}",
                slot.id(), slot.availableCapacity(), slot.committedCount());
        SlotEntity saved = jpaSlotRepository.save(SlotEntity.fromDomain(slot));
        return saved.toDomain();
    }

    @Override
    public List<Slot> saveAll(List<Slot> slots) {
        return jpaSlotRepository.saveAll(slots.stream().map(SlotEntity::fromDomain).toList())
                .stream()
                .map(SlotEntity::toDomain)
                .toList();
    }
}
