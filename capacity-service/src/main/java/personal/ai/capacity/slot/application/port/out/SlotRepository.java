package personal.ai.capacity.slot.application.port.out;

import personal.ai.capacity.slot.domain.model.Slot;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Slot Repository Port (Output Port)
 * 슬롯 저장소 인터페이스
 */
public interface SlotRepository {

    Optional<Slot> findById(Long slotId);

    /**
     * 슬롯 행 배타 락 조회 (SELECT ... FOR UPDATE)
     * 호출자의 트랜잭션이 끝날 때까지 같은 슬롯의 다른 쓰기는 대기
     */
    Optional<Slot> findByIdForUpdate(Long slotId);

    List<Slot> findByShiftIdAndDateRange(Long shiftId, LocalDate from, LocalDate to);

    /**
     * id 오름차순 키셋 페이지 조회 (전체 보정 배치용)
     */
    List<Long> findIdsAfter(Long afterId, int limit);

    int deleteByIds(List<Long> slotIds);

    Slot save(Slot slot);

    List<Slot> saveAll(List<Slot> slots);
}
