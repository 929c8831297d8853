package personal.ai.capacity.slot.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for Slot
 */
public interface JpaSlotRepository extends JpaRepository<SlotEntity, Long> {

    /**
     * 비관적 쓰기 락 조회
     * 대기 시간은 jakarta.persistence.lock.timeout / innodb_lock_wait_timeout 설정을 따른다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM SlotEntity s WHERE s.id = :id")
    Optional<SlotEntity> findByIdForUpdate(@Param("id") Long id);

    @Query("SELECT s FROM SlotEntity s WHERE s.shiftId = :shiftId AND s.slotDate BETWEEN :from AND :to " +
            "ORDER BY s.startsAt ASC, s.id ASC")
    List<SlotEntity> findByShiftIdAndDateRange(@Param("shiftId") Long shiftId,
                                               @Param("from") LocalDate from,
                                               @Param("to") LocalDate to);

    @Query("SELECT s.id FROM SlotEntity s WHERE s.id > :afterId ORDER BY s.id ASC")
    List<Long> findIdsAfter(@Param("afterId") Long afterId, Pageable pageable);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM SlotEntity s WHERE s.id IN :ids")
    int deleteByIdIn(@Param("ids") List<Long> ids);
}
