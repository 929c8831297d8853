package personal.ai.capacity.lock.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Spring Data JPA Repository for Reservation Lock
 */
public interface JpaReservationLockRepository extends JpaRepository<ReservationLockEntity, UUID> {

    @Query("SELECT COALESCE(SUM(l.quantity), 0) FROM ReservationLockEntity l " +
            "WHERE l.slotId = :slotId AND l.expiresAt > :now")
    Long sumActiveQuantity(@Param("slotId") Long slotId, @Param("now") Instant now);

    @Query("SELECT COALESCE(SUM(l.quantity), 0) FROM ReservationLockEntity l " +
            "WHERE l.slotId = :slotId AND l.expiresAt > :now AND l.id <> :excludedId")
    Long sumActiveQuantityExcluding(@Param("slotId") Long slotId,
                                    @Param("excludedId") UUID excludedId,
                                    @Param("now") Instant now);

    @Query("SELECT l.slotId AS slotId, SUM(l.quantity) AS heldQuantity FROM ReservationLockEntity l " +
            "WHERE l.slotId IN :slotIds AND l.expiresAt > :now GROUP BY l.slotId")
    List<HeldQuantityView> sumActiveQuantityBySlotIds(@Param("slotIds") Collection<Long> slotIds,
                                                      @Param("now") Instant now);

    @Modifying
    @Query("DELETE FROM ReservationLockEntity l WHERE l.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);

    @Modifying
    @Query("DELETE FROM ReservationLockEntity l WHERE l.slotId IN :slotIds")
    int deleteBySlotIdIn(@Param("slotIds") Collection<Long> slotIds);

    /**
     * 슬롯별 홀드 수량 집계 Projection
     */
    interface HeldQuantityView {
        Long getSlotId();

        Long getHeldQuantity();
    }
}
