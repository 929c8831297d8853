package personal.ai.capacity.booking.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.ai.capacity.booking.domain.model.BookingStatus;

import java.util.Collection;
import java.util.Optional;

/**
 * Spring Data JPA Repository for Booking
 */
public interface JpaBookingRepository extends JpaRepository<BookingEntity, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM BookingEntity b WHERE b.id = :id")
    Optional<BookingEntity> findByIdForUpdate(@Param("id") Long id);

    boolean existsBySlotIdIn(Collection<Long> slotIds);

    @Query("SELECT COALESCE(SUM(b.quantity), 0) FROM BookingEntity b " +
            "WHERE b.slotId = :slotId AND b.status IN :statuses")
    Long sumQuantityBySlotIdAndStatusIn(@Param("slotId") Long slotId,
                                        @Param("statuses") Collection<BookingStatus> statuses);
}
