package personal.ai.capacity.schedule.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Spring Data JPA Repository for Shift
 */
public interface JpaShiftRepository extends JpaRepository<ShiftEntity, Long> {
}
