package personal.ai.capacity.schedule.application.port.out;

import personal.ai.capacity.schedule.domain.model.Shift;

import java.util.Optional;

/**
 * Shift Repository Port (Output Port)
 * 근무 일정 저장소 인터페이스
 */
public interface ShiftRepository {

    Optional<Shift> findById(Long shiftId);

    Shift save(Shift shift);
}
