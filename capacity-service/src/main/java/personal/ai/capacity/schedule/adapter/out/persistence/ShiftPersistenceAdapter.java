package personal.ai.capacity.schedule.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.ai.capacity.schedule.application.port.out.ShiftRepository;
import personal.ai.capacity.schedule.domain.model.Shift;

import java.util.Optional;

/**
 * Shift Persistence Adapter
 * JPA를 사용한 근무 일정 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ShiftPersistenceAdapter implements ShiftRepository {

    private final JpaShiftRepository jpaShiftRepository;

    @Override
    public Optional<Shift> findById(Long shiftId) {
        log.debug("Finding shift by id: {}", shiftId);
        return jpaShiftRepository.findById(shiftId)
                .map(ShiftEntity::toDomain);
    }

    @Override
    public Shift save(Shift shift) {
        return jpaShiftRepository.save(ShiftEntity.fromDomain(shift)).toDomain();
    }
}
