package personal.ai.capacity.lock.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.ai.capacity.lock.application.port.out.ReservationLockRepository;
import personal.ai.capacity.lock.domain.model.ReservationLock;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Reservation Lock Persistence Adapter
 * JPA를 사용한 홀드 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReservationLockPersistenceAdapter implements ReservationLockRepository {

    private final JpaReservationLockRepository jpaReservationLockRepository;

    @Override
    public ReservationLock save(ReservationLock lock) {
        log.debug("Saving reservation lock: lockId={}, slotId={}", lock.id(), lock.slotId());
        return jpaReservationLockRepository.save(ReservationLockEntity.fromDomain(lock)).toDomain();
    }

    @Override
    public Optional<ReservationLock> findById(UUID lockId) {
        return jpaReservationLockRepository.findById(lockId)
                .map(ReservationLockEntity::toDomain);
    }

    @Override
    public int sumActiveQuantity(Long slotId, Instant now) {
        return Math.toIntExact(jpaReservationLockRepository.sumActiveQuantity(slotId, now));
    }

    @Override
    public int sumActiveQuantityExcluding(Long slotId, UUID excludedLockId, Instant now) {
        return Math.toIntExact(jpaReservationLockRepository.sumActiveQuantityExcluding(slotId, excludedLockId, now));
    }

    @Override
    public Map<Long, Integer> sumActiveQuantityBySlotIds(Collection<Long> slotIds, Instant now) {
        if (slotIds.isEmpty()) {
            return Map.of();
        }
        return jpaReservationLockRepository.sumActiveQuantityBySlotIds(slotIds, now)
                .stream()
                .collect(Collectors.toMap(
                        JpaReservationLockRepository.HeldQuantityView::getSlotId,
                        view -> Math.toIntExact(view.getHeldQuantity())
                ));
    }

    @Override
    public int deleteExpired(Instant now) {
        return jpaReservationLockRepository.deleteExpired(now);
    }

    @Override
    public void deleteById(UUID lockId) {
        jpaReservationLockRepository.deleteById(lockId);
    }

    @Override
    public int deleteBySlotIds(Collection<Long> slotIds) {
        if (slotIds.isEmpty()) {
            return 0;
        }
        return jpaReservationLockRepository.deleteBySlotIdIn(slotIds);
    }
}
