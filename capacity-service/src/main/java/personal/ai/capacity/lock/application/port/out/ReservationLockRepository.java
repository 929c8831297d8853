package personal.ai.capacity.lock.application.port.out;

import personal.ai.capacity.lock.domain.model.ReservationLock;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Reservation Lock Repository Port (Output Port)
 * 홀드 저장소 인터페이스
 */
public interface ReservationLockRepository {

    ReservationLock save(ReservationLock lock);

    Optional<ReservationLock> findById(UUID lockId);

    /**
     * 슬롯의 미만료 홀드 수량 합계 (expiresAt > now)
     */
    int sumActiveQuantity(Long slotId, Instant now);

    /**
     * 특정 홀드를 제외한 미만료 홀드 수량 합계 (홀드로 예약 생성 시)
     */
    int sumActiveQuantityExcluding(Long slotId, UUID excludedLockId, Instant now);

    /**
     * 슬롯별 미만료 홀드 수량 합계 (홀드가 없는 슬롯은 결과에 없음)
     */
    Map<Long, Integer> sumActiveQuantityBySlotIds(Collection<Long> slotIds, Instant now);

    int deleteExpired(Instant now);

    void deleteById(UUID lockId);

    int deleteBySlotIds(Collection<Long> slotIds);
}
