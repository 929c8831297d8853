package personal.ai.capacity.lock.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.ai.capacity.config.CapacityProperties;
import personal.ai.capacity.lock.application.port.in.*;
import personal.ai.capacity.lock.application.port.out.ReservationLockRepository;
import personal.ai.capacity.lock.domain.exception.LockNotFoundException;
import personal.ai.capacity.lock.domain.model.ReservationLock;
import personal.ai.capacity.slot.application.port.out.SlotRepository;
import personal.ai.capacity.slot.domain.exception.SlotNotFoundException;
import personal.ai.capacity.slot.domain.model.Slot;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Reservation Lock Service
 * 예약 홀드 획득/검증/해제/조회/정리
 * <p>
 * 같은 슬롯에 대한 획득 요청은 슬롯 행 락으로 직렬화된다.
 * 나중에 락을 얻은 요청은 먼저 커밋된 홀드를 반드시 보게 된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ReservationLockService implements AcquireLockUseCase, ValidateLockUseCase, ReleaseLockUseCase,
        QueryHeldCapacityUseCase, SweepExpiredLocksUseCase {

    private final SlotRepository slotRepository;
    private final ReservationLockRepository lockRepository;
    private final CapacityProperties capacityProperties;
    private final Clock clock;

    @Override
    @Transactional
    public ReservationLock acquireLock(AcquireLockCommand command) {
        Duration ttl = resolveTtl(command.ttlSeconds());

        // 1. 슬롯 행 배타 락 (동일 슬롯 획득 요청 직렬화)
        Slot slot = slotRepository.findByIdForUpdate(command.slotId())
                .orElseThrow(() -> new SlotNotFoundException(command.slotId()));

        // 2. 오픈 여부 및 유효 가용량 검증
        slot.ensureOpen();
        Instant now = clock.instant();
        int held = lockRepository.sumActiveQuantity(slot.id(), now);
        slot.ensureCanReserve(command.quantity(), held);

        // 3. 홀드 저장 (슬롯 원장은 건드리지 않음)
        ReservationLock saved = lockRepository.save(
                ReservationLock.create(slot.id(), command.holderId(), command.quantity(), ttl, now));

        log.info("Reservation lock acquired: lockId={}, slotId={}, holderId={}, quantity={}, expiresAt={}",
                saved.id(), saved.slotId(), saved.holderId(), saved.quantity(), saved.expiresAt());
        return saved;
    }

    @Override
    public boolean validateLock(UUID lockId, String holderId) {
        Instant now = clock.instant();
        boolean valid = lockRepository.findById(lockId)
                .map(lock -> lock.isValidFor(holderId, now))
                .orElse(false);
        log.debug("Reservation lock validated: lockId={}, holderId={}, valid={}", lockId, holderId, valid);
        return valid;
    }

    @Override
    @Transactional
    public boolean releaseLock(UUID lockId, String holderId) {
        ReservationLock lock = lockRepository.findById(lockId)
                .orElseThrow(() -> new LockNotFoundException(lockId));

        lock.ensureHeldBy(holderId);
        boolean active = !lock.isExpired(clock.instant());
        lockRepository.deleteById(lockId);

        log.info("Reservation lock released: lockId={}, slotId={}, holderId={}, active={}",
                lockId, lock.slotId(), holderId, active);
        return active;
    }

    @Override
    public Map<Long, Integer> queryHeldCapacity(Collection<Long> slotIds) {
        Map<Long, Integer> result = new LinkedHashMap<>();
        slotIds.forEach(slotId -> result.put(slotId, 0));
        if (result.isEmpty()) {
            return result;
        }

        result.putAll(lockRepository.sumActiveQuantityBySlotIds(result.keySet(), clock.instant()));
        return result;
    }

    @Override
    @Transactional
    public int sweepExpiredLocks() {
        int removed = lockRepository.deleteExpired(clock.instant());
        if (removed > 0) {
            log.info("Expired reservation locks swept: removed={}", removed);
        }
        return removed;
    }

    private Duration resolveTtl(Integer ttlSeconds) {
        CapacityProperties.Lock lockProperties = capacityProperties.lock();
        if (ttlSeconds == null) {
            return lockProperties.defaultTtl();
        }
        if (ttlSeconds <= 0 || ttlSeconds > lockProperties.maxTtlSeconds()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("TTL must be between 1 and %d seconds: ttlSeconds=%d",
                            lockProperties.maxTtlSeconds(), ttlSeconds));
        }
        return Duration.ofSeconds(ttlSeconds);
    }
}
