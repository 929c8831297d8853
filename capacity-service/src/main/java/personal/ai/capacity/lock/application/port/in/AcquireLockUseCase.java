package personal.ai.capacity.lock.application.port.in;

import personal.ai.capacity.lock.domain.model.ReservationLock;

/**
 * Acquire Lock UseCase (Input Port)
 * 슬롯 용량 홀드 획득
 */
public interface AcquireLockUseCase {

    /**
     * @throws personal.ai.capacity.slot.domain.exception.SlotNotFoundException      슬롯 없음
     * @throws personal.ai.capacity.slot.domain.exception.SlotNotOpenException       닫힌 슬롯
     * @throws personal.ai.capacity.slot.domain.exception.CapacityExceededException  유효 가용량 부족
     */
    ReservationLock acquireLock(AcquireLockCommand command);
}
