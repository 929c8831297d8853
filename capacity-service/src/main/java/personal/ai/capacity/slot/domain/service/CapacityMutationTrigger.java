package personal.ai.capacity.slot.domain.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import personal.ai.capacity.slot.application.port.out.SlotRepository;
import personal.ai.capacity.slot.domain.exception.SlotNotFoundException;
import personal.ai.capacity.slot.domain.model.CapacityChange;
import personal.ai.capacity.slot.domain.model.CapacityCharge;
import personal.ai.capacity.slot.domain.model.Slot;

/**
 * Capacity Mutation Trigger (Domain Service)
 * 예약 쓰기 직후 같은 트랜잭션 안에서 슬롯 용량 원장을 맞춘다.
 * <p>
 * 예약 쓰기 경로(BookingPersistenceAdapter)만 호출하며, 슬롯 카운터를 바꾸는 유일한 경로이다.
 * 활성 트랜잭션 없이 호출되면 IllegalTransactionStateException (MANDATORY).
 * <ul>
 *   <li>소비 상태로 생성/전환: 수량만큼 차감</li>
 *   <li>비소비 상태로 전환: 수량만큼 반환</li>
 *   <li>소비 상태 유지 중 수량 변경: 차이만큼 차감/반환</li>
 *   <li>소비 상태 유지 중 슬롯 변경: 기존 슬롯 반환 후 새 슬롯 차감 (슬롯 id 오름차순으로 락)</li>
 * </ul>
 * 범위를 벗어나는 변경은 잘라서 반영하고 불변식 위반으로 기록만 한다. 쓰기를 실패시키지 않는다.
 */
@Slf4j
@Component
public class CapacityMutationTrigger {

    private final SlotRepository slotRepository;
    private final Counter invariantViolationCounter;

    public CapacityMutationTrigger(SlotRepository slotRepository, MeterRegistry meterRegistry) {
        this.slotRepository = slotRepository;
        this.invariantViolationCounter = Counter.builder("capacity.invariant.violations")
                .description("Capacity ledger changes clamped to [0, total]")
                .register(meterRegistry);
    }

    /**
     * 예약 한 건의 변경 전/후 부과량으로 원장 반영
     *
     * @param bookingId 로그용 예약 ID
     * @param previous  변경 전 부과량 (신규 생성이면 CapacityCharge.none())
     * @param current   변경 후 부과량
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void onBookingWritten(Long bookingId, CapacityCharge previous, CapacityCharge current) {
        if (previous.isEmpty() && current.isEmpty()) {
            return;
        }

        if (!previous.isEmpty() && !current.isEmpty() && previous.slotId().equals(current.slotId())) {
            int delta = current.quantity() - previous.quantity();
            if (delta == 0) {
                return;
            }
            Slot slot = lockSlot(current.slotId());
            apply(bookingId, delta > 0 ? slot.charge(delta) : slot.release(-delta));
            return;
        }

        // 서로 다른 슬롯 두 개를 건드리면 교착 방지를 위해 id 오름차순으로 락
        if (!previous.isEmpty() && !current.isEmpty() && previous.slotId() > current.slotId()) {
            Slot target = lockSlot(current.slotId());
            Slot source = lockSlot(previous.slotId());
            apply(bookingId, source.release(previous.quantity()));
            apply(bookingId, target.charge(current.quantity()));
            return;
        }

        if (!previous.isEmpty()) {
            apply(bookingId, lockSlot(previous.slotId()).release(previous.quantity()));
        }
        if (!current.isEmpty()) {
            apply(bookingId, lockSlot(current.slotId()).charge(current.quantity()));
        }
    }

    private Slot lockSlot(Long slotId) {
        return slotRepository.findByIdForUpdate(slotId)
                .orElseThrow(() -> new SlotNotFoundException(slotId));
    }

    private void apply(Long bookingId, CapacityChange change) {
        Slot after = change.after();
        slotRepository.save(after);

        if (change.clamped()) {
            invariantViolationCounter.increment();
            log.warn("[InvariantViolation] Capacity change clamped: slotId={}, bookingId={}, requested={}, applied={}, committed={}, total={}",
                    after.id(), bookingId, change.requested(), change.applied(),
                    after.committedCount(), after.totalCapacity());
        }

        log.debug("Capacity ledger updated: slotId={}, bookingId={}, delta={}, available={}, committed={}",
                after.id(), bookingId, change.applied(), after.availableCapacity(), after.committedCount());
    }
}
