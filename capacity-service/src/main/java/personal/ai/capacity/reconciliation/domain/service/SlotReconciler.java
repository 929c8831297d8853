package personal.ai.capacity.reconciliation.domain.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import personal.ai.capacity.booking.application.port.out.BookingRepository;
import personal.ai.capacity.reconciliation.domain.model.CapacityCorrection;
import personal.ai.capacity.slot.application.port.out.SlotRepository;
import personal.ai.capacity.slot.domain.exception.SlotNotFoundException;
import personal.ai.capacity.slot.domain.model.Slot;

import java.util.Optional;

/**
 * Slot Reconciler (Domain Service, Transaction Manager)
 * 슬롯 한 건을 자기 트랜잭션에서 보정
 * <p>
 * READ COMMITTED: 슬롯 행 락을 얻기 전에 커밋된 예약을 모두 본다.
 * REQUIRES_NEW: 한 슬롯의 실패가 다른 슬롯 보정에 영향을 주지 않는다.
 */
@Slf4j
@Component
public class SlotReconciler {

    private final SlotRepository slotRepository;
    private final BookingRepository bookingRepository;
    private final Counter invariantViolationCounter;

    public SlotReconciler(SlotRepository slotRepository, BookingRepository bookingRepository,
                          MeterRegistry meterRegistry) {
        this.slotRepository = slotRepository;
        this.bookingRepository = bookingRepository;
        this.invariantViolationCounter = Counter.builder("capacity.invariant.violations")
                .description("Capacity ledger changes clamped to [0, total]")
                .register(meterRegistry);
    }

    /**
     * @return 값이 바뀌었으면 보정 내역, 이미 일치하면 empty
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW, isolation = Isolation.READ_COMMITTED)
    public Optional<CapacityCorrection> reconcile(Long slotId) {
        Slot slot = slotRepository.findByIdForUpdate(slotId)
                .orElseThrow(() -> new SlotNotFoundException(slotId));

        long consuming = bookingRepository.sumConsumingQuantity(slotId);
        boolean overbooked = consuming > slot.totalCapacity();
        if (overbooked) {
            invariantViolationCounter.increment();
            log.warn("[InvariantViolation] Consuming bookings exceed capacity: slotId={}, consuming={}, total={}",
                    slotId, consuming, slot.totalCapacity());
        }

        Slot recounted = slot.recount(consuming);
        if (recounted.availableCapacity() == slot.availableCapacity()
                && recounted.committedCount() == slot.committedCount()) {
            return Optional.empty();
        }

        slotRepository.save(recounted);

        CapacityCorrection correction = new CapacityCorrection(
                slotId,
                slot.availableCapacity(),
                recounted.availableCapacity(),
                slot.committedCount(),
                recounted.committedCount(),
                overbooked);
        log.info("Slot capacity corrected: slotId={}, available {} -> {}, committed {} -> {}",
                slotId, correction.oldAvailable(), correction.newAvailable(),
                correction.oldCommitted(), correction.newCommitted());
        return Optional.of(correction);
    }
}
