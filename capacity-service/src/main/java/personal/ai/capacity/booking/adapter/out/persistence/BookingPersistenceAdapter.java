package personal.ai.capacity.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.ai.capacity.booking.application.port.out.BookingCapacityPort;
import personal.ai.capacity.booking.application.port.out.BookingRepository;
import personal.ai.capacity.booking.domain.exception.BookingNotFoundException;
import personal.ai.capacity.booking.domain.model.Booking;
import personal.ai.capacity.booking.domain.model.BookingStatus;
import personal.ai.capacity.slot.domain.model.CapacityCharge;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Booking Persistence Adapter
 * JPA를 사용한 예약 저장소 구현체
 * 저장할 때마다 변경 전/후 부과량을 BookingCapacityPort에 넘겨 슬롯 원장을 같은 트랜잭션에서 맞춘다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingPersistenceAdapter implements BookingRepository {

    private static final List<BookingStatus> CONSUMING_STATUSES = Arrays.stream(BookingStatus.values())
            .filter(BookingStatus::consumesCapacity)
            .toList();

    private final JpaBookingRepository jpaBookingRepository;
    private final BookingCapacityPort bookingCapacityPort;

    @Override
    public Booking save(Booking booking) {
        log.debug("Saving booking: bookingId={}, slotId={}, status={}, quantity={}",
                booking.id(), booking.slotId(), booking.status(), booking.quantity());

        // 변경 전 부과량 (저장 전 DB 상태 기준)
        CapacityCharge previous = booking.id() == null
                ? CapacityCharge.none()
                : jpaBookingRepository.findById(booking.id())
                        .map(entity -> entity.toDomain().capacityCharge())
                        .orElseThrow(() -> new BookingNotFoundException(booking.id()));

        var saved = jpaBookingRepository.save(BookingEntity.fromDomain(booking));
        var savedBooking = saved.toDomain();

        bookingCapacityPort.applyCapacityChange(savedBooking.id(), previous, savedBooking.capacityCharge());

        return savedBooking;
    }

    @Override
    public Optional<Booking> findById(Long bookingId) {
        log.debug("Finding booking: bookingId={}", bookingId);
        return jpaBookingRepository.findById(bookingId)
                .map(BookingEntity::toDomain);
    }

    @Override
    public Optional<Booking> findByIdForUpdate(Long bookingId) {
        return jpaBookingRepository.findByIdForUpdate(bookingId)
                .map(BookingEntity::toDomain);
    }

    @Override
    public boolean existsBySlotIds(Collection<Long> slotIds) {
        if (slotIds.isEmpty()) {
            return false;
        }
        return jpaBookingRepository.existsBySlotIdIn(slotIds);
    }

    @Override
    public long sumConsumingQuantity(Long slotId) {
        return jpaBookingRepository.sumQuantityBySlotIdAndStatusIn(slotId, CONSUMING_STATUSES);
    }
}
