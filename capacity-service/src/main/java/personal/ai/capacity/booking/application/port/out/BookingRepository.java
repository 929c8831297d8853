package personal.ai.capacity.booking.application.port.out;

import personal.ai.capacity.booking.domain.model.Booking;

import java.util.Collection;
import java.util.Optional;

/**
 * Booking Repository Port (Output Port)
 * 예약 저장소 인터페이스
 * <p>
 * save 는 슬롯 용량 원장 반영까지 포함하는 쓰기 경로이다. 호출자의 트랜잭션 안에서만 호출해야 한다.
 */
public interface BookingRepository {

    Booking save(Booking booking);

    Optional<Booking> findById(Long bookingId);

    Optional<Booking> findByIdForUpdate(Long bookingId);

    /**
     * 슬롯들 중 하나라도 예약(상태 무관)이 걸려 있는지 여부
     */
    boolean existsBySlotIds(Collection<Long> slotIds);

    /**
     * 슬롯의 용량 소비 상태 예약 수량 합계 (보정 기준값)
     */
    long sumConsumingQuantity(Long slotId);
}
