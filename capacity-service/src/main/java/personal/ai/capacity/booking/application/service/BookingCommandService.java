package personal.ai.capacity.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.ai.capacity.booking.application.port.in.*;
import personal.ai.capacity.booking.application.port.out.BookingRepository;
import personal.ai.capacity.booking.domain.exception.BookingNotFoundException;
import personal.ai.capacity.booking.domain.model.Booking;
import personal.ai.capacity.booking.domain.model.BookingStatus;
import personal.ai.capacity.lock.application.port.out.ReservationLockRepository;
import personal.ai.capacity.lock.domain.exception.ExpiredOrMismatchedLockException;
import personal.ai.capacity.lock.domain.model.ReservationLock;
import personal.ai.capacity.slot.application.port.out.SlotRepository;
import personal.ai.capacity.slot.domain.exception.SlotNotFoundException;
import personal.ai.capacity.slot.domain.model.Slot;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.Clock;
import java.time.Instant;

/**
 * Booking Command Service
 * 예약 쓰기 경로 (생성, 상태 변경, 인원 변경, 일정 변경)
 * <p>
 * 이 서비스는 슬롯 카운터를 직접 바꾸지 않는다. 용량 검증만 하고,
 * 원장 반영은 BookingRepository.save 가 같은 트랜잭션에서 CapacityMutationTrigger로 처리한다.
 * 락 순서: 예약 행 -> 슬롯 행(id 오름차순)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingCommandService implements CreateBookingUseCase, ChangeBookingStatusUseCase,
        ChangeBookingQuantityUseCase, RescheduleBookingUseCase {

    private final BookingRepository bookingRepository;
    private final SlotRepository slotRepository;
    private final ReservationLockRepository lockRepository;
    private final Clock clock;

    @Override
    @Transactional
    public Booking createBooking(CreateBookingCommand command) {
        // 1. 슬롯 행 배타 락 (홀드 획득과 같은 직렬화 지점)
        Slot slot = lockSlot(command.slotId());
        Instant now = clock.instant();
        BookingStatus status = command.resolvedStatus();

        // 2. 홀드 검증: 보유자, 슬롯, 수량, 만료
        ReservationLock lock = null;
        if (command.lockId() != null) {
            lock = lockRepository.findById(command.lockId())
                    .orElseThrow(() -> new ExpiredOrMismatchedLockException(command.lockId()));
            lock.ensureCovers(command.holderId(), slot.id(), command.quantity(), now);
        }

        // 3. 용량 검증 (자기 홀드는 제외한 유효 가용량 기준)
        if (status.consumesCapacity()) {
            slot.ensureOpen();
            int heldByOthers = lock == null
                    ? lockRepository.sumActiveQuantity(slot.id(), now)
                    : lockRepository.sumActiveQuantityExcluding(slot.id(), lock.id(), now);
            slot.ensureCanReserve(command.quantity(), heldByOthers);
        }

        // 4. 저장 (원장 반영 포함) 후 소비된 홀드 삭제
        Booking saved = bookingRepository.save(
                Booking.create(slot.id(), command.quantity(), status, command.holderId(), now));
        if (lock != null) {
            lockRepository.deleteById(lock.id());
        }

        log.info("Booking created: bookingId={}, slotId={}, quantity={}, status={}, lockId={}",
                saved.id(), saved.slotId(), saved.quantity(), saved.status(), command.lockId());
        return saved;
    }

    @Override
    @Transactional
    public Booking changeStatus(Long bookingId, BookingStatus newStatus) {
        Booking booking = lockBooking(bookingId);
        if (booking.status() == newStatus) {
            return booking;
        }

        Instant now = clock.instant();

        // 취소 -> 소비 상태 복귀는 용량을 다시 차지하므로 오픈 여부와 가용량 검증
        if (!booking.consumesCapacity() && newStatus.consumesCapacity()) {
            Slot slot = lockSlot(booking.slotId());
            slot.ensureOpen();
            slot.ensureCanReserve(booking.quantity(), lockRepository.sumActiveQuantity(slot.id(), now));
        }

        Booking saved = bookingRepository.save(booking.changeStatus(newStatus, now));
        log.info("Booking status changed: bookingId={}, {} -> {}", bookingId, booking.status(), newStatus);
        return saved;
    }

    @Override
    @Transactional
    public Booking changeQuantity(Long bookingId, int newQuantity) {
        if (newQuantity < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Quantity must be positive");
        }

        Booking booking = lockBooking(bookingId);
        if (booking.quantity() == newQuantity) {
            return booking;
        }

        Instant now = clock.instant();
        Booking changed = booking.changeQuantity(newQuantity, now);

        // 늘어나는 만큼만 검증 (닫힌 슬롯은 증원 불가)
        int growth = newQuantity - booking.quantity();
        if (booking.consumesCapacity() && growth > 0) {
            Slot slot = lockSlot(booking.slotId());
            slot.ensureOpen();
            slot.ensureCanReserve(growth, lockRepository.sumActiveQuantity(slot.id(), now));
        }

        Booking saved = bookingRepository.save(changed);
        log.info("Booking quantity changed: bookingId={}, {} -> {}", bookingId, booking.quantity(), newQuantity);
        return saved;
    }

    @Override
    @Transactional
    public Booking reschedule(Long bookingId, Long newSlotId) {
        Booking booking = lockBooking(bookingId);
        booking.ensureReschedulable();
        if (booking.slotId().equals(newSlotId)) {
            return booking;
        }

        // 두 슬롯을 id 오름차순으로 락 (트리거와 같은 순서)
        Slot currentSlot;
        Slot targetSlot;
        if (booking.slotId() < newSlotId) {
            currentSlot = lockSlot(booking.slotId());
            targetSlot = lockSlot(newSlotId);
        } else {
            targetSlot = lockSlot(newSlotId);
            currentSlot = lockSlot(booking.slotId());
        }

        if (!currentSlot.serviceId().equals(targetSlot.serviceId())) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Cannot move booking to another service: bookingId=%d, fromSlot=%d, toSlot=%d",
                            bookingId, currentSlot.id(), targetSlot.id()));
        }

        Instant now = clock.instant();
        targetSlot.ensureOpen();
        if (booking.consumesCapacity()) {
            targetSlot.ensureCanReserve(booking.quantity(), lockRepository.sumActiveQuantity(targetSlot.id(), now));
        }

        Booking saved = bookingRepository.save(booking.moveTo(newSlotId, now));
        log.info("Booking rescheduled: bookingId={}, slotId {} -> {}", bookingId, currentSlot.id(), newSlotId);
        return saved;
    }

    private Booking lockBooking(Long bookingId) {
        return bookingRepository.findByIdForUpdate(bookingId)
                .orElseThrow(() -> {
                    log.warn("Booking not found: bookingId={}", bookingId);
                    return new BookingNotFoundException(bookingId);
                });
    }

    private Slot lockSlot(Long slotId) {
        return slotRepository.findByIdForUpdate(slotId)
                .orElseThrow(() -> new SlotNotFoundException(slotId));
    }
}
