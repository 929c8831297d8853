package personal.ai.capacity.lock.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.ai.capacity.lock.application.port.in.AcquireLockCommand;
import personal.ai.capacity.lock.application.port.out.ReservationLockRepository;
import personal.ai.capacity.lock.domain.exception.ExpiredOrMismatchedLockException;
import personal.ai.capacity.lock.domain.exception.LockNotFoundException;
import personal.ai.capacity.lock.domain.model.ReservationLock;
import personal.ai.capacity.slot.application.port.out.SlotRepository;
import personal.ai.capacity.slot.domain.exception.CapacityExceededException;
import personal.ai.capacity.slot.domain.exception.SlotNotFoundException;
import personal.ai.capacity.slot.domain.exception.SlotNotOpenException;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.*;
import static personal.ai.capacity.support.CapacityFixtures.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReservationLockService 단위 테스트")
class ReservationLockServiceTest {

    private static final Long SLOT_ID = 10L;
    private static final String HOLDER = "session-a";

    @Mock
    private SlotRepository slotRepository;
    @Mock
    private ReservationLockRepository lockRepository;

    private ReservationLockService lockService;

    @BeforeEach
    void setUp() {
        lockService = new ReservationLockService(slotRepository, lockRepository, properties(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("용량 5 슬롯: 3 홀드 성공 -> 3 홀드 실패(남은 2) -> 2 홀드 성공")
    void acquire_CapacityScenario() {
        // given
        given(slotRepository.findByIdForUpdate(SLOT_ID)).willReturn(Optional.of(slot(SLOT_ID, 5, 0)));
        given(lockRepository.sumActiveQuantity(SLOT_ID, NOW)).willReturn(0, 3, 3);
        given(lockRepository.save(any(ReservationLock.class))).willAnswer(inv -> inv.getArgument(0));

        // when
        ReservationLock first = lockService.acquireLock(new AcquireLockCommand(SLOT_ID, "a", 3, null));

        // then
        assertThat(first.quantity()).isEqualTo(3);
        assertThat(first.expiresAt()).isEqualTo(NOW.plusSeconds(120));

        assertThatThrownBy(() -> lockService.acquireLock(new AcquireLockCommand(SLOT_ID, "b", 3, null)))
                .isInstanceOf(CapacityExceededException.class)
                .satisfies(e -> assertThat(((CapacityExceededException) e).getAvailable()).isEqualTo(2));

        ReservationLock third = lockService.acquireLock(new AcquireLockCommand(SLOT_ID, "c", 2, null));
        assertThat(third.quantity()).isEqualTo(2);
        verify(lockRepository, times(2)).save(any(ReservationLock.class));
    }

    @Test
    @DisplayName("홀드는 슬롯 원장을 바꾸지 않는다")
    void acquire_DoesNotTouchLedger() {
        // given
        given(slotRepository.findByIdForUpdate(SLOT_ID)).willReturn(Optional.of(slot(SLOT_ID, 5, 0)));
        given(lockRepository.sumActiveQuantity(SLOT_ID, NOW)).willReturn(0);
        given(lockRepository.save(any(ReservationLock.class))).willAnswer(inv -> inv.getArgument(0));

        // when
        lockService.acquireLock(new AcquireLockCommand(SLOT_ID, HOLDER, 2, 60));

        // then
        verify(slotRepository, never()).save(any());
    }

    @Test
    @DisplayName("슬롯이 없으면 SlotNotFoundException, 닫힌 슬롯이면 SlotNotOpenException")
    void acquire_MissingOrClosedSlot() {
        given(slotRepository.findByIdForUpdate(1L)).willReturn(Optional.empty());
        given(slotRepository.findByIdForUpdate(2L)).willReturn(Optional.of(slot(2L, 10L, 5, 5, 0, false)));

        assertThatThrownBy(() -> lockService.acquireLock(new AcquireLockCommand(1L, HOLDER, 1, null)))
                .isInstanceOf(SlotNotFoundException.class);
        assertThatThrownBy(() -> lockService.acquireLock(new AcquireLockCommand(2L, HOLDER, 1, null)))
                .isInstanceOf(SlotNotOpenException.class);
        verify(lockRepository, never()).save(any());
    }

    @Test
    @DisplayName("TTL이 최대값을 넘으면 INVALID_INPUT")
    void acquire_TtlTooLong() {
        assertThatThrownBy(() -> lockService.acquireLock(new AcquireLockCommand(SLOT_ID, HOLDER, 1, 901)))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_INPUT));
        verifyNoInteractions(slotRepository);
    }

    @Test
    @DisplayName("홀드 검증: 보유자 일치 + 미만료면 true, 만료/불일치/없음이면 false")
    void validateLock() {
        // given
        ReservationLock live = ReservationLock.create(SLOT_ID, HOLDER, 1, Duration.ofSeconds(60), NOW.minusSeconds(30));
        ReservationLock expired = ReservationLock.create(SLOT_ID, HOLDER, 1, Duration.ofSeconds(1), NOW.minusSeconds(2));
        UUID missing = UUID.randomUUID();
        given(lockRepository.findById(live.id())).willReturn(Optional.of(live));
        given(lockRepository.findById(expired.id())).willReturn(Optional.of(expired));
        given(lockRepository.findById(missing)).willReturn(Optional.empty());

        // then
        assertThat(lockService.validateLock(live.id(), HOLDER)).isTrue();
        assertThat(lockService.validateLock(live.id(), "someone-else")).isFalse();
        assertThat(lockService.validateLock(expired.id(), HOLDER)).isFalse();
        assertThat(lockService.validateLock(missing, HOLDER)).isFalse();
    }

    @Test
    @DisplayName("홀드 수량 조회는 요청한 모든 슬롯을 포함하고 홀드가 없으면 0이다")
    void queryHeldCapacity_AllRequestedPresent() {
        // given
        given(lockRepository.sumActiveQuantityBySlotIds(anyCollection(), any())).willReturn(Map.of(1L, 3));

        // when
        Map<Long, Integer> held = lockService.queryHeldCapacity(List.of(1L, 2L, 3L));

        // then
        assertThat(held).containsExactly(Map.entry(1L, 3), Map.entry(2L, 0), Map.entry(3L, 0));
    }

    @Test
    @DisplayName("빈 슬롯 목록 조회는 저장소를 호출하지 않는다")
    void queryHeldCapacity_Empty() {
        assertThat(lockService.queryHeldCapacity(List.of())).isEmpty();
        verifyNoInteractions(lockRepository);
    }

    @Test
    @DisplayName("홀드 해제는 보유자만 가능하다")
    void releaseLock() {
        // given
        ReservationLock lock = ReservationLock.create(SLOT_ID, HOLDER, 1, Duration.ofSeconds(60), NOW);
        given(lockRepository.findById(lock.id())).willReturn(Optional.of(lock));

        // when & then
        assertThatThrownBy(() -> lockService.releaseLock(lock.id(), "intruder"))
                .isInstanceOf(ExpiredOrMismatchedLockException.class);
        verify(lockRepository, never()).deleteById(any());

        assertThat(lockService.releaseLock(lock.id(), HOLDER)).isTrue();
        verify(lockRepository).deleteById(lock.id());
    }

    @Test
    @DisplayName("이미 만료된 홀드도 해제로 지우지만 false 를 돌려준다")
    void releaseLock_Expired_ReturnsFalse() {
        // given: 2분 전에 60초 TTL로 잡은 홀드
        ReservationLock lock = ReservationLock.create(SLOT_ID, HOLDER, 1, Duration.ofSeconds(60),
                NOW.minusSeconds(120));
        given(lockRepository.findById(lock.id())).willReturn(Optional.of(lock));

        // when
        boolean released = lockService.releaseLock(lock.id(), HOLDER);

        // then
        assertThat(released).isFalse();
        verify(lockRepository).deleteById(lock.id());
    }

    @Test
    @DisplayName("없는 홀드 해제는 LockNotFoundException")
    void releaseLock_NotFound() {
        UUID lockId = UUID.randomUUID();
        given(lockRepository.findById(lockId)).willReturn(Optional.empty());

        assertThatThrownBy(() -> lockService.releaseLock(lockId, HOLDER))
                .isInstanceOf(LockNotFoundException.class);
    }

    @Test
    @DisplayName("만료 홀드 정리는 현재 시각 기준으로 삭제 수를 돌려준다")
    void sweepExpiredLocks() {
        given(lockRepository.deleteExpired(NOW)).willReturn(4);

        assertThat(lockService.sweepExpiredLocks()).isEqualTo(4);
    }
}
