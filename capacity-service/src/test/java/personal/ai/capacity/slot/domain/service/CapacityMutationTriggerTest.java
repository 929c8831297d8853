package personal.ai.capacity.slot.domain.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.ai.capacity.slot.application.port.out.SlotRepository;
import personal.ai.capacity.slot.domain.exception.SlotNotFoundException;
import personal.ai.capacity.slot.domain.model.CapacityCharge;
import personal.ai.capacity.slot.domain.model.Slot;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CapacityMutationTrigger 단위 테스트")
class CapacityMutationTriggerTest {

    private static final Long BOOKING_ID = 1L;
    private static final Instant STARTS_AT = Instant.parse("2026-03-02T00:00:00Z");

    @Mock
    private SlotRepository slotRepository;

    private SimpleMeterRegistry meterRegistry;
    private CapacityMutationTrigger trigger;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        trigger = new CapacityMutationTrigger(slotRepository, meterRegistry);
    }

    private Slot slot(Long id, int total, int committed) {
        return new Slot(id, 1L, 10L, 100L, null, LocalDate.of(2026, 3, 2),
                LocalTime.of(9, 0), LocalTime.of(10, 0), STARTS_AT, STARTS_AT.plusSeconds(3600),
                total, total - committed, committed, true);
    }

    private Slot savedSlot() {
        ArgumentCaptor<Slot> captor = ArgumentCaptor.forClass(Slot.class);
        verify(slotRepository).save(captor.capture());
        return captor.getValue();
    }

    private double violations() {
        return meterRegistry.counter("capacity.invariant.violations").count();
    }

    @Test
    @DisplayName("소비 상태 예약 생성 시 수량만큼 차감된다")
    void create_ChargesQuantity() {
        // given
        given(slotRepository.findByIdForUpdate(10L)).willReturn(Optional.of(slot(10L, 5, 0)));

        // when
        trigger.onBookingWritten(BOOKING_ID, CapacityCharge.none(), new CapacityCharge(10L, 2));

        // then
        Slot saved = savedSlot();
        assertThat(saved.committedCount()).isEqualTo(2);
        assertThat(saved.availableCapacity()).isEqualTo(3);
        assertThat(violations()).isZero();
    }

    @Test
    @DisplayName("소비 상태끼리의 전환(PENDING -> CONFIRMED)은 원장을 건드리지 않는다")
    void consumingToConsuming_NoChange() {
        // when
        trigger.onBookingWritten(BOOKING_ID, new CapacityCharge(10L, 2), new CapacityCharge(10L, 2));

        // then
        verifyNoInteractions(slotRepository);
    }

    @Test
    @DisplayName("비소비 상태끼리의 변경은 원장을 건드리지 않는다")
    void nonConsumingToNonConsuming_NoChange() {
        trigger.onBookingWritten(BOOKING_ID, CapacityCharge.none(), CapacityCharge.none());

        verifyNoInteractions(slotRepository);
    }

    @Test
    @DisplayName("취소되면 수량만큼 반환된다")
    void cancel_ReleasesQuantity() {
        // given
        given(slotRepository.findByIdForUpdate(10L)).willReturn(Optional.of(slot(10L, 5, 2)));

        // when
        trigger.onBookingWritten(BOOKING_ID, new CapacityCharge(10L, 2), CapacityCharge.none());

        // then
        Slot saved = savedSlot();
        assertThat(saved.committedCount()).isZero();
        assertThat(saved.availableCapacity()).isEqualTo(5);
    }

    @Test
    @DisplayName("소비 상태 유지 중 인원 변경은 차이만큼만 반영된다")
    void quantityChange_AppliesDelta() {
        // given
        given(slotRepository.findByIdForUpdate(10L)).willReturn(Optional.of(slot(10L, 5, 2)));

        // when
        trigger.onBookingWritten(BOOKING_ID, new CapacityCharge(10L, 2), new CapacityCharge(10L, 3));

        // then
        Slot saved = savedSlot();
        assertThat(saved.committedCount()).isEqualTo(3);
        assertThat(saved.availableCapacity()).isEqualTo(2);
    }

    @Test
    @DisplayName("슬롯 변경 시 기존 슬롯 반환, 새 슬롯 차감을 슬롯 id 오름차순 락으로 처리한다")
    void reschedule_LocksInAscendingOrder() {
        // given
        given(slotRepository.findByIdForUpdate(11L)).willReturn(Optional.of(slot(11L, 5, 0)));
        given(slotRepository.findByIdForUpdate(20L)).willReturn(Optional.of(slot(20L, 5, 2)));

        // when: 20번 -> 11번 슬롯으로 이동
        trigger.onBookingWritten(BOOKING_ID, new CapacityCharge(20L, 2), new CapacityCharge(11L, 2));

        // then
        InOrder inOrder = inOrder(slotRepository);
        inOrder.verify(slotRepository).findByIdForUpdate(11L);
        inOrder.verify(slotRepository).findByIdForUpdate(20L);

        ArgumentCaptor<Slot> captor = ArgumentCaptor.forClass(Slot.class);
        verify(slotRepository, times(2)).save(captor.capture());
        List<Slot> saved = captor.getAllValues();
        assertThat(saved).filteredOn(s -> s.id() == 20L).singleElement()
                .satisfies(s -> assertThat(s.committedCount()).isZero());
        assertThat(saved).filteredOn(s -> s.id() == 11L).singleElement()
                .satisfies(s -> assertThat(s.committedCount()).isEqualTo(2));
    }

    @Test
    @DisplayName("범위를 넘는 차감은 잘라서 반영하고 불변식 위반 카운터를 올리되 실패시키지 않는다")
    void overflow_ClampedAndReported() {
        // given
        given(slotRepository.findByIdForUpdate(10L)).willReturn(Optional.of(slot(10L, 5, 4)));

        // when
        trigger.onBookingWritten(BOOKING_ID, CapacityCharge.none(), new CapacityCharge(10L, 3));

        // then
        Slot saved = savedSlot();
        assertThat(saved.committedCount()).isEqualTo(5);
        assertThat(saved.availableCapacity()).isZero();
        assertThat(violations()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("슬롯이 없으면 예외로 예약 쓰기 전체를 되돌린다")
    void missingSlot_Throws() {
        given(slotRepository.findByIdForUpdate(10L)).willReturn(Optional.empty());

        assertThatThrownBy(() ->
                trigger.onBookingWritten(BOOKING_ID, CapacityCharge.none(), new CapacityCharge(10L, 1)))
                .isInstanceOf(SlotNotFoundException.class);
        verify(slotRepository, never()).save(any());
    }
}
