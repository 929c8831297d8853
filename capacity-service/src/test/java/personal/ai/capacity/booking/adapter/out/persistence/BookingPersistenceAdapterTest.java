package personal.ai.capacity.booking.adapter.out.persistence;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.ai.capacity.booking.application.port.out.BookingCapacityPort;
import personal.ai.capacity.booking.domain.exception.BookingNotFoundException;
import personal.ai.capacity.booking.domain.model.Booking;
import personal.ai.capacity.booking.domain.model.BookingStatus;
import personal.ai.capacity.slot.domain.model.CapacityCharge;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.*;
import static personal.ai.capacity.support.CapacityFixtures.NOW;

@ExtendWith(MockitoExtension.class)
@DisplayName("BookingPersistenceAdapter 단위 테스트")
class BookingPersistenceAdapterTest {

    private static final Long BOOKING_ID = 55L;
    private static final Long SLOT_ID = 7L;

    @Mock
    private JpaBookingRepository jpaBookingRepository;
    @Mock
    private BookingCapacityPort bookingCapacityPort;

    private BookingPersistenceAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new BookingPersistenceAdapter(jpaBookingRepository, bookingCapacityPort);
    }

    private Booking stored(int quantity, BookingStatus status) {
        return new Booking(BOOKING_ID, SLOT_ID, quantity, status, null, NOW, NOW);
    }

    @Test
    @DisplayName("신규 예약 저장은 (없음 -> 부과량)으로 원장에 반영한다")
    void save_Create_ChargesFromNone() {
        // given
        Booking created = Booking.create(SLOT_ID, 2, BookingStatus.PENDING, null, NOW);
        given(jpaBookingRepository.save(any(BookingEntity.class)))
                .willReturn(BookingEntity.fromDomain(stored(2, BookingStatus.PENDING)));

        // when
        Booking saved = adapter.save(created);

        // then
        assertThat(saved.id()).isEqualTo(BOOKING_ID);
        InOrder inOrder = inOrder(jpaBookingRepository, bookingCapacityPort);
        inOrder.verify(jpaBookingRepository).save(any(BookingEntity.class));
        inOrder.verify(bookingCapacityPort)
                .applyCapacityChange(BOOKING_ID, CapacityCharge.none(), new CapacityCharge(SLOT_ID, 2));
        verify(jpaBookingRepository, never()).findById(any());
    }

    @Test
    @DisplayName("PENDING -> CONFIRMED 는 변경 전후 부과량이 같다")
    void save_PendingToConfirmed_SameCharge() {
        // given
        given(jpaBookingRepository.findById(BOOKING_ID))
                .willReturn(Optional.of(BookingEntity.fromDomain(stored(2, BookingStatus.PENDING))));
        given(jpaBookingRepository.save(any(BookingEntity.class)))
                .willAnswer(inv -> inv.getArgument(0));

        // when
        adapter.save(stored(2, BookingStatus.CONFIRMED));

        // then
        verify(bookingCapacityPort).applyCapacityChange(BOOKING_ID,
                new CapacityCharge(SLOT_ID, 2), new CapacityCharge(SLOT_ID, 2));
    }

    @Test
    @DisplayName("CONFIRMED -> CANCELLED 는 변경 후 부과량이 없다")
    void save_ConfirmedToCancelled_ReleasesCharge() {
        // given
        given(jpaBookingRepository.findById(BOOKING_ID))
                .willReturn(Optional.of(BookingEntity.fromDomain(stored(3, BookingStatus.CONFIRMED))));
        given(jpaBookingRepository.save(any(BookingEntity.class)))
                .willAnswer(inv -> inv.getArgument(0));

        // when
        Booking saved = adapter.save(stored(3, BookingStatus.CANCELLED));

        // then
        assertThat(saved.status()).isEqualTo(BookingStatus.CANCELLED);
        verify(bookingCapacityPort).applyCapacityChange(BOOKING_ID,
                new CapacityCharge(SLOT_ID, 3), CapacityCharge.none());
    }

    @Test
    @DisplayName("저장소에 없는 id 로 저장하면 BookingNotFoundException, 원장은 건드리지 않는다")
    void save_UnknownId_NotFound() {
        given(jpaBookingRepository.findById(BOOKING_ID)).willReturn(Optional.empty());

        assertThatThrownBy(() -> adapter.save(stored(2, BookingStatus.CONFIRMED)))
                .isInstanceOf(BookingNotFoundException.class);
        verify(jpaBookingRepository, never()).save(any());
        verifyNoInteractions(bookingCapacityPort);
    }

    @Test
    @DisplayName("슬롯 예약 존재 여부: 빈 목록은 조회 없이 false")
    void existsBySlotIds() {
        given(jpaBookingRepository.existsBySlotIdIn(List.of(1L, 2L))).willReturn(true);

        assertThat(adapter.existsBySlotIds(List.of(1L, 2L))).isTrue();
        assertThat(adapter.existsBySlotIds(List.of())).isFalse();
        verify(jpaBookingRepository, times(1)).existsBySlotIdIn(any());
    }
}
