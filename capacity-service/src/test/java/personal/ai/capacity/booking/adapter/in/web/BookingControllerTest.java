package personal.ai.capacity.booking.adapter.in.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import personal.ai.capacity.booking.application.port.in.*;
import personal.ai.capacity.booking.domain.exception.BookingNotFoundException;
import personal.ai.capacity.booking.domain.exception.InvalidBookingStateException;
import personal.ai.capacity.booking.domain.model.Booking;
import personal.ai.capacity.booking.domain.model.BookingStatus;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(BookingController.class)
@DisplayName("Booking API 단위 테스트")
class BookingControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T00:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CreateBookingUseCase createBookingUseCase;
    @MockBean
    private ChangeBookingStatusUseCase changeBookingStatusUseCase;
    @MockBean
    private ChangeBookingQuantityUseCase changeBookingQuantityUseCase;
    @MockBean
    private RescheduleBookingUseCase rescheduleBookingUseCase;
    @MockBean
    private GetBookingUseCase getBookingUseCase;

    private Booking booking(BookingStatus status) {
        return new Booking(1L, 10L, 2, status, "checkout-1", NOW, NOW);
    }

    @Test
    @DisplayName("홀드와 보유자 헤더로 예약을 생성하면 201")
    void createBooking_WithLock() throws Exception {
        // given
        UUID lockId = UUID.randomUUID();
        given(createBookingUseCase.createBooking(any(CreateBookingCommand.class)))
                .willReturn(booking(BookingStatus.PENDING));

        // when
        mockMvc.perform(post("/api/v1/bookings")
                        .header("X-Holder-Id", "checkout-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"slotId\": 10, \"quantity\": 2, \"lockId\": \"" + lockId + "\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.bookingId").value(1))
                .andExpect(jsonPath("$.data.status").value("PENDING"));

        // then
        ArgumentCaptor<CreateBookingCommand> captor = ArgumentCaptor.forClass(CreateBookingCommand.class);
        verify(createBookingUseCase).createBooking(captor.capture());
        assertThat(captor.getValue().lockId()).isEqualTo(lockId);
        assertThat(captor.getValue().holderId()).isEqualTo("checkout-1");
    }

    @Test
    @DisplayName("홀드를 지정했는데 보유자 헤더가 없으면 400")
    void createBooking_LockWithoutHolder() throws Exception {
        mockMvc.perform(post("/api/v1/bookings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"slotId\": 10, \"quantity\": 2, \"lockId\": \"" + UUID.randomUUID() + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C001"));
    }

    @Test
    @DisplayName("알 수 없는 상태 값은 400")
    void changeStatus_UnknownStatus() throws Exception {
        mockMvc.perform(patch("/api/v1/bookings/1/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"TELEPORTED\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("예약 취소")
    void changeStatus_Cancel() throws Exception {
        given(changeBookingStatusUseCase.changeStatus(1L, BookingStatus.CANCELLED))
                .willReturn(booking(BookingStatus.CANCELLED));

        mockMvc.perform(patch("/api/v1/bookings/1/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"CANCELLED\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("CANCELLED"));
    }

    @Test
    @DisplayName("이용 완료 예약의 인원 변경은 400 INVALID_BOOKING_STATE")
    void changeQuantity_Completed() throws Exception {
        given(changeBookingQuantityUseCase.changeQuantity(1L, 3))
                .willThrow(new InvalidBookingStateException(1L, BookingStatus.COMPLETED, "change quantity"));

        mockMvc.perform(patch("/api/v1/bookings/1/quantity")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"quantity\": 3}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("B002"));
    }

    @Test
    @DisplayName("일정 변경")
    void reschedule() throws Exception {
        given(rescheduleBookingUseCase.reschedule(1L, 20L))
                .willReturn(new Booking(1L, 20L, 2, BookingStatus.CONFIRMED, null, NOW, NOW));

        mockMvc.perform(patch("/api/v1/bookings/1/slot")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"slotId\": 20}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.slotId").value(20));
    }

    @Test
    @DisplayName("없는 예약 조회는 404")
    void getBooking_NotFound() throws Exception {
        given(getBookingUseCase.getBooking(99L)).willThrow(new BookingNotFoundException(99L));

        mockMvc.perform(get("/api/v1/bookings/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("B001"));
    }
}
