package personal.ai.capacity.slot.adapter.in.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import personal.ai.capacity.slot.application.port.in.ChangeSlotOpenUseCase;
import personal.ai.capacity.slot.application.port.in.GetSlotAvailabilityUseCase;
import personal.ai.capacity.slot.domain.exception.SlotNotFoundException;
import personal.ai.capacity.slot.domain.model.SlotAvailability;

import java.time.LocalDate;
import java.util.List;

import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;
import static personal.ai.capacity.support.CapacityFixtures.slot;

@WebMvcTest(SlotController.class)
@DisplayName("Slot API 단위 테스트")
class SlotControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GetSlotAvailabilityUseCase getSlotAvailabilityUseCase;
    @MockBean
    private ChangeSlotOpenUseCase changeSlotOpenUseCase;

    @Test
    @DisplayName("슬롯 목록은 원장 값과 홀드 반영 유효 가용량을 함께 보여준다")
    void listSlots() throws Exception {
        // given: 용량 5, 예약 1, 홀드 3
        LocalDate day = LocalDate.of(2026, 3, 2);
        given(getSlotAvailabilityUseCase.listSlots(100L, day, day))
                .willReturn(List.of(new SlotAvailability(slot(1L, 5, 1), 3)));

        // when & then
        mockMvc.perform(get("/api/v1/shifts/100/slots")
                        .param("from", "2026-03-02")
                        .param("to", "2026-03-02"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].slotId").value(1))
                .andExpect(jsonPath("$.data[0].availableCapacity").value(4))
                .andExpect(jsonPath("$.data[0].committedCount").value(1))
                .andExpect(jsonPath("$.data[0].heldQuantity").value(3))
                .andExpect(jsonPath("$.data[0].effectiveAvailable").value(1));
    }

    @Test
    @DisplayName("날짜 형식이 잘못되면 400")
    void listSlots_BadDate() throws Exception {
        mockMvc.perform(get("/api/v1/shifts/100/slots")
                        .param("from", "03/02/2026")
                        .param("to", "2026-03-02"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(getSlotAvailabilityUseCase);
    }

    @Test
    @DisplayName("없는 슬롯 조회는 404")
    void getSlot_NotFound() throws Exception {
        given(getSlotAvailabilityUseCase.getSlot(9L)).willThrow(new SlotNotFoundException(9L));

        mockMvc.perform(get("/api/v1/slots/9"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("S002"));
    }

    @Test
    @DisplayName("슬롯 마감")
    void closeSlot() throws Exception {
        given(changeSlotOpenUseCase.changeOpen(1L, false)).willReturn(slot(1L, 5, 0).withOpen(false));

        mockMvc.perform(patch("/api/v1/slots/1/open")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"open\": false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.open").value(false));
    }
}
