package personal.slotbook.core.booking.adapter.in.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.web.servlet.MockMvc;
import personal.slotbook.core.booking.application.port.in.FindNextAvailableSlotUseCase;
import personal.slotbook.core.booking.application.port.in.GetAvailabilityStatisticsUseCase;
import personal.slotbook.core.booking.application.port.in.GetDayAvailabilityUseCase;
import personal.slotbook.core.booking.application.port.in.GetRangeAvailabilityUseCase;
import personal.slotbook.core.booking.domain.exception.BusinessNotFoundException;
import personal.slotbook.core.booking.domain.exception.StoreUnavailableException;
import personal.slotbook.core.booking.domain.model.AvailableSlot;
import personal.slotbook.core.booking.domain.model.BlockedInterval;
import personal.slotbook.core.booking.domain.model.DayAvailability;
import personal.slotbook.core.booking.domain.model.TimeRange;
import personal.slotbook.core.booking.domain.model.TimeSlot;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AvailabilityController.class)
@DisplayName("Availability API 단위 테스트")
class AvailabilityControllerTest {

    private static final LocalDate MONDAY = LocalDate.of(2025, 3, 3);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GetDayAvailabilityUseCase getDayAvailabilityUseCase;
    @MockBean
    private GetRangeAvailabilityUseCase getRangeAvailabilityUseCase;
    @MockBean
    private FindNextAvailableSlotUseCase findNextAvailableSlotUseCase;
    @MockBean
    private GetAvailabilityStatisticsUseCase getAvailabilityStatisticsUseCase;

    @Test
    @DisplayName("하루 조회 응답은 HH:MM 문자열과 isOpen 필드 사용")
    void getDayAvailability() throws Exception {
        DayAvailability day = new DayAvailability(MONDAY, true, LocalTime.of(9, 0), LocalTime.of(17, 0),
                List.of(TimeSlot.available(TimeRange.of("09:00", "10:00")),
                        TimeSlot.available(TimeRange.of("10:00", "11:00")).withAvailability(false, null)),
                List.of(new BlockedInterval(5L, TimeRange.of("10:00", "10:30"), "회의")));
        given(getDayAvailabilityUseCase.getDayAvailability(1L, MONDAY, 60, null)).willReturn(day);

        mockMvc.perform(get("/api/v1/businesses/1/availability")
                        .param("date", "2025-03-03")
                        .param("duration", "60"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.date").value("2025-03-03"))
                .andExpect(jsonPath("$.isOpen").value(true))
                .andExpect(jsonPath("$.openTime").value("09:00"))
                .andExpect(jsonPath("$.slots[0].startTime").value("09:00"))
                .andExpect(jsonPath("$.slots[0].available").value(true))
                .andExpect(jsonPath("$.slots[1].available").value(false))
                .andExpect(jsonPath("$.blockedSlots[0].reason").value("회의"));
    }

    @Test
    @DisplayName("소요 시간이 0이면 400")
    void getDayAvailability_InvalidDuration() throws Exception {
        mockMvc.perform(get("/api/v1/businesses/1/availability")
                        .param("date", "2025-03-03")
                        .param("duration", "0"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(getDayAvailabilityUseCase);
    }

    @Test
    @DisplayName("존재하지 않는 업체면 404")
    void getDayAvailability_BusinessNotFound() throws Exception {
        given(getDayAvailabilityUseCase.getDayAvailability(any(), any(), anyInt(), any()))
                .willThrow(new BusinessNotFoundException(99L));

        mockMvc.perform(get("/api/v1/businesses/99/availability")
                        .param("date", "2025-03-03")
                        .param("duration", "60"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("S001"));
    }

    @Test
    @DisplayName("조회 중 저장소 장애면 503")
    void getDayAvailability_StoreUnavailable() throws Exception {
        given(getDayAvailabilityUseCase.getDayAvailability(any(), any(), anyInt(), any()))
                .willThrow(new StoreUnavailableException("getDayAvailability",
                        new DataAccessResourceFailureException("db down")));

        mockMvc.perform(get("/api/v1/businesses/1/availability")
                        .param("date", "2025-03-03")
                        .param("duration", "60"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("E001"));
    }

    @Test
    @DisplayName("다음 예약 가능 슬롯이 없으면 204")
    void findNext_NoContent() throws Exception {
        given(findNextAvailableSlotUseCase.findNextAvailableSlot(1L, 60, null, MONDAY, null))
                .willReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/businesses/1/availability/next")
                        .param("from", "2025-03-03")
                        .param("duration", "60"))
                .andExpect(status().isNoContent());
    }

    @Test
    @DisplayName("다음 예약 가능 슬롯 조회")
    void findNext() throws Exception {
        given(findNextAvailableSlotUseCase.findNextAvailableSlot(1L, 60, 7L, MONDAY, 14))
                .willReturn(Optional.of(new AvailableSlot(MONDAY.plusDays(1), LocalTime.of(9, 0), LocalTime.of(10, 0), 7L)));

        mockMvc.perform(get("/api/v1/businesses/1/availability/next")
                        .param("from", "2025-03-03")
                        .param("duration", "60")
                        .param("staffId", "7")
                        .param("horizonDays", "14"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.date").value("2025-03-04"))
                .andExpect(jsonPath("$.startTime").value("09:00"))
                .andExpect(jsonPath("$.staffId").value(7));
    }
}
