package personal.slotbook.core.booking.adapter.in.web;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.slotbook.core.booking.adapter.in.web.dto.AvailabilityStatisticsResponse;
import personal.slotbook.core.booking.adapter.in.web.dto.AvailableSlotResponse;
import personal.slotbook.core.booking.adapter.in.web.dto.DayAvailabilityResponse;
import personal.slotbook.core.booking.application.port.in.FindNextAvailableSlotUseCase;
import personal.slotbook.core.booking.application.port.in.GetAvailabilityStatisticsUseCase;
import personal.slotbook.core.booking.application.port.in.GetDayAvailabilityUseCase;
import personal.slotbook.core.booking.application.port.in.GetRangeAvailabilityUseCase;

import java.time.LocalDate;
import java.util.List;

/**
 * Availability API Controller
 * 예약 가능 슬롯 조회 REST API (읽기 전용)
 * 조회 결과는 참고용이며 실제 예약 가능 여부는 예약 생성 시점에 다시 검사됨
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/businesses/{businessId}/availability")
@RequiredArgsConstructor
public class AvailabilityController {

    private static final int MAX_DURATION_MINUTES = 24 * 60;

    private final GetDayAvailabilityUseCase getDayAvailabilityUseCase;
    private final GetRangeAvailabilityUseCase getRangeAvailabilityUseCase;
    private final FindNextAvailableSlotUseCase findNextAvailableSlotUseCase;
    private final GetAvailabilityStatisticsUseCase getAvailabilityStatisticsUseCase;

    /**
     * 하루 예약 가능 슬롯 조회
     * GET /api/v1/businesses/{businessId}/availability?date=2025-01-06&duration=60&staffId=
     */
    @GetMapping
    public ResponseEntity<DayAvailabilityResponse> getDayAvailability(
            @PathVariable Long businessId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam @Min(1) @Max(MAX_DURATION_MINUTES) int duration,
            @RequestParam(required = false) Long staffId
    ) {
        log.info("Get day availability: businessId={}, date={}, duration={}, staffId={}",
                businessId, date, duration, staffId);

        return ResponseEntity.ok(DayAvailabilityResponse.from(
                getDayAvailabilityUseCase.getDayAvailability(businessId, date, duration, staffId)));
    }

    /**
     * 기간 예약 가능 슬롯 조회
     * GET /api/v1/businesses/{businessId}/availability/range?startDate=&endDate=&duration=
     */
    @GetMapping("/range")
    public ResponseEntity<List<DayAvailabilityResponse>> getRangeAvailability(
            @PathVariable Long businessId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam @Min(1) @Max(MAX_DURATION_MINUTES) int duration,
            @RequestParam(required = false) Long staffId
    ) {
        log.info("Get range availability: businessId={}, startDate={}, endDate={}, duration={}, staffId={}",
                businessId, startDate, endDate, duration, staffId);

        List<DayAvailabilityResponse> response = getRangeAvailabilityUseCase
                .getRangeAvailability(businessId, startDate, endDate, duration, staffId)
                .stream()
                .map(DayAvailabilityResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }

    /**
     * 다음 예약 가능 슬롯 조회
     * GET /api/v1/businesses/{businessId}/availability/next?from=&duration=&horizonDays=
     * 탐색 범위 내에 없으면 204 No Content
     */
    @GetMapping("/next")
    public ResponseEntity<AvailableSlotResponse> findNextAvailableSlot(
            @PathVariable Long businessId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @Min(1) @Max(MAX_DURATION_MINUTES) int duration,
            @RequestParam(required = false) Long staffId,
            @RequestParam(required = false) @Min(1) Integer horizonDays
    ) {
        log.info("Find next available slot: businessId={}, from={}, duration={}, staffId={}, horizonDays={}",
                businessId, from, duration, staffId, horizonDays);

        return findNextAvailableSlotUseCase
                .findNextAvailableSlot(businessId, duration, staffId, from, horizonDays)
                .map(slot -> ResponseEntity.ok(AvailableSlotResponse.from(slot)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    /**
     * 기간 이용률 통계
     * GET /api/v1/businesses/{businessId}/availability/statistics?startDate=&endDate=&duration=
     */
    @GetMapping("/statistics")
    public ResponseEntity<AvailabilityStatisticsResponse> getStatistics(
            @PathVariable Long businessId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam @Min(1) @Max(MAX_DURATION_MINUTES) int duration,
            @RequestParam(required = false) Long staffId
    ) {
        log.info("Get availability statistics: businessId={}, startDate={}, endDate={}, duration={}",
                businessId, startDate, endDate, duration);

        return ResponseEntity.ok(AvailabilityStatisticsResponse.from(
                getAvailabilityStatisticsUseCase.getStatistics(businessId, startDate, endDate, duration, staffId)));
    }
}
