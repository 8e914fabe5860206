package personal.slotbook.core.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.slotbook.core.booking.application.config.AvailabilityProperties;
import personal.slotbook.core.booking.application.port.in.FindNextAvailableSlotUseCase;
import personal.slotbook.core.booking.application.port.in.GetAvailabilityStatisticsUseCase;
import personal.slotbook.core.booking.application.port.in.GetDayAvailabilityUseCase;
import personal.slotbook.core.booking.application.port.in.GetRangeAvailabilityUseCase;
import personal.slotbook.core.booking.domain.exception.InvalidIntervalException;
import personal.slotbook.core.booking.domain.model.AvailabilityStatistics;
import personal.slotbook.core.booking.domain.model.AvailableSlot;
import personal.slotbook.core.booking.domain.model.DayAvailability;
import personal.slotbook.core.booking.domain.model.TimeSlot;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Availability Query Service (Query Facade)
 * 하루/기간 조회, 다음 예약 가능 슬롯 탐색, 이용률 통계
 * 모든 조회는 AvailabilityResolver를 거치며 탐색/조회 기간은 maxHorizonDays로 제한
 * 저장소 장애는 StoreUnavailableException으로 변환 (재시도 가능한 503)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvailabilityQueryService implements
        GetDayAvailabilityUseCase,
        GetRangeAvailabilityUseCase,
        FindNextAvailableSlotUseCase,
        GetAvailabilityStatisticsUseCase {

    private final AvailabilityResolver availabilityResolver;
    private final AvailabilityProperties availabilityProperties;

    @Override
    public DayAvailability getDayAvailability(Long businessId, LocalDate date, int durationMinutes, Long staffId) {
        log.debug("Getting day availability: businessId={}, date={}, duration={}, staffId={}",
                businessId, date, durationMinutes, staffId);
        return StoreOperations.execute("getDayAvailability",
                () -> availabilityResolver.resolve(businessId, date, durationMinutes, staffId));
    }

    @Override
    public List<DayAvailability> getRangeAvailability(Long businessId, LocalDate startDate, LocalDate endDate,
                                                      int durationMinutes, Long staffId) {
        validateRange(startDate, endDate);
        return StoreOperations.execute("getRangeAvailability",
                () -> resolveRange(businessId, startDate, endDate, durationMinutes, staffId));
    }

    @Override
    public Optional<AvailableSlot> findNextAvailableSlot(Long businessId, int durationMinutes, Long staffId,
                                                         LocalDate fromDate, Integer horizonDays) {
        int horizon = horizonDays == null ? availabilityProperties.defaultHorizonDays() : horizonDays;
        if (horizon <= 0) {
            throw new InvalidIntervalException("Horizon must be positive: " + horizon);
        }
        int boundedHorizon = Math.min(horizon, availabilityProperties.maxHorizonDays());
        return StoreOperations.execute("findNextAvailableSlot",
                () -> scanForward(businessId, durationMinutes, staffId, fromDate, boundedHorizon));
    }

    @Override
    public AvailabilityStatistics getStatistics(Long businessId, LocalDate startDate, LocalDate endDate,
                                                int durationMinutes, Long staffId) {
        validateRange(startDate, endDate);
        return StoreOperations.execute("getStatistics", () -> AvailabilityStatistics.aggregate(
                resolveRange(businessId, startDate, endDate, durationMinutes, staffId)));
    }

    private List<DayAvailability> resolveRange(Long businessId, LocalDate startDate, LocalDate endDate,
                                               int durationMinutes, Long staffId) {
        List<DayAvailability> days = new ArrayList<>();
        for (LocalDate date = startDate; !date.isAfter(endDate); date = date.plusDays(1)) {
            days.add(availabilityResolver.resolve(businessId, date, durationMinutes, staffId));
        }
        return days;
    }

    private Optional<AvailableSlot> scanForward(Long businessId, int durationMinutes, Long staffId,
                                                LocalDate fromDate, int horizon) {
        for (int offset = 0; offset < horizon; offset++) {
            LocalDate date = fromDate.plusDays(offset);
            DayAvailability day = availabilityResolver.resolve(businessId, date, durationMinutes, staffId);
            Optional<TimeSlot> slot = day.firstAvailableSlot();
            if (slot.isPresent()) {
                log.debug("Next available slot found: businessId={}, date={}, start={}",
                        businessId, date, slot.get().startTime());
                return Optional.of(AvailableSlot.of(date, slot.get()));
            }
        }

        log.debug("No available slot within horizon: businessId={}, from={}, horizonDays={}",
                businessId, fromDate, horizon);
        return Optional.empty();
    }

    private void validateRange(LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null) {
            throw new InvalidIntervalException("Start date and end date are required");
        }
        if (startDate.isAfter(endDate)) {
            throw new InvalidIntervalException(
                    String.format("Start date must not be after end date: %s ~ %s", startDate, endDate));
        }
        long days = ChronoUnit.DAYS.between(startDate, endDate) + 1;
        if (days > availabilityProperties.maxHorizonDays()) {
            throw new InvalidIntervalException(
                    String.format("Range exceeds %d days: %s ~ %s",
                            availabilityProperties.maxHorizonDays(), startDate, endDate));
        }
    }
}
