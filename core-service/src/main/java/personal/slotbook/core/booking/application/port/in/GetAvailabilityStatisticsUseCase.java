package personal.slotbook.core.booking.application.port.in;

import personal.slotbook.core.booking.domain.model.AvailabilityStatistics;

import java.time.LocalDate;

/**
 * Get Availability Statistics UseCase (Input Port)
 * 기간 내 슬롯 이용률 통계
 */
public interface GetAvailabilityStatisticsUseCase {

    AvailabilityStatistics getStatistics(Long businessId, LocalDate startDate, LocalDate endDate,
                                         int durationMinutes, Long staffId);
}
