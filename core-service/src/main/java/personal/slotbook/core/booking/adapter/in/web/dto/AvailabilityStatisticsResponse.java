package personal.slotbook.core.booking.adapter.in.web.dto;

import personal.slotbook.core.booking.domain.model.AvailabilityStatistics;

/**
 * 이용률 통계 응답 DTO
 */
public record AvailabilityStatisticsResponse(
        int totalSlots,
        int availableSlots,
        int bookedSlots,
        int blockedCount,
        double utilizationRate
) {
    public static AvailabilityStatisticsResponse from(AvailabilityStatistics statistics) {
        return new AvailabilityStatisticsResponse(
                statistics.totalSlots(),
                statistics.availableSlots(),
                statistics.bookedSlots(),
                statistics.blockedCount(),
                statistics.utilizationRate()
        );
    }
}
