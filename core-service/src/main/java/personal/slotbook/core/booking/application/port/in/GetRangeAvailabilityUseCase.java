package personal.slotbook.core.booking.application.port.in;

import personal.slotbook.core.booking.domain.model.DayAvailability;

import java.time.LocalDate;
import java.util.List;

/**
 * Get Range Availability UseCase (Input Port)
 */
public interface GetRangeAvailabilityUseCase {

    /**
     * 기간 [startDate, endDate] 의 날짜별 예약 가능 정보 조회
     *
     * @return 날짜 오름차순 목록 (휴무일 포함)
     * @throws personal.slotbook.core.booking.domain.exception.InvalidIntervalException 시작일이 종료일 이후이거나 최대 조회 기간 초과
     */
    List<DayAvailability> getRangeAvailability(Long businessId, LocalDate startDate, LocalDate endDate,
                                               int durationMinutes, Long staffId);
}
