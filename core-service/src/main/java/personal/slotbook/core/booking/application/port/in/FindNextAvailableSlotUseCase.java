package personal.slotbook.core.booking.application.port.in;

import personal.slotbook.core.booking.domain.model.AvailableSlot;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Find Next Available Slot UseCase (Input Port)
 */
public interface FindNextAvailableSlotUseCase {

    /**
     * fromDate부터 하루씩 탐색하여 첫 번째 예약 가능 슬롯 반환
     *
     * @param fromDate    탐색 기준일 (호출자가 명시적으로 전달)
     * @param horizonDays 탐색 일수 (null이면 기본값, 최대값으로 제한)
     * @return 예약 가능 슬롯, 탐색 범위 내에 없으면 Optional.empty()
     */
    Optional<AvailableSlot> findNextAvailableSlot(Long businessId, int durationMinutes, Long staffId,
                                                  LocalDate fromDate, Integer horizonDays);
}
