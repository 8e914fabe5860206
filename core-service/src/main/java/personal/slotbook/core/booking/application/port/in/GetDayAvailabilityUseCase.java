package personal.slotbook.core.booking.application.port.in;

import personal.slotbook.core.booking.domain.model.DayAvailability;

import java.time.LocalDate;

/**
 * Get Day Availability UseCase (Input Port)
 * 하루 단위 예약 가능 슬롯 조회
 */
public interface GetDayAvailabilityUseCase {

    /**
     * 하루 예약 가능 슬롯 조회
     * 같은 키로 반복 호출하면 (입력 변경이 없는 한) 같은 인스턴스를 반환
     *
     * @param businessId      업체 ID
     * @param date            조회 날짜
     * @param durationMinutes 서비스 소요 시간 (분)
     * @param staffId         직원 ID (업체 전체 조회면 null)
     * @return 하루 예약 가능 정보 (휴무일이면 open=false, 슬롯 없음)
     * @throws personal.slotbook.core.booking.domain.exception.BusinessNotFoundException 업체가 없을 때
     * @throws personal.slotbook.core.booking.domain.exception.StaffNotFoundException 직원이 없거나 다른 업체 소속일 때
     */
    DayAvailability getDayAvailability(Long businessId, LocalDate date, int durationMinutes, Long staffId);
}
