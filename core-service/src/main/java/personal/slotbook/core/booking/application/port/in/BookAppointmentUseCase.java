package personal.slotbook.core.booking.application.port.in;

import personal.slotbook.core.booking.domain.model.Appointment;

/**
 * Book Appointment UseCase (Input Port)
 * 예약 생성 유스케이스
 */
public interface BookAppointmentUseCase {

    /**
     * 예약 생성
     * 업체 잠금 트랜잭션 안에서 저장소 기준으로 충돌을 재검사한 뒤 SCHEDULED 상태로 저장
     *
     * @param command 예약 커맨드
     * @return 저장된 예약 (ID 포함)
     * @throws personal.slotbook.core.booking.domain.exception.InvalidIntervalException 구간이 잘못되었거나 영업 시간 밖일 때
     * @throws personal.slotbook.core.booking.domain.exception.BusinessClosedException 휴무일일 때
     * @throws personal.slotbook.core.booking.domain.exception.SlotConflictException 기존 예약/차단 시간과 겹칠 때 (409)
     * @throws personal.slotbook.core.booking.domain.exception.StoreUnavailableException 저장소 장애 (503)
     */
    Appointment bookAppointment(BookAppointmentCommand command);
}
