package personal.slotbook.core.booking.application.port.out;

import personal.slotbook.core.booking.domain.model.Appointment;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Appointment Repository (Output Port)
 * Domain Layer가 Infrastructure에 의존하지 않도록 인터페이스 정의
 */
public interface AppointmentRepository {

    /**
     * 예약 저장 (생성 또는 수정)
     *
     * @param appointment 저장할 예약
     * @return 저장된 예약 (ID 포함)
     */
    Appointment save(Appointment appointment);

    Optional<Appointment> findById(Long id);

    /**
     * 예약의 업체 ID만 조회 (엔티티를 영속성 컨텍스트에 올리지 않음)
     * 업체 잠금 전에 잠금 대상을 찾는 용도
     */
    Optional<Long> findBusinessIdById(Long id);

    /**
     * 예약 행 비관적 쓰기 잠금 조회 (트랜잭션 안에서만 호출)
     * 잠금 읽기이므로 트랜잭션 스냅샷과 무관하게 최신 커밋 상태를 반환
     */
    Optional<Appointment> findByIdForUpdate(Long id);

    /**
     * 업체 + 날짜의 취소되지 않은 예약 조회 (직원 무관)
     *
     * @param businessId 업체 ID
     * @param date       날짜
     * @return 시간을 점유하는 예약 목록
     */
    List<Appointment> findActiveByBusinessIdAndDate(Long businessId, LocalDate date);
}
