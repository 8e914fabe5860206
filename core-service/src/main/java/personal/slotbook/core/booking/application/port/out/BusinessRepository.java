package personal.slotbook.core.booking.application.port.out;

/**
 * Business Repository (Output Port)
 * 업체 존재 확인과 업체 단위 쓰기 잠금
 */
public interface BusinessRepository {

    boolean existsById(Long businessId);

    /**
     * 업체 행에 비관적 쓰기 잠금 획득 (현재 트랜잭션 종료 시 해제)
     * 같은 업체에 대한 충돌 검사 + 저장을 직렬화하는 용도
     *
     * @param businessId 업체 ID
     * @return 업체가 존재하여 잠금을 획득했으면 true
     */
    boolean lockForWrite(Long businessId);
}
