package personal.slotbook.core.booking.application.port.in;

/**
 * Remove Blocked Period UseCase (Input Port)
 * 반복 템플릿을 삭제하면 모든 반복 날짜가 함께 해제됨
 */
public interface RemoveBlockedPeriodUseCase {

    /**
     * @throws personal.slotbook.core.booking.domain.exception.BlockedPeriodNotFoundException 차단 시간이 없을 때
     */
    void removeBlockedPeriod(Long blockedPeriodId);
}
