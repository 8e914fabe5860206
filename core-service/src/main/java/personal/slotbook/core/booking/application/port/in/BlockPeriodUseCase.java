package personal.slotbook.core.booking.application.port.in;

import personal.slotbook.core.booking.domain.model.BlockedPeriod;

/**
 * Block Period UseCase (Input Port)
 */
public interface BlockPeriodUseCase {

    /**
     * 차단 시간 생성
     * 예약과 같은 충돌 검사를 거치며, 반복 템플릿은 기준일 기준으로 검사
     *
     * @throws personal.slotbook.core.booking.domain.exception.SlotConflictException 기존 예약/차단 시간과 겹칠 때
     */
    BlockedPeriod blockPeriod(BlockPeriodCommand command);
}
