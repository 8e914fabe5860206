package personal.slotbook.core.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.slotbook.core.booking.application.port.in.BlockPeriodCommand;
import personal.slotbook.core.booking.application.port.in.BlockPeriodUseCase;
import personal.slotbook.core.booking.application.port.in.RemoveBlockedPeriodUseCase;
import personal.slotbook.core.booking.application.port.out.BlockedPeriodRepository;
import personal.slotbook.core.booking.domain.exception.BlockedPeriodNotFoundException;
import personal.slotbook.core.booking.domain.model.BlockedPeriod;
import personal.slotbook.core.booking.domain.model.TimeRange;
import personal.slotbook.core.booking.domain.service.ConflictGuard;

/**
 * Blocked Period Application Service
 * 차단 시간 생성은 휴무일에도 허용 (영업 시간 검증 없음)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BlockedPeriodService implements BlockPeriodUseCase, RemoveBlockedPeriodUseCase {

    private final AvailabilityResolver availabilityResolver;
    private final ConflictGuard conflictGuard;
    private final BlockedPeriodRepository blockedPeriodRepository;

    @Override
    public BlockedPeriod blockPeriod(BlockPeriodCommand command) {
        log.info("Blocking period: businessId={}, staffId={}, date={}, start={}, end={}, recurrence={}",
                command.businessId(), command.staffId(), command.date(),
                command.startTime(), command.endTime(), command.recurrence());

        TimeRange requested = command.timeRange();

        BlockedPeriod saved = StoreOperations.execute("blockPeriod", () -> {
            availabilityResolver.ensureBusinessExists(command.businessId());
            availabilityResolver.ensureStaffBelongsTo(command.businessId(), command.staffId());

            BlockedPeriod candidate = BlockedPeriod.create(command.businessId(), command.staffId(),
                    command.date(), requested, command.reason(), command.recurrence());
            return conflictGuard.commitBlockedPeriod(candidate);
        });

        availabilityResolver.invalidate(saved.businessId());

        log.info("Period blocked: blockedPeriodId={}, businessId={}, date={}, interval={}",
                saved.id(), saved.businessId(), saved.date(), saved.timeRange());
        return saved;
    }

    @Override
    public void removeBlockedPeriod(Long blockedPeriodId) {
        log.info("Removing blocked period: blockedPeriodId={}", blockedPeriodId);

        BlockedPeriod removed = StoreOperations.execute("removeBlockedPeriod", () -> {
            BlockedPeriod period = blockedPeriodRepository.findById(blockedPeriodId)
                    .orElseThrow(() -> new BlockedPeriodNotFoundException(blockedPeriodId));
            blockedPeriodRepository.deleteById(blockedPeriodId);
            return period;
        });

        // 반복 템플릿이면 모든 반복 날짜가 함께 해제되므로 업체 캐시 전체 무효화
        availabilityResolver.invalidate(removed.businessId());
        log.info("Blocked period removed: blockedPeriodId={}, businessId={}", blockedPeriodId, removed.businessId());
    }
}
