package personal.slotbook.core.booking.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.slotbook.core.booking.adapter.in.web.dto.BlockPeriodRequest;
import personal.slotbook.core.booking.adapter.in.web.dto.BlockedPeriodResponse;
import personal.slotbook.core.booking.application.port.in.BlockPeriodUseCase;
import personal.slotbook.core.booking.application.port.in.RemoveBlockedPeriodUseCase;
import personal.slotbook.core.booking.domain.model.BlockedPeriod;

/**
 * Blocked Period API Controller
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class BlockedPeriodController {

    private final BlockPeriodUseCase blockPeriodUseCase;
    private final RemoveBlockedPeriodUseCase removeBlockedPeriodUseCase;

    /**
     * 차단 시간 생성
     * POST /api/v1/businesses/{businessId}/blocked-periods
     */
    @PostMapping("/businesses/{businessId}/blocked-periods")
    public ResponseEntity<BlockedPeriodResponse> blockPeriod(
            @PathVariable Long businessId,
            @Valid @RequestBody BlockPeriodRequest request,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Block period: businessId={}, userId={}, date={}, start={}, end={}, recurrence={}",
                businessId, userId, request.date(), request.startTime(), request.endTime(), request.recurrence());

        BlockedPeriod blockedPeriod = blockPeriodUseCase.blockPeriod(request.toCommand(businessId));

        return ResponseEntity.status(HttpStatus.CREATED).body(BlockedPeriodResponse.from(blockedPeriod));
    }

    /**
     * 차단 시간 삭제 (반복 템플릿이면 모든 반복 날짜 해제)
     * DELETE /api/v1/blocked-periods/{blockedPeriodId}
     */
    @DeleteMapping("/blocked-periods/{blockedPeriodId}")
    public ResponseEntity<Void> removeBlockedPeriod(
            @PathVariable Long blockedPeriodId,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Remove blocked period: blockedPeriodId={}, userId={}", blockedPeriodId, userId);

        removeBlockedPeriodUseCase.removeBlockedPeriod(blockedPeriodId);
        return ResponseEntity.noContent().build();
    }
}
