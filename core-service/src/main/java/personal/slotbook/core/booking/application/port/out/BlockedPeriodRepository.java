package personal.slotbook.core.booking.application.port.out;

import personal.slotbook.core.booking.domain.model.BlockedPeriod;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Blocked Period Repository (Output Port)
 * 차단 시간 저장소. 반복 템플릿은 한 건으로 저장되고 삭제 단위도 템플릿 한 건
 */
public interface BlockedPeriodRepository {

    BlockedPeriod save(BlockedPeriod blockedPeriod);

    Optional<BlockedPeriod> findById(Long id);

    void deleteById(Long id);

    /**
     * 날짜에 적용될 수 있는 차단 시간 후보 조회
     * 해당 날짜의 단건 차단 + 기준일이 해당 날짜 이전(포함)인 모든 반복 템플릿
     * 실제 적용 여부는 RecurrenceExpander로 판단
     *
     * @param businessId 업체 ID
     * @param date       대상 날짜
     * @return 차단 시간 후보 목록
     */
    List<BlockedPeriod> findCandidatesOn(Long businessId, LocalDate date);
}
