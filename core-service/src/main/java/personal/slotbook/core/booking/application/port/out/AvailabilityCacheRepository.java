package personal.slotbook.core.booking.application.port.out;

import personal.slotbook.core.booking.domain.model.AvailabilityKey;
import personal.slotbook.core.booking.domain.model.DayAvailability;

import java.util.Optional;

/**
 * Availability Cache Repository (Output Port)
 * 프로세스 로컬 DayAvailability 캐시. 권한 있는 저장소가 아니며 언제든 비워도 안전함
 *
 * 업체별 버전으로 무효화와 동시 계산 결과 저장 사이의 경합을 막음:
 * 계산 전에 {@link #currentVersion(Long)}을 읽고, 저장 시 그 버전을 전달하면
 * 그 사이 무효화가 있었던 결과는 캐시에 남지 않음
 */
public interface AvailabilityCacheRepository {

    Optional<DayAvailability> get(AvailabilityKey key);

    long currentVersion(Long businessId);

    /**
     * 키가 비어 있을 때만 저장
     *
     * @param version 계산 시작 전에 읽은 업체 버전
     * @return 캐시에 이미 있던 값 또는 새로 저장한 값 (무효화 경합 시에는 전달한 값)
     */
    DayAvailability putIfAbsent(AvailabilityKey key, DayAvailability value, long version);

    /**
     * 업체의 모든 캐시 항목 무효화
     */
    void evictBusiness(Long businessId);
}
