package personal.slotbook.core.booking.adapter.out.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;
import personal.slotbook.core.booking.application.port.out.AvailabilityCacheRepository;
import personal.slotbook.core.booking.domain.model.AvailabilityKey;
import personal.slotbook.core.booking.domain.model.DayAvailability;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Availability Cache Adapter
 * AvailabilityCacheRepository 구현체 (Spring Cache 추상화 사용)
 *
 * 무효화: 업체 버전 증가 -> 업체 캐시 영역 전체 삭제
 * 저장: 계산 전 읽은 버전과 저장 후 버전이 다르면 방금 저장한 항목을 제거
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AvailabilityCacheAdapter implements AvailabilityCacheRepository {

    private static final String CACHE_PREFIX = "dayAvailability:";

    private final CacheManager availabilityCacheManager;
    private final Map<Long, AtomicLong> versions = new ConcurrentHashMap<>();

    @Override
    public Optional<DayAvailability> get(AvailabilityKey key) {
        DayAvailability cached = cacheFor(key.businessId()).get(key, DayAvailability.class);
        log.debug("Availability cache {}: key={}", cached != null ? "hit" : "miss", key);
        return Optional.ofNullable(cached);
    }

    @Override
    public long currentVersion(Long businessId) {
        return versionOf(businessId).get();
    }

    @Override
    public DayAvailability putIfAbsent(AvailabilityKey key, DayAvailability value, long version) {
        Cache cache = cacheFor(key.businessId());
        Cache.ValueWrapper existing = cache.putIfAbsent(key, value);
        DayAvailability result = existing != null ? (DayAvailability) existing.get() : value;

        if (versionOf(key.businessId()).get() != version) {
            // 계산 도중 무효화됨. 오래된 결과가 남지 않도록 제거
            cache.evictIfPresent(key);
            log.debug("Discarded stale availability: key={}, version={}", key, version);
            return value;
        }
        return result;
    }

    @Override
    public void evictBusiness(Long businessId) {
        versionOf(businessId).incrementAndGet();
        cacheFor(businessId).clear();
        log.debug("Availability cache invalidated: businessId={}", businessId);
    }

    private Cache cacheFor(Long businessId) {
        Cache cache = availabilityCacheManager.getCache(CACHE_PREFIX + businessId);
        if (cache == null) {
            throw new IllegalStateException("Availability cache region unavailable: businessId=" + businessId);
        }
        return cache;
    }

    private AtomicLong versionOf(Long businessId) {
        return versions.computeIfAbsent(businessId, id -> new AtomicLong());
    }
}
