package personal.slotbook.core.booking.adapter.out.cache;

import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Availability Cache Configuration
 *
 * 프로세스 로컬 캐시 (ConcurrentMapCacheManager)
 * - 업체별 캐시 영역 (dayAvailability:{businessId}) 을 동적으로 생성
 * - 값을 복사하지 않고 참조로 저장 (같은 키는 같은 인스턴스 반환)
 * - null 값은 캐싱하지 않음
 */
@Configuration
public class AvailabilityCacheConfig {

    @Bean
    public ConcurrentMapCacheManager availabilityCacheManager() {
        ConcurrentMapCacheManager cacheManager = new ConcurrentMapCacheManager();
        cacheManager.setAllowNullValues(false);
        cacheManager.setStoreByValue(false);
        return cacheManager;
    }
}
