package personal.slotbook.core.booking.application.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 예약 가능 시간 계산 설정
 * application.yml의 slotbook.availability.* 설정을 바인딩
 *
 * @param slotStepMinutes    슬롯 시작 간격 (분)
 * @param defaultHorizonDays 다음 예약 가능 슬롯 탐색 기본 일수
 * @param maxHorizonDays     기간 조회/탐색 최대 일수
 */
@ConfigurationProperties(prefix = "slotbook.availability")
public record AvailabilityProperties(
        Integer slotStepMinutes,
        Integer defaultHorizonDays,
        Integer maxHorizonDays
) {
    public AvailabilityProperties {
        if (slotStepMinutes == null || slotStepMinutes <= 0) {
            slotStepMinutes = 30;
        }
        if (defaultHorizonDays == null || defaultHorizonDays <= 0) {
            defaultHorizonDays = 30;
        }
        if (maxHorizonDays == null || maxHorizonDays <= 0) {
            maxHorizonDays = 366;
        }
    }

    public static AvailabilityProperties defaults() {
        return new AvailabilityProperties(null, null, null);
    }
}
