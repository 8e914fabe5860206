package personal.slotbook.core;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;
import personal.slotbook.core.booking.application.config.AvailabilityProperties;

/**
 * Slotbook Application
 * 예약 가능 시간 계산과 예약 충돌 방지를 담당하는 서비스
 */
@EnableScheduling  // Outbox Scheduler 활성화
@EnableConfigurationProperties(AvailabilityProperties.class)
@SpringBootApplication(
    scanBasePackages = {
        "personal.slotbook.core",
        "personal.slotbook.common"  // common 모듈의 GlobalExceptionHandler 등을 스캔
    }
)
public class SlotbookApplication {
    public static void main(String[] args) {
        SpringApplication.run(SlotbookApplication.class, args);
    }
}
