package personal.slotbook.core.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.slotbook.common.dto.ApiResponse;
import personal.slotbook.common.dto.HealthCheckResponse;
import personal.slotbook.common.health.HealthCheckService;

import javax.sql.DataSource;

/**
 * Health Check API Controller
 * 저장소와 이벤트 브로커 연결 상태를 확인하는 엔드포인트
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class HealthCheckController {

    private final DataSource dataSource;
    private final HealthCheckService healthCheckService;

    /**
     * 데이터베이스, Kafka의 연결 상태 확인
     * 장애가 있어도 200으로 응답하고 본문의 success=false로 구분
     */
    @GetMapping("/health")
    public ResponseEntity<ApiResponse<HealthCheckResponse>> healthCheck() {
        log.debug("Health check requested");

        String databaseStatus = healthCheckService.checkDatabase(dataSource);
        String kafkaStatus = healthCheckService.checkKafka();

        HealthCheckResponse data = new HealthCheckResponse(databaseStatus, kafkaStatus);

        boolean allHealthy = "UP".equals(databaseStatus) && "UP".equals(kafkaStatus);

        if (allHealthy) {
            return ResponseEntity.ok(ApiResponse.success("Application is healthy", data));
        }
        return ResponseEntity.ok(ApiResponse.error("Some components are unhealthy", data));
    }
}
