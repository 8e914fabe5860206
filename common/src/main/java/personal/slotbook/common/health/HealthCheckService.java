package personal.slotbook.common.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.AdminClient;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.TimeUnit;

/**
 * Health Check 공통 유틸리티 서비스
 * 저장소(DB)와 이벤트 브로커(Kafka)의 상태를 확인
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HealthCheckService {

    private final KafkaAdmin kafkaAdmin;

    /**
     * Kafka 연결 상태 확인
     *
     * @return "UP" if Kafka cluster is reachable, "DOWN" otherwise
     */
    public String checkKafka() {
        try (AdminClient adminClient = AdminClient.create(kafkaAdmin.getConfigurationProperties())) {
            var nodes = adminClient.describeCluster().nodes().get(5, TimeUnit.SECONDS);
            return (nodes != null && !nodes.isEmpty()) ? "UP" : "DOWN";
        } catch (Exception e) {
            log.error("Kafka health check failed", e);
            return "DOWN";
        }
    }

    /**
     * 데이터베이스 연결 상태 확인
     *
     * @param dataSource the DataSource to check
     * @return "UP" if database is reachable, "DOWN" otherwise
     */
    public String checkDatabase(DataSource dataSource) {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(1) ? "UP" : "DOWN";
        } catch (Exception e) {
            log.error("Database health check failed", e);
            return "DOWN";
        }
    }
}
