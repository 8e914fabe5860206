package personal.slotbook.core.acceptance.support;

import io.cucumber.spring.CucumberContextConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

/**
 * Cucumber와 Spring Boot를 통합하기 위한 설정 클래스
 * 실제 HTTP 서버(랜덤 포트) + H2 인메모리 DB로 테스트
 */
@CucumberContextConfiguration
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@Import({SlotbookHttpAdapter.class, SlotbookTestAdapter.class, AppointmentTestContext.class})
public class CucumberSpringConfiguration {
}
