package personal.slotbook.core.acceptance.support;

import io.cucumber.spring.ScenarioScope;
import io.restassured.response.Response;
import lombok.Getter;
import lombok.Setter;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Appointment Acceptance Test Context
 * 시나리오 간 상태 공유를 위한 컨텍스트 클래스
 *
 * @ScenarioScope: Cucumber 시나리오당 하나의 인스턴스 생성
 */
@Getter
@Setter
@ScenarioScope
public class AppointmentTestContext {

    /** 성공한 예약 수 (동시성 테스트) */
    private final AtomicInteger successfulBookings = new AtomicInteger(0);
    /** 충돌로 거절된 예약 수 (동시성 테스트) */
    private final AtomicInteger conflictedBookings = new AtomicInteger(0);

    /** 마지막 HTTP API 응답 (모든 Step에서 공유) */
    private Response lastHttpResponse;
    /** 현재 시나리오의 업체 ID */
    private Long currentBusinessId;
    /** 마지막으로 생성된 예약 ID */
    private Long currentAppointmentId;
}
