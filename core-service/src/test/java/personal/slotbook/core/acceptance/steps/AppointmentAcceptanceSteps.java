package personal.slotbook.core.acceptance.steps;

import io.cucumber.java.en.And;
import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;
import io.cucumber.spring.ScenarioScope;
import io.restassured.response.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import personal.slotbook.core.acceptance.support.AppointmentTestContext;
import personal.slotbook.core.acceptance.support.SlotbookHttpAdapter;
import personal.slotbook.core.acceptance.support.SlotbookTestAdapter;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Appointment Acceptance Test Step Definitions
 * 비즈니스 관점의 자연어로 작성된 시나리오에 매핑
 */
@Slf4j
@ScenarioScope
@RequiredArgsConstructor
public class AppointmentAcceptanceSteps {

    private static final Long OWNER_ID = 1L;

    private final SlotbookHttpAdapter httpAdapter;
    private final SlotbookTestAdapter testAdapter;
    private final AppointmentTestContext context;

    // ==========================================
    // 배경: 영업 중인 업체
    // ==========================================

    @Given("평일 {string}부터 {string}까지 영업하는 업체가 있다")
    public void 평일_영업하는_업체가_있다(String openTime, String closeTime) {
        log.info(">>> Given: 평일 {}-{} 영업 업체 생성", openTime, closeTime);
        Long businessId = testAdapter.createBusiness("인수 테스트 업체");
        context.setCurrentBusinessId(businessId);

        for (DayOfWeek day : DayOfWeek.values()) {
            boolean weekday = day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
            Response response = weekday
                    ? httpAdapter.updateOperatingHours(businessId, day.name(), true, openTime, closeTime, OWNER_ID)
                    : httpAdapter.updateOperatingHours(businessId, day.name(), false, null, null, OWNER_ID);
            assertThat(response.statusCode()).isEqualTo(200);
        }
    }

    @Given("{string}은 특별 휴무일이다")
    public void 특별_휴무일이다(String date) {
        log.info(">>> Given: 특별 휴무일 설정 - {}", date);
        Response response = httpAdapter.setSpecialDay(context.getCurrentBusinessId(), date, false, "임시 휴무", OWNER_ID);
        assertThat(response.statusCode()).isEqualTo(200);
    }

    @Given("{string} {string}부터 {string}까지 매주 반복 차단 시간이 있다")
    public void 매주_반복_차단_시간이_있다(String date, String startTime, String endTime) {
        log.info(">>> Given: 매주 반복 차단 등록 - {} {}-{}", date, startTime, endTime);
        Response response = httpAdapter.blockPeriod(context.getCurrentBusinessId(), date, startTime, endTime,
                "정기 회의", "weekly", OWNER_ID);
        assertThat(response.statusCode()).isEqualTo(201);
    }

    @Given("{long}번 고객이 {string} {string}부터 {string}까지 예약했다")
    public void 고객이_예약했다(Long customerId, String date, String startTime, String endTime) {
        log.info(">>> Given: 사전 예약 - customerId={}, {} {}-{}", customerId, date, startTime, endTime);
        Response response = httpAdapter.bookAppointment(context.getCurrentBusinessId(), customerId,
                date, startTime, endTime);
        assertThat(response.statusCode()).isEqualTo(201);
        context.setCurrentAppointmentId(response.jsonPath().getLong("appointmentId"));
    }

    // ==========================================
    // When: 사용자 행동
    // ==========================================

    @When("{long}번 고객이 {string} {string}부터 {string}까지 예약을 요청한다")
    public void 고객이_예약을_요청한다(Long customerId, String date, String startTime, String endTime) {
        log.info(">>> When: 예약 요청 - customerId={}, {} {}-{}", customerId, date, startTime, endTime);
        Response response = httpAdapter.bookAppointment(context.getCurrentBusinessId(), customerId,
                date, startTime, endTime);
        context.setLastHttpResponse(response);
        if (response.statusCode() == 201) {
            context.setCurrentAppointmentId(response.jsonPath().getLong("appointmentId"));
        }
    }

    @When("{int}명의 고객이 동시에 {string} {string}부터 {string}까지 예약을 요청한다")
    public void 동시에_예약을_요청한다(int customerCount, String date, String startTime, String endTime) {
        log.info(">>> When: 동시 예약 요청 - {}명, {} {}-{}", customerCount, date, startTime, endTime);
        Long businessId = context.getCurrentBusinessId();

        List<CompletableFuture<Integer>> futures = IntStream.rangeClosed(1, customerCount)
                .mapToObj(i -> CompletableFuture.supplyAsync(() -> httpAdapter
                        .bookAppointment(businessId, 1000L + i, date, startTime, endTime)
                        .statusCode()))
                .toList();

        for (CompletableFuture<Integer> future : futures) {
            int status = future.join();
            if (status == 201) {
                context.getSuccessfulBookings().incrementAndGet();
            } else if (status == 409) {
                context.getConflictedBookings().incrementAndGet();
            }
        }
        log.info(">>> 동시 예약 결과 - 성공={}, 충돌={}",
                context.getSuccessfulBookings().get(), context.getConflictedBookings().get());
    }

    @When("예약 취소를 요청한다")
    public void 예약_취소를_요청한다() {
        log.info(">>> When: 예약 취소 요청 - appointmentId={}", context.getCurrentAppointmentId());
        context.setLastHttpResponse(httpAdapter.cancelAppointment(context.getCurrentAppointmentId(), OWNER_ID));
    }

    @When("예약 일정을 {string} {string}부터 {string}까지로 변경한다")
    public void 예약_일정을_변경한다(String date, String startTime, String endTime) {
        log.info(">>> When: 일정 변경 요청 - appointmentId={}, {} {}-{}",
                context.getCurrentAppointmentId(), date, startTime, endTime);
        context.setLastHttpResponse(httpAdapter.rescheduleAppointment(context.getCurrentAppointmentId(),
                date, startTime, endTime, OWNER_ID));
    }

    @When("{string}의 {int}분 예약 가능 시간을 조회한다")
    public void 예약_가능_시간을_조회한다(String date, int duration) {
        log.info(">>> When: 하루 예약 가능 시간 조회 - {}, {}분", date, duration);
        context.setLastHttpResponse(httpAdapter.getDayAvailability(context.getCurrentBusinessId(), date, duration));
    }

    @When("{string}부터 {int}분 다음 예약 가능 슬롯을 조회한다")
    public void 다음_예약_가능_슬롯을_조회한다(String from, int duration) {
        log.info(">>> When: 다음 예약 가능 슬롯 조회 - from={}, {}분", from, duration);
        context.setLastHttpResponse(httpAdapter.findNextAvailableSlot(context.getCurrentBusinessId(), from, duration));
    }

    @When("{string}부터 {string}까지 {int}분 이용률 통계를 조회한다")
    public void 이용률_통계를_조회한다(String startDate, String endDate, int duration) {
        log.info(">>> When: 이용률 통계 조회 - {} ~ {}, {}분", startDate, endDate, duration);
        context.setLastHttpResponse(httpAdapter.getStatistics(context.getCurrentBusinessId(),
                startDate, endDate, duration));
    }

    // ==========================================
    // Then: 결과 검증
    // ==========================================

    @Then("응답 상태 코드는 {int}이다")
    public void 응답_상태_코드는(int statusCode) {
        log.info(">>> Then: 응답 상태 코드 검증 - expected={}", statusCode);
        assertThat(context.getLastHttpResponse().statusCode()).isEqualTo(statusCode);
    }

    @And("에러 코드는 {string}이다")
    public void 에러_코드는(String errorCode) {
        assertThat(context.getLastHttpResponse().jsonPath().getString("code")).isEqualTo(errorCode);
    }

    @And("예약 상태는 {string}이다")
    public void 예약_상태는(String status) {
        assertThat(context.getLastHttpResponse().jsonPath().getString("status")).isEqualTo(status);
    }

    @And("예약 시간은 {string} {string}부터 {string}까지이다")
    public void 예약_시간은(String date, String startTime, String endTime) {
        Response response = context.getLastHttpResponse();
        assertThat(response.jsonPath().getString("date")).isEqualTo(date);
        assertThat(response.jsonPath().getString("startTime")).isEqualTo(startTime);
        assertThat(response.jsonPath().getString("endTime")).isEqualTo(endTime);
    }

    @Then("{string} 슬롯은 예약 불가이다")
    public void 슬롯은_예약_불가이다(String startTime) {
        assertThat(slotAvailability(startTime)).isFalse();
    }

    @Then("{string} 슬롯은 예약 가능이다")
    public void 슬롯은_예약_가능이다(String startTime) {
        assertThat(slotAvailability(startTime)).isTrue();
    }

    @Then("영업하지 않는 날로 표시된다")
    public void 영업하지_않는_날로_표시된다() {
        Response response = context.getLastHttpResponse();
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.jsonPath().getBoolean("isOpen")).isFalse();
        assertThat(response.jsonPath().getList("slots")).isEmpty();
    }

    @Then("다음 예약 가능 슬롯은 {string} {string}이다")
    public void 다음_예약_가능_슬롯은(String date, String startTime) {
        Response response = context.getLastHttpResponse();
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.jsonPath().getString("date")).isEqualTo(date);
        assertThat(response.jsonPath().getString("startTime")).isEqualTo(startTime);
    }

    @Then("{int}건만 성공하고 나머지는 충돌로 거절된다")
    public void 한_건만_성공한다(int expectedSuccess) {
        assertThat(context.getSuccessfulBookings().get()).isEqualTo(expectedSuccess);
        assertThat(context.getConflictedBookings().get()).isPositive();
    }

    @Then("전체 슬롯은 {int}개, 예약된 슬롯은 {int}개이다")
    public void 통계_검증(int totalSlots, int bookedSlots) {
        Response response = context.getLastHttpResponse();
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.jsonPath().getInt("totalSlots")).isEqualTo(totalSlots);
        assertThat(response.jsonPath().getInt("bookedSlots")).isEqualTo(bookedSlots);
    }

    private boolean slotAvailability(String startTime) {
        Response response = context.getLastHttpResponse();
        assertThat(response.statusCode()).isEqualTo(200);
        List<Map<String, Object>> slots = response.jsonPath().getList("slots");
        return slots.stream()
                .filter(slot -> startTime.equals(slot.get("startTime")))
                .findFirst()
                .map(slot -> (Boolean) slot.get("available"))
                .orElseThrow(() -> new AssertionError("No slot starting at " + startTime));
    }
}
