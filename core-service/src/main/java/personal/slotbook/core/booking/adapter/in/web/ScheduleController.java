package personal.slotbook.core.booking.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.slotbook.core.booking.adapter.in.web.dto.OperatingHoursRequest;
import personal.slotbook.core.booking.adapter.in.web.dto.OperatingScheduleResponse;
import personal.slotbook.core.booking.adapter.in.web.dto.SpecialDayRequest;
import personal.slotbook.core.booking.adapter.in.web.dto.SpecialDayResponse;
import personal.slotbook.core.booking.adapter.in.web.dto.StaffOverrideRequest;
import personal.slotbook.core.booking.adapter.in.web.dto.StaffOverrideResponse;
import personal.slotbook.core.booking.application.port.in.ManageOperatingHoursUseCase;
import personal.slotbook.core.booking.application.port.in.ManageStaffOverrideUseCase;
import personal.slotbook.core.booking.domain.model.DailyHours;

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * Schedule API Controller
 * 영업 시간, 특별 영업일, 직원 근무 예외 관리 REST API
 * 변경 시 해당 업체의 예약 가능 캐시가 무효화됨
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ScheduleController {

    private final ManageOperatingHoursUseCase manageOperatingHoursUseCase;
    private final ManageStaffOverrideUseCase manageStaffOverrideUseCase;

    /**
     * 주간 영업 시간표 조회
     * GET /api/v1/businesses/{businessId}/operating-hours
     */
    @GetMapping("/businesses/{businessId}/operating-hours")
    public ResponseEntity<OperatingScheduleResponse> getOperatingSchedule(@PathVariable Long businessId) {
        log.info("Get operating schedule: businessId={}", businessId);
        return ResponseEntity.ok(OperatingScheduleResponse.from(
                manageOperatingHoursUseCase.getOperatingSchedule(businessId)));
    }

    /**
     * 요일 영업 시간 변경
     * PUT /api/v1/businesses/{businessId}/operating-hours/{dayOfWeek}
     */
    @PutMapping("/businesses/{businessId}/operating-hours/{dayOfWeek}")
    public ResponseEntity<OperatingScheduleResponse.Day> updateOperatingHours(
            @PathVariable Long businessId,
            @PathVariable DayOfWeek dayOfWeek,
            @Valid @RequestBody OperatingHoursRequest request,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Update operating hours: businessId={}, dayOfWeek={}, userId={}", businessId, dayOfWeek, userId);

        DailyHours saved = manageOperatingHoursUseCase.updateOperatingHours(request.toCommand(businessId, dayOfWeek));
        return ResponseEntity.ok(OperatingScheduleResponse.Day.from(saved));
    }

    /**
     * 특별 영업일 설정
     * PUT /api/v1/businesses/{businessId}/special-days/{date}
     */
    @PutMapping("/businesses/{businessId}/special-days/{date}")
    public ResponseEntity<SpecialDayResponse> setSpecialDay(
            @PathVariable Long businessId,
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @Valid @RequestBody SpecialDayRequest request,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Set special day: businessId={}, date={}, userId={}", businessId, date, userId);
        return ResponseEntity.ok(SpecialDayResponse.from(
                manageOperatingHoursUseCase.setSpecialDay(request.toCommand(businessId, date))));
    }

    /**
     * 특별 영업일 삭제
     * DELETE /api/v1/businesses/{businessId}/special-days/{date}
     */
    @DeleteMapping("/businesses/{businessId}/special-days/{date}")
    public ResponseEntity<Void> removeSpecialDay(
            @PathVariable Long businessId,
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Remove special day: businessId={}, date={}, userId={}", businessId, date, userId);
        manageOperatingHoursUseCase.removeSpecialDay(businessId, date);
        return ResponseEntity.noContent().build();
    }

    /**
     * 직원 근무 예외 설정
     * PUT /api/v1/staff/{staffId}/overrides/{date}
     */
    @PutMapping("/staff/{staffId}/overrides/{date}")
    public ResponseEntity<StaffOverrideResponse> setStaffOverride(
            @PathVariable Long staffId,
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @Valid @RequestBody StaffOverrideRequest request,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Set staff override: staffId={}, date={}, available={}, userId={}",
                staffId, date, request.isAvailable(), userId);
        return ResponseEntity.ok(StaffOverrideResponse.from(
                manageStaffOverrideUseCase.setStaffOverride(request.toCommand(staffId, date))));
    }

    /**
     * 직원 근무 예외 삭제 (업체 영업 시간을 따르도록 복원)
     * DELETE /api/v1/staff/{staffId}/overrides/{date}
     */
    @DeleteMapping("/staff/{staffId}/overrides/{date}")
    public ResponseEntity<Void> removeStaffOverride(
            @PathVariable Long staffId,
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Remove staff override: staffId={}, date={}, userId={}", staffId, date, userId);
        manageStaffOverrideUseCase.removeStaffOverride(staffId, date);
        return ResponseEntity.noContent().build();
    }
}
