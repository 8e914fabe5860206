package personal.slotbook.core.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.slotbook.core.booking.application.config.AvailabilityProperties;
import personal.slotbook.core.booking.application.port.out.AppointmentRepository;
import personal.slotbook.core.booking.application.port.out.AvailabilityCacheRepository;
import personal.slotbook.core.booking.application.port.out.BlockedPeriodRepository;
import personal.slotbook.core.booking.application.port.out.BusinessRepository;
import personal.slotbook.core.booking.application.port.out.OperatingScheduleRepository;
import personal.slotbook.core.booking.application.port.out.SpecialDayHoursRepository;
import personal.slotbook.core.booking.application.port.out.StaffOverrideRepository;
import personal.slotbook.core.booking.application.port.out.StaffRepository;
import personal.slotbook.core.booking.domain.exception.BusinessNotFoundException;
import personal.slotbook.core.booking.domain.exception.InvalidIntervalException;
import personal.slotbook.core.booking.domain.exception.StaffNotFoundException;
import personal.slotbook.core.booking.domain.model.AvailabilityKey;
import personal.slotbook.core.booking.domain.model.DailyHours;
import personal.slotbook.core.booking.domain.model.DayAvailability;
import personal.slotbook.core.booking.domain.model.Staff;
import personal.slotbook.core.booking.domain.service.AvailabilityCalculator;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Availability Resolver
 * 저장소에서 입력을 모아 AvailabilityCalculator로 계산하고, 결과를 업체별 캐시에 보관
 *
 * 캐시 히트 시 저장된 인스턴스를 그대로 반환 (참조 동일성)
 * 업체의 영업 시간/차단 시간/직원 예외/예약이 바뀌면 {@link #invalidate(Long)}로 업체 캐시 전체 삭제
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvailabilityResolver {

    private final BusinessRepository businessRepository;
    private final StaffRepository staffRepository;
    private final OperatingScheduleRepository operatingScheduleRepository;
    private final SpecialDayHoursRepository specialDayHoursRepository;
    private final BlockedPeriodRepository blockedPeriodRepository;
    private final StaffOverrideRepository staffOverrideRepository;
    private final AppointmentRepository appointmentRepository;
    private final AvailabilityCacheRepository availabilityCacheRepository;
    private final AvailabilityCalculator availabilityCalculator;
    private final AvailabilityProperties availabilityProperties;

    public DayAvailability resolve(Long businessId, LocalDate date, int durationMinutes, Long staffId) {
        if (durationMinutes <= 0) {
            throw new InvalidIntervalException("Duration must be positive: " + durationMinutes);
        }
        AvailabilityKey key = new AvailabilityKey(businessId, date, durationMinutes, staffId);

        Optional<DayAvailability> cached = availabilityCacheRepository.get(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        // 계산 시작 전 버전을 읽어야 계산 중 무효화된 결과가 캐시에 남지 않음
        long version = availabilityCacheRepository.currentVersion(businessId);
        DayAvailability computed = compute(businessId, date, durationMinutes, staffId);
        return availabilityCacheRepository.putIfAbsent(key, computed, version);
    }

    /**
     * 업체의 모든 캐시 항목 무효화 (쓰기 커밋 이후 호출)
     */
    public void invalidate(Long businessId) {
        availabilityCacheRepository.evictBusiness(businessId);
    }

    /**
     * 날짜의 실제 영업 시간 (특별 영업일 우선)
     *
     * @return 휴무면 Optional.empty()
     */
    public Optional<DailyHours> effectiveHours(Long businessId, LocalDate date) {
        return availabilityCalculator.effectiveHours(
                date,
                operatingScheduleRepository.findByBusinessIdAndDayOfWeek(businessId, date.getDayOfWeek()),
                specialDayHoursRepository.findByBusinessIdAndDate(businessId, date));
    }

    public void ensureBusinessExists(Long businessId) {
        if (!businessRepository.existsById(businessId)) {
            throw new BusinessNotFoundException(businessId);
        }
    }

    /**
     * 직원이 존재하고 해당 업체 소속인지 확인 (staffId가 null이면 통과)
     */
    public void ensureStaffBelongsTo(Long businessId, Long staffId) {
        if (staffId == null) {
            return;
        }
        Staff staff = staffRepository.findById(staffId)
                .orElseThrow(() -> new StaffNotFoundException(staffId));
        if (!staff.belongsTo(businessId)) {
            log.warn("Staff does not belong to business: staffId={}, businessId={}", staffId, businessId);
            throw new StaffNotFoundException(staffId);
        }
    }

    private DayAvailability compute(Long businessId, LocalDate date, int durationMinutes, Long staffId) {
        ensureBusinessExists(businessId);
        ensureStaffBelongsTo(businessId, staffId);

        Optional<DailyHours> hours = effectiveHours(businessId, date);
        if (hours.isEmpty()) {
            log.debug("Business closed: businessId={}, date={}", businessId, date);
            return DayAvailability.closed(date);
        }

        DayAvailability computed = availabilityCalculator.calculate(
                date,
                hours,
                blockedPeriodRepository.findCandidatesOn(businessId, date),
                appointmentRepository.findActiveByBusinessIdAndDate(businessId, date),
                staffId == null ? Optional.empty() : staffOverrideRepository.findByStaffIdAndDate(staffId, date),
                staffId,
                durationMinutes,
                availabilityProperties.slotStepMinutes());

        log.debug("Availability computed: businessId={}, date={}, duration={}, staffId={}, slots={}",
                businessId, date, durationMinutes, staffId, computed.slots().size());
        return computed;
    }
}
