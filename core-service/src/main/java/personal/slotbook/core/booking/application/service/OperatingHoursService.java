package personal.slotbook.core.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.slotbook.core.booking.application.port.in.ManageOperatingHoursUseCase;
import personal.slotbook.core.booking.application.port.in.SetSpecialDayCommand;
import personal.slotbook.core.booking.application.port.in.UpdateOperatingHoursCommand;
import personal.slotbook.core.booking.application.port.out.OperatingScheduleRepository;
import personal.slotbook.core.booking.application.port.out.SpecialDayHoursRepository;
import personal.slotbook.core.booking.domain.model.DailyHours;
import personal.slotbook.core.booking.domain.model.OperatingSchedule;
import personal.slotbook.core.booking.domain.model.SpecialDayHours;

import java.time.LocalDate;

/**
 * Operating Hours Application Service
 * 주간 영업 시간 / 특별 영업일 관리
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OperatingHoursService implements ManageOperatingHoursUseCase {

    private final AvailabilityResolver availabilityResolver;
    private final OperatingScheduleRepository operatingScheduleRepository;
    private final SpecialDayHoursRepository specialDayHoursRepository;

    @Override
    public OperatingSchedule getOperatingSchedule(Long businessId) {
        return StoreOperations.execute("getOperatingSchedule", () -> {
            availabilityResolver.ensureBusinessExists(businessId);
            return operatingScheduleRepository.findByBusinessId(businessId);
        });
    }

    @Override
    public DailyHours updateOperatingHours(UpdateOperatingHoursCommand command) {
        log.info("Updating operating hours: businessId={}, dayOfWeek={}, open={}",
                command.businessId(), command.dayOfWeek(), command.open());

        // 영업 시간 규칙 검증 (저장소 접근 전)
        DailyHours hours = command.toDailyHours();

        DailyHours saved = StoreOperations.execute("updateOperatingHours", () -> {
            availabilityResolver.ensureBusinessExists(command.businessId());
            return operatingScheduleRepository.save(command.businessId(), hours);
        });

        availabilityResolver.invalidate(command.businessId());
        return saved;
    }

    @Override
    public SpecialDayHours setSpecialDay(SetSpecialDayCommand command) {
        log.info("Setting special day: businessId={}, date={}, open={}",
                command.businessId(), command.date(), command.open());

        SpecialDayHours specialDay = command.toSpecialDayHours();

        SpecialDayHours saved = StoreOperations.execute("setSpecialDay", () -> {
            availabilityResolver.ensureBusinessExists(command.businessId());
            return specialDayHoursRepository.save(specialDay);
        });

        availabilityResolver.invalidate(command.businessId());
        return saved;
    }

    @Override
    public void removeSpecialDay(Long businessId, LocalDate date) {
        log.info("Removing special day: businessId={}, date={}", businessId, date);

        boolean removed = StoreOperations.execute("removeSpecialDay",
                () -> specialDayHoursRepository.deleteByBusinessIdAndDate(businessId, date));
        if (removed) {
            availabilityResolver.invalidate(businessId);
        }
    }
}
