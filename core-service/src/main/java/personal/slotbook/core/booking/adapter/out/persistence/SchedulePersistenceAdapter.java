package personal.slotbook.core.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.slotbook.core.booking.application.port.out.OperatingScheduleRepository;
import personal.slotbook.core.booking.application.port.out.SpecialDayHoursRepository;
import personal.slotbook.core.booking.domain.model.DailyHours;
import personal.slotbook.core.booking.domain.model.OperatingSchedule;
import personal.slotbook.core.booking.domain.model.SpecialDayHours;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Schedule Persistence Adapter
 * 주간 영업 시간 + 특별 영업일 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchedulePersistenceAdapter implements OperatingScheduleRepository, SpecialDayHoursRepository {

    private final JpaOperatingHoursRepository jpaOperatingHoursRepository;
    private final JpaSpecialDayHoursRepository jpaSpecialDayHoursRepository;

    @Override
    @Transactional(readOnly = true)
    public OperatingSchedule findByBusinessId(Long businessId) {
        Map<DayOfWeek, DailyHours> days = new EnumMap<>(DayOfWeek.class);
        jpaOperatingHoursRepository.findByBusinessId(businessId).stream()
                .map(OperatingHoursEntity::toDomain)
                .forEach(hours -> days.put(hours.dayOfWeek(), hours));
        return new OperatingSchedule(businessId, days);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<DailyHours> findByBusinessIdAndDayOfWeek(Long businessId, DayOfWeek dayOfWeek) {
        return jpaOperatingHoursRepository.findByBusinessIdAndDayOfWeek(businessId, dayOfWeek)
                .map(OperatingHoursEntity::toDomain);
    }

    @Override
    @Transactional
    public DailyHours save(Long businessId, DailyHours dailyHours) {
        log.debug("Saving operating hours: businessId={}, dayOfWeek={}", businessId, dailyHours.dayOfWeek());

        OperatingHoursEntity entity = jpaOperatingHoursRepository
                .findByBusinessIdAndDayOfWeek(businessId, dailyHours.dayOfWeek())
                .map(existing -> {
                    existing.update(dailyHours);
                    return existing;
                })
                .orElseGet(() -> OperatingHoursEntity.create(businessId, dailyHours));
        return jpaOperatingHoursRepository.save(entity).toDomain();
    }

    @Override
    public Optional<SpecialDayHours> findByBusinessIdAndDate(Long businessId, LocalDate date) {
        return jpaSpecialDayHoursRepository.findByBusinessIdAndSpecialDate(businessId, date)
                .map(SpecialDayHoursEntity::toDomain);
    }

    @Override
    @Transactional
    public SpecialDayHours save(SpecialDayHours specialDayHours) {
        log.debug("Saving special day: businessId={}, date={}", specialDayHours.businessId(), specialDayHours.date());

        SpecialDayHoursEntity entity = jpaSpecialDayHoursRepository
                .findByBusinessIdAndSpecialDate(specialDayHours.businessId(), specialDayHours.date())
                .map(existing -> {
                    existing.update(specialDayHours);
                    return existing;
                })
                .orElseGet(() -> SpecialDayHoursEntity.create(specialDayHours));
        return jpaSpecialDayHoursRepository.save(entity).toDomain();
    }

    @Override
    @Transactional
    public boolean deleteByBusinessIdAndDate(Long businessId, LocalDate date) {
        return jpaSpecialDayHoursRepository.findByBusinessIdAndSpecialDate(businessId, date)
                .map(entity -> {
                    jpaSpecialDayHoursRepository.delete(entity);
                    return true;
                })
                .orElse(false);
    }
}
