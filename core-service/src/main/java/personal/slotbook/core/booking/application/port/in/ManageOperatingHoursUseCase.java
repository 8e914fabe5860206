package personal.slotbook.core.booking.application.port.in;

import personal.slotbook.core.booking.domain.model.DailyHours;
import personal.slotbook.core.booking.domain.model.OperatingSchedule;
import personal.slotbook.core.booking.domain.model.SpecialDayHours;

import java.time.LocalDate;

/**
 * Manage Operating Hours UseCase (Input Port)
 * 주간 영업 시간과 특별 영업일 관리. 변경 시 업체의 예약 가능 캐시 전체 무효화
 */
public interface ManageOperatingHoursUseCase {

    OperatingSchedule getOperatingSchedule(Long businessId);

    DailyHours updateOperatingHours(UpdateOperatingHoursCommand command);

    SpecialDayHours setSpecialDay(SetSpecialDayCommand command);

    void removeSpecialDay(Long businessId, LocalDate date);
}
