package personal.slotbook.core.booking.application.port.in;

import personal.slotbook.common.exception.BusinessException;
import personal.slotbook.common.exception.ErrorCode;
import personal.slotbook.core.booking.domain.model.StaffAvailabilityOverride;
import personal.slotbook.core.booking.domain.model.TimeRange;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Set Staff Override Command
 * 시작/종료 시각은 둘 다 있거나 둘 다 없어야 함
 */
public record SetStaffOverrideCommand(
        Long staffId,
        LocalDate date,
        boolean available,
        LocalTime startTime,
        LocalTime endTime,
        String reason
) {
    public SetStaffOverrideCommand {
        if (staffId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Staff ID cannot be null");
        }
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Date cannot be null");
        }
        if ((startTime == null) != (endTime == null)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Start time and end time must be given together");
        }
    }

    public StaffAvailabilityOverride toOverride() {
        TimeRange window = startTime == null ? null : new TimeRange(startTime, endTime);
        return new StaffAvailabilityOverride(staffId, date, available, window, reason);
    }
}
