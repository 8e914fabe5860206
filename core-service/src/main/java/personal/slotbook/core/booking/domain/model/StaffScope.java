package personal.slotbook.core.booking.domain.model;

import java.util.Objects;

/**
 * 직원 범위 규칙
 * 두 일정 중 하나라도 직원 미지정(업체 전체)이거나 같은 직원에게 배정된 경우 같은 자원을 점유함
 */
public final class StaffScope {

    private StaffScope() {
    }

    public static boolean sharesResource(Long staffId, Long otherStaffId) {
        return staffId == null || otherStaffId == null || Objects.equals(staffId, otherStaffId);
    }
}
