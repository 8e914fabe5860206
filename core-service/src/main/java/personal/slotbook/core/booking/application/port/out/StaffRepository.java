package personal.slotbook.core.booking.application.port.out;

import personal.slotbook.core.booking.domain.model.Staff;

import java.util.Optional;

/**
 * Staff Repository (Output Port)
 */
public interface StaffRepository {

    Optional<Staff> findById(Long staffId);
}
