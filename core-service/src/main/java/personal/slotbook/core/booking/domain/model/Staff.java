package personal.slotbook.core.booking.domain.model;

/**
 * Staff Domain Model
 */
public record Staff(
        Long id,
        Long businessId,
        String name) {

    public boolean belongsTo(Long otherBusinessId) {
        return businessId.equals(otherBusinessId);
    }
}
