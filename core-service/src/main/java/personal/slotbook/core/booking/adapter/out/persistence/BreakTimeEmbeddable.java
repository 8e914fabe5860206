package personal.slotbook.core.booking.adapter.out.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.slotbook.core.booking.domain.model.TimeRange;

import java.time.LocalTime;

/**
 * 휴게 시간 (operating_hour_breaks 컬렉션 테이블)
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BreakTimeEmbeddable {

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    public static BreakTimeEmbeddable fromDomain(TimeRange range) {
        BreakTimeEmbeddable embeddable = new BreakTimeEmbeddable();
        embeddable.startTime = range.startTime();
        embeddable.endTime = range.endTime();
        return embeddable;
    }

    public TimeRange toDomain() {
        return new TimeRange(startTime, endTime);
    }
}
