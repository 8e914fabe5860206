package personal.slotbook.core.booking.adapter.in.web.dto;

/**
 * 요청 DTO 공통 시각 형식 ("HH:MM", 24시간제)
 */
public final class TimeFormats {

    public static final String HH_MM_PATTERN = "^([01]\\d|2[0-3]):[0-5]\\d$";
    public static final String HH_MM_MESSAGE = "시각은 HH:MM 형식이어야 합니다.";

    private TimeFormats() {
    }
}
