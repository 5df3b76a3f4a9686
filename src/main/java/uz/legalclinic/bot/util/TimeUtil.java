package uz.legalclinic.bot.util;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

public final class TimeUtil {
    private TimeUtil() {}

    public static final DateTimeFormatter DATETIME = DateTimeFormatter.ISO_LOCAL_DATE_TIME;
    public static final DateTimeFormatter DISPLAY_DATE = DateTimeFormatter.ofPattern("dd.MM.yyyy");

    public static String nowIso(ZoneId zone) {
        return LocalDateTime.now(zone).format(DATETIME);
    }

    public static LocalDateTime parseDateTime(String iso) {
        return LocalDateTime.parse(iso, DATETIME);
    }

    /**
     * Stored timestamp as dd.MM.yyyy; the raw value if it cannot be parsed.
     */
    public static String displayDate(String iso) {
        if (iso == null) return "";
        try {
            return parseDateTime(iso).format(DISPLAY_DATE);
        } catch (RuntimeException e) {
            return iso;
        }
    }
}
