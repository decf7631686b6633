package com.replybot.autoreply.schedule;

import com.replybot.common.config.BotSettings;
import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Evaluates the operator's working-hours window.
 * <p>
 * The window is inclusive at minute granularity in the configured zone:
 * with 09:00-17:00, 09:00 and 17:00 are inside, 08:59 and 17:01 are not.
 * Windows that span midnight ({@code start > end}) are not supported and
 * are always closed; each such window is logged once.
 */
@Slf4j
public class BusinessHours {

    private final Set<String> warned = ConcurrentHashMap.newKeySet();

    /**
     * Whether {@code now} falls inside the window. Ignores
     * {@link BotSettings.WorkingHours#isEnabled()}.
     */
    public boolean isOpen(BotSettings.WorkingHours hours, Instant now) {
        Integer start = parseMinutes(hours.getStart());
        Integer end = parseMinutes(hours.getEnd());
        if (start == null || end == null) {
            warnOnce("invalid:" + hours.getStart() + "-" + hours.getEnd(),
                    "[gate] Invalid working hours {}-{}, treating as closed", hours.getStart(), hours.getEnd());
            return false;
        }
        if (start > end) {
            warnOnce("span:" + hours.getStart() + "-" + hours.getEnd(),
                    "[gate] Working hours {}-{} span midnight, which is unsupported; treating as closed",
                    hours.getStart(), hours.getEnd());
            return false;
        }
        LocalTime local = now.atZone(resolveZone(hours.getTimezone())).toLocalTime();
        int minute = local.getHour() * 60 + local.getMinute();
        return minute >= start && minute <= end;
    }

    private ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            warnOnce("zone:" + timezone, "[gate] Unknown timezone {}, using UTC", timezone);
            return ZoneOffset.UTC;
        }
    }

    static Integer parseMinutes(String hhmm) {
        if (hhmm == null) {
            return null;
        }
        String[] parts = hhmm.trim().split(":");
        if (parts.length != 2) {
            return null;
        }
        try {
            int h = Integer.parseInt(parts[0]);
            int m = Integer.parseInt(parts[1]);
            if (h < 0 || h > 23 || m < 0 || m > 59) {
                return null;
            }
            return h * 60 + m;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private void warnOnce(String key, String format, Object... args) {
        if (warned.add(key)) {
            log.warn(format, args);
        }
    }
}
