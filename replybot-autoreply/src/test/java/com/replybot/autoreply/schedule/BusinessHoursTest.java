package com.replybot.autoreply.schedule;

import com.replybot.common.config.BotSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class BusinessHoursTest {

    private final BusinessHours businessHours = new BusinessHours();

    private static BotSettings.WorkingHours window(String start, String end, String zone) {
        return BotSettings.WorkingHours.builder().enabled(true).start(start).end(end).timezone(zone).build();
    }

    @ParameterizedTest
    @CsvSource({
            "2024-03-04T08:59:00Z, false",
            "2024-03-04T09:00:00Z, true",
            "2024-03-04T12:30:00Z, true",
            "2024-03-04T17:00:00Z, true",
            "2024-03-04T17:00:59Z, true",
            "2024-03-04T17:01:00Z, false"
    })
    void inclusiveBoundaries(String instant, boolean expected) {
        assertEquals(expected, businessHours.isOpen(window("09:00", "17:00", "UTC"), Instant.parse(instant)));
    }

    @Test
    void evaluatedInConfiguredZone() {
        // 14:00 UTC is 09:00 in New York (EST, UTC-5)
        BotSettings.WorkingHours ny = window("09:00", "17:00", "America/New_York");
        assertTrue(businessHours.isOpen(ny, Instant.parse("2024-01-15T14:00:00Z")));
        assertFalse(businessHours.isOpen(ny, Instant.parse("2024-01-15T13:59:00Z")));
    }

    @Test
    void midnightSpanningWindow_isAlwaysClosed() {
        BotSettings.WorkingHours night = window("22:00", "06:00", "UTC");
        assertFalse(businessHours.isOpen(night, Instant.parse("2024-03-04T23:00:00Z")));
        assertFalse(businessHours.isOpen(night, Instant.parse("2024-03-04T03:00:00Z")));
        assertFalse(businessHours.isOpen(night, Instant.parse("2024-03-04T12:00:00Z")));
    }

    @Test
    void malformedWindow_isClosed() {
        assertFalse(businessHours.isOpen(window("9am", "17:00", "UTC"), Instant.parse("2024-03-04T12:00:00Z")));
    }

    @Test
    void unknownZone_fallsBackToUtc() {
        assertTrue(businessHours.isOpen(window("09:00", "17:00", "Mars/Olympus"),
                Instant.parse("2024-03-04T10:00:00Z")));
    }

    @Test
    void parseMinutes() {
        assertEquals(540, BusinessHours.parseMinutes("09:00"));
        assertEquals(1439, BusinessHours.parseMinutes("23:59"));
        assertNull(BusinessHours.parseMinutes("24:00"));
        assertNull(BusinessHours.parseMinutes("noon"));
    }
}
