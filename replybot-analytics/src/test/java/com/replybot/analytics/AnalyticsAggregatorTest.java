package com.replybot.analytics;

import com.replybot.analytics.errors.ErrorCategory;
import com.replybot.analytics.model.ContactStat;
import com.replybot.analytics.model.DailyStat;
import com.replybot.analytics.model.ErrorStat;
import com.replybot.analytics.model.ResponseTimeStats;
import com.replybot.channel.model.Message;
import com.replybot.channel.model.MessageDirection;
import com.replybot.channel.model.MessageStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnalyticsAggregatorTest {

    private static final Instant NOW = Instant.parse("2024-03-15T12:00:00Z");

    private AnalyticsAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new AnalyticsAggregator(ZoneOffset.UTC, 1000, 10_000, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Message incoming(String from, Instant at) {
        return Message.builder()
                .id("in-" + from + "-" + at.toEpochMilli())
                .sender(from)
                .recipient("bot@c.us")
                .content("hi")
                .direction(MessageDirection.INCOMING)
                .status(MessageStatus.RECEIVED)
                .timestamp(at)
                .build();
    }

    private static Message outgoing(String to, Instant at) {
        return Message.builder()
                .id("out-" + to + "-" + at.toEpochMilli())
                .sender("bot@c.us")
                .recipient(to)
                .content("hello")
                .direction(MessageDirection.OUTGOING)
                .status(MessageStatus.SENT)
                .timestamp(at)
                .fromMe(true)
                .build();
    }

    private static Message failed(String to, Instant at, String error) {
        return outgoing(to, at).toBuilder()
                .id(Message.FAILED_ID_PREFIX + at.toEpochMilli())
                .status(MessageStatus.FAILED)
                .error(error)
                .build();
    }

    @Nested
    class Recording {

        @Test
        void countsIncomingAndFailedPerDay() {
            for (int i = 0; i < 10; i++) {
                aggregator.record(incoming("a@c.us", NOW.plusSeconds(i)));
            }
            for (int i = 0; i < 3; i++) {
                aggregator.record(failed("a@c.us", NOW.plusSeconds(20 + i), "Network unreachable"));
            }

            DailyStat day = aggregator.getDailyStat(LocalDate.of(2024, 3, 15));
            assertEquals(13, day.getTotal());
            assertEquals(0, day.getSent());
            assertEquals(10, day.getReceived());
            assertEquals(3, day.getFailed());
        }

        @Test
        void hourlyHistogramUsesConfiguredZone() {
            AnalyticsAggregator shifted = new AnalyticsAggregator(
                    ZoneOffset.ofHours(2), 10, 10, Clock.fixed(NOW, ZoneOffset.UTC));
            shifted.record(incoming("a@c.us", NOW));

            assertEquals(1, shifted.hourlyDistribution().get(14).count());
            assertEquals(0, shifted.hourlyDistribution().get(12).count());
            assertEquals(24, shifted.hourlyDistribution().size());
        }

        @Test
        void missingTimestampUsesClock() {
            aggregator.record(incoming("a@c.us", NOW).toBuilder().timestamp(null).build());

            assertEquals(1, aggregator.getDailyStat(LocalDate.of(2024, 3, 15)).getReceived());
            assertEquals(1, aggregator.hourlyDistribution().get(12).count());
        }

        @Test
        void failuresWithErrorTextAreLogged() {
            aggregator.record(failed("a@c.us", NOW, "Connection timeout to authentication server"));
            aggregator.record(failed("b@c.us", NOW.plusSeconds(1), "Invalid recipient"));
            aggregator.record(failed("b@c.us", NOW.plusSeconds(2), ""));

            assertEquals(2, aggregator.errorLog().size());
            assertEquals(ErrorCategory.NETWORK, aggregator.errorLog().get(0).category());
            assertEquals("a@c.us", aggregator.errorLog().get(0).contact());
        }

        @Test
        void errorLogIsBounded() {
            AnalyticsAggregator small = new AnalyticsAggregator(ZoneOffset.UTC, 2, 10, Clock.systemUTC());
            for (int i = 0; i < 4; i++) {
                small.record(failed("a@c.us", NOW.plusSeconds(i), "File missing " + i));
            }
            assertEquals(2, small.errorLog().size());
            assertEquals("File missing 2", small.errorLog().get(0).error());
        }
    }

    @Nested
    class Contacts {

        @Test
        void topContactsOrderedByCount() {
            for (int i = 0; i < 3; i++) {
                aggregator.record(incoming("busy@c.us", NOW.plusSeconds(i)));
            }
            aggregator.record(incoming("quiet@c.us", NOW));
            aggregator.record(outgoing("busy@c.us", NOW.plusSeconds(10)));

            List<ContactStat> top = aggregator.topContacts(10);
            assertEquals(2, top.size());
            assertEquals("busy@c.us", top.get(0).getContact());
            assertEquals(4, top.get(0).getMessageCount());
            assertEquals(NOW, top.get(0).getFirstContact());
            assertEquals(NOW.plusSeconds(10), top.get(0).getLastActive());
        }

        @Test
        void leastRecentlyActiveContactIsEvicted() {
            AnalyticsAggregator small = new AnalyticsAggregator(ZoneOffset.UTC, 10, 2, Clock.systemUTC());
            small.record(incoming("a@c.us", NOW));
            small.record(incoming("b@c.us", NOW.plusSeconds(1)));
            small.record(incoming("a@c.us", NOW.plusSeconds(2)));
            small.record(incoming("c@c.us", NOW.plusSeconds(3)));

            assertEquals(2, small.contactCount());
            List<String> names = small.topContacts(10).stream().map(ContactStat::getContact).toList();
            assertTrue(names.contains("a@c.us"));
            assertTrue(names.contains("c@c.us"));
            assertFalse(names.contains("b@c.us"));
        }
    }

    @Nested
    class ResponseTimes {

        @Test
        void pairsIncomingWithFollowingReply() {
            List<Message> messages = List.of(
                    incoming("a@c.us", NOW),
                    outgoing("a@c.us", NOW.plusSeconds(5)),
                    incoming("b@c.us", NOW.plusSeconds(60)),
                    outgoing("b@c.us", NOW.plusSeconds(65)));

            ResponseTimeStats stats = AnalyticsAggregator.computeResponseTimes(messages);
            assertEquals(new ResponseTimeStats(5, 5, 5), stats);
        }

        @Test
        void unorderedInputIsSortedPerConversation() {
            List<Message> messages = List.of(
                    outgoing("a@c.us", NOW.plusSeconds(30)),
                    incoming("a@c.us", NOW),
                    outgoing("a@c.us", NOW.plusSeconds(2)),
                    incoming("a@c.us", NOW.plusSeconds(20)));

            ResponseTimeStats stats = AnalyticsAggregator.computeResponseTimes(messages);
            assertEquals(6, stats.average());
            assertEquals(2, stats.fastest());
            assertEquals(10, stats.slowest());
        }

        @Test
        void noPairsIsAllZero() {
            assertEquals(ResponseTimeStats.EMPTY,
                    AnalyticsAggregator.computeResponseTimes(List.of(incoming("a@c.us", NOW))));
            assertEquals(ResponseTimeStats.EMPTY, AnalyticsAggregator.computeResponseTimes(List.of()));
        }
    }

    @Nested
    class Reports {

        @Test
        void dailyStatsFillGaps() {
            aggregator.record(incoming("a@c.us", Instant.parse("2024-03-12T08:00:00Z")));
            aggregator.record(incoming("a@c.us", Instant.parse("2024-03-14T08:00:00Z")));

            List<DailyStat> days = aggregator.getDailyStats(LocalDate.of(2024, 3, 11), LocalDate.of(2024, 3, 15));
            assertEquals(5, days.size());
            assertEquals("2024-03-11", days.get(0).getDate());
            assertEquals(0, days.get(0).getTotal());
            assertEquals(1, days.get(1).getTotal());
            assertEquals(0, days.get(2).getTotal());
            assertEquals(1, days.get(3).getTotal());
            assertEquals("2024-03-15", days.get(4).getDate());
        }

        @Test
        void trendComparesWithPreviousWindow() {
            List<Message> messages = new ArrayList<>();
            // previous day window: 2 messages
            messages.add(incoming("a@c.us", NOW.minus(30, ChronoUnit.HOURS)));
            messages.add(incoming("a@c.us", NOW.minus(40, ChronoUnit.HOURS)));
            // current window: 3 messages, one failed
            messages.add(incoming("a@c.us", NOW.minus(2, ChronoUnit.HOURS)));
            messages.add(outgoing("a@c.us", NOW.minus(1, ChronoUnit.HOURS)));
            messages.add(failed("a@c.us", NOW.minus(30, ChronoUnit.MINUTES), "Rate limited"));

            AnalyticsReport report = aggregator.report(messages, TimeRange.DAY, NOW);

            assertEquals(3, report.messageVolume().total());
            assertEquals(1, report.messageVolume().sent());
            assertEquals(1, report.messageVolume().received());
            assertEquals(1, report.messageVolume().failed());
            assertEquals(50, report.messageVolume().trend());
            assertEquals(2, report.dailyStats().size());
            assertEquals(3600, report.responseTime().average());
        }

        @Test
        void noPreviousTrafficMeansFlatTrend() {
            AnalyticsReport report = aggregator.report(
                    List.of(incoming("a@c.us", NOW.minusSeconds(10))), TimeRange.WEEK, NOW);
            assertEquals(0, report.messageVolume().trend());
            assertEquals(8, report.dailyStats().size());
        }

        @Test
        void errorsGroupedByCategory() {
            aggregator.record(failed("a@c.us", NOW, "Network down"));
            aggregator.record(failed("a@c.us", NOW.plusSeconds(5), "Connection refused"));
            aggregator.record(failed("a@c.us", NOW.plusSeconds(9), "Auth token expired"));

            List<ErrorStat> errors = aggregator.analyzeErrors();
            assertEquals(2, errors.size());
            assertEquals(ErrorCategory.NETWORK, errors.get(0).type());
            assertEquals(2, errors.get(0).count());
            assertEquals(NOW.plusSeconds(5), errors.get(0).lastOccurrence());
            assertFalse(errors.get(0).resolved());
            assertEquals(ErrorCategory.AUTHENTICATION, errors.get(1).type());
        }

        @Test
        void timeRangeFromIdDefaultsToWeek() {
            assertEquals(TimeRange.MONTH, TimeRange.fromId("month"));
            assertEquals(TimeRange.WEEK, TimeRange.fromId("bogus"));
        }
    }

    @Test
    void snapshotRestoresState() {
        aggregator.record(incoming("a@c.us", NOW));
        aggregator.record(failed("a@c.us", NOW.plusSeconds(1), "Media rejected"));
        AnalyticsSnapshot snapshot = aggregator.snapshot();

        AnalyticsAggregator fresh = new AnalyticsAggregator(ZoneOffset.UTC, 1000, 10_000, Clock.systemUTC());
        fresh.restore(snapshot);

        assertEquals(2, fresh.getDailyStat(LocalDate.of(2024, 3, 15)).getTotal());
        assertEquals(2, fresh.hourlyDistribution().get(12).count());
        assertEquals(1, fresh.topContacts(5).size());
        assertEquals(ErrorCategory.MEDIA, fresh.errorLog().get(0).category());

        aggregator.reset();
        assertEquals(0, aggregator.getDailyStat(LocalDate.of(2024, 3, 15)).getTotal());
        assertEquals(2, fresh.getDailyStat(LocalDate.of(2024, 3, 15)).getTotal());
    }
}
