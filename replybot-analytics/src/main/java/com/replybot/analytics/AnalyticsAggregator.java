package com.replybot.analytics;

import com.replybot.analytics.errors.ErrorCategorizer;
import com.replybot.analytics.errors.ErrorCategory;
import com.replybot.analytics.errors.ErrorLog;
import com.replybot.analytics.errors.ErrorLogEntry;
import com.replybot.analytics.model.ContactStat;
import com.replybot.analytics.model.DailyStat;
import com.replybot.analytics.model.ErrorStat;
import com.replybot.analytics.model.HourCount;
import com.replybot.analytics.model.MessageVolume;
import com.replybot.analytics.model.ResponseTimeStats;
import com.replybot.channel.model.Message;
import com.replybot.channel.model.MessageStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Running message analytics: daily totals, hour-of-day histogram, per-contact
 * activity and a bounded error log.
 * <p>
 * Updated incrementally by {@link #record(Message)}; every message counts,
 * there is no dedup. Contact stats keep the {@code contactCapacity} most
 * recently active contacts. Thread-safe via synchronization.
 */
@Slf4j
public class AnalyticsAggregator {

    static final int TOP_CONTACTS = 10;

    private final ZoneId zone;
    private final Clock clock;
    private final int contactCapacity;

    private final TreeMap<String, DailyStat> dailyStats = new TreeMap<>();
    private final long[] hourly = new long[24];
    private final LinkedHashMap<String, ContactStat> contacts;
    private final ErrorLog errorLog;

    public AnalyticsAggregator(ZoneId zone, int errorLogCapacity, int contactCapacity, Clock clock) {
        this.zone = zone;
        this.clock = clock;
        this.contactCapacity = Math.max(1, contactCapacity);
        this.errorLog = new ErrorLog(errorLogCapacity);
        this.contacts = new LinkedHashMap<>(64, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, ContactStat> eldest) {
                return size() > AnalyticsAggregator.this.contactCapacity;
            }
        };
    }

    // ── Incremental update ──────────────────────────────────────────────

    /**
     * Fold one message into the rollups.
     */
    public synchronized void record(Message message) {
        Instant timestamp = message.getTimestamp() != null ? message.getTimestamp() : clock.instant();
        ZonedDateTime local = timestamp.atZone(zone);
        String dateKey = local.toLocalDate().toString();

        DailyStat day = dailyStats.computeIfAbsent(dateKey, DailyStat::empty);
        day.setTotal(day.getTotal() + 1);
        if (message.isOutgoing()) {
            if (message.getStatus() == MessageStatus.FAILED) {
                day.setFailed(day.getFailed() + 1);
            } else {
                day.setSent(day.getSent() + 1);
            }
        } else {
            day.setReceived(day.getReceived() + 1);
        }

        hourly[local.getHour()]++;

        String contact = message.contact();
        if (contact != null) {
            ContactStat stat = contacts.get(contact);
            if (stat == null) {
                stat = new ContactStat(contact, 0, timestamp, timestamp);
                contacts.put(contact, stat);
            }
            stat.setMessageCount(stat.getMessageCount() + 1);
            if (stat.getLastActive() == null || timestamp.isAfter(stat.getLastActive())) {
                stat.setLastActive(timestamp);
            }
        }

        if (message.getStatus() == MessageStatus.FAILED
                && message.getError() != null && !message.getError().isBlank()) {
            ErrorCategory category = ErrorCategorizer.categorize(message.getError());
            errorLog.add(new ErrorLogEntry(timestamp, category, message.getError(), message.getId(), contact));
            log.debug("Recorded {} for message {}", category.getLabel(), message.getId());
        }
    }

    // ── Derived metrics ─────────────────────────────────────────────────

    /**
     * Pair each incoming message with the outgoing message that directly
     * follows it in the same conversation.
     */
    public static ResponseTimeStats computeResponseTimes(Collection<Message> messages) {
        Map<String, List<Message>> byContact = new HashMap<>();
        for (Message m : messages) {
            if (m.getTimestamp() == null) {
                continue;
            }
            String contact = m.contact();
            byContact.computeIfAbsent(contact != null ? contact : "", k -> new ArrayList<>()).add(m);
        }

        List<Double> samples = new ArrayList<>();
        for (List<Message> conversation : byContact.values()) {
            conversation.sort(Comparator.comparing(Message::getTimestamp));
            for (int i = 1; i < conversation.size(); i++) {
                Message previous = conversation.get(i - 1);
                Message current = conversation.get(i);
                if (previous.isIncoming() && current.isOutgoing()) {
                    long millis = Duration.between(previous.getTimestamp(), current.getTimestamp()).toMillis();
                    samples.add(millis / 1000.0);
                }
            }
        }

        if (samples.isEmpty()) {
            return ResponseTimeStats.EMPTY;
        }
        double sum = 0;
        double fastest = Double.MAX_VALUE;
        double slowest = -Double.MAX_VALUE;
        for (double s : samples) {
            sum += s;
            fastest = Math.min(fastest, s);
            slowest = Math.max(slowest, s);
        }
        return new ResponseTimeStats(Math.round(sum / samples.size()), Math.round(fastest), Math.round(slowest));
    }

    public static ErrorCategory categorizeError(String errorMessage) {
        return ErrorCategorizer.categorize(errorMessage);
    }

    /**
     * Error log grouped by category, in order of first appearance.
     */
    public synchronized List<ErrorStat> analyzeErrors() {
        Map<ErrorCategory, long[]> counts = new EnumMap<>(ErrorCategory.class);
        Map<ErrorCategory, Instant> last = new EnumMap<>(ErrorCategory.class);
        List<ErrorCategory> order = new ArrayList<>();
        for (ErrorLogEntry entry : errorLog.entries()) {
            if (!counts.containsKey(entry.category())) {
                counts.put(entry.category(), new long[1]);
                order.add(entry.category());
            }
            counts.get(entry.category())[0]++;
            Instant seen = last.get(entry.category());
            if (seen == null || entry.timestamp().isAfter(seen)) {
                last.put(entry.category(), entry.timestamp());
            }
        }
        List<ErrorStat> result = new ArrayList<>();
        for (ErrorCategory category : order) {
            result.add(new ErrorStat(category, counts.get(category)[0], last.get(category), false));
        }
        return result;
    }

    /**
     * One entry per day from {@code from} to {@code to} inclusive; days
     * without traffic are zero-filled.
     */
    public synchronized List<DailyStat> getDailyStats(LocalDate from, LocalDate to) {
        List<DailyStat> result = new ArrayList<>();
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            String key = d.toString();
            DailyStat stat = dailyStats.get(key);
            result.add(stat != null ? stat.copy() : DailyStat.empty(key));
        }
        return result;
    }

    public synchronized DailyStat getDailyStat(LocalDate date) {
        DailyStat stat = dailyStats.get(date.toString());
        return stat != null ? stat.copy() : DailyStat.empty(date.toString());
    }

    /** Most active contacts, highest message count first. */
    public synchronized List<ContactStat> topContacts(int n) {
        return contacts.values().stream()
                .sorted(Comparator.comparingLong(ContactStat::getMessageCount).reversed())
                .limit(Math.max(0, n))
                .map(ContactStat::copy)
                .toList();
    }

    public synchronized List<HourCount> hourlyDistribution() {
        List<HourCount> result = new ArrayList<>(24);
        for (int h = 0; h < 24; h++) {
            result.add(new HourCount(h, hourly[h]));
        }
        return result;
    }

    public synchronized List<ErrorLogEntry> errorLog() {
        return errorLog.entries();
    }

    public synchronized int contactCount() {
        return contacts.size();
    }

    /**
     * Build the dashboard report for {@code range} ending at {@code now}.
     * Volume and response times come from {@code messages}; the trend compares
     * against the previous window of equal length.
     */
    public AnalyticsReport report(Collection<Message> messages, TimeRange range, Instant now) {
        Instant start = now.minus(range.duration());
        Instant previousStart = start.minus(range.duration());

        List<Message> current = new ArrayList<>();
        long previousTotal = 0;
        long sent = 0;
        long received = 0;
        long failed = 0;
        for (Message m : messages) {
            Instant ts = m.getTimestamp();
            if (ts == null) {
                continue;
            }
            if (!ts.isBefore(start)) {
                current.add(m);
                if (m.isOutgoing() && m.getStatus() != MessageStatus.FAILED) {
                    sent++;
                }
                if (m.isIncoming()) {
                    received++;
                }
                if (m.getStatus() == MessageStatus.FAILED) {
                    failed++;
                }
            } else if (!ts.isBefore(previousStart)) {
                previousTotal++;
            }
        }
        long total = current.size();
        long trend = previousTotal > 0 ? Math.round((total - previousTotal) * 100.0 / previousTotal) : 0;

        return new AnalyticsReport(
                range,
                now,
                new MessageVolume(total, sent, received, failed, trend),
                computeResponseTimes(current),
                topContacts(TOP_CONTACTS),
                hourlyDistribution(),
                getDailyStats(start.atZone(zone).toLocalDate(), now.atZone(zone).toLocalDate()),
                analyzeErrors());
    }

    // ── Persistence ─────────────────────────────────────────────────────

    public synchronized AnalyticsSnapshot snapshot() {
        List<DailyStat> days = new ArrayList<>();
        dailyStats.values().forEach(d -> days.add(d.copy()));
        List<ContactStat> contactCopies = new ArrayList<>();
        contacts.values().forEach(c -> contactCopies.add(c.copy()));
        return AnalyticsSnapshot.builder()
                .takenAt(clock.instant())
                .dailyStats(days)
                .hourlyDistribution(hourly.clone())
                .contacts(contactCopies)
                .errorLog(errorLog.entries())
                .build();
    }

    /**
     * Replace the current state with a persisted snapshot.
     */
    public synchronized void restore(AnalyticsSnapshot snapshot) {
        reset();
        if (snapshot.getDailyStats() != null) {
            snapshot.getDailyStats().forEach(d -> dailyStats.put(d.getDate(), d.copy()));
        }
        long[] savedHourly = snapshot.getHourlyDistribution();
        if (savedHourly != null) {
            System.arraycopy(savedHourly, 0, hourly, 0, Math.min(savedHourly.length, hourly.length));
        }
        if (snapshot.getContacts() != null) {
            snapshot.getContacts().stream()
                    .sorted(Comparator.comparing(ContactStat::getLastActive,
                            Comparator.nullsFirst(Comparator.naturalOrder())))
                    .forEach(c -> contacts.put(c.getContact(), c.copy()));
        }
        if (snapshot.getErrorLog() != null) {
            errorLog.addAll(snapshot.getErrorLog());
        }
        log.info("Restored analytics: {} days, {} contacts, {} errors",
                dailyStats.size(), contacts.size(), errorLog.size());
    }

    public synchronized void reset() {
        dailyStats.clear();
        Arrays.fill(hourly, 0);
        contacts.clear();
        errorLog.clear();
    }
}
