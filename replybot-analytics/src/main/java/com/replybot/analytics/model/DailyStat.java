package com.replybot.analytics.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Message counts for one calendar day ({@code yyyy-MM-dd} in the analytics zone).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DailyStat {
    private String date;
    private long total;
    private long sent;
    private long received;
    private long failed;

    public static DailyStat empty(String date) {
        return new DailyStat(date, 0, 0, 0, 0);
    }

    public DailyStat copy() {
        return new DailyStat(date, total, sent, received, failed);
    }
}
