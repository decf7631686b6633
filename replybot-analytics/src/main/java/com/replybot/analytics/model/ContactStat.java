package com.replybot.analytics.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Activity summary for one contact.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ContactStat {
    private String contact;
    private long messageCount;
    private Instant firstContact;
    private Instant lastActive;

    public ContactStat copy() {
        return new ContactStat(contact, messageCount, firstContact, lastActive);
    }
}
