package com.replybot.channel.model;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MessageStatusTest {

    @ParameterizedTest
    @CsvSource({
            "0, PENDING",
            "1, SENT",
            "2, DELIVERED",
            "3, READ",
            "-1, FAILED",
            "4, UNKNOWN",
            "-7, UNKNOWN"
    })
    void fromAck(int ack, MessageStatus expected) {
        assertEquals(expected, MessageStatus.fromAck(ack));
    }
}
