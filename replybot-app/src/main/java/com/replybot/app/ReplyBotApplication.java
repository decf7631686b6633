package com.replybot.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ReplyBot application entry point.
 */
@SpringBootApplication
public class ReplyBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReplyBotApplication.class, args);
    }
}
