package com.streambot.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Stream bot host application entry point.
 */
@SpringBootApplication
public class StreamBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(StreamBotApplication.class, args);
    }
}
