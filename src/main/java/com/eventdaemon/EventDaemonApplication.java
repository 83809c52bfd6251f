package com.eventdaemon;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EventDaemonApplication {

    public static void main(String[] args) {
        SpringApplication.run(EventDaemonApplication.class, args);
    }
}
