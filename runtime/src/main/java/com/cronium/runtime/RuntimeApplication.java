package com.cronium.runtime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

@SpringBootApplication
public class RuntimeApplication {

    public static void main(String[] args) {
        SpringApplication.run(RuntimeApplication.class, args);
    }

    /**
     * Single time source for token expiry, rate windows and state timestamps.
     * Tests replace it with a fixed or mutable clock.
     */
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
