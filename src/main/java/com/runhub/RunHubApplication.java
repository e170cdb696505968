package com.runhub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

@SpringBootApplication
public class RunHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(RunHubApplication.class, args);
    }

    // Cooldown and attribution windows are computed against this clock
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
