package com.tally.reference;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Reference service that wires the REST controllers, storage and core engine together. */
@Slf4j
@EnableScheduling
@SpringBootApplication(scanBasePackages = {"com.tally"})
public class TallyApplication {

    public static void main(String[] args) {
        long maxMemory = Runtime.getRuntime().maxMemory();
        log.info("Max memory: {} MB", maxMemory / 1_048_576L);
        SpringApplication.run(TallyApplication.class, args);
    }
}
