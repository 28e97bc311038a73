package com.roster.reference;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Reference service that wires the public and admin controllers onto the in-memory registry. */
@EnableScheduling
@SpringBootApplication(scanBasePackages = {"com.roster"})
public class RosterApplication {

    public static void main(String[] args) {
        SpringApplication.run(RosterApplication.class, args);
    }
}
