package com.repairdesk.sync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RealtimeSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(RealtimeSyncApplication.class, args);
    }
}
