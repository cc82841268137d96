package com.mtsa.findings;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FindingsCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(FindingsCacheApplication.class, args);
    }
}
