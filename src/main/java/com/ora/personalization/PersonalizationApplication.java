package com.ora.personalization;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PersonalizationApplication {
    public static void main(String[] args) {
        SpringApplication.run(PersonalizationApplication.class, args);
    }
}
