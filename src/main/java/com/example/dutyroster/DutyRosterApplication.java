package com.example.dutyroster;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DutyRosterApplication {

    public static void main(String[] args) {
        SpringApplication.run(DutyRosterApplication.class, args);
    }
}
