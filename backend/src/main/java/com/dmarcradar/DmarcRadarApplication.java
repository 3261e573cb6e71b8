package com.dmarcradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DmarcRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(DmarcRadarApplication.class, args);
    }
}
