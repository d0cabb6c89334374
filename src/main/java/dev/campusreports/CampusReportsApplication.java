package dev.campusreports;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CampusReportsApplication {

    public static void main(String[] args) {
        SpringApplication.run(CampusReportsApplication.class, args);
    }
}
