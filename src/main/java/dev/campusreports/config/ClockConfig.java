package dev.campusreports.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration(proxyBeanMethods = false)
public class ClockConfig {

    /** Server time source for {@code updated_at} and checkpoints. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
