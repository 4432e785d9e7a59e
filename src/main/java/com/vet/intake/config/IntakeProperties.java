package com.vet.intake.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Engine settings under {@code intake.*}.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "intake")
public class IntakeProperties {

    private long practiceId = 1;

    private Backend backend = new Backend();

    private Zone zone = new Zone();

    private Search search = new Search();

    private Visit visit = new Visit();

    @Getter
    @Setter
    public static class Backend {
        private String baseUrl = "http://localhost:3000";
        private Duration connectTimeout = Duration.ofSeconds(3);
        private Duration readTimeout = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class Zone {
        private Duration quietPeriod = Duration.ofMillis(750);
    }

    @Getter
    @Setter
    public static class Search {
        private Duration quietPeriod = Duration.ofMillis(400);
    }

    @Getter
    @Setter
    public static class Visit {
        private int baseMinutes = 40;
        private int perAdditionalAnimalMinutes = 20;
    }
}
