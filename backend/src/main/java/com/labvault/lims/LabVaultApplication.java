package com.labvault.lims;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.TimeZone;

@SpringBootApplication
public class LabVaultApplication {
    private static final Logger log = LoggerFactory.getLogger(LabVaultApplication.class);

    // Completion dates and link timestamps are stored without zone
    @Value("${lims.timezone:UTC}")
    private String timezone;

    @PostConstruct
    public void initTimezone() {
        TimeZone.setDefault(TimeZone.getTimeZone(timezone));
        log.info("[Startup] Server timezone set to {}", timezone);
    }

    public static void main(String[] args) {
        SpringApplication.run(LabVaultApplication.class, args);
    }
}
