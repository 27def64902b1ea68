package dev.distroblog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Entry point of the feed discovery and article ingestion service.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableRetry
public class DistroblogApplication {
    public static void main(String[] args) {
        SpringApplication.run(DistroblogApplication.class, args);
    }
}
