package com.enrichreview.backend;

import com.enrichreview.backend.config.ReviewProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ReviewProperties.class)
public class ReviewBackendApplication {
    public static void main(String[] args) {
        SpringApplication.run(ReviewBackendApplication.class, args);
    }
}
