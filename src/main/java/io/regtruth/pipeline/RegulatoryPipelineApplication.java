package io.regtruth.pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableRetry
@EnableScheduling
@ConfigurationPropertiesScan
public class RegulatoryPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(RegulatoryPipelineApplication.class, args);
    }
}
