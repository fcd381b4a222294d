package io.feedrecorder.ingestion;

import io.feedrecorder.ingestion.config.RecorderConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.retry.annotation.EnableRetry;

@SpringBootApplication
@EnableRetry
@EnableConfigurationProperties(RecorderConfig.class)
@ConfigurationPropertiesScan
public class FeedRecorderApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(FeedRecorderApplication.class, args)));
    }
}
