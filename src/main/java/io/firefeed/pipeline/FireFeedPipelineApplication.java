package io.firefeed.pipeline;

import io.firefeed.pipeline.config.RssConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableRetry
@EnableScheduling
@EnableConfigurationProperties(RssConfig.class)
@ConfigurationPropertiesScan
public class FireFeedPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(FireFeedPipelineApplication.class, args);
    }
}
