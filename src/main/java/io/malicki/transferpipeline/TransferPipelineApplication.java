package io.malicki.transferpipeline;

import io.malicki.transferpipeline.config.TransferProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(TransferProperties.class)
public class TransferPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(TransferPipelineApplication.class, args);
    }
}
