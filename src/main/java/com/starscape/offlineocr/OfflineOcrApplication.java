package com.starscape.offlineocr;

import com.starscape.offlineocr.common.config.ArtifactProperties;
import com.starscape.offlineocr.common.config.ProcessingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({ProcessingProperties.class, ArtifactProperties.class})
public class OfflineOcrApplication {

    public static void main(String[] args) {
        SpringApplication.run(OfflineOcrApplication.class, args);
    }
}
