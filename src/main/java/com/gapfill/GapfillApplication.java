package com.gapfill;

import com.gapfill.config.FetcherProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(FetcherProperties.class)
public class GapfillApplication {

    public static void main(String[] args) {
        SpringApplication.run(GapfillApplication.class, args);
    }
}
