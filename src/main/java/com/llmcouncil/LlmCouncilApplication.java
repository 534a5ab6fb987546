package com.llmcouncil;

import com.llmcouncil.config.properties.CouncilProperties;
import com.llmcouncil.config.properties.OpenRouterProperties;
import com.llmcouncil.config.properties.StorageProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        CouncilProperties.class,
        OpenRouterProperties.class,
        StorageProperties.class
})
@EnableScheduling
public class LlmCouncilApplication {

    public static void main(String[] args) {
        SpringApplication.run(LlmCouncilApplication.class, args);
    }

}
