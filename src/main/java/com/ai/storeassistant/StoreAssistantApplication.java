package com.ai.storeassistant;

import com.ai.storeassistant.config.AssistantProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.ai.storeassistant")
@EnableJpaRepositories(basePackages = "com.ai.storeassistant.repository")
@EntityScan(basePackages = "com.ai.storeassistant.entity")
@EnableConfigurationProperties(AssistantProperties.class)
public class StoreAssistantApplication {

    public static void main(String[] args) {
        SpringApplication.run(StoreAssistantApplication.class, args);
    }
}
