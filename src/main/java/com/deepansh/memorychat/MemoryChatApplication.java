package com.deepansh.memorychat;

import com.deepansh.memorychat.config.OrchestratorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
@EnableConfigurationProperties(OrchestratorProperties.class)
public class MemoryChatApplication {
    public static void main(String[] args) {
        SpringApplication.run(MemoryChatApplication.class, args);
    }
}
