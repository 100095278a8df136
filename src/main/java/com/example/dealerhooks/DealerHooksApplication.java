package com.example.dealerhooks;

import com.example.dealerhooks.config.WebhookProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(WebhookProperties.class)
public class DealerHooksApplication {

    public static void main(String[] args) {
        SpringApplication.run(DealerHooksApplication.class, args);
    }

}
