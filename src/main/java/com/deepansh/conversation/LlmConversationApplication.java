package com.deepansh.conversation;

import com.deepansh.conversation.config.LlmProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(LlmProperties.class)
public class LlmConversationApplication {
    public static void main(String[] args) {
        SpringApplication.run(LlmConversationApplication.class, args);
    }
}
