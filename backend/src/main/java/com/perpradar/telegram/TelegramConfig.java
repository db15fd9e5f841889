package com.perpradar.telegram;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@EnableConfigurationProperties(TelegramProperties.class)
public class TelegramConfig {

    @Bean
    public TelegramBotClient telegramBotClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                                               TelegramProperties properties) {
        return new WebClientTelegramBotClient(webClientBuilder, objectMapper,
                properties.getApiBaseUrl(), properties.getBotToken());
    }
}
