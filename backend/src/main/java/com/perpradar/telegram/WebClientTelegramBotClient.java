package com.perpradar.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Telegram Bot API client using WebClient.
 */
public class WebClientTelegramBotClient implements TelegramBotClient {

    private static final Duration SEND_TIMEOUT = Duration.ofSeconds(15);
    private static final String REDACTED = "<redacted>";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String methodBaseUrl;
    private final String botToken;

    public WebClientTelegramBotClient(WebClient.Builder builder, ObjectMapper objectMapper, String apiBaseUrl, String botToken) {
        this.webClient = builder.build();
        this.objectMapper = objectMapper;
        this.methodBaseUrl = apiBaseUrl + "/bot" + botToken + "/";
        this.botToken = botToken;
    }

    @Override
    public List<TelegramUpdate> getUpdates(long offset, int timeoutSeconds) {
        Map<String, Object> body = Map.of(
                "offset", offset,
                "timeout", timeoutSeconds,
                "allowed_updates", List.of("message")
        );
        JsonNode result = call("getUpdates", body, Duration.ofSeconds(timeoutSeconds + 10L));
        List<TelegramUpdate> updates = new ArrayList<>();
        if (!result.isArray()) {
            return updates;
        }
        for (JsonNode u : result) {
            long updateId = u.path("update_id").asLong();
            JsonNode message = u.path("message");
            if (message.isMissingNode()) {
                updates.add(new TelegramUpdate(updateId, null, null, null));
                continue;
            }
            JsonNode chat = message.path("chat");
            Long chatId = chat.hasNonNull("id") ? chat.get("id").asLong() : null;
            JsonNode from = message.path("from");
            String name = from.hasNonNull("username") ? from.get("username").asText()
                    : from.path("first_name").asText("");
            String text = message.hasNonNull("text") ? message.get("text").asText() : null;
            updates.add(new TelegramUpdate(updateId, chatId, name, text));
        }
        return updates;
    }

    @Override
    public void sendMessage(long chatId, String text) {
        call("sendMessage", Map.of("chat_id", chatId, "text", text), SEND_TIMEOUT);
    }

    private JsonNode call(String method, Map<String, Object> body, Duration timeout) {
        String json;
        try {
            json = webClient.post()
                    .uri(methodBaseUrl + method)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(timeout);
        } catch (WebClientResponseException e) {
            // The request URL carries the token, so the WebClient exception is not kept as cause.
            throw new TelegramApiException(method + " failed: HTTP " + e.getStatusCode().value()
                    + " " + redact(e.getResponseBodyAsString()));
        } catch (RuntimeException e) {
            throw new TelegramApiException(method + " failed: " + e.getClass().getSimpleName()
                    + ": " + redact(e.getMessage()));
        }
        if (json == null || json.isBlank()) {
            throw new TelegramApiException(method + " returned an empty body");
        }
        try {
            JsonNode root = objectMapper.readTree(json);
            if (!root.path("ok").asBoolean(false)) {
                throw new TelegramApiException(method + " failed: " + root.path("description").asText("unknown error"));
            }
            return root.path("result");
        } catch (TelegramApiException e) {
            throw e;
        } catch (Exception e) {
            throw new TelegramApiException("Unparseable " + method + " response", e);
        }
    }

    private String redact(String text) {
        if (text == null || botToken == null || botToken.isEmpty()) {
            return text;
        }
        return text.replace(botToken, REDACTED);
    }
}
