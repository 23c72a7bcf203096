package com.purchasingpower.policyflow.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.policyflow.config.GeminiConfig;
import com.purchasingpower.policyflow.configuration.AppProperties;
import com.purchasingpower.policyflow.model.CallContext;
import com.purchasingpower.policyflow.model.ServiceType;
import com.purchasingpower.policyflow.util.ExternalCallLogger;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Component
@RequiredArgsConstructor
public class GeminiClient {

    private final AppProperties props;
    private final GeminiConfig geminiConfig;
    private final ObjectMapper objectMapper;

    private WebClient geminiWebClient;

    @PostConstruct
    public void init() {
        // API key travels in a header so it never shows up in access logs
        this.geminiWebClient = WebClient.builder()
                .baseUrl(props.getGemini().getBaseUrl())
                .defaultHeader("x-goog-api-key", props.getGemini().getApiKey())
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                        .build())
                .build();
    }

    private String getApiUrl(String model, String action) {
        return String.format("/%s/models/%s:%s",
                props.getGemini().getApiVersion(), model, action);
    }

    /**
     * Exponential backoff for transient HTTP failures (429, 5xx).
     */
    private Retry buildRetrySpec() {
        GeminiConfig.RetryConfig retry = geminiConfig.getRetry();
        return Retry.backoff(
                        retry.getMaxAttempts(),
                        Duration.ofSeconds(retry.getInitialBackoffSeconds()))
                .maxBackoff(Duration.ofSeconds(retry.getMaxBackoffSeconds()))
                .filter(this::isRetryable);
    }

    private boolean isRetryable(Throwable ex) {
        if (!(ex instanceof WebClientResponseException webEx)) {
            return false;
        }
        GeminiConfig.RetryConfig retry = geminiConfig.getRetry();
        if (retry.getRetryableStatusCodes() == null) {
            return webEx.getStatusCode().is5xxServerError() ||
                    webEx.getStatusCode().value() == 429;
        }
        return retry.getRetryableStatusCodes().contains(webEx.getStatusCode().value());
    }

    /**
     * Role-tagged generateContent call. System messages become the system
     * instruction; the rest become user turns.
     *
     * @return raw reply text
     */
    public String callChatApi(List<PromptMessage> messages, String stageName, String sessionId) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.GEMINI, "generateContent", sessionId, log);

        String model = props.getGemini().getChatModel();
        String url = getApiUrl(model, "generateContent");
        double temperature = geminiConfig.getTemperatureForStage(stageName);

        String systemText = messages.stream()
                .filter(PromptMessage::isSystem)
                .map(PromptMessage::getContent)
                .collect(Collectors.joining("\n\n"));
        List<Map<String, Object>> contents = new ArrayList<>();
        for (PromptMessage message : messages) {
            if (!message.isSystem()) {
                contents.add(Map.of("role", "user", "parts", List.of(Map.of("text", message.getContent()))));
            }
        }

        Map<String, Object> body = new HashMap<>();
        body.put("contents", contents);
        body.put("generationConfig", Map.of("temperature", temperature));
        if (!systemText.isBlank()) {
            body.put("systemInstruction", Map.of("parts", List.of(Map.of("text", systemText))));
        }

        int promptLength = messages.stream().mapToInt(m -> m.getContent().length()).sum();
        callCtx.logRequest("Generating text",
                "Stage", stageName,
                "Model", model,
                "Temperature", temperature,
                "Prompt Length", promptLength + " chars");

        try {
            String json = geminiWebClient.post().uri(url).bodyValue(body)
                    .retrieve().bodyToMono(String.class)
                    .retryWhen(buildRetrySpec())
                    .block();

            JsonNode root = objectMapper.readTree(json);
            JsonNode candidate = root.path("candidates").path(0);
            if (candidate.isMissingNode()) {
                throw new IllegalStateException("Gemini returned no candidates: "
                        + ExternalCallLogger.truncate(json, 300));
            }
            String response = candidate.path("content").path("parts").path(0).path("text").asText("");

            JsonNode usage = root.path("usageMetadata");
            callCtx.logResponse("Text generated",
                    "Tokens", String.format("%d in + %d out",
                            usage.path("promptTokenCount").asInt(0),
                            usage.path("candidatesTokenCount").asInt(0)),
                    "Response Length", response.length() + " chars",
                    "Response", ExternalCallLogger.truncate(response, 500));
            return response;

        } catch (WebClientResponseException e) {
            callCtx.logError(e.getStatusCode() + ": " + e.getMessage(), e);
            throw new RuntimeException("Gemini API call failed for stage: " + stageName, e);
        } catch (Exception e) {
            callCtx.logError("Unexpected error", e);
            throw new RuntimeException("Gemini API call failed for stage: " + stageName, e);
        }
    }
}
