package com.purchasingpower.policyflow.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.policyflow.model.CallContext;
import com.purchasingpower.policyflow.model.ServiceType;
import com.purchasingpower.policyflow.util.ExternalCallLogger;
import io.netty.channel.ChannelOption;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Ollama provider for local models. The /api/chat endpoint takes the
 * role-tagged messages as they are.
 */
@Slf4j
@Component
public class OllamaClient implements LLMProvider {

    private WebClient ollamaWebClient;

    @Value("${app.ollama.base-url:http://localhost:11434}")
    private String baseUrl;

    @Value("${app.ollama.chat-model:llama3.1:8b}")
    private String chatModel;

    @Value("${app.ollama.num-ctx:8192}")
    private int numCtx;

    @Value("${app.ollama.response-timeout-seconds:300}")
    private long responseTimeoutSeconds;

    @PostConstruct
    public void init() {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10000)
                .responseTimeout(Duration.ofSeconds(responseTimeoutSeconds));

        this.ollamaWebClient = WebClient.builder()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @Override
    public String getProviderName() {
        return "Ollama";
    }

    @Override
    public String chat(List<PromptMessage> messages, String stageName, String sessionId) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.OLLAMA, "/api/chat", sessionId, log);
        callCtx.logRequest("Generating text", "Stage", stageName, "Model", chatModel);

        Map<String, Object> body = Map.of(
                "model", chatModel,
                "messages", messages.stream()
                        .map(m -> Map.of("role", m.getRole(), "content", m.getContent()))
                        .collect(Collectors.toList()),
                "stream", false,
                "options", Map.of("num_ctx", numCtx, "temperature", 0.2)
        );

        try {
            JsonNode response = ollamaWebClient.post()
                    .uri("/api/chat")
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();

            if (response == null) {
                throw new IllegalStateException("Ollama returned an empty body");
            }
            String content = response.path("message").path("content").asText("");
            callCtx.logResponse("Text generated",
                    "Response Length", content.length() + " chars",
                    "Response", ExternalCallLogger.truncate(content, 500));
            return content;

        } catch (Exception e) {
            callCtx.logError("Ollama call failed", e);
            throw new RuntimeException("Ollama API call failed for stage: " + stageName, e);
        }
    }
}
