package com.purchasingpower.policyflow.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.purchasingpower.policyflow.client.LLMProvider;
import com.purchasingpower.policyflow.client.LLMProviderFactory;
import com.purchasingpower.policyflow.client.PromptMessage;
import com.purchasingpower.policyflow.config.StageRetryConfig;
import com.purchasingpower.policyflow.exception.ExtractionFailedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Round-trip wrapper around the generation service.
 *
 * <p>One attempt is: call the provider, extract a structured value, check the
 * required top-level fields and bind it to the target type. A missing value,
 * a missing field, a binding error, a transport error or a timeout all fail
 * the attempt. Failed attempts are retried with the same prompt using
 * exponential backoff with jitter ({@link StageRetryConfig}); once attempts
 * run out the stage default is returned instead of an error.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StructuredCallExecutor {

    private final LLMProviderFactory providerFactory;
    private final ResponseExtractor extractor;
    private final StageRetryConfig retryConfig;
    private final ObjectMapper objectMapper;

    public <T> RoundTripResult<T> callForObject(String stageName,
                                                String sessionId,
                                                List<PromptMessage> messages,
                                                List<String> requiredFields,
                                                Class<T> type,
                                                Supplier<T> defaultValue) {
        return execute(stageName, sessionId, messages, reply -> accept(reply, requiredFields, type), defaultValue);
    }

    /**
     * Free-text variant: any non-blank reply is accepted as is.
     */
    public RoundTripResult<String> callForText(String stageName,
                                               String sessionId,
                                               List<PromptMessage> messages,
                                               Supplier<String> defaultText) {
        return execute(stageName, sessionId, messages, reply -> {
            if (reply == null || reply.isBlank()) {
                throw new ExtractionFailedException("blank reply");
            }
            return reply.trim();
        }, defaultText);
    }

    private <T> RoundTripResult<T> execute(String stageName,
                                           String sessionId,
                                           List<PromptMessage> messages,
                                           Function<String, T> acceptor,
                                           Supplier<T> defaultValue) {
        Preconditions.checkNotNull(stageName, "Stage name cannot be null");
        Preconditions.checkArgument(messages != null && !messages.isEmpty(), "Messages cannot be empty");
        Preconditions.checkNotNull(defaultValue, "Default value supplier cannot be null");
        StageRetryConfig.Settings settings = retryConfig.settingsFor(stageName);
        LLMProvider provider = providerFactory.getProvider();
        AtomicInteger attempts = new AtomicInteger();

        T accepted = Mono.fromCallable(() -> {
                    int attempt = attempts.incrementAndGet();
                    log.debug("[{}] Attempt {}/{} via {}", stageName, attempt, settings.maxAttempts(),
                            provider.getProviderName());
                    return acceptor.apply(provider.chat(messages, stageName, sessionId));
                })
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(settings.timeout())
                .doOnError(e -> log.warn("⚠️ [{}] Attempt {} failed: {}", stageName, attempts.get(), describe(e)))
                .retryWhen(buildRetrySpec(settings))
                .onErrorResume(e -> Mono.empty())
                .block();

        if (accepted != null) {
            return new RoundTripResult<>(accepted, false, attempts.get());
        }

        log.warn("🔁 [{}] No usable reply after {} attempts, using stage default", stageName, attempts.get());
        return new RoundTripResult<>(defaultValue.get(), true, attempts.get());
    }

    private Retry buildRetrySpec(StageRetryConfig.Settings settings) {
        return Retry.backoff(Math.max(0, settings.maxAttempts() - 1), settings.backoff())
                .maxBackoff(settings.maxBackoff())
                .jitter(settings.jitter());
    }

    private <T> T accept(String reply, List<String> requiredFields, Class<T> type) {
        JsonNode node = extractor.extract(reply)
                .orElseThrow(() -> new ExtractionFailedException("no structured data in reply"));

        if (!node.isObject()) {
            throw new ExtractionFailedException("expected an object but got " + node.getNodeType());
        }

        List<String> missing = requiredFields.stream()
                .filter(field -> isAbsent(node.get(field)))
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new ExtractionFailedException("missing required fields " + missing);
        }

        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ExtractionFailedException("reply does not match " + type.getSimpleName() + ": " + e.getMessage());
        }
    }

    private static boolean isAbsent(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return true;
        }
        if (value.isTextual()) {
            return value.asText().isBlank();
        }
        return value.isContainerNode() && value.size() == 0;
    }

    private static String describe(Throwable e) {
        return e.getClass().getSimpleName() + (e.getMessage() != null ? ": " + e.getMessage() : "");
    }
}
