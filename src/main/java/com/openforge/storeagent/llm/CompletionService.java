package com.openforge.storeagent.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.storeagent.llm.model.ChatRequest;
import com.openforge.storeagent.llm.model.ChatResponse;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.function.Supplier;

/**
 * The completion capability used by the chat turn loop.
 *
 * Call graph:
 *
 *   complete(request)
 *     └─ completionCircuitBreaker
 *           └─ completionRetry (transient failures only, exponential back-off)
 *                 └─ LlmClient.chat(request)
 *
 * With the default retry settings a transient failure is retried exactly
 * once; a second failure, or any non-transient one, reaches the caller as
 * an {@link LlmClient.LlmException}.
 */
@Slf4j
@Component
public class CompletionService {

    private final LlmClient      client;
    private final CircuitBreaker circuitBreaker;
    private final Retry          retry;

    @Autowired
    public CompletionService(HttpClient httpClient,
                             ObjectMapper objectMapper,
                             LlmProperties properties,
                             CircuitBreaker completionCircuitBreaker,
                             Retry completionRetry) {
        this(new LlmClient(httpClient, objectMapper, properties.provider()),
                completionCircuitBreaker, completionRetry);
    }

    CompletionService(LlmClient client, CircuitBreaker circuitBreaker, Retry retry) {
        this.client         = client;
        this.circuitBreaker = circuitBreaker;
        this.retry          = retry;
        this.retry.getEventPublisher().onRetry(event -> log.warn(
                "[Completion] Attempt {} failed ({}), retrying in {} ms",
                event.getNumberOfRetryAttempts(),
                event.getLastThrowable() == null ? "?" : event.getLastThrowable().getMessage(),
                event.getWaitInterval().toMillis()));
    }

    // ── Public API ───────────────────────────────────────────────────────────

    public ChatResponse complete(ChatRequest request) {
        return complete(request, () -> { });
    }

    /**
     * Same as {@link #complete(ChatRequest)}; {@code onAttempt} runs once
     * for every request actually sent to the provider, retries included.
     */
    public ChatResponse complete(ChatRequest request, Runnable onAttempt) {
        Supplier<ChatResponse> decorated =
                CircuitBreaker.decorateSupplier(circuitBreaker,
                        Retry.decorateSupplier(retry, () -> {
                            onAttempt.run();
                            return client.chat(request);
                        }));
        try {
            return decorated.get();
        } catch (CallNotPermittedException e) {
            throw new LlmClient.LlmTransientException(
                    "Completion provider [%s] is unavailable (circuit open)".formatted(client.providerName()), e);
        } catch (LlmClient.LlmException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LlmClient.LlmException(
                    "Completion provider [%s] failed: %s".formatted(client.providerName(), e.getMessage()), e);
        }
    }

    public String modelName() {
        return client.modelName();
    }
}
