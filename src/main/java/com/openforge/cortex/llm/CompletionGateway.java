package com.openforge.cortex.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.cortex.llm.model.CompletionEnvelope;
import com.openforge.cortex.llm.model.CompletionRequest;
import com.openforge.cortex.llm.model.RawArguments;
import com.openforge.cortex.llm.model.ToolCall;
import com.openforge.cortex.llm.model.ToolSchema;
import com.openforge.cortex.llm.model.wire.OllamaChatResponse;
import com.openforge.cortex.llm.model.wire.WireMessage;
import com.openforge.cortex.llm.model.wire.WireToolCall;
import com.openforge.cortex.recovery.InlineToolCallParser;
import com.openforge.cortex.recovery.MalformedArgumentsException;
import com.openforge.cortex.recovery.MarkupCleaner;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Async client for the local model server's /api/chat endpoint.
 *
 *  complete()          : one JSON response, normalized into a {@link CompletionEnvelope}.
 *                        Accelerator faults are retried (see {@link AcceleratorFaultClassifier}),
 *                        each retry forcing CPU inference.
 *
 *  completeStreaming() : NDJSON stream; every text fragment goes to the callback
 *                        as it arrives and the cleaned full text is returned at the end.
 *                        Streams are not retried.
 *
 * Both honour a per-call deadline: the request's timeout, or cortex.llm.timeout-seconds.
 * The model is checked against the installed ones first ({@link InstalledModelResolver}).
 * When the deadline passes or the caller cancels, the pending HTTP exchange is cancelled
 * and an open response stream is closed, so no reader thread stays blocked on it.
 */
@Slf4j
@Component
public class CompletionGateway {

    private static final String CHAT_PATH         = "/api/chat";
    private static final int    ERROR_BODY_LINES  = 20;

    private final HttpClient               httpClient;
    private final ObjectMapper             objectMapper;
    private final LlmProperties            properties;
    private final ChatPayloadFactory       payloadFactory;
    private final InstalledModelResolver   modelResolver;
    private final InlineToolCallParser     inlineParser;
    private final Retry                    retry;
    private final ScheduledExecutorService retryScheduler;
    private final Executor                 ioExecutor;

    public CompletionGateway(HttpClient httpClient,
                             ObjectMapper objectMapper,
                             LlmProperties properties,
                             ChatPayloadFactory payloadFactory,
                             InstalledModelResolver modelResolver,
                             InlineToolCallParser inlineParser,
                             @Qualifier("completionGatewayRetry") Retry retry,
                             @Qualifier("llmRetryScheduler") ScheduledExecutorService retryScheduler,
                             @Qualifier("llmIoExecutor") Executor ioExecutor) {
        this.httpClient     = httpClient;
        this.objectMapper   = objectMapper;
        this.properties     = properties;
        this.payloadFactory = payloadFactory;
        this.modelResolver  = modelResolver;
        this.inlineParser   = inlineParser;
        this.retry          = retry;
        this.retryScheduler = retryScheduler;
        this.ioExecutor     = ioExecutor;

        retry.getEventPublisher().onRetry(event -> log.warn(
                "[Gateway] Accelerator fault on attempt {}, retrying on CPU: {}",
                event.getNumberOfRetryAttempts(),
                event.getLastThrowable() == null ? "?" : event.getLastThrowable().getMessage()));
    }

    // ── Public API ───────────────────────────────────────────────────────────

    public CompletableFuture<CompletionEnvelope> complete(CompletionRequest request) {
        Duration deadline = deadlineFor(request);
        InFlightCall call = new InFlightCall();

        CompletableFuture<CompletionEnvelope> decorated = modelResolver
                .resolve(payloadFactory.resolveModel(request.model()))
                .thenCompose(model -> {
                    CompletionRequest pinned = request.toBuilder().model(model).stream(false).build();
                    AtomicReference<RetryState> state = new AtomicReference<>();
                    Supplier<CompletionStage<CompletionEnvelope>> attempt = () -> {
                        if (call.isReleased()) {
                            return CompletableFuture.failedFuture(new CancellationException("Call already ended"));
                        }
                        RetryState current = state.updateAndGet(
                                s -> s == null ? RetryState.initial() : (s.canRetry() ? s.next() : s));
                        return sendOnce(pinned, current, deadline, call);
                    };
                    return Retry.decorateCompletionStage(retry, retryScheduler, attempt).get();
                });
        return translateFailures(decorated.orTimeout(deadline.toMillis(), TimeUnit.MILLISECONDS), deadline, call);
    }

    /**
     * @param onChunk receives every raw text fragment in arrival order
     * @return the accumulated text, reasoning markup removed
     */
    public CompletableFuture<String> completeStreaming(CompletionRequest request, Consumer<String> onChunk) {
        Duration deadline = deadlineFor(request);
        InFlightCall call = new InFlightCall();

        CompletableFuture<String> text = modelResolver
                .resolve(payloadFactory.resolveModel(request.model()))
                .thenCompose(model -> {
                    CompletionRequest streaming = request.toBuilder().model(model).stream(true).build();
                    ChatPayloadFactory.PreparedChat prepared = payloadFactory.prepare(streaming, RetryState.initial());
                    HttpRequest httpRequest = buildHttpRequest(serialize(prepared), deadline);
                    log.debug("[Gateway] → stream POST model={}", prepared.model());
                    return call.track(httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofLines()));
                })
                .thenApplyAsync(response -> readStream(response.statusCode(), call.track(response.body()), onChunk),
                        ioExecutor);
        return translateFailures(text.orTimeout(deadline.toMillis(), TimeUnit.MILLISECONDS), deadline, call);
    }

    // ── Single attempt ───────────────────────────────────────────────────────

    private CompletableFuture<CompletionEnvelope> sendOnce(CompletionRequest request,
                                                           RetryState state,
                                                           Duration deadline,
                                                           InFlightCall call) {
        ChatPayloadFactory.PreparedChat prepared;
        String body;
        try {
            prepared = payloadFactory.prepare(request, state);
            body = serialize(prepared);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        log.debug("[Gateway] → chat POST model={} attempt={} body-length={}",
                prepared.model(), state.attempt(), body.length());

        return call.track(httpClient.sendAsync(buildHttpRequest(body, deadline), HttpResponse.BodyHandlers.ofString()))
                .handle((response, error) -> {
                    if (error != null) {
                        Throwable cause = unwrap(error);
                        if (cause instanceof LlmException llm) {
                            throw llm;
                        }
                        throw new LlmException("Network error calling %s".formatted(chatUri()), cause);
                    }
                    return toEnvelope(response, prepared, request.tools());
                });
    }

    // ── Response normalization ───────────────────────────────────────────────

    private CompletionEnvelope toEnvelope(HttpResponse<String> response,
                                          ChatPayloadFactory.PreparedChat prepared,
                                          List<ToolSchema> tools) {
        int    status = response.statusCode();
        String body   = response.body();
        log.debug("[Gateway] ← HTTP {} body-length={}", status, body == null ? 0 : body.length());

        if (status < 200 || status >= 300) {
            throw new LlmTransportException(status, body);
        }

        OllamaChatResponse parsed;
        try {
            parsed = objectMapper.readValue(body, OllamaChatResponse.class);
        } catch (JsonProcessingException e) {
            throw new LlmException("Failed to parse chat response: %s".formatted(body), e);
        }
        if (parsed.error() != null && !parsed.error().isBlank()) {
            throw new LlmException("Model server reported: " + parsed.error());
        }

        WireMessage message = parsed.message();
        String content = MarkupCleaner.clean(parsed.textFragment()).trim();
        List<ToolCall> toolCalls = message == null ? List.of() : nativeToolCalls(message.toolCalls());

        boolean fromText = false;
        if (toolCalls.isEmpty() && prepared.emulatedTools() && !content.isEmpty()) {
            toolCalls = inlineParser.parse(content, new HashSet<>(ToolSchema.names(tools)));
            fromText = !toolCalls.isEmpty();
        }

        String model = parsed.model() != null ? parsed.model() : prepared.model();
        return new CompletionEnvelope(content.isEmpty() ? null : content, toolCalls, model, fromText);
    }

    private List<ToolCall> nativeToolCalls(List<WireToolCall> wireCalls) {
        if (wireCalls == null || wireCalls.isEmpty()) {
            return List.of();
        }
        List<ToolCall> calls = new ArrayList<>();
        for (WireToolCall wireCall : wireCalls) {
            WireToolCall.Function function = wireCall.function();
            if (function == null || function.name() == null || function.name().isBlank()) {
                log.warn("[Gateway] Dropping tool call without a function name");
                continue;
            }
            try {
                calls.add(new ToolCall(function.name(), RawArguments.of(function.arguments())));
            } catch (MalformedArgumentsException e) {
                log.warn("[Gateway] Dropping tool call '{}': {}", function.name(), e.getMessage());
            }
        }
        return calls;
    }

    // ── Streaming ────────────────────────────────────────────────────────────

    private String readStream(int status, Stream<String> body, Consumer<String> onChunk) {
        try (Stream<String> lines = body) {
            if (status < 200 || status >= 300) {
                String snippet = lines == null ? "" : String.join("\n",
                        lines.limit(ERROR_BODY_LINES).toList());
                throw new LlmTransportException(status, snippet);
            }

            StringBuilder text = new StringBuilder();
            boolean finished = false;
            for (String line : (Iterable<String>) lines::iterator) {
                if (line.isBlank()) continue;

                OllamaChatResponse chunk;
                try {
                    chunk = objectMapper.readValue(line, OllamaChatResponse.class);
                } catch (JsonProcessingException e) {
                    log.warn("[Gateway] Skipping malformed stream line: {}", line);
                    continue;
                }

                if (chunk.error() != null && !chunk.error().isBlank()) {
                    throw new LlmException("Model server reported mid-stream: " + chunk.error());
                }

                String fragment = chunk.textFragment();
                if (!fragment.isEmpty()) {
                    text.append(fragment);
                    onChunk.accept(fragment);
                }
                if (chunk.isDone()) {
                    finished = true;
                    break;
                }
            }
            if (!finished) {
                log.debug("[Gateway] Stream ended without a done marker after {} chars", text.length());
            }
            return MarkupCleaner.clean(text.toString()).trim();
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private HttpRequest buildHttpRequest(String body, Duration deadline) {
        return HttpRequest.newBuilder()
                .uri(chatUri())
                .header("Content-Type", "application/json")
                .timeout(deadline)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
    }

    private URI chatUri() {
        return properties.endpoint(CHAT_PATH);
    }

    private Duration deadlineFor(CompletionRequest request) {
        if (request.timeout() != null && !request.timeout().isNegative() && !request.timeout().isZero()) {
            return request.timeout();
        }
        return Duration.ofSeconds(properties.timeoutSeconds());
    }

    private String serialize(ChatPayloadFactory.PreparedChat prepared) {
        try {
            return objectMapper.writeValueAsString(prepared.body());
        } catch (JsonProcessingException e) {
            throw new LlmException("Failed to serialize chat request", e);
        }
    }

    /**
     * Re-completes {@code source} so that callers only ever see an {@link LlmException}
     * as the failure cause. Once the result fails or is cancelled, the source is cancelled
     * and the resources of {@code call} are released.
     */
    private static <T> CompletableFuture<T> translateFailures(CompletableFuture<T> source,
                                                              Duration deadline,
                                                              InFlightCall call) {
        CompletableFuture<T> result = new CompletableFuture<>();
        result.whenComplete((value, error) -> {
            if (error != null) {
                call.release();
                source.cancel(true);
            }
        });
        source.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
                return;
            }
            Throwable cause = unwrap(error);
            if (cause instanceof LlmException llm) {
                result.completeExceptionally(llm);
            } else if (cause instanceof TimeoutException) {
                result.completeExceptionally(new LlmException(
                        "No response within %d ms".formatted(deadline.toMillis()), cause));
            } else {
                result.completeExceptionally(new LlmException("Completion failed: " + cause.getMessage(), cause));
            }
        });
        return result;
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * The HTTP exchange and response stream of one call, held so they can be
     * cancelled and closed from another thread. Anything tracked after
     * {@link #release()} is released immediately.
     */
    static final class InFlightCall {

        private final AtomicReference<CompletableFuture<?>> exchange = new AtomicReference<>();
        private final AtomicReference<Stream<String>>       body     = new AtomicReference<>();
        private volatile boolean released;

        <T> CompletableFuture<T> track(CompletableFuture<T> pending) {
            exchange.set(pending);
            if (released) {
                pending.cancel(true);
            }
            return pending;
        }

        Stream<String> track(Stream<String> lines) {
            body.set(lines);
            if (released) {
                closeBody();
            }
            return lines;
        }

        boolean isReleased() {
            return released;
        }

        void release() {
            released = true;
            CompletableFuture<?> pending = exchange.get();
            if (pending != null) {
                pending.cancel(true);
            }
            closeBody();
        }

        private void closeBody() {
            Stream<String> lines = body.getAndSet(null);
            if (lines == null) {
                return;
            }
            try {
                lines.close();
            } catch (RuntimeException e) {
                log.debug("[Gateway] Closing response stream failed: {}", e.getMessage());
            }
        }
    }

    // ── Exception types ──────────────────────────────────────────────────────

    public static class LlmException extends RuntimeException {
        public LlmException(String message) { super(message); }
        public LlmException(String message, Throwable cause) { super(message, cause); }
    }

    /** Non-2xx answer from the model server. */
    public static class LlmTransportException extends LlmException {

        private final int    status;
        private final String body;

        public LlmTransportException(int status, String body) {
            super("Chat endpoint returned status %d: %s".formatted(status, body));
            this.status = status;
            this.body   = body;
        }

        public int status() { return status; }
        public String body() { return body; }
    }
}
