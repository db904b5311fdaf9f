package com.openforge.cortex.llm;

import com.openforge.cortex.llm.model.ChatMessage;
import com.openforge.cortex.llm.model.CompletionRequest;
import com.openforge.cortex.llm.model.ToolSchema;
import com.openforge.cortex.llm.model.wire.OllamaChatRequest;
import com.openforge.cortex.llm.model.wire.OllamaOptions;
import com.openforge.cortex.llm.model.wire.WireMessage;
import com.openforge.cortex.llm.model.wire.WireTool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the /api/chat body for one attempt of a {@link CompletionRequest}.
 *
 * Precedence: model profile value, then request value. Models without native
 * tool support get the tools described in the system prompt instead.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatPayloadFactory {

    public static final String FALLBACK_MODEL = "qwen3:latest";

    static final String NATIVE_TOOL_REMINDER =
            "You must use the provided tools to respond. Do not answer in plain text.";

    private static final double TOP_P          = 0.9;
    private static final double REPEAT_PENALTY = 1.1;

    private final ModelCatalog            catalog;
    private final ToolInstructionEmulator emulator;

    /** Wire body plus whether tool calls must be read back from the text. */
    public record PreparedChat(OllamaChatRequest body, boolean emulatedTools) {

        public String model() {
            return body.model();
        }
    }

    public PreparedChat prepare(CompletionRequest request, RetryState state) {
        String model = resolveModel(request.model());
        ModelTuning tuning = catalog.tuningFor(model);

        boolean emulate = request.hasTools() && !catalog.supportsNativeTools(model);
        List<ChatMessage> messages = request.messages();
        List<WireTool> tools = null;
        String toolChoice = null;

        if (emulate) {
            messages = emulator.inject(messages, request.tools());
        } else if (request.hasTools()) {
            messages = ToolInstructionEmulator.appendToSystem(messages, NATIVE_TOOL_REMINDER);
            tools = request.tools().stream().map(WireTool::from).toList();
            toolChoice = "required";
        }

        OllamaOptions options = OllamaOptions.builder()
                .temperature(firstNonNull(tuning.temperature(), request.temperature()))
                .numPredict(firstNonNull(tuning.maxTokens(), request.maxTokens()))
                .numCtx(tuning.contextWindow())
                .topP(TOP_P)
                .repeatPenalty(REPEAT_PENALTY)
                .numGpu(state.forceCpu() ? 0 : null)
                .build();

        if (log.isDebugEnabled()) {
            log.debug("[Payload] model={} tools={} emulated={} attempt={} forceCpu={}",
                    model, ToolSchema.names(request.tools()), emulate, state.attempt(), state.forceCpu());
        }

        OllamaChatRequest body = OllamaChatRequest.builder()
                .model(model)
                .messages(messages.stream()
                        .map(m -> WireMessage.of(m.role().wireName(), m.content()))
                        .toList())
                .tools(tools)
                .toolChoice(toolChoice)
                .stream(request.stream())
                .options(options)
                .build();
        return new PreparedChat(body, emulate);
    }

    public String resolveModel(String requested) {
        if (requested != null && !requested.isBlank()) {
            return requested.trim();
        }
        return catalog.defaultModel().orElse(FALLBACK_MODEL);
    }

    private static <T> T firstNonNull(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }
}
