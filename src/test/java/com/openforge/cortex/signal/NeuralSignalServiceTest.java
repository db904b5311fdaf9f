package com.openforge.cortex.signal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.cortex.config.AppConfig;
import com.openforge.cortex.llm.CompletionGateway;
import com.openforge.cortex.llm.CompletionGateway.LlmException;
import com.openforge.cortex.llm.model.CompletionEnvelope;
import com.openforge.cortex.llm.model.CompletionRequest;
import com.openforge.cortex.llm.model.RawArguments;
import com.openforge.cortex.llm.model.ToolCall;
import com.openforge.cortex.llm.model.ToolSchema;
import com.openforge.cortex.prompt.DefaultPromptBuilder;
import com.openforge.cortex.prompt.PromptProperties;
import com.openforge.cortex.recovery.InlineToolCallParser;
import com.openforge.cortex.recovery.JsonObjectSalvager;
import com.openforge.cortex.recovery.ResponseRecoveryPipeline;
import com.openforge.cortex.recovery.ToolCallArgumentParser;
import com.openforge.cortex.schema.ClasspathToolSchemaRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class NeuralSignalServiceTest {

    private ObjectMapper objectMapper;
    private CompletionGateway gateway;
    private NeuralSignalService service;

    @BeforeEach
    void setUp() {
        objectMapper = AppConfig.createObjectMapper();
        gateway = mock(CompletionGateway.class);
        service = new NeuralSignalService(
                gateway,
                new ResponseRecoveryPipeline(
                        new ToolCallArgumentParser(objectMapper),
                        new InlineToolCallParser(objectMapper),
                        new JsonObjectSalvager(objectMapper)),
                new ClasspathToolSchemaRegistry(objectMapper),
                new DefaultPromptBuilder(new PromptProperties("pt-BR", 300)));
    }

    private void answer(CompletionEnvelope envelope) {
        when(gateway.complete(any())).thenReturn(CompletableFuture.completedFuture(envelope));
    }

    private ToolCall call(String name, String json) throws Exception {
        return new ToolCall(name, RawArguments.of(objectMapper.readTree(json)));
    }

    @Nested
    class GenerateStructuredSignal {

        @Test
        void shouldReturnOneSignalPerValidActivation() throws Exception {
            answer(CompletionEnvelope.ofToolCalls(List.of(
                    call("activateBrainArea", """
                            {"core": "memory", "intensity": 0.8, "query": "last trip to Lisbon",
                             "keywords": ["trip", "Lisbon"], "topK": 5}
                            """),
                    call("activateBrainArea", "{\"intensity\": 0.9}"),
                    call("enrichSemanticQuery", "{\"enrichedQuery\": \"unrelated\"}"),
                    call("activateBrainArea", "{\"core\": \"emotion\", \"intensity\": \"0.6\"}"))));

            List<NeuralSignal> signals = service.generateStructuredSignal("Remember Lisbon?", null, null).join();

            assertThat(signals).extracting(NeuralSignal::core).containsExactly("memory", "emotion");
            NeuralSignal memory = signals.get(0);
            assertThat(memory.intensity()).isEqualTo(0.8);
            assertThat(memory.query()).isEqualTo("last trip to Lisbon");
            assertThat(memory.keywords()).containsExactly("trip", "Lisbon");
            assertThat(memory.topK()).isEqualTo(5);
            assertThat(signals.get(1).intensity()).isEqualTo(0.6);
        }

        @Test
        void shouldClampIntensityAndDefaultWhenAbsent() throws Exception {
            answer(CompletionEnvelope.ofToolCalls(List.of(
                    call("activateBrainArea", "{\"core\": \"logic\", \"intensity\": 0.05}"),
                    call("activateBrainArea", "{\"core\": \"will\", \"intensity\": 3}"),
                    call("activateBrainArea", "{\"core\": \"planning\"}"))));

            List<NeuralSignal> signals = service.generateStructuredSignal("Plan my day", null, null).join();

            assertThat(signals).extracting(NeuralSignal::intensity).containsExactly(0.3, 1.0, 0.5);
        }

        @Test
        void shouldKeepIntensityInRangeWhenNotFinite() throws Exception {
            answer(CompletionEnvelope.ofToolCalls(List.of(
                    call("activateBrainArea", "{\"core\": \"memory\", \"intensity\": \"NaN\"}"),
                    call("activateBrainArea", "{\"core\": \"logic\", \"intensity\": \"-Infinity\"}"))));

            List<NeuralSignal> signals = service.generateStructuredSignal("Remember?", null, null).join();

            assertThat(signals).extracting(NeuralSignal::intensity)
                    .allSatisfy(intensity -> assertThat(intensity).isBetween(0.3, 1.0))
                    .containsExactly(0.5, 0.5);
        }

        @Test
        void shouldFallBackThroughQuerySources() throws Exception {
            answer(CompletionEnvelope.ofToolCalls(List.of(
                    call("activateBrainArea", "{\"core\": \"memory\", \"symbolic_query\": {\"query\": \"nested\"}}"),
                    call("activateBrainArea", "{\"core\": \"logic\", \"keywords\": \"budget, rent\"}"),
                    call("activateBrainArea", "{\"core\": \"emotion\", \"query\": \"  \"}"))));

            List<NeuralSignal> signals = service.generateStructuredSignal("How am I doing?", null, null).join();

            assertThat(signals).extracting(NeuralSignal::query)
                    .containsExactly("nested", "budget rent", "How am I doing?");
        }

        @Test
        void shouldParseInlineActivationsFromText() {
            answer(CompletionEnvelope.ofText("""
                    <think>two cores</think>
                    activateBrainArea(core: "memory", intensity: 0.7, query: "childhood home")
                    activateBrainArea(core: "emotion", intensity: 0.4)
                    """));

            List<NeuralSignal> signals = service.generateStructuredSignal("My old house", null, null).join();

            assertThat(signals).extracting(NeuralSignal::core).containsExactly("memory", "emotion");
            assertThat(signals.get(1).query()).isEqualTo("My old house");
        }

        @Test
        void shouldReturnEmptyListWhenNothingIsRecoverable() {
            answer(CompletionEnvelope.ofText("I am not sure which area applies."));

            assertThat(service.generateStructuredSignal("hi", null, null).join()).isEmpty();
        }

        @Test
        void shouldPropagateTransportFailure() {
            when(gateway.complete(any())).thenReturn(CompletableFuture.failedFuture(new LlmException("down")));

            CompletableFuture<List<NeuralSignal>> future = service.generateStructuredSignal("hi", null, null);

            assertThatThrownBy(future::join)
                    .isInstanceOf(CompletionException.class)
                    .hasCauseInstanceOf(LlmException.class);
        }

        @Test
        void shouldSendActivationSchemaWithSignalSettings() throws Exception {
            answer(CompletionEnvelope.ofToolCalls(List.of(call("activateBrainArea", "{\"core\": \"memory\"}"))));

            service.generateStructuredSignal("hi", "earlier we talked about work", "en").join();

            ArgumentCaptor<CompletionRequest> captor = ArgumentCaptor.forClass(CompletionRequest.class);
            verify(gateway).complete(captor.capture());
            CompletionRequest request = captor.getValue();
            assertThat(request.temperature()).isEqualTo(0.7);
            assertThat(request.maxTokens()).isEqualTo(1000);
            assertThat(request.tools()).extracting(ToolSchema::name).containsExactly("activateBrainArea");
            assertThat(request.messages().get(1).content()).contains("hi");
        }
    }

    @Nested
    class EnrichSemanticQuery {

        @Test
        void shouldReturnEnrichedQuery() throws Exception {
            answer(CompletionEnvelope.ofToolCalls(List.of(call("enrichSemanticQuery", """
                    {"enrichedQuery": "memories of the Lisbon trip in 2019",
                     "keywords": "[\\"Lisbon\\", \\"2019\\"]",
                     "contextualHints": {"temporalFocus": "past"}}
                    """))));

            SemanticEnrichment enrichment = service
                    .enrichSemanticQuery("memory", "Lisbon trip", 0.8, null, null).join();

            assertThat(enrichment.enrichedQuery()).isEqualTo("memories of the Lisbon trip in 2019");
            assertThat(enrichment.keywords()).containsExactly("Lisbon", "2019");
            assertThat(enrichment.contextualHints().path("temporalFocus").asText()).isEqualTo("past");
        }

        @Test
        void shouldKeepOriginalQueryWhenAnswerIsTruncated() {
            answer(CompletionEnvelope.ofText("{\"enrichedQuery\": \"memories of the Lis"));

            SemanticEnrichment enrichment = service
                    .enrichSemanticQuery("memory", "Lisbon trip", 0.8, null, null).join();

            assertThat(enrichment.enrichedQuery()).isEqualTo("Lisbon trip");
            assertThat(enrichment.keywords()).isEmpty();
            assertThat(enrichment.contextualHints()).isNull();
        }

        @Test
        void shouldSendEnrichmentAtLowTemperature() {
            List<CompletionRequest> sent = new ArrayList<>();
            when(gateway.complete(any())).thenAnswer(invocation -> {
                sent.add(invocation.getArgument(0));
                return CompletableFuture.completedFuture(CompletionEnvelope.ofText("{\"enrichedQuery\": \"x\"}"));
            });

            SemanticEnrichment enrichment = service.enrichSemanticQuery("logic", "q", 0.5, null, "en").join();

            assertThat(enrichment.enrichedQuery()).isEqualTo("x");
            assertThat(sent).singleElement().satisfies(request -> {
                assertThat(request.temperature()).isEqualTo(0.2);
                assertThat(request.tools()).extracting(ToolSchema::name).containsExactly("enrichSemanticQuery");
            });
        }
    }
}
