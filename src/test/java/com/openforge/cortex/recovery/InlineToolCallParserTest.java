package com.openforge.cortex.recovery;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.cortex.llm.model.RawArguments;
import com.openforge.cortex.llm.model.ToolCall;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class InlineToolCallParserTest {

    private static final Set<String> BRAIN = Set.of("activateBrainArea");

    private InlineToolCallParser parser;

    @BeforeEach
    void setUp() {
        parser = new InlineToolCallParser(new ObjectMapper());
    }

    private static ObjectNode structured(ToolCall call) {
        assertThat(call.rawArguments()).isInstanceOf(RawArguments.Structured.class);
        return ((RawArguments.Structured) call.rawArguments()).value();
    }

    @Nested
    class DirectCalls {

        @Test
        void shouldParseColonSyntax() {
            List<ToolCall> calls = parser.parse("activateBrainArea(core:\"memory\", intensity:0.7)", BRAIN);

            assertThat(calls).hasSize(1);
            assertThat(calls.get(0).functionName()).isEqualTo("activateBrainArea");
            ObjectNode args = structured(calls.get(0));
            assertThat(args.get("core").asText()).isEqualTo("memory");
            assertThat(args.get("intensity").doubleValue()).isEqualTo(0.7);
        }

        @Test
        void shouldParseEqualsSyntaxAndComplexValues() {
            List<ToolCall> calls = parser.parse(
                    "Sure. activateBrainArea(core='shadow', keywords=[\"fear\", \"night\"], expand=true,"
                            + " symbolicInsights={\"hypothesis\": \"a, b\"})",
                    BRAIN);

            ObjectNode args = structured(calls.get(0));
            assertThat(args.get("core").asText()).isEqualTo("shadow");
            assertThat(args.get("keywords")).hasSize(2);
            assertThat(args.get("expand").booleanValue()).isTrue();
            assertThat(args.get("symbolicInsights").get("hypothesis").asText()).isEqualTo("a, b");
        }

        @Test
        void shouldKeepUnquotedWordsAsText() {
            ObjectNode args = structured(parser.parse("activateBrainArea(core: memory)", BRAIN).get(0));

            assertThat(args.get("core").asText()).isEqualTo("memory");
        }

        @Test
        void shouldFindSeveralCalls() {
            List<ToolCall> calls = parser.parse(
                    "activateBrainArea(core: \"memory\")\nactivateBrainArea(core: \"valence\")", BRAIN);

            assertThat(calls).extracting(c -> structured(c).get("core").asText())
                    .containsExactly("memory", "valence");
        }

        @Test
        void shouldIgnoreUnknownFunctionNames() {
            assertThat(parser.parse("otherFunction(core: \"memory\")", BRAIN)).isEmpty();
        }

        @Test
        void shouldIgnoreUnterminatedCall() {
            assertThat(parser.parse("activateBrainArea(core: \"memory\"", BRAIN)).isEmpty();
        }
    }

    @Nested
    class JsonForms {

        @Test
        void shouldParseToolBlock() {
            String content = """
                    ```tool
                    {"call": {"name": "activateBrainArea", "arguments": {"core": "memory"}}}
                    ```
                    """;

            List<ToolCall> calls = parser.parse(content, BRAIN);

            assertThat(calls).hasSize(1);
            assertThat(structured(calls.get(0)).get("core").asText()).isEqualTo("memory");
        }

        @Test
        void shouldParseJsonBlockWithNameAndArguments() {
            String content = """
                    Here you go:
                    ```json
                    {"name": "activateBrainArea", "arguments": {"core": "will", "intensity": 0.9}}
                    ```
                    """;

            assertThat(parser.parse(content, BRAIN)).singleElement()
                    .satisfies(call -> assertThat(structured(call).get("core").asText()).isEqualTo("will"));
        }

        @Test
        void shouldParseWholeContentArrayOfCalls() {
            String content = """
                    [{"function_name": "activateBrainArea", "parameters": {"core": "memory"}},
                     {"function": {"name": "activateBrainArea", "arguments": "{\\"core\\": \\"body\\"}"}}]
                    """;

            List<ToolCall> calls = parser.parse(content, BRAIN);

            assertThat(calls).hasSize(2);
            assertThat(structured(calls.get(0)).get("core").asText()).isEqualTo("memory");
            assertThat(calls.get(1).rawArguments()).isInstanceOf(RawArguments.Text.class);
        }

        @Test
        void shouldParseMistralMarker() {
            String content = "[TOOL_CALLS] [{\"name\": \"activateBrainArea\", \"arguments\": {\"core\": \"self\"}}]";

            assertThat(parser.parse(content, BRAIN)).singleElement()
                    .satisfies(call -> assertThat(structured(call).get("core").asText()).isEqualTo("self"));
        }

        @Test
        void shouldDropCallsWithInvalidArgumentType() {
            String content = "{\"name\": \"activateBrainArea\", \"arguments\": 42}";

            assertThat(parser.parse(content, BRAIN)).isEmpty();
        }
    }

    @Nested
    class XmlForm {

        @Test
        void shouldParseToolCallTags() {
            String content = """
                    <tool_call>
                      <function>activateBrainArea</function>
                      <parameters>{"core": "archetype", "intensity": 0.4}</parameters>
                    </tool_call>
                    """;

            List<ToolCall> calls = parser.parse(content, BRAIN);

            assertThat(calls).hasSize(1);
            assertThat(structured(calls.get(0)).get("core").asText()).isEqualTo("archetype");
        }

        @Test
        void shouldKeepUndecodableParametersAsText() {
            String content = "<tool_call><function>activateBrainArea</function>"
                    + "<parameters>{\"core\": \"arch</parameters></tool_call>";

            assertThat(parser.parse(content, BRAIN)).singleElement()
                    .satisfies(call -> assertThat(call.rawArguments()).isInstanceOf(RawArguments.Text.class));
        }
    }

    @Test
    void shouldReturnEmptyForPlainProse() {
        assertThat(parser.parse("I think the memory core is most relevant here.", BRAIN)).isEmpty();
        assertThat(parser.parse("", BRAIN)).isEmpty();
        assertThat(parser.parse(null, BRAIN)).isEmpty();
    }
}
