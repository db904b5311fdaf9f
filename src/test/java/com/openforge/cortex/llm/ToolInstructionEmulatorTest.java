package com.openforge.cortex.llm;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.cortex.llm.model.ChatMessage;
import com.openforge.cortex.llm.model.Role;
import com.openforge.cortex.llm.model.ToolSchema;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ToolInstructionEmulatorTest {

    private ToolInstructionEmulator emulator;
    private ToolSchema schema;

    @BeforeEach
    void setUp() throws Exception {
        emulator = new ToolInstructionEmulator();
        schema = new ToolSchema("activateBrainArea", "Activates a brain area.", new ObjectMapper().readTree("""
                {"type": "object",
                 "properties": {
                   "core": {"type": "string", "enum": ["memory", "valence"], "description": "Area."},
                   "intensity": {"type": "number"},
                   "expand": {"type": "boolean"},
                   "keywords": {"type": "array", "items": {"type": "string"}},
                   "filters": {"type": "object"}
                 },
                 "required": ["core", "intensity"]}
                """));
    }

    @Test
    void shouldBuildTypeDrivenExampleCall() {
        assertThat(emulator.exampleCall(schema)).isEqualTo(
                "activateBrainArea(core: \"text\", intensity: 0.5, expand: true, "
                        + "keywords: [\"item1\", \"item2\"], filters: {\"key\": \"value\"})");
    }

    @Test
    void shouldDescribeParametersWithRequirednessAndEnum() {
        String block = emulator.instructionBlock(List.of(schema));

        assertThat(block)
                .contains("Function: activateBrainArea")
                .contains("- core (string, required): Area. One of: memory, valence")
                .contains("- expand (boolean, optional)")
                .contains("exactly one function call");
    }

    @Test
    void shouldAppendToExistingSystemMessage() {
        List<ChatMessage> result = emulator.inject(
                List.of(ChatMessage.system("You are a router."), ChatMessage.user("hello")), List.of(schema));

        assertThat(result).hasSize(2);
        assertThat(result.get(0).role()).isEqualTo(Role.SYSTEM);
        assertThat(result.get(0).content()).startsWith("You are a router.\n\n## Function calling");
        assertThat(result.get(1).content()).isEqualTo("hello");
    }

    @Test
    void shouldCreateSystemMessageWhenMissing() {
        List<ChatMessage> result = emulator.inject(List.of(ChatMessage.user("hello")), List.of(schema));

        assertThat(result).hasSize(2);
        assertThat(result.get(0).role()).isEqualTo(Role.SYSTEM);
        assertThat(result.get(0).content()).contains("activateBrainArea(");
    }

    @Test
    void shouldLeaveMessagesAloneWithoutTools() {
        List<ChatMessage> messages = List.of(ChatMessage.user("hello"));

        assertThat(emulator.inject(messages, List.of())).isSameAs(messages);
    }
}
