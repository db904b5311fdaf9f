package com.openforge.cortex.config;

import com.openforge.cortex.embedding.EmbeddingProperties;
import com.openforge.cortex.llm.LlmProperties;
import com.openforge.cortex.llm.ModelCatalog;
import com.openforge.cortex.prompt.PromptProperties;
import com.openforge.cortex.schema.ToolSchemaRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Prints a structured startup summary after the application context is fully ready:
 * model server, model profiles, registered tool schemas, embeddings and runtime.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final LlmProperties       llmProperties;
    private final EmbeddingProperties embeddingProperties;
    private final PromptProperties    promptProperties;
    private final ModelCatalog        modelCatalog;
    private final ToolSchemaRegistry  schemaRegistry;

    @Override
    public void run(ApplicationArguments args) {
        String javaVersion = System.getProperty("java.version");
        String defaultModel = modelCatalog.defaultModel().orElse("(fallback) qwen3:latest");

        String nativeTools = llmProperties.models().stream()
                .filter(LlmProperties.ModelProfile::nativeTools)
                .map(LlmProperties.ModelProfile::name)
                .collect(Collectors.joining(", "));
        String emulated = llmProperties.models().stream()
                .filter(p -> !p.nativeTools())
                .map(LlmProperties.ModelProfile::name)
                .collect(Collectors.joining(", "));

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              Cortex Bridge  -  Startup Summary           ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Model server                                            ║
                ║    Base URL       : {}
                ║    Default model  : {}
                ║    Timeout        : {} s   retry wait={} ms
                ║    Fallbacks      : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Model profiles                                          ║
                ║    Native tools   : {}
                ║    Emulated tools : {}
                ║    Tool schemas   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Embedding                                               ║
                ║    Model          : {}
                ║    Endpoint       : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Runtime                                                 ║
                ║    Java Version   : {}
                ║    Prompt language: {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                llmProperties.baseUrl(),
                defaultModel,
                llmProperties.timeoutSeconds(), llmProperties.retryWaitMillis(),
                llmProperties.verifyInstalledModels() ? llmProperties.fallbackModels() : "(check disabled)",

                nativeTools.isEmpty() ? "(none)" : nativeTools,
                emulated.isEmpty() ? "(none)" : emulated,
                schemaRegistry.names(),

                embeddingProperties.model(),
                embeddingProperties.baseUrl(),

                javaVersion,
                promptProperties.defaultLanguage()
        );
    }
}
