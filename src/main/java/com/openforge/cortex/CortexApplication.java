package com.openforge.cortex;

import com.openforge.cortex.embedding.EmbeddingProperties;
import com.openforge.cortex.llm.LlmProperties;
import com.openforge.cortex.prompt.PromptProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({LlmProperties.class, EmbeddingProperties.class, PromptProperties.class})
public class CortexApplication {

    public static void main(String[] args) {
        SpringApplication.run(CortexApplication.class, args);
    }
}
