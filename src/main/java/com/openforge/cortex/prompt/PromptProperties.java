package com.openforge.cortex.prompt;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * cortex:
 *   prompt:
 *     default-language: pt-BR
 *     snippet-length: 300
 */
@ConfigurationProperties(prefix = "cortex.prompt")
public record PromptProperties(
        @DefaultValue("pt-BR") String defaultLanguage,
        @DefaultValue("300") int snippetLength
) {}
