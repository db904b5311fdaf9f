package com.openforge.cortex.llm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.openforge.cortex.config.AppConfig;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class InstalledModelResolverTest {

    private static final String INSTALLED = """
            {"models": [{"name": "llama3.2:latest", "size": 2019393189},
                        {"name": "mistral:latest"},
                        {"name": "qwen3:8b"}]}
            """;

    private HttpClient httpClient;
    private InstalledModelResolver resolver;

    @BeforeEach
    void setUp() {
        httpClient = mock(HttpClient.class);
        resolver = newResolver(true, LlmProperties.DEFAULT_FALLBACK_MODELS);
    }

    private InstalledModelResolver newResolver(boolean verify, List<String> fallbacks) {
        return new InstalledModelResolver(httpClient, AppConfig.createObjectMapper(),
                new LlmProperties("http://localhost:11434/", "qwen3:latest", 120, 250, null, verify, fallbacks));
    }

    @SuppressWarnings("unchecked")
    private void respond(int status, String body) {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        doReturn(CompletableFuture.completedFuture(response))
                .when(httpClient).sendAsync(any(HttpRequest.class), any());
    }

    @Nested
    class Installed {

        @Test
        void shouldKeepInstalledModel() {
            respond(200, INSTALLED);

            assertThat(resolver.resolve("qwen3:8b").join()).isEqualTo("qwen3:8b");

            ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
            verify(httpClient).sendAsync(captor.capture(), any());
            assertThat(captor.getValue().uri()).isEqualTo(URI.create("http://localhost:11434/api/tags"));
            assertThat(captor.getValue().method()).isEqualTo("GET");
        }

        @Test
        void shouldTreatUntaggedNameAsLatest() {
            respond(200, INSTALLED);

            assertThat(resolver.resolve("mistral").join()).isEqualTo("mistral");
        }
    }

    @Nested
    class Missing {

        @Test
        void shouldUseFirstInstalledFallback() {
            respond(200, INSTALLED);

            assertThat(resolver.resolve("qwen3:latest").join()).isEqualTo("mistral:latest");
        }

        @Test
        void shouldKeepModelWhenNoFallbackIsInstalled() {
            respond(200, "{\"models\": [{\"name\": \"phi4:latest\"}]}");

            assertThat(resolver.resolve("qwen3:latest").join()).isEqualTo("qwen3:latest");
        }

        @Test
        void shouldKeepModelWhenFallbackListIsEmpty() {
            respond(200, INSTALLED);

            assertThat(newResolver(true, List.of()).resolve("gemma3:4b").join()).isEqualTo("gemma3:4b");
        }
    }

    @Nested
    class LookupFailure {

        @Test
        void shouldKeepModelWhenServerIsUnreachable() {
            doReturn(CompletableFuture.failedFuture(new IOException("Connection refused")))
                    .when(httpClient).sendAsync(any(HttpRequest.class), any());

            assertThat(resolver.resolve("qwen3:latest").join()).isEqualTo("qwen3:latest");
        }

        @Test
        void shouldKeepModelOnErrorStatusOrUnreadableBody() {
            respond(500, "boom");
            assertThat(resolver.resolve("qwen3:latest").join()).isEqualTo("qwen3:latest");

            respond(200, "<html>");
            assertThat(resolver.resolve("qwen3:latest").join()).isEqualTo("qwen3:latest");
        }

        @Test
        void shouldSkipLookupWhenDisabled() {
            assertThat(newResolver(false, List.of("mistral:latest")).resolve("qwen3:latest").join())
                    .isEqualTo("qwen3:latest");
            verifyNoInteractions(httpClient);
        }
    }
}
