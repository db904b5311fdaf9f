package com.openforge.cortex.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.openforge.cortex.config.AppConfig;
import com.openforge.cortex.embedding.EmbeddingClient.EmbeddingException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class EmbeddingClientTest {

    private HttpClient httpClient;
    private EmbeddingClient client;

    @BeforeEach
    void setUp() {
        httpClient = mock(HttpClient.class);
        client = new EmbeddingClient(httpClient, AppConfig.createObjectMapper(),
                new EmbeddingProperties("http://localhost:11434/", "nomic-embed-text", 30, 8000));
    }

    @SuppressWarnings("unchecked")
    private void respond(int status, String body) {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        doReturn(CompletableFuture.completedFuture(response))
                .when(httpClient).sendAsync(any(HttpRequest.class), any());
    }

    @Test
    void shouldReturnVector() {
        respond(200, "{\"embedding\": [0.1, -0.25, 0.5]}");

        List<Float> vector = client.embed("hello world").join();

        assertThat(vector).containsExactly(0.1f, -0.25f, 0.5f);
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).sendAsync(captor.capture(), any());
        assertThat(captor.getValue().uri()).isEqualTo(URI.create("http://localhost:11434/api/embeddings"));
    }

    @Test
    void shouldRejectBlankText() {
        assertThatThrownBy(() -> client.embed("  ")).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(httpClient);
    }

    @Test
    void shouldFailOnHttpError() {
        respond(500, "boom");

        assertThatThrownBy(() -> client.embed("x").join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(EmbeddingException.class)
                .hasMessageContaining("HTTP 500");
    }

    @Test
    void shouldFailOnErrorFieldOrEmptyVector() {
        respond(200, "{\"error\": \"model not found\"}");
        assertThatThrownBy(() -> client.embed("x").join()).hasMessageContaining("model not found");

        respond(200, "{\"embedding\": []}");
        assertThatThrownBy(() -> client.embed("x").join()).hasMessageContaining("no vector");
    }

    @Test
    void shouldWrapNetworkErrors() {
        doReturn(CompletableFuture.failedFuture(new IOException("refused")))
                .when(httpClient).sendAsync(any(HttpRequest.class), any());

        assertThatThrownBy(() -> client.embed("x").join())
                .hasCauseInstanceOf(EmbeddingException.class)
                .hasRootCauseInstanceOf(IOException.class);
    }
}
