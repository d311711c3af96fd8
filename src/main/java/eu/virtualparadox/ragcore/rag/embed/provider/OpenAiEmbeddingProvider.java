package eu.virtualparadox.ragcore.rag.embed.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.CodecException;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

/**
 * {@link EmbeddingProvider} for OpenAI-compatible {@code POST /embeddings} endpoints.
 * <p>
 * The request runs on the non-blocking {@link WebClient}; the returned future completes on the
 * I/O thread and cancelling it cancels the HTTP exchange. Every failure is mapped to a
 * {@link ProviderException} here, so callers never inspect transport exceptions.
 * </p>
 */
@Slf4j
public final class OpenAiEmbeddingProvider implements EmbeddingProvider {

    private final WebClient webClient;
    private final Integer dimensions;
    private final Duration requestTimeout;

    /**
     * @param webClient      client with base URL and authorization header applied
     * @param dimensions     requested output dimension, or {@code null} for the model default
     * @param requestTimeout per-request timeout, reported as {@link EProviderError#TIMEOUT}
     */
    public OpenAiEmbeddingProvider(final WebClient webClient,
                                   final Integer dimensions,
                                   final Duration requestTimeout) {
        this.webClient = webClient;
        this.dimensions = dimensions;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public CompletableFuture<List<float[]>> embed(final List<String> texts, final String model) {
        final Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("input", texts);
        if (dimensions != null) {
            body.put("dimensions", dimensions);
        }

        return webClient.post()
                .uri("/embeddings")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(errorBody -> ProviderException.fromHttpStatus(response.statusCode().value(), errorBody)))
                .bodyToMono(EmbeddingResponse.class)
                .timeout(requestTimeout)
                .map(response -> toVectors(response, texts.size()))
                .onErrorMap(error -> !(error instanceof ProviderException), OpenAiEmbeddingProvider::classify)
                .toFuture();
    }

    @Override
    public String name() {
        return "openai";
    }

    /**
     * Orders the returned items by their {@code index} and checks they cover the batch exactly.
     */
    static List<float[]> toVectors(final EmbeddingResponse response, final int expected) {
        if (response == null || response.data() == null || response.data().size() != expected) {
            throw new ProviderException(EProviderError.MALFORMED_RESPONSE,
                    "Expected " + expected + " embeddings, got " + (response == null || response.data() == null ? 0 : response.data().size()));
        }

        final List<EmbeddingItem> items = new ArrayList<>(response.data());
        items.sort(Comparator.comparingInt(EmbeddingItem::index));

        final List<float[]> vectors = new ArrayList<>(expected);
        for (int i = 0; i < items.size(); i++) {
            final EmbeddingItem item = items.get(i);
            if (item.index() != i || item.embedding() == null || item.embedding().length == 0) {
                throw new ProviderException(EProviderError.MALFORMED_RESPONSE, "Missing or empty embedding at index " + i);
            }
            vectors.add(item.embedding());
        }
        return vectors;
    }

    private static ProviderException classify(final Throwable error) {
        if (error instanceof TimeoutException) {
            return new ProviderException(EProviderError.TIMEOUT, "Embedding request timed out", error);
        }
        if (error instanceof WebClientRequestException || error instanceof IOException) {
            return new ProviderException(EProviderError.CONNECTION, "Embedding provider unreachable: " + error.getMessage(), error);
        }
        if (error instanceof CodecException) {
            return new ProviderException(EProviderError.MALFORMED_RESPONSE, "Unreadable embedding response", error);
        }
        log.debug("Unclassified embedding provider failure", error);
        return new ProviderException(EProviderError.UNKNOWN, "Embedding request failed: " + error.getMessage(), error);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EmbeddingResponse(List<EmbeddingItem> data, String model) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EmbeddingItem(int index, float[] embedding) {
    }
}
