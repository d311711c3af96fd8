package eu.virtualparadox.ragcore.application.config;

import eu.virtualparadox.ragcore.exception.InvalidConfigurationException;
import eu.virtualparadox.ragcore.rag.embed.provider.EmbeddingProvider;
import eu.virtualparadox.ragcore.rag.embed.provider.HashEmbeddingProvider;
import eu.virtualparadox.ragcore.rag.embed.provider.OpenAiEmbeddingProvider;
import eu.virtualparadox.ragcore.rag.embed.retry.BackoffScheduler;
import eu.virtualparadox.ragcore.rag.embed.retry.TaskSchedulerBackoffScheduler;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Wires the embedding provider selected by {@code ragcore.embedding.provider} and the backoff
 * timer used by the retrying client.
 */
@Configuration
@Slf4j
public class EmbeddingConfig {

    /**
     * A full batch response carries {@code maxBatchSize} vectors of up to a few thousand floats.
     */
    private static final int MAX_RESPONSE_BYTES = 256 * 1024 * 1024;

    @Bean
    @ConditionalOnProperty(prefix = "ragcore.embedding", name = "provider", havingValue = "openai")
    public EmbeddingProvider openAiEmbeddingProvider(final ApplicationConfig props,
                                                     final WebClient.Builder webClientBuilder) {
        final ApplicationConfig.Embedding settings = props.getEmbedding();
        if (StringUtils.isBlank(settings.getApiKey())) {
            throw new InvalidConfigurationException("ragcore.embedding.api-key is required for the openai provider");
        }

        final WebClient webClient = webClientBuilder
                .baseUrl(StringUtils.removeEnd(settings.getBaseUrl(), "/"))
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + settings.getApiKey())
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES))
                .build();

        log.info("Using OpenAI-compatible embedding provider at {} with model {}", settings.getBaseUrl(), settings.getModel());
        return new OpenAiEmbeddingProvider(webClient, settings.getDimensions(), settings.getRequestTimeout());
    }

    @Bean
    @ConditionalOnProperty(prefix = "ragcore.embedding", name = "provider", havingValue = "hash", matchIfMissing = true)
    public EmbeddingProvider hashEmbeddingProvider(final ApplicationConfig props) {
        final Integer dimensions = props.getEmbedding().getDimensions();
        if (dimensions == null || dimensions <= 0) {
            throw new InvalidConfigurationException("ragcore.embedding.dimensions is required for the hash provider");
        }
        log.warn("Using the offline hash embedding provider ({} dimensions); search results carry no semantic meaning", dimensions);
        return new HashEmbeddingProvider(dimensions);
    }

    @Bean
    public BackoffScheduler backoffScheduler(final ThreadPoolTaskScheduler embeddingBackoffScheduler) {
        return new TaskSchedulerBackoffScheduler(embeddingBackoffScheduler);
    }
}
