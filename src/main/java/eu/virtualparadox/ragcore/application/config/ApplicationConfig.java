package eu.virtualparadox.ragcore.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "ragcore")
@Getter @Setter
public class ApplicationConfig {

    /**
     * Lucene index directory; the index lives in memory when unset.
     */
    private Path index;

    private final Embedding embedding = new Embedding();

    @PostConstruct
    public void ensureFolders() throws IOException {
        if (index != null) Files.createDirectories(index);
    }

    @Getter @Setter
    public static class Embedding {

        /**
         * {@code openai} or {@code hash}.
         */
        private String provider = "hash";
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey = "";
        private String model = "text-embedding-3-small";

        /**
         * Expected vector length; sent to the provider and checked on every response. Unset means any.
         */
        private Integer dimensions = 1536;

        private int maxBatchSize = 2048;
        private int maxAttempts = 5;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration requestTimeout = Duration.ofSeconds(60);
    }
}
