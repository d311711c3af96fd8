package eu.virtualparadox.ragcore.rag.embed;

import eu.virtualparadox.ragcore.application.config.ApplicationConfig;
import eu.virtualparadox.ragcore.exception.EmbeddingServiceException;
import eu.virtualparadox.ragcore.exception.InvalidArgumentException;
import eu.virtualparadox.ragcore.exception.InvalidConfigurationException;
import eu.virtualparadox.ragcore.exception.OperationCancelledException;
import eu.virtualparadox.ragcore.rag.embed.provider.EProviderError;
import eu.virtualparadox.ragcore.rag.embed.provider.EmbeddingProvider;
import eu.virtualparadox.ragcore.rag.embed.provider.ProviderException;
import eu.virtualparadox.ragcore.rag.embed.retry.BackoffScheduler;
import eu.virtualparadox.ragcore.rag.embed.retry.EFailureDisposition;
import eu.virtualparadox.ragcore.rag.embed.retry.FailureClassifier;
import eu.virtualparadox.ragcore.rag.embed.retry.RetryState;
import eu.virtualparadox.ragcore.util.CancellationSignal;
import eu.virtualparadox.ragcore.util.Futures;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link EmbeddingClient} that partitions input into provider-sized batches and retries
 * retryable provider failures with exponential backoff.
 * <p>
 * Steps per call:
 * <ol>
 *   <li>Split {@code texts} into consecutive batches of at most {@code maxBatchSize} items</li>
 *   <li>Embed the batches one after another, each with its own {@link RetryState}</li>
 *   <li>On a failure classified {@link EFailureDisposition#RETRYABLE}, wait
 *       {@code initialBackoff * 2^n} through the {@link BackoffScheduler} and try again, up to
 *       {@code maxAttempts} calls per batch</li>
 *   <li>Concatenate the batch results in input order</li>
 * </ol>
 * A fatal failure, exhausted attempts or a malformed response fail the whole call; vectors of
 * batches that already succeeded are dropped. No thread is blocked while waiting for the provider
 * or for a backoff timer.
 * </p>
 */
@Slf4j
@Service
public final class RetryingEmbeddingClient implements EmbeddingClient {

    private final EmbeddingProvider provider;
    private final FailureClassifier classifier;
    private final BackoffScheduler backoffScheduler;

    private final String defaultModel;
    private final int maxBatchSize;
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Integer expectedDimensions;

    public RetryingEmbeddingClient(final EmbeddingProvider provider,
                                   final FailureClassifier classifier,
                                   final BackoffScheduler backoffScheduler,
                                   final ApplicationConfig config) {
        final ApplicationConfig.Embedding settings = config.getEmbedding();
        if (settings.getMaxBatchSize() < 1) {
            throw new InvalidConfigurationException("maxBatchSize must be at least 1");
        }
        if (settings.getMaxAttempts() < 1) {
            throw new InvalidConfigurationException("maxAttempts must be at least 1");
        }
        if (settings.getInitialBackoff() == null || settings.getInitialBackoff().isNegative()) {
            throw new InvalidConfigurationException("initialBackoff must be non-negative");
        }
        if (StringUtils.isBlank(settings.getModel())) {
            throw new InvalidConfigurationException("a default embedding model must be configured");
        }

        this.provider = provider;
        this.classifier = classifier;
        this.backoffScheduler = backoffScheduler;
        this.defaultModel = settings.getModel();
        this.maxBatchSize = settings.getMaxBatchSize();
        this.maxAttempts = settings.getMaxAttempts();
        this.initialBackoff = settings.getInitialBackoff();
        this.expectedDimensions = settings.getDimensions();
    }

    @Override
    public CompletableFuture<List<float[]>> embedBatch(final List<String> texts,
                                                       final String model,
                                                       final CancellationSignal cancellation) {
        if (texts == null) {
            throw new InvalidArgumentException("texts cannot be null");
        }
        if (texts.isEmpty()) {
            return CompletableFuture.completedFuture(Collections.emptyList());
        }
        for (final String text : texts) {
            if (text == null) {
                throw new InvalidArgumentException("texts cannot contain null elements");
            }
        }

        final String resolvedModel = StringUtils.isBlank(model) ? defaultModel : model;
        final EmbedCall call = new EmbedCall(partition(texts), resolvedModel, texts.size(), cancellation);
        call.start();
        return call.result;
    }

    /**
     * Index-based partitioning into consecutive sub-lists of at most {@code maxBatchSize} items.
     */
    List<List<String>> partition(final List<String> texts) {
        final List<List<String>> batches = new ArrayList<>((texts.size() + maxBatchSize - 1) / maxBatchSize);
        for (int from = 0; from < texts.size(); from += maxBatchSize) {
            batches.add(List.copyOf(texts.subList(from, Math.min(from + maxBatchSize, texts.size()))));
        }
        return batches;
    }

    /**
     * State of one {@code embedBatch} invocation. Batches run strictly one after another, so the
     * fields touched by the callbacks are never accessed concurrently.
     */
    private final class EmbedCall {

        private final List<List<String>> batches;
        private final String model;
        private final CancellationSignal cancellation;
        private final int total;
        private final List<float[]> vectors;
        private final CompletableFuture<List<float[]>> result = new CompletableFuture<>();
        private final AtomicReference<CompletableFuture<?>> inFlight = new AtomicReference<>();
        private int dimensions = -1;

        EmbedCall(final List<List<String>> batches,
                  final String model,
                  final int total,
                  final CancellationSignal cancellation) {
            this.batches = batches;
            this.model = model;
            this.cancellation = cancellation;
            this.total = total;
            this.vectors = new ArrayList<>(total);
        }

        void start() {
            if (cancellation.isCancelled()) {
                result.completeExceptionally(cancelled());
                return;
            }

            final Runnable unregister = cancellation.onCancel(this::abort);
            final CompletableFuture<Void> deadline = cancellation.remaining()
                    .map(backoffScheduler::delay)
                    .orElse(null);
            if (deadline != null) {
                deadline.thenRun(cancellation::cancel);
            }

            result.whenComplete((ignored, error) -> {
                unregister.run();
                if (deadline != null) {
                    deadline.cancel(false);
                }
                if (result.isCancelled()) {
                    cancelInFlight();
                }
            });

            log.debug("Embedding {} texts in {} batch(es) with model {} via {}",
                    total, batches.size(), model, provider.name());
            attempt(0, new RetryState(maxAttempts, initialBackoff));
        }

        private void attempt(final int batchIndex, final RetryState state) {
            if (result.isDone()) {
                return;
            }
            if (cancellation.isCancelled()) {
                abort();
                return;
            }

            state.beginAttempt();
            CompletableFuture<List<float[]>> call;
            try {
                call = provider.embed(batches.get(batchIndex), model);
            } catch (final RuntimeException e) {
                call = CompletableFuture.failedFuture(e);
            }
            inFlight.set(call);
            if (result.isDone()) {
                call.cancel(true);
                return;
            }

            call.whenComplete((batchVectors, error) -> {
                if (error == null) {
                    onBatchSuccess(batchIndex, state, batchVectors);
                } else {
                    onBatchFailure(batchIndex, state, Futures.unwrap(error));
                }
            });
        }

        private void onBatchSuccess(final int batchIndex, final RetryState state, final List<float[]> batchVectors) {
            if (result.isDone()) {
                return;
            }

            final String problem = validate(batches.get(batchIndex).size(), batchVectors);
            if (problem != null) {
                onBatchFailure(batchIndex, state, new ProviderException(EProviderError.MALFORMED_RESPONSE, problem));
                return;
            }

            state.succeeded();
            vectors.addAll(batchVectors);

            if (batchIndex + 1 < batches.size()) {
                attempt(batchIndex + 1, new RetryState(maxAttempts, initialBackoff));
            } else {
                log.debug("Embedded {} texts ({} dimensions)", vectors.size(), dimensions);
                result.complete(Collections.unmodifiableList(vectors));
            }
        }

        private void onBatchFailure(final int batchIndex, final RetryState state, final Throwable failure) {
            if (result.isDone()) {
                return;
            }
            if (failure instanceof CancellationException || cancellation.isCancelled()) {
                abort();
                return;
            }

            final EProviderError error = failure instanceof ProviderException providerException
                    ? providerException.getError()
                    : EProviderError.UNKNOWN;

            if (classifier.classify(error) == EFailureDisposition.FATAL) {
                state.failed(error, failure);
                log.error("Embedding batch {}/{} failed with non-retryable {} on attempt {}",
                        batchIndex + 1, batches.size(), error, state.getAttempts(), failure);
                result.completeExceptionally(new EmbeddingServiceException(error, state.getAttempts(),
                        "Embedding service error: " + failure.getMessage(), failure));
                return;
            }

            final Duration backoff = state.retryableFailure(error, failure);
            if (backoff == null) {
                log.error("Embedding batch {}/{} failed with {} after {} attempts, giving up",
                        batchIndex + 1, batches.size(), error, state.getAttempts(), failure);
                result.completeExceptionally(new EmbeddingServiceException(error, state.getAttempts(),
                        "Embedding service unavailable after " + state.getAttempts() + " attempts: " + failure.getMessage(),
                        failure));
                return;
            }

            log.warn("{} on embedding batch {}/{}, attempt {}/{}, retrying in {} ms",
                    error, batchIndex + 1, batches.size(), state.getAttempts(), state.getMaxAttempts(), backoff.toMillis());

            final CompletableFuture<Void> wait = backoffScheduler.delay(backoff);
            inFlight.set(wait);
            wait.whenComplete((ignored, waitError) -> {
                if (waitError != null) {
                    onBatchFailure(batchIndex, state, Futures.unwrap(waitError));
                    return;
                }
                attempt(batchIndex, state);
            });
        }

        /**
         * @return a description of what is wrong with the batch response, or {@code null} if it is usable
         */
        private String validate(final int expected, final List<float[]> batchVectors) {
            if (batchVectors == null || batchVectors.size() != expected) {
                return "Provider returned " + (batchVectors == null ? 0 : batchVectors.size()) + " vectors for " + expected + " texts";
            }
            for (final float[] vector : batchVectors) {
                if (vector == null || vector.length == 0) {
                    return "Provider returned an empty vector";
                }
                if (expectedDimensions != null && vector.length != expectedDimensions) {
                    return "Vector dimension mismatch. Expected=" + expectedDimensions + ", got=" + vector.length;
                }
                if (dimensions == -1) {
                    dimensions = vector.length;
                } else if (vector.length != dimensions) {
                    return "Vector dimension mismatch within one call. Existing=" + dimensions + ", new=" + vector.length;
                }
            }
            return null;
        }

        private void abort() {
            if (result.completeExceptionally(cancelled())) {
                cancelInFlight();
            }
        }

        private void cancelInFlight() {
            final CompletableFuture<?> current = inFlight.get();
            if (current != null) {
                current.cancel(true);
            }
        }

        private OperationCancelledException cancelled() {
            return new OperationCancelledException(cancellation.remaining().map(Duration::isZero).orElse(false)
                    ? "Embedding deadline exceeded"
                    : "Embedding cancelled");
        }
    }
}
