package dev.cortex.embedding;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decorator that bounds every embedding call by a timeout.
 *
 * <p>The delegate runs on a dedicated worker pool; the caller waits at most {@code timeout}. A call
 * that overruns is cancelled (the worker is interrupted) and reported as {@link
 * EmbeddingUnavailableException}, so neither writes nor queries can hang on a stuck model.
 */
public class TimeLimitedEmbeddingGenerator implements EmbeddingGenerator, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(TimeLimitedEmbeddingGenerator.class);

  private final EmbeddingGenerator delegate;
  private final ExecutorService executor;
  private final Duration timeout;

  public TimeLimitedEmbeddingGenerator(
      EmbeddingGenerator delegate, ExecutorService executor, Duration timeout) {
    this.delegate = delegate;
    this.executor = executor;
    this.timeout = timeout;
  }

  @Override
  public float[] embed(String text) {
    Future<float[]> future;
    try {
      future = executor.submit(() -> delegate.embed(text));
    } catch (RejectedExecutionException e) {
      throw new EmbeddingUnavailableException("Embedding executor rejected the request", e);
    }

    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn("Embedding timed out after {} ms", timeout.toMillis());
      throw new EmbeddingUnavailableException(
          "Embedding timed out after " + timeout.toMillis() + " ms", e);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new EmbeddingUnavailableException("Interrupted while waiting for embedding", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof EmbeddingUnavailableException unavailable) {
        throw unavailable;
      }
      throw new EmbeddingUnavailableException("Embedding failed: " + cause, cause);
    }
  }

  @Override
  public int dimension() {
    return delegate.dimension();
  }

  /** Stops the worker pool; pending embedding calls are interrupted. */
  @Override
  public void close() {
    executor.shutdownNow();
  }
}
