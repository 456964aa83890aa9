package dev.cortex.embedding;

/**
 * Raised when no embedding can be produced: the model failed to load or run, returned a vector of
 * the wrong dimension, or did not answer within the configured timeout.
 *
 * <p>Callers treat this as non-fatal: writes store the item without a vector, queries fall back to
 * keyword-only scoring.
 */
public class EmbeddingUnavailableException extends RuntimeException {

  public EmbeddingUnavailableException(String message) {
    super(message);
  }

  public EmbeddingUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
