package dev.cortex.embedding;

/**
 * Turns text into a fixed-length dense vector.
 *
 * <p>Implementations must be deterministic: the same text always yields the same vector. Every
 * returned vector has exactly {@link #dimension()} components; an implementation that cannot honour
 * that throws {@link EmbeddingUnavailableException} instead of returning a partial vector.
 */
public interface EmbeddingGenerator {

  /**
   * Embeds the given text.
   *
   * @param text the text to embed (may be empty)
   * @return a freshly allocated vector of length {@link #dimension()}
   * @throws EmbeddingUnavailableException if the underlying model cannot produce a vector
   */
  float[] embed(String text);

  /** Vector dimension {@code D} produced by this generator. */
  int dimension();
}
