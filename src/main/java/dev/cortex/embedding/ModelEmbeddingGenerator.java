package dev.cortex.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;

/**
 * {@link EmbeddingGenerator} backed by a LangChain4j {@link EmbeddingModel}.
 *
 * <p>Any failure raised by the model, and any vector whose length differs from the configured
 * dimension, surfaces as {@link EmbeddingUnavailableException}.
 */
public class ModelEmbeddingGenerator implements EmbeddingGenerator {

  private final EmbeddingModel embeddingModel;
  private final int dimension;

  public ModelEmbeddingGenerator(EmbeddingModel embeddingModel, int dimension) {
    this.embeddingModel = embeddingModel;
    this.dimension = dimension;
  }

  @Override
  public float[] embed(String text) {
    Embedding embedding;
    try {
      embedding = embeddingModel.embed(text).content();
    } catch (RuntimeException e) {
      throw new EmbeddingUnavailableException("Embedding model failed: " + e.getMessage(), e);
    }
    if (embedding == null) {
      throw new EmbeddingUnavailableException("Embedding model returned no vector");
    }
    float[] vector = embedding.vector();
    if (vector.length != dimension) {
      throw new EmbeddingUnavailableException(
          "Embedding model returned %d dimensions, expected %d".formatted(vector.length, dimension));
    }
    return vector.clone();
  }

  @Override
  public int dimension() {
    return dimension;
  }
}
