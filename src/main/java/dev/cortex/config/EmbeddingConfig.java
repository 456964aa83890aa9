package dev.cortex.config;

import dev.cortex.embedding.EmbeddingGenerator;
import dev.cortex.embedding.EmbeddingProperties;
import dev.cortex.embedding.ModelEmbeddingGenerator;
import dev.cortex.embedding.TimeLimitedEmbeddingGenerator;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2q.AllMiniLmL6V2QuantizedEmbeddingModel;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the embedding model and the generator the core depends on.
 *
 * <p>Uses the ONNX-based all-MiniLM-L6-v2 quantized model (384 dimensions) running in-process,
 * avoiding any external embedding API. Every call goes through {@link
 * TimeLimitedEmbeddingGenerator} so a stuck inference cannot block writes or queries.
 */
@Configuration
public class EmbeddingConfig {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingConfig.class);

    /**
     * Provides the in-process ONNX embedding model (all-MiniLM-L6-v2 quantized, 384 dimensions).
     *
     * @return a ready-to-use embedding model requiring no external API
     */
    @Bean
    public EmbeddingModel embeddingModel() {
        EmbeddingModel model = new AllMiniLmL6V2QuantizedEmbeddingModel();
        log.info("Loaded embedding model all-MiniLM-L6-v2 (quantized)");
        return model;
    }

    /**
     * Wraps the model in a dimension-checked, time-bounded generator.
     *
     * @param embeddingModel the LangChain4j model
     * @param properties     dimension, timeout and worker pool size
     * @return the generator used by item writes and queries
     */
    @Bean(destroyMethod = "close")
    public TimeLimitedEmbeddingGenerator embeddingGenerator(
            EmbeddingModel embeddingModel, EmbeddingProperties properties) {
        EmbeddingGenerator model = new ModelEmbeddingGenerator(embeddingModel, properties.dimension());
        ExecutorService workers =
                Executors.newFixedThreadPool(properties.workerThreads(), namedDaemonThreads());
        return new TimeLimitedEmbeddingGenerator(model, workers, properties.timeout());
    }

    private static ThreadFactory namedDaemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "embedding-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
