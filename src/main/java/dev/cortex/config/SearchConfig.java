package dev.cortex.config;

import dev.cortex.item.ItemStore;
import dev.cortex.search.CosineSimilarityScorer;
import dev.cortex.search.HybridRanker;
import dev.cortex.search.SearchProperties;
import dev.cortex.search.TermOverlapScorer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the ranker with the concrete semantic and keyword scorers. */
@Configuration
public class SearchConfig {

  @Bean
  public HybridRanker hybridRanker(ItemStore itemStore, SearchProperties properties) {
    return new HybridRanker(
        itemStore,
        new CosineSimilarityScorer(),
        new TermOverlapScorer(properties.getContentTermCap()),
        properties.getScanBatchSize());
  }
}
