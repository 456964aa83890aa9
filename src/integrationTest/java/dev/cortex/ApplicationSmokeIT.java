package dev.cortex;

import static org.assertj.core.api.Assertions.assertThat;

import dev.cortex.embedding.EmbeddingGenerator;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.health.Status;

class ApplicationSmokeIT extends BaseIntegrationTest {

  @Autowired EmbeddingGenerator embeddingGenerator;

  @Autowired List<ToolCallbackProvider> toolCallbackProviders;

  @Autowired HealthEndpoint healthEndpoint;

  @Test
  void contextLoadsWithMigratedSchema() {
    Integer tables =
        jdbcTemplate.queryForObject(
            "SELECT count(*) FROM information_schema.tables "
                + "WHERE table_name IN ('context_items', 'context_projects')",
            Integer.class);

    assertThat(tables).isEqualTo(2);
  }

  @Test
  void embeddingModelProducesConfiguredDimension() {
    float[] vector = embeddingGenerator.embed("Rust ownership and the borrow checker");

    assertThat(embeddingGenerator.dimension()).isEqualTo(384);
    assertThat(vector).hasSize(384);
  }

  @Test
  void allMcpToolsAreRegistered() {
    List<String> names =
        toolCallbackProviders.stream()
            .flatMap(provider -> Arrays.stream(provider.getToolCallbacks()))
            .map(ToolCallback::getToolDefinition)
            .map(definition -> definition.name())
            .toList();

    assertThat(names)
        .contains(
            "store_context",
            "retrieve_context",
            "search_context",
            "list_contexts",
            "delete_context",
            "create_project",
            "list_projects",
            "context_stats");
  }

  @Test
  void healthReportsDatabaseAndEmbeddingModel() {
    HealthComponent database = healthEndpoint.healthForPath("db");
    HealthComponent embedding = healthEndpoint.healthForPath("embedding");

    assertThat(database).isNotNull();
    assertThat(database.getStatus()).isEqualTo(Status.UP);
    assertThat(embedding).isNotNull();
    assertThat(embedding.getStatus()).isEqualTo(Status.UP);
    assertThat(healthEndpoint.health().getStatus()).isEqualTo(Status.UP);
  }
}
