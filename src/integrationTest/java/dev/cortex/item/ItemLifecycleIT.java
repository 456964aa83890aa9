package dev.cortex.item;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import dev.cortex.BaseIntegrationTest;
import dev.cortex.embedding.EmbeddingGenerator;
import dev.cortex.project.ProjectDraft;
import dev.cortex.project.ProjectService;
import dev.cortex.stats.ContextStats;
import dev.cortex.stats.ContextStatsService;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class ItemLifecycleIT extends BaseIntegrationTest {

  @Autowired ItemService itemService;

  @Autowired ProjectService projectService;

  @Autowired ContextStatsService statsService;

  @Autowired EmbeddingGenerator embeddingGenerator;

  private ContextItem create(String title, String content) {
    return itemService.create(
        new ContextItemDraft(title, content, null, Set.of("notes"), Map.of("k", "v"), "test", null));
  }

  @Test
  void metadataUpdateKeepsStoredVector() {
    ContextItem created = create("Cache notes", "LRU eviction drops the least recently used entry");

    ContextItem updated =
        itemService.update(created.id(), ContextItemPatch.tags(Set.of("cache", "lru")));

    assertThat(updated.vector()).containsExactly(created.vector());
    assertThat(updated.tags()).containsExactlyInAnyOrder("cache", "lru");
    assertThat(updated.version()).isEqualTo(created.version() + 1);
  }

  @Test
  void contentUpdateStoresEmbeddingOfNewContent() {
    ContextItem created = create("Cache notes", "LRU eviction drops the least recently used entry");

    ContextItem updated =
        itemService.update(created.id(), ContextItemPatch.content("Bloom filters answer maybe"));

    assertThat(updated.vector())
        .containsExactly(embeddingGenerator.embed("Bloom filters answer maybe"), within(1e-4f));
    assertThat(itemService.get(created.id()).vector()).containsExactly(updated.vector());
  }

  @Test
  void softDeleteAndReactivate() {
    ContextItem created = create("Temp", "short lived");

    itemService.softDelete(created.id());
    assertThatThrownBy(() -> itemService.get(created.id())).isInstanceOf(NotFoundException.class);

    itemService.update(created.id(), ContextItemPatch.reactivate());
    assertThat(itemService.get(created.id()).active()).isTrue();
  }

  @Test
  void hardDeleteRemovesItem() {
    ContextItem created = create("Temp", "short lived");

    itemService.hardDelete(created.id());

    assertThatThrownBy(() -> itemService.get(created.id(), true))
        .isInstanceOf(NotFoundException.class);
  }

  @Test
  void statsReflectItemsAndProjects() {
    projectService.create(new ProjectDraft("lang", "Languages", null, null));
    create("One", "first");
    ContextItem second = create("Two", "second");
    itemService.softDelete(second.id());

    ContextStats stats = statsService.stats(null);

    assertThat(stats.totalItems()).isEqualTo(2);
    assertThat(stats.activeItems()).isEqualTo(1);
    assertThat(stats.itemsWithVector()).isEqualTo(1);
    assertThat(stats.contentTypes()).containsEntry(ContentType.TEXT, 1L);
    assertThat(stats.projectsCount()).isEqualTo(1);
    assertThat(stats.embeddingDimension()).isEqualTo(384);
    assertThat(stats.lastUpdated()).isNotNull();
  }
}
