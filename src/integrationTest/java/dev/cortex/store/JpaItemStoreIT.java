package dev.cortex.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.cortex.BaseIntegrationTest;
import dev.cortex.item.ContentType;
import dev.cortex.item.ContextItem;
import dev.cortex.item.ItemCriteria;
import dev.cortex.item.StaleItemException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.StreamSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.PlatformTransactionManager;

class JpaItemStoreIT extends BaseIntegrationTest {

  private static final Instant CREATED = Instant.parse("2026-01-15T10:00:00Z");

  @Autowired JpaItemStore store;

  @Autowired ContextItemRepository repository;

  @Autowired PlatformTransactionManager transactionManager;

  private ContextItem draft(long id, String projectId, boolean active, float[] vector) {
    return new ContextItem(
        id,
        "Item " + id,
        "content " + id,
        ContentType.CODE,
        Set.of("rust", "memory"),
        Map.of("lines", 42, "lang", "rust"),
        "test",
        projectId,
        active,
        CREATED,
        CREATED,
        vector,
        0);
  }

  private static List<Long> ids(Iterable<ContextItem> items) {
    return StreamSupport.stream(items.spliterator(), false).map(ContextItem::id).toList();
  }

  @Test
  void insertRoundTripsAllColumns() {
    long id = store.nextId();

    ContextItem stored = store.upsert(draft(id, "lang", true, new float[] {0.25f, -0.5f, 1f}));

    ContextItem read = store.get(id).orElseThrow();
    assertThat(stored.version()).isEqualTo(1);
    assertThat(read.version()).isEqualTo(1);
    assertThat(read.vector()).containsExactly(0.25f, -0.5f, 1f);
    assertThat(read.tags()).containsExactlyInAnyOrder("rust", "memory");
    assertThat(read.extraMetadata()).containsEntry("lines", 42).containsEntry("lang", "rust");
    assertThat(read.contentType()).isEqualTo(ContentType.CODE);
    assertThat(read.projectId()).isEqualTo("lang");
    assertThat(read.createdAt().truncatedTo(ChronoUnit.MILLIS)).isEqualTo(CREATED);
  }

  @Test
  void itemWithoutVectorStoresNull() {
    long id = store.nextId();

    store.upsert(draft(id, null, true, null));

    assertThat(store.get(id).orElseThrow().hasVector()).isFalse();
  }

  @Test
  void insertOfExistingIdIsStale() {
    long id = store.nextId();
    store.upsert(draft(id, null, true, null));

    assertThatThrownBy(() -> store.upsert(draft(id, null, true, null)))
        .isInstanceOf(StaleItemException.class);
  }

  @Test
  void updateRequiresCurrentVersion() {
    long id = store.nextId();
    ContextItem v1 = store.upsert(draft(id, null, true, new float[] {1f}));
    ContextItem v2 = store.upsert(v1.withVector(new float[] {2f}));

    assertThatThrownBy(() -> store.upsert(v1.withVector(new float[] {3f})))
        .isInstanceOf(StaleItemException.class);
    assertThat(v2.version()).isEqualTo(2);
    assertThat(store.get(id).orElseThrow().vector()).containsExactly(2f);
  }

  @Test
  void updateOfMissingItemIsStale() {
    ContextItem ghost = draft(store.nextId(), null, true, null).withVersion(3);

    assertThatThrownBy(() -> store.upsert(ghost)).isInstanceOf(StaleItemException.class);
  }

  @Test
  void nextIdNeverRepeats() {
    long first = store.nextId();
    long second = store.nextId();

    assertThat(second).isGreaterThan(first);
  }

  @Test
  void scanPagesThroughAllRowsInIdOrder() {
    JpaItemStore smallPages = new JpaItemStore(repository, transactionManager, 2);
    List<Long> expected = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      long id = smallPages.nextId();
      smallPages.upsert(draft(id, null, true, null));
      expected.add(id);
    }

    assertThat(ids(smallPages.scan(ItemCriteria.activeOnly()))).containsExactlyElementsOf(expected);
  }

  @Test
  void scanPushesProjectAndActivityFiltersDown() {
    long active = store.nextId();
    long inactive = store.nextId();
    long otherProject = store.nextId();
    store.upsert(draft(active, "lang", true, null));
    store.upsert(draft(inactive, "lang", false, null));
    store.upsert(draft(otherProject, "web", true, null));

    assertThat(ids(store.scan(ItemCriteria.forProject("lang")))).containsExactly(active);
    assertThat(ids(store.scan(new ItemCriteria("lang", null, null, true))))
        .containsExactly(active, inactive);
    assertThat(ids(store.scan(ItemCriteria.everything())))
        .containsExactly(active, inactive, otherProject);
  }

  @Test
  void scanIsRestartable() {
    long id = store.nextId();
    store.upsert(draft(id, null, true, null));
    Iterable<ContextItem> scan = store.scan(ItemCriteria.activeOnly());

    assertThat(ids(scan)).containsExactly(id);
    assertThat(ids(scan)).containsExactly(id);
  }

  @Test
  void deleteRemovesRow() {
    long id = store.nextId();
    store.upsert(draft(id, null, true, null));

    assertThat(store.delete(id)).isTrue();
    assertThat(store.get(id)).isEmpty();
    assertThat(store.delete(id)).isFalse();
  }
}
