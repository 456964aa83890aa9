package dev.cortex.item;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.cortex.embedding.EmbeddingUnavailableException;
import dev.cortex.fixture.ContextItemBuilder;
import dev.cortex.fixture.InMemoryItemStore;
import dev.cortex.fixture.StubEmbeddingGenerator;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ItemServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private static ValidatorFactory validatorFactory;
  private static Validator validator;

  private InMemoryItemStore store;
  private StubEmbeddingGenerator embeddings;
  private ItemService service;

  @BeforeAll
  static void createValidator() {
    validatorFactory = Validation.buildDefaultValidatorFactory();
    validator = validatorFactory.getValidator();
  }

  @AfterAll
  static void closeValidator() {
    validatorFactory.close();
  }

  @BeforeEach
  void setUp() {
    store = new InMemoryItemStore();
    embeddings = new StubEmbeddingGenerator();
    service =
        new ItemService(
            store,
            embeddings,
            validator,
            Clock.fixed(NOW, ZoneOffset.UTC),
            new MutationProperties(3, 0),
            new ListingProperties(20));
  }

  private static ContextItemDraft draft(String title, String content) {
    return new ContextItemDraft(title, content, null, Set.of("notes"), Map.of(), "test", null);
  }

  // --- create ---

  @Test
  void createStoresItemWithContentEmbedding() {
    ContextItem created = service.create(draft("Rust ownership", "each value has one owner"));

    assertThat(created.id()).isPositive();
    assertThat(created.version()).isEqualTo(1);
    assertThat(created.active()).isTrue();
    assertThat(created.contentType()).isEqualTo(ContentType.TEXT);
    assertThat(created.createdAt()).isEqualTo(NOW);
    assertThat(created.vector())
        .containsExactly(
            StubEmbeddingGenerator.hashed("each value has one owner", StubEmbeddingGenerator.DIMENSION));
    assertThat(service.get(created.id())).isEqualTo(created);
  }

  @Test
  void createAllocatesDistinctIds() {
    ContextItem first = service.create(draft("a", "one"));
    ContextItem second = service.create(draft("b", "two"));

    assertThat(second.id()).isNotEqualTo(first.id());
  }

  @Test
  void createWithoutModelStoresItemWithoutVector() {
    embeddings.setAvailable(false);

    ContextItem created = service.create(draft("Offline", "still saved"));

    assertThat(created.hasVector()).isFalse();
    assertThat(store.size()).isEqualTo(1);
  }

  @Test
  void createRejectsBlankTitleBeforeEmbedding() {
    assertThatThrownBy(() -> service.create(draft(" ", "content")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageStartingWith("Validation failed")
        .hasMessageContaining("title");
    assertThat(embeddings.calls()).isZero();
    assertThat(store.size()).isZero();
  }

  @Test
  void createRejectsMissingContent() {
    assertThatThrownBy(() -> service.create(draft("title", null)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("content");
  }

  @Test
  void createAcceptsEmptyContent() {
    ContextItem created = service.create(draft("Empty", ""));

    assertThat(created.content()).isEmpty();
    assertThat(created.hasVector()).isTrue();
  }

  // --- update ---

  @Test
  void metadataOnlyUpdateKeepsVectorWithoutCallingModel() {
    ContextItem created = service.create(draft("Rust", "borrow checker rules"));
    int callsAfterCreate = embeddings.calls();

    ContextItem updated =
        service.update(
            created.id(),
            new ContextItemPatch(
                "Rust borrowing", null, ContentType.MARKDOWN, Set.of("rust"), null, null, "lang",
                null));

    assertThat(embeddings.calls()).isEqualTo(callsAfterCreate);
    assertThat(updated.vector()).containsExactly(created.vector());
    assertThat(updated.title()).isEqualTo("Rust borrowing");
    assertThat(updated.contentType()).isEqualTo(ContentType.MARKDOWN);
    assertThat(updated.tags()).containsExactly("rust");
    assertThat(updated.projectId()).isEqualTo("lang");
    assertThat(updated.content()).isEqualTo("borrow checker rules");
    assertThat(updated.version()).isEqualTo(created.version() + 1);
  }

  @Test
  void contentUpdateRecomputesVector() {
    ContextItem created = service.create(draft("Note", "first draft"));

    ContextItem updated = service.update(created.id(), ContextItemPatch.content("second version"));

    assertThat(updated.vector())
        .containsExactly(
            StubEmbeddingGenerator.hashed("second version", StubEmbeddingGenerator.DIMENSION));
  }

  @Test
  void unchangedContentIsNotReembedded() {
    ContextItem created = service.create(draft("Note", "same text"));
    int callsAfterCreate = embeddings.calls();

    service.update(created.id(), ContextItemPatch.content("same text"));

    assertThat(embeddings.calls()).isEqualTo(callsAfterCreate);
  }

  @Test
  void contentUpdateWithFailingModelDropsStaleVector() {
    ContextItem created = service.create(draft("Note", "old content"));
    embeddings.setAvailable(false);

    ContextItem updated = service.update(created.id(), ContextItemPatch.content("new content"));

    assertThat(updated.content()).isEqualTo("new content");
    assertThat(updated.hasVector()).isFalse();
  }

  @Test
  void updateRetriesWhenItemChangesConcurrently() {
    ContextItem created = service.create(draft("Note", "text"));
    store.beforeNextUpsert(
        () -> store.upsert(store.get(created.id()).orElseThrow().withVector(new float[] {1f})));

    ContextItem updated = service.update(created.id(), ContextItemPatch.title("Renamed"));

    assertThat(updated.title()).isEqualTo("Renamed");
    assertThat(updated.version()).isEqualTo(created.version() + 2);
    assertThat(updated.vector()).containsExactly(1f);
  }

  @Test
  void updateGivesUpAfterMaxAttempts() {
    ContextItem created = service.create(draft("Note", "text"));
    store.beforeNextUpsert(
        new Runnable() {
          @Override
          public void run() {
            store.upsert(store.get(created.id()).orElseThrow());
            store.beforeNextUpsert(this);
          }
        });

    assertThatThrownBy(() -> service.update(created.id(), ContextItemPatch.title("x")))
        .isInstanceOf(StaleItemException.class)
        .hasMessageContaining("changed concurrently");
    assertThat(service.get(created.id()).title()).isEqualTo("Note");
  }

  @Test
  void updateOfMissingItemFails() {
    assertThatThrownBy(() -> service.update(42, ContextItemPatch.title("x")))
        .isInstanceOf(NotFoundException.class)
        .hasMessage("Context item 42 not found");
  }

  @Test
  void updateRejectsEmptyTitle() {
    ContextItem created = service.create(draft("Note", "text"));

    assertThatThrownBy(() -> service.update(created.id(), ContextItemPatch.title("")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  // --- delete ---

  @Test
  void softDeleteHidesItemButKeepsIt() {
    ContextItem created = service.create(draft("Note", "text"));

    ContextItem deleted = service.softDelete(created.id());

    assertThat(deleted.active()).isFalse();
    assertThatThrownBy(() -> service.get(created.id())).isInstanceOf(NotFoundException.class);
    assertThat(service.get(created.id(), true).active()).isFalse();
    assertThat(deleted.vector()).containsExactly(created.vector());
  }

  @Test
  void softDeleteIsIdempotent() {
    ContextItem created = service.create(draft("Note", "text"));
    ContextItem first = service.softDelete(created.id());
    int upserts = store.upserts();

    ContextItem second = service.softDelete(created.id());

    assertThat(second).isEqualTo(first);
    assertThat(store.upserts()).isEqualTo(upserts);
  }

  @Test
  void reactivationRestoresVisibility() {
    ContextItem created = service.create(draft("Note", "text"));
    service.softDelete(created.id());

    ContextItem restored = service.update(created.id(), ContextItemPatch.reactivate());

    assertThat(restored.active()).isTrue();
    assertThat(service.get(created.id())).isEqualTo(restored);
  }

  @Test
  void hardDeleteRemovesItem() {
    ContextItem created = service.create(draft("Note", "text"));

    service.hardDelete(created.id());

    assertThat(store.size()).isZero();
    assertThatThrownBy(() -> service.get(created.id(), true))
        .isInstanceOf(NotFoundException.class);
  }

  @Test
  void hardDeleteOfMissingItemFails() {
    assertThatThrownBy(() -> service.hardDelete(7)).isInstanceOf(NotFoundException.class);
  }

  // --- list ---

  @Test
  void listReturnsNewestFirstWithIdTieBreak() {
    store.seed(
        new ContextItemBuilder().id(1).createdSecondsAfterBase(0).build(),
        new ContextItemBuilder().id(2).createdSecondsAfterBase(10).build(),
        new ContextItemBuilder().id(3).createdSecondsAfterBase(10).build(),
        new ContextItemBuilder().id(4).createdSecondsAfterBase(20).active(false).build());

    List<ContextItem> page = service.list(ItemCriteria.activeOnly(), 10, 0);

    assertThat(page).extracting(ContextItem::id).containsExactly(3L, 2L, 1L);
  }

  @Test
  void listAppliesFiltersAndPaging() {
    store.seed(
        new ContextItemBuilder().id(1).projectId("a").tags("x").createdSecondsAfterBase(1).build(),
        new ContextItemBuilder().id(2).projectId("a").tags("y").createdSecondsAfterBase(2).build(),
        new ContextItemBuilder().id(3).projectId("a").tags("x").createdSecondsAfterBase(3).build(),
        new ContextItemBuilder().id(4).projectId("b").tags("x").createdSecondsAfterBase(4).build());
    ItemCriteria criteria = new ItemCriteria("a", null, Set.of("x"), false);

    assertThat(service.list(criteria, 1, 0)).extracting(ContextItem::id).containsExactly(3L);
    assertThat(service.list(criteria, 1, 1)).extracting(ContextItem::id).containsExactly(1L);
    assertThat(service.list(criteria, 5, 2)).isEmpty();
  }

  @Test
  void listRejectsPagesAboveConfiguredMaximum() {
    assertThatThrownBy(() -> service.list(ItemCriteria.activeOnly(), 21, 0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("limit must be <= 20, got: 21");
    assertThat(service.list(ItemCriteria.activeOnly(), 20, 0)).isEmpty();
  }

  @Test
  void listKeepsNewestMatchesAcrossLargeScan() {
    for (int i = 1; i <= 60; i++) {
      store.seed(
          new ContextItemBuilder()
              .id(i)
              .tags(i % 3 == 0 ? "even-third" : "other")
              .createdSecondsAfterBase(i % 7)
              .build());
    }
    ItemCriteria criteria = new ItemCriteria(null, null, Set.of("even-third"), false);

    List<ContextItem> firstPage = service.list(criteria, 5, 0);
    List<ContextItem> secondPage = service.list(criteria, 5, 5);

    assertThat(firstPage)
        .extracting(ContextItem::id)
        .containsExactly(48L, 27L, 6L, 54L, 33L);
    assertThat(secondPage)
        .extracting(ContextItem::id)
        .containsExactly(12L, 60L, 39L, 18L, 45L);
    assertThat(store.scannedItems()).isEqualTo(120);
  }

  @Test
  void listWithZeroLimitReturnsNothing() {
    store.seed(new ContextItemBuilder().id(1).build());

    assertThat(service.list(ItemCriteria.activeOnly(), 0, 0)).isEmpty();
  }

  @Test
  void listRejectsNegativePaging() {
    assertThatThrownBy(() -> service.list(ItemCriteria.activeOnly(), -1, 0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> service.list(ItemCriteria.activeOnly(), 1, -1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  // --- re-embedding ---

  @Test
  void reembedRepairsMissingVector() {
    embeddings.setAvailable(false);
    ContextItem created = service.create(draft("Note", "repair me"));
    embeddings.setAvailable(true);

    ContextItem repaired = service.reembed(created.id());

    assertThat(repaired.hasVector()).isTrue();
  }

  @Test
  void reembedPropagatesModelFailure() {
    ContextItem created = service.create(draft("Note", "text"));
    embeddings.setAvailable(false);

    assertThatThrownBy(() -> service.reembed(created.id()))
        .isInstanceOf(EmbeddingUnavailableException.class);
    assertThat(service.get(created.id()).hasVector()).isTrue();
  }

  @Test
  void reembedMissingOnlyTouchesItemsWithoutVector() {
    service.create(draft("Has vector", "alpha"));
    embeddings.setAvailable(false);
    service.create(draft("No vector", "beta"));
    service.create(draft("No vector either", "gamma"));
    embeddings.setAvailable(true);
    int callsBefore = embeddings.calls();

    int repaired = service.reembedMissing();

    assertThat(repaired).isEqualTo(2);
    assertThat(embeddings.calls() - callsBefore).isEqualTo(2);
    assertThat(service.list(ItemCriteria.everything(), 10, 0)).allMatch(ContextItem::hasVector);
  }

  @Test
  void reembedMissingSkipsItemsThatStillFail() {
    embeddings.setAvailable(false);
    service.create(draft("No vector", "beta"));

    assertThat(service.reembedMissing()).isZero();
  }
}
