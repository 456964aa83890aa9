package dev.cortex.search;

import static org.assertj.core.api.Assertions.assertThat;

import dev.cortex.BaseIntegrationTest;
import dev.cortex.item.ContentType;
import dev.cortex.item.ContextItem;
import dev.cortex.item.ContextItemDraft;
import dev.cortex.item.ItemCriteria;
import dev.cortex.item.ItemService;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class HybridSearchIT extends BaseIntegrationTest {

  @Autowired ItemService itemService;

  @Autowired SearchService searchService;

  private ContextItem rust;
  private ContextItem vue;
  private ContextItem postgres;

  @BeforeEach
  void seedItems() {
    rust =
        store(
            "Rust ownership",
            "Each value in Rust has a single owner. The borrow checker rules enforce that "
                + "references never outlive the data they point to.",
            ContentType.MARKDOWN,
            "lang",
            "rust");
    vue =
        store(
            "Vue router",
            "Navigation guards let you redirect or cancel a route change before the new "
                + "component is rendered.",
            ContentType.MARKDOWN,
            "web",
            "vue");
    postgres =
        store(
            "PostgreSQL JSONB",
            "JSONB columns store semi-structured data; use the -> operator to read fields.",
            ContentType.CODE,
            "web",
            "sql");
  }

  private ContextItem store(
      String title, String content, ContentType type, String projectId, String tag) {
    return itemService.create(
        new ContextItemDraft(title, content, type, Set.of(tag), null, "test", projectId));
  }

  private static List<Long> ids(SearchResponse response) {
    return response.items().stream().map(hit -> hit.item().id()).toList();
  }

  @Test
  void storedItemsCarryEmbeddings() {
    assertThat(rust.hasVector()).isTrue();
    assertThat(rust.vector()).hasSize(384);
  }

  @Test
  void keywordSearchRanksTitleAndContentOverlap() {
    SearchResponse response =
        searchService.search(new SearchRequest("ownership rules", SearchMode.KEYWORD));

    assertThat(ids(response)).containsExactly(rust.id());
    assertThat(response.items().get(0).keywordScore()).isPositive();
  }

  @Test
  void semanticSearchFindsItemsByMeaning() {
    SearchResponse response =
        searchService.search(
            new SearchRequest(
                "how does memory safety work without a garbage collector", SearchMode.SEMANTIC));

    assertThat(ids(response)).first().isEqualTo(rust.id());
    assertThat(response.degraded()).isFalse();
  }

  @Test
  void semanticSearchRanksRoutingQueryToRouterItem() {
    SearchResponse response =
        searchService.search(
            new SearchRequest("redirect users before changing pages", SearchMode.SEMANTIC));

    assertThat(ids(response)).first().isEqualTo(vue.id());
  }

  @Test
  void hybridWithZeroWeightMatchesKeywordRanking() {
    SearchRequest keyword = new SearchRequest("navigation route operator", SearchMode.KEYWORD);
    SearchRequest hybrid =
        new SearchRequest("navigation route operator", SearchMode.HYBRID).withSemanticWeight(0.0);

    assertThat(ids(searchService.search(hybrid))).isEqualTo(ids(searchService.search(keyword)));
  }

  @Test
  void hybridWithFullWeightMatchesSemanticRanking() {
    SearchRequest semantic = new SearchRequest("structured data columns", SearchMode.SEMANTIC);
    SearchRequest hybrid =
        new SearchRequest("structured data columns", SearchMode.HYBRID).withSemanticWeight(1.0);

    assertThat(ids(searchService.search(hybrid))).isEqualTo(ids(searchService.search(semantic)));
  }

  @Test
  void filtersRestrictResults() {
    SearchRequest request =
        new SearchRequest("data", SearchMode.HYBRID)
            .withFilters(new ItemCriteria("web", Set.of(ContentType.CODE), null, false));

    assertThat(ids(searchService.search(request))).containsExactly(postgres.id());
  }

  @Test
  void softDeletedItemsDisappearFromSearch() {
    itemService.softDelete(rust.id());

    SearchResponse response =
        searchService.search(new SearchRequest("ownership borrow checker", SearchMode.HYBRID));

    assertThat(ids(response)).doesNotContain(rust.id());
  }

  @Test
  void paginationReportsTotalBeyondPage() {
    SearchResponse response =
        searchService.search(new SearchRequest("data", SearchMode.SEMANTIC).withPage(1, 0));

    assertThat(response.items()).hasSize(1);
    assertThat(response.total()).isEqualTo(3);
  }
}
