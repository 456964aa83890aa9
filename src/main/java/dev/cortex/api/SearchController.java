package dev.cortex.api;

import dev.cortex.item.ItemCriteria;
import dev.cortex.search.SearchMode;
import dev.cortex.search.SearchRequest;
import dev.cortex.search.SearchService;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST adapter for ranked search. */
@RestController
@RequestMapping("/api/items/search")
public class SearchController {

  private final SearchService searchService;

  public SearchController(SearchService searchService) {
    this.searchService = searchService;
  }

  @PostMapping
  public SearchResponseBody search(@RequestBody SearchRequestBody body) {
    return SearchResponseBody.from(searchService.search(body.toRequest()));
  }

  /** Query-string variant, e.g. {@code GET /api/items/search/keyword?q=rust+ownership}. */
  @GetMapping("/{mode}")
  public SearchResponseBody search(
      @PathVariable String mode,
      @RequestParam(name = "q", defaultValue = "") String query,
      @RequestParam(name = "project_id", required = false) @Nullable String projectId,
      @RequestParam(name = "content_type", required = false) @Nullable Set<String> contentTypes,
      @RequestParam(name = "tags", required = false) @Nullable Set<String> tags,
      @RequestParam(name = "include_inactive", defaultValue = "false") boolean includeInactive,
      @RequestParam(name = "semantic_weight", required = false) @Nullable Double semanticWeight,
      @RequestParam(name = "limit", defaultValue = "50") int limit,
      @RequestParam(name = "offset", defaultValue = "0") int offset) {
    ItemCriteria filters =
        new ItemCriteria(
            projectId,
            ContextItemController.parseContentTypes(contentTypes),
            tags,
            includeInactive);
    SearchRequest request =
        new SearchRequest(
            query, SearchMode.fromValue(mode), filters, semanticWeight, limit, offset);
    return SearchResponseBody.from(searchService.search(request));
  }
}
