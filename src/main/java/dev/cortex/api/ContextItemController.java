package dev.cortex.api;

import dev.cortex.item.ContentType;
import dev.cortex.item.ContextItem;
import dev.cortex.item.ItemCriteria;
import dev.cortex.item.ItemService;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST adapter for the item mutation pipeline and filter-only listing. */
@RestController
@RequestMapping("/api/items")
public class ContextItemController {

  private final ItemService itemService;

  public ContextItemController(ItemService itemService) {
    this.itemService = itemService;
  }

  @PostMapping
  public ResponseEntity<ItemResponse> create(@RequestBody ItemRequest request) {
    ContextItem created = itemService.create(request.toDraft());
    return ResponseEntity.created(URI.create("/api/items/" + created.id()))
        .body(ItemResponse.from(created));
  }

  @GetMapping("/{id}")
  public ItemResponse get(
      @PathVariable long id,
      @RequestParam(name = "include_inactive", defaultValue = "false") boolean includeInactive) {
    return ItemResponse.from(itemService.get(id, includeInactive));
  }

  @GetMapping
  public List<ItemResponse> list(
      @RequestParam(name = "project_id", required = false) @Nullable String projectId,
      @RequestParam(name = "content_type", required = false) @Nullable Set<String> contentTypes,
      @RequestParam(name = "tags", required = false) @Nullable Set<String> tags,
      @RequestParam(name = "include_inactive", defaultValue = "false") boolean includeInactive,
      @RequestParam(name = "limit", defaultValue = "50") int limit,
      @RequestParam(name = "offset", defaultValue = "0") int offset) {
    ItemCriteria criteria =
        new ItemCriteria(projectId, parseContentTypes(contentTypes), tags, includeInactive);
    return itemService.list(criteria, limit, offset).stream().map(ItemResponse::from).toList();
  }

  @PutMapping("/{id}")
  public ItemResponse update(@PathVariable long id, @RequestBody ItemUpdateRequest request) {
    return ItemResponse.from(itemService.update(id, request.toPatch()));
  }

  /** Soft-deletes by default; {@code ?hard=true} removes the row. */
  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(
      @PathVariable long id, @RequestParam(name = "hard", defaultValue = "false") boolean hard) {
    if (hard) {
      itemService.hardDelete(id);
    } else {
      itemService.softDelete(id);
    }
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{id}/reembed")
  public ItemResponse reembed(@PathVariable long id) {
    return ItemResponse.from(itemService.reembed(id));
  }

  @PostMapping("/reembed-missing")
  public Map<String, Integer> reembedMissing() {
    return Map.of("reembedded", itemService.reembedMissing());
  }

  static @Nullable Set<ContentType> parseContentTypes(@Nullable Set<String> values) {
    if (values == null || values.isEmpty()) {
      return null;
    }
    return values.stream()
        .map(ContentType::fromValue)
        .collect(Collectors.toSet());
  }
}
