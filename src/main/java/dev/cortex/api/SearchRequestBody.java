package dev.cortex.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.cortex.item.ContentType;
import dev.cortex.item.ItemCriteria;
import dev.cortex.search.SearchMode;
import dev.cortex.search.SearchRequest;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/** JSON body for {@code POST /api/items/search}. Omitted fields take their defaults. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SearchRequestBody(
    @Nullable String query,
    @Nullable SearchMode searchType,
    @Nullable String projectId,
    @Nullable Set<ContentType> contentTypes,
    @Nullable Set<String> tags,
    @Nullable Boolean includeInactive,
    @Nullable Double semanticWeight,
    @Nullable Integer limit,
    @Nullable Integer offset) {

  SearchRequest toRequest() {
    ItemCriteria filters =
        new ItemCriteria(projectId, contentTypes, tags, Boolean.TRUE.equals(includeInactive));
    return new SearchRequest(
        query,
        searchType != null ? searchType : SearchMode.HYBRID,
        filters,
        semanticWeight,
        limit != null ? limit : SearchRequest.DEFAULT_LIMIT,
        offset != null ? offset : 0);
  }
}
