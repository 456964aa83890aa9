package dev.cortex.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.cortex.embedding.EmbeddingUnavailableException;
import dev.cortex.fixture.ContextItemBuilder;
import dev.cortex.item.ContentType;
import dev.cortex.item.ContextItem;
import dev.cortex.item.ContextItemDraft;
import dev.cortex.item.ContextItemPatch;
import dev.cortex.item.ItemCriteria;
import dev.cortex.item.ItemService;
import dev.cortex.item.NotFoundException;
import dev.cortex.item.StaleItemException;
import dev.cortex.item.StoreUnavailableException;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@ExtendWith(MockitoExtension.class)
@SuppressWarnings("NullAway.Init")
class ContextItemControllerTest {

  @Mock ItemService itemService;

  @Captor ArgumentCaptor<ContextItemDraft> draftCaptor;

  @Captor ArgumentCaptor<ContextItemPatch> patchCaptor;

  private MockMvc mockMvc;

  private final ContextItem rust =
      new ContextItemBuilder()
          .id(7)
          .title("Rust ownership")
          .content("borrow checker rules")
          .contentType(ContentType.MARKDOWN)
          .tags("rust")
          .projectId("lang")
          .vector(1f, 0f)
          .build();

  @BeforeEach
  void setUp() {
    mockMvc = JsonMockMvc.of(new ContextItemController(itemService));
  }

  @Test
  void createReturns201WithSnakeCaseBody() throws Exception {
    given(itemService.create(any())).willReturn(rust);

    mockMvc
        .perform(
            post("/api/items")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"title": "Rust ownership", "content": "borrow checker rules",
                     "content_type": "markdown", "tags": ["rust"], "project_id": "lang"}
                    """))
        .andExpect(status().isCreated())
        .andExpect(header().string("Location", "/api/items/7"))
        .andExpect(jsonPath("$.id").value(7))
        .andExpect(jsonPath("$.content_type").value("markdown"))
        .andExpect(jsonPath("$.project_id").value("lang"))
        .andExpect(jsonPath("$.has_embedding").value(true))
        .andExpect(jsonPath("$.is_active").value(true))
        .andExpect(jsonPath("$.created_at").value("2026-01-15T10:00:00Z"))
        .andExpect(jsonPath("$.updated_at").value("2026-01-15T10:00:00Z"))
        .andExpect(jsonPath("$.vector").doesNotExist());

    verify(itemService).create(draftCaptor.capture());
    ContextItemDraft draft = draftCaptor.getValue();
    assertThat(draft.contentType()).isEqualTo(ContentType.MARKDOWN);
    assertThat(draft.projectId()).isEqualTo("lang");
    assertThat(draft.source()).isEqualTo("api");
  }

  @Test
  void createWithValidationFailureReturns400() throws Exception {
    given(itemService.create(any()))
        .willThrow(new IllegalArgumentException("Validation failed: title: must not be blank"));

    mockMvc
        .perform(
            post("/api/items")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\": \"\", \"content\": \"x\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value("Validation failed: title: must not be blank"));
  }

  @Test
  void createWithUnknownContentTypeReturns400() throws Exception {
    mockMvc
        .perform(
            post("/api/items")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\": \"t\", \"content\": \"x\", \"content_type\": \"yaml\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Malformed request body"));
    verify(itemService, never()).create(any());
  }

  @Test
  void getMissingItemReturns404() throws Exception {
    given(itemService.get(99L, false)).willThrow(NotFoundException.item(99));

    mockMvc
        .perform(get("/api/items/99"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.detail").value("Context item 99 not found"));
  }

  @Test
  void getCanIncludeInactiveItems() throws Exception {
    given(itemService.get(7L, true)).willReturn(rust);

    mockMvc
        .perform(get("/api/items/7").param("include_inactive", "true"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.title").value("Rust ownership"));
  }

  @Test
  void listPassesFiltersAndPaging() throws Exception {
    given(itemService.list(any(ItemCriteria.class), anyInt(), anyInt())).willReturn(List.of(rust));

    mockMvc
        .perform(
            get("/api/items")
                .param("project_id", "lang")
                .param("content_type", "code", "markdown")
                .param("tags", "rust")
                .param("limit", "5")
                .param("offset", "10"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(1)));

    verify(itemService)
        .list(
            eq(
                new ItemCriteria(
                    "lang",
                    Set.of(ContentType.CODE, ContentType.MARKDOWN),
                    Set.of("rust"),
                    false)),
            eq(5),
            eq(10));
  }

  @Test
  void listWithNegativeLimitReturns400() throws Exception {
    given(itemService.list(any(ItemCriteria.class), eq(-1), eq(0)))
        .willThrow(new IllegalArgumentException("limit and offset must be >= 0"));

    mockMvc.perform(get("/api/items").param("limit", "-1")).andExpect(status().isBadRequest());
  }

  @Test
  void updateMapsIsActiveToPatch() throws Exception {
    given(itemService.update(eq(7L), any())).willReturn(rust);

    mockMvc
        .perform(
            put("/api/items/7")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"is_active\": true, \"tags\": [\"rust\", \"memory\"]}"))
        .andExpect(status().isOk());

    verify(itemService).update(eq(7L), patchCaptor.capture());
    ContextItemPatch patch = patchCaptor.getValue();
    assertThat(patch.active()).isTrue();
    assertThat(patch.tags()).containsExactlyInAnyOrder("rust", "memory");
    assertThat(patch.content()).isNull();
  }

  @Test
  void concurrentUpdateConflictReturns409() throws Exception {
    given(itemService.update(eq(7L), any())).willThrow(new StaleItemException(7, 3));

    mockMvc
        .perform(
            put("/api/items/7")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\": \"x\"}"))
        .andExpect(status().isConflict());
  }

  @Test
  void deleteIsSoftByDefault() throws Exception {
    mockMvc.perform(delete("/api/items/7")).andExpect(status().isNoContent());

    verify(itemService).softDelete(7L);
    verify(itemService, never()).hardDelete(7L);
  }

  @Test
  void hardDeleteRemovesItem() throws Exception {
    mockMvc.perform(delete("/api/items/7").param("hard", "true")).andExpect(status().isNoContent());

    verify(itemService).hardDelete(7L);
  }

  @Test
  void reembedWithModelDownReturns503WithoutInternals() throws Exception {
    given(itemService.reembed(7L))
        .willThrow(new EmbeddingUnavailableException("Embedding timed out after 5000 ms"));

    mockMvc
        .perform(post("/api/items/7/reembed"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.detail").value("The embedding model is unavailable"));
  }

  @Test
  void reembedMissingReportsCount() throws Exception {
    given(itemService.reembedMissing()).willReturn(3);

    mockMvc
        .perform(post("/api/items/reembed-missing"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.reembedded").value(3));
  }

  @Test
  void storeOutageReturns503() throws Exception {
    given(itemService.get(7L, false))
        .willThrow(new StoreUnavailableException("connection refused", new RuntimeException()));

    mockMvc
        .perform(get("/api/items/7"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.detail").value("The item store is unavailable"));
  }
}
