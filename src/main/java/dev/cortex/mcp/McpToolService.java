package dev.cortex.mcp;

import dev.cortex.item.ContentType;
import dev.cortex.item.ContextItem;
import dev.cortex.item.ContextItemDraft;
import dev.cortex.item.ItemCriteria;
import dev.cortex.item.ItemService;
import dev.cortex.item.NotFoundException;
import dev.cortex.project.ContextProject;
import dev.cortex.project.ProjectAlreadyExistsException;
import dev.cortex.project.ProjectDraft;
import dev.cortex.project.ProjectService;
import dev.cortex.search.InvalidQueryException;
import dev.cortex.search.SearchMode;
import dev.cortex.search.SearchRequest;
import dev.cortex.search.SearchResponse;
import dev.cortex.search.SearchService;
import dev.cortex.stats.ContextStats;
import dev.cortex.stats.ContextStatsService;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing the context store as tool methods.
 *
 * <p>Each method is annotated with {@code @Tool} and registered via {@link McpToolConfig}. Tool
 * methods follow the structured error pattern: all exceptions are caught and returned as
 * descriptive error strings, never thrown.
 *
 * <p>Tools: {@code store_context}, {@code retrieve_context}, {@code search_context}, {@code
 * list_contexts}, {@code delete_context}, {@code create_project}, {@code list_projects}, {@code
 * context_stats}.
 *
 * @see TokenBudgetFormatter
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  static final int DEFAULT_LIMIT = 10;
  static final int MAX_LIMIT = 100;

  private final ItemService itemService;
  private final SearchService searchService;
  private final ProjectService projectService;
  private final ContextStatsService statsService;
  private final TokenBudgetFormatter formatter;

  public McpToolService(
      ItemService itemService,
      SearchService searchService,
      ProjectService projectService,
      ContextStatsService statsService,
      TokenBudgetFormatter formatter) {
    this.itemService = itemService;
    this.searchService = searchService;
    this.projectService = projectService;
    this.statsService = statsService;
    this.formatter = formatter;
  }

  /** Stores a new context snippet and embeds its content. */
  @Tool(
      name = "store_context",
      description =
          "Store a new context item (note, code snippet, documentation) for later retrieval. "
              + "Content is embedded for semantic search.")
  public String storeContext(
      @ToolParam(description = "Title of the context item") @Nullable String title,
      @ToolParam(description = "The main content/text of the context") @Nullable String content,
      @ToolParam(description = "Content type: text, code, markdown or json", required = false)
          @Nullable String contentType,
      @ToolParam(description = "Comma-separated tags, e.g. 'rust,memory'", required = false)
          @Nullable String tags,
      @ToolParam(description = "Project ID to associate the item with", required = false)
          @Nullable String projectId) {
    try {
      if (title == null || title.isBlank()) {
        return "Error: Title must not be empty.";
      }
      if (content == null) {
        return "Error: Content must not be null.";
      }
      ContextItem item =
          itemService.create(
              new ContextItemDraft(
                  title,
                  content,
                  contentType != null ? ContentType.fromValue(contentType) : null,
                  parseCommaSeparated(tags),
                  null,
                  "mcp",
                  projectId));
      return "Context '%s' stored (ID: %d)%s."
          .formatted(
              item.title(),
              item.id(),
              item.hasVector() ? "" : " without embedding; semantic search will skip it");
    } catch (Exception e) {
      return "Error storing context: " + e.getMessage();
    }
  }

  /** Retrieves one context item by id. */
  @Tool(name = "retrieve_context", description = "Retrieve a specific context item by its ID.")
  public String retrieveContext(
      @ToolParam(description = "Numeric ID of the context item") @Nullable Long contextId) {
    try {
      if (contextId == null) {
        return "Error: Context ID is required.";
      }
      return formatItem(itemService.get(contextId));
    } catch (NotFoundException e) {
      return "Error: " + e.getMessage() + ".";
    } catch (Exception e) {
      return "Error retrieving context: " + e.getMessage();
    }
  }

  /** Ranked search over stored context with token budget enforcement. */
  @Tool(
      name = "search_context",
      description =
          "Search stored context by natural-language query. Supports semantic, keyword and "
              + "hybrid ranking with project, content type and tag filters.")
  public String searchContext(
      @ToolParam(description = "Search query text") @Nullable String query,
      @ToolParam(description = "Search type: semantic, keyword or hybrid (default hybrid)", required = false)
          @Nullable String searchType,
      @ToolParam(description = "Filter by project ID", required = false) @Nullable String projectId,
      @ToolParam(description = "Comma-separated content types to include", required = false)
          @Nullable String contentTypes,
      @ToolParam(description = "Comma-separated tags; items with any of them match", required = false)
          @Nullable String tags,
      @ToolParam(
              description = "Weight of semantic similarity in hybrid search (0.0-1.0, default 0.7)",
              required = false)
          @Nullable Double semanticWeight,
      @ToolParam(description = "Maximum number of results (1-100, default 10)", required = false)
          @Nullable Integer limit) {
    try {
      if (query == null || query.isBlank()) {
        return "Error: Query must not be empty. Provide a search query string.";
      }
      SearchMode mode = searchType != null ? SearchMode.fromValue(searchType) : SearchMode.HYBRID;
      ItemCriteria filters =
          new ItemCriteria(
              projectId, parseContentTypes(contentTypes), parseCommaSeparated(tags), false);
      SearchResponse response =
          searchService.search(
              new SearchRequest(query, mode, filters, semanticWeight, clampLimit(limit), 0));

      if (response.items().isEmpty()) {
        return "No context found for query: " + query;
      }

      StringBuilder sb = new StringBuilder();
      sb.append(
          String.format(
              Locale.ROOT,
              "Found %d matching items (%s search, %.1f ms).%n",
              response.total(),
              response.effectiveMode().value(),
              response.executionTimeMs()));
      for (String warning : response.warnings()) {
        sb.append("Warning: ").append(warning).append(System.lineSeparator());
      }
      sb.append(System.lineSeparator());
      sb.append(formatter.format(response.items()));
      return sb.toString();
    } catch (InvalidQueryException e) {
      return "Error: " + e.getMessage();
    } catch (Exception e) {
      log.debug("search_context failed", e);
      return "Error searching context: " + e.getMessage();
    }
  }

  /** Lists context items newest first, without ranking. */
  @Tool(
      name = "list_contexts",
      description = "List stored context items, newest first, optionally filtered by project.")
  public String listContexts(
      @ToolParam(description = "Filter by project ID", required = false) @Nullable String projectId,
      @ToolParam(description = "Filter by content type", required = false)
          @Nullable String contentType,
      @ToolParam(description = "Maximum number of items (1-100, default 10)", required = false)
          @Nullable Integer limit,
      @ToolParam(description = "Number of items to skip", required = false) @Nullable Integer offset) {
    try {
      ItemCriteria criteria =
          new ItemCriteria(projectId, parseContentTypes(contentType), null, false);
      List<ContextItem> items =
          itemService.list(criteria, clampLimit(limit), offset != null ? Math.max(0, offset) : 0);
      if (items.isEmpty()) {
        return "No context items found. Use store_context to add one.";
      }
      StringBuilder sb = new StringBuilder();
      for (ContextItem item : items) {
        sb.append(
            String.format(
                "- #%d %s [%s] project: %s | tags: %s | updated: %s%n",
                item.id(),
                item.title(),
                item.contentType().value(),
                item.projectId() != null ? item.projectId() : "-",
                item.tags().isEmpty() ? "-" : String.join(", ", item.tags()),
                item.updatedAt()));
      }
      return sb.toString();
    } catch (Exception e) {
      return "Error listing contexts: " + e.getMessage();
    }
  }

  /** Soft-deletes (default) or permanently removes a context item. */
  @Tool(
      name = "delete_context",
      description =
          "Delete a context item by ID. Soft delete by default (item hidden from search); "
              + "hard=true removes it permanently.")
  public String deleteContext(
      @ToolParam(description = "Numeric ID of the context item") @Nullable Long contextId,
      @ToolParam(description = "Permanently remove the item", required = false) @Nullable Boolean hard) {
    try {
      if (contextId == null) {
        return "Error: Context ID is required.";
      }
      if (Boolean.TRUE.equals(hard)) {
        itemService.hardDelete(contextId);
        return "Context %d permanently deleted.".formatted(contextId);
      }
      itemService.softDelete(contextId);
      return "Context %d deleted.".formatted(contextId);
    } catch (NotFoundException e) {
      return "Error: " + e.getMessage() + ".";
    } catch (Exception e) {
      return "Error deleting context: " + e.getMessage();
    }
  }

  /** Registers a project under a user-chosen id. */
  @Tool(name = "create_project", description = "Create a project to group context items.")
  public String createProject(
      @ToolParam(description = "Unique project ID, e.g. 'my-app'") @Nullable String projectId,
      @ToolParam(description = "Display name") @Nullable String name,
      @ToolParam(description = "Project description", required = false) @Nullable String description) {
    try {
      if (projectId == null || projectId.isBlank()) {
        return "Error: Project ID must not be empty.";
      }
      ContextProject project =
          projectService.create(
              new ProjectDraft(projectId, name != null ? name : projectId, description, null));
      return "Project '%s' created (ID: %s).".formatted(project.getName(), project.getId());
    } catch (ProjectAlreadyExistsException e) {
      return "Error: " + e.getMessage() + ".";
    } catch (Exception e) {
      return "Error creating project: " + e.getMessage();
    }
  }

  /** Lists active projects. */
  @Tool(name = "list_projects", description = "List all active projects.")
  public String listProjects(
      @ToolParam(description = "Maximum number of projects (1-100, default 10)", required = false)
          @Nullable Integer limit,
      @ToolParam(description = "Number of projects to skip", required = false) @Nullable Integer offset) {
    try {
      List<ContextProject> projects =
          projectService.list(false, clampLimit(limit), offset != null ? Math.max(0, offset) : 0);
      if (projects.isEmpty()) {
        return "No projects found. Use create_project to add one.";
      }
      StringBuilder sb = new StringBuilder();
      for (ContextProject project : projects) {
        sb.append(
            String.format(
                "- %s (%s)%s%n",
                project.getName(),
                project.getId(),
                project.getDescription() != null ? ": " + project.getDescription() : ""));
      }
      return sb.toString();
    } catch (Exception e) {
      return "Error listing projects: " + e.getMessage();
    }
  }

  /** Store statistics, optionally for one project. */
  @Tool(
      name = "context_stats",
      description =
          "View context store statistics: item counts, content types, projects, "
              + "embedding coverage and last update.")
  public String contextStats(
      @ToolParam(description = "Restrict item counts to this project", required = false)
          @Nullable String projectId) {
    try {
      ContextStats stats = statsService.stats(projectId);
      Map<String, Long> byType = new TreeMap<>();
      stats.contentTypes().forEach((type, count) -> byType.put(type.value(), count));
      return """
          Context Statistics%s:
          - Total items: %,d
          - Active items: %,d
          - Items with embedding: %,d
          - Content types: %s
          - Projects: %d
          - Embedding dimensions: %d (all-MiniLM-L6-v2)
          - Last updated: %s"""
          .formatted(
              projectId != null ? " for project '" + projectId + "'" : "",
              stats.totalItems(),
              stats.activeItems(),
              stats.itemsWithVector(),
              byType.isEmpty() ? "none" : byType,
              stats.projectsCount(),
              stats.embeddingDimension(),
              stats.lastUpdated() != null ? stats.lastUpdated().toString() : "never");
    } catch (Exception e) {
      return "Error retrieving statistics: " + e.getMessage();
    }
  }

  private static String formatItem(ContextItem item) {
    return String.format(
        "# %s%nID: %d | Type: %s | Project: %s | Tags: %s%nCreated: %s | Updated: %s%n%n%s",
        item.title(),
        item.id(),
        item.contentType().value(),
        item.projectId() != null ? item.projectId() : "-",
        item.tags().isEmpty() ? "-" : String.join(", ", item.tags()),
        item.createdAt(),
        item.updatedAt(),
        item.content());
  }

  private static int clampLimit(@Nullable Integer limit) {
    if (limit == null || limit < 1) {
      return DEFAULT_LIMIT;
    }
    return Math.min(limit, MAX_LIMIT);
  }

  private static @Nullable Set<ContentType> parseContentTypes(@Nullable String value) {
    Set<String> values = parseCommaSeparated(value);
    if (values == null) {
      return null;
    }
    return values.stream().map(ContentType::fromValue).collect(Collectors.toSet());
  }

  private static @Nullable Set<String> parseCommaSeparated(@Nullable String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return Arrays.stream(value.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }
}
