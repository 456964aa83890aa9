package dev.cortex.mcp;

import dev.cortex.search.ScoredItem;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Renders ranked context items as text that fits a token budget.
 *
 * <p>Tokens are estimated as characters / 4. Items are appended best first until the next one would
 * exceed the budget. If the first item alone is over budget it is cut at the character limit, so at
 * least one result is always returned.
 */
@Component
public class TokenBudgetFormatter {

  private static final double CHARS_PER_TOKEN = 4.0;

  private final int tokenBudget;

  public TokenBudgetFormatter(@Value("${cortex.mcp.token-budget:5000}") int tokenBudget) {
    this.tokenBudget = tokenBudget;
  }

  /**
   * Formats as many results as fit within the token budget.
   *
   * @param results ranked results, best first
   * @return formatted text, empty when there are no results
   */
  public String format(@Nullable List<ScoredItem> results) {
    if (results == null || results.isEmpty()) {
      return "";
    }

    StringBuilder output = new StringBuilder();
    int estimatedTokens = 0;

    for (int i = 0; i < results.size(); i++) {
      String formatted = formatResult(i + 1, results.get(i));
      int resultTokens = estimateTokens(formatted);

      if (i == 0 && resultTokens > tokenBudget) {
        int maxChars = (int) (tokenBudget * CHARS_PER_TOKEN);
        output.append(formatted, 0, Math.min(maxChars, formatted.length()));
        break;
      }

      if (estimatedTokens + resultTokens > tokenBudget) {
        break;
      }

      output.append(formatted);
      estimatedTokens += resultTokens;
    }

    return output.toString();
  }

  public int getTokenBudget() {
    return tokenBudget;
  }

  int estimateTokens(String text) {
    return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
  }

  private String formatResult(int index, ScoredItem result) {
    String tags =
        result.item().tags().isEmpty()
            ? "-"
            : result.item().tags().stream().sorted().collect(Collectors.joining(", "));
    return String.format(
        Locale.ROOT,
        "## [%d] #%d %s\nType: %s | Tags: %s | Project: %s\nScore: %.3f%s\n\n%s\n\n---\n",
        index,
        result.item().id(),
        result.item().title(),
        result.item().contentType().value(),
        tags,
        result.item().projectId() != null ? result.item().projectId() : "-",
        result.combinedScore(),
        breakdown(result),
        result.item().content());
  }

  private static String breakdown(ScoredItem result) {
    if (result.semanticScore() == null || result.keywordScore() == null) {
      return "";
    }
    return String.format(
        Locale.ROOT,
        " (semantic %.3f, keyword %.3f)",
        result.semanticScore(),
        result.keywordScore());
  }
}
