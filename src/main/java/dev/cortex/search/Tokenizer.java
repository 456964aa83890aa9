package dev.cortex.search;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Splits text into lower-case terms on every character that is neither a Unicode letter nor a
 * digit.
 */
public final class Tokenizer {

  private Tokenizer() {}

  /** Distinct terms of {@code text}, in first-occurrence order. */
  public static Set<String> distinctTerms(String text) {
    Set<String> terms = new LinkedHashSet<>();
    if (text == null || text.isEmpty()) {
      return terms;
    }
    String lower = text.toLowerCase(Locale.ROOT);
    int start = -1;
    int i = 0;
    while (i < lower.length()) {
      int cp = lower.codePointAt(i);
      boolean alnum = Character.isLetterOrDigit(cp);
      if (alnum && start < 0) {
        start = i;
      } else if (!alnum && start >= 0) {
        terms.add(lower.substring(start, i));
        start = -1;
      }
      i += Character.charCount(cp);
    }
    if (start >= 0) {
      terms.add(lower.substring(start));
    }
    return terms;
  }
}
