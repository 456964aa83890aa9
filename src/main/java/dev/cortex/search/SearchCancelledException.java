package dev.cortex.search;

import java.util.concurrent.CancellationException;

/** The caller cancelled a search, or its deadline passed, before the ranking finished. */
public class SearchCancelledException extends CancellationException {

  public SearchCancelledException(String message) {
    super(message);
  }
}
