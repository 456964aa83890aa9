package dev.cortex.config;

import dev.cortex.embedding.EmbeddingUnavailableException;
import dev.cortex.item.NotFoundException;
import dev.cortex.item.StaleItemException;
import dev.cortex.item.StoreUnavailableException;
import dev.cortex.project.ProjectAlreadyExistsException;
import dev.cortex.search.InvalidQueryException;
import dev.cortex.search.SearchCancelledException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps application exceptions to RFC 9457 Problem Detail responses.
 *
 * <p>Client mistakes map to 4xx with the exception message as detail. Store and embedding outages
 * map to 503; their messages are generic so no internals leak.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(InvalidQueryException.class)
  ProblemDetail handleInvalidQuery(InvalidQueryException ex) {
    return problem(HttpStatus.BAD_REQUEST, "Invalid query", ex.getMessage());
  }

  /**
   * Maps {@link IllegalArgumentException} to a 400 Bad Request Problem Detail.
   *
   * @param ex the exception thrown by validation logic
   * @return a Problem Detail with HTTP 400 status and the exception message
   */
  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  ProblemDetail handleInvalidBody(MethodArgumentNotValidException ex) {
    String detail =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .sorted()
            .collect(Collectors.joining(", "));
    return problem(HttpStatus.BAD_REQUEST, "Validation failed", detail);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  ProblemDetail handleUnreadableBody(HttpMessageNotReadableException ex) {
    return problem(
        HttpStatus.BAD_REQUEST,
        "Malformed request body",
        "Request body is not valid JSON for this endpoint");
  }

  @ExceptionHandler(NotFoundException.class)
  ProblemDetail handleNotFound(NotFoundException ex) {
    return problem(HttpStatus.NOT_FOUND, "Not found", ex.getMessage());
  }

  @ExceptionHandler(StaleItemException.class)
  ProblemDetail handleStale(StaleItemException ex) {
    return problem(HttpStatus.CONFLICT, "Concurrent modification", ex.getMessage());
  }

  @ExceptionHandler(ProjectAlreadyExistsException.class)
  ProblemDetail handleProjectExists(ProjectAlreadyExistsException ex) {
    return problem(HttpStatus.CONFLICT, "Project exists", ex.getMessage());
  }

  @ExceptionHandler(SearchCancelledException.class)
  ProblemDetail handleCancelled(SearchCancelledException ex) {
    log.warn("Search cancelled: {}", ex.getMessage());
    return problem(
        HttpStatus.SERVICE_UNAVAILABLE, "Search cancelled", "Search did not complete in time");
  }

  @ExceptionHandler(StoreUnavailableException.class)
  ProblemDetail handleStoreUnavailable(StoreUnavailableException ex) {
    log.error("Store unavailable", ex);
    return problem(
        HttpStatus.SERVICE_UNAVAILABLE, "Store unavailable", "The item store is unavailable");
  }

  @ExceptionHandler(EmbeddingUnavailableException.class)
  ProblemDetail handleEmbeddingUnavailable(EmbeddingUnavailableException ex) {
    log.warn("Embedding unavailable: {}", ex.getMessage());
    return problem(
        HttpStatus.SERVICE_UNAVAILABLE,
        "Embedding unavailable",
        "The embedding model is unavailable");
  }

  private static ProblemDetail problem(HttpStatus status, String title, String detail) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
    problem.setTitle(title);
    return problem;
  }
}
