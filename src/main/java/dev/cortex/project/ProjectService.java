package dev.cortex.project;

import dev.cortex.item.NotFoundException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Project registry. Projects are a weak grouping: nothing here reads or writes context items.
 */
@Service
public class ProjectService {

  private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

  private final ProjectRepository repository;
  private final Validator validator;

  public ProjectService(ProjectRepository repository, Validator validator) {
    this.repository = repository;
    this.validator = validator;
  }

  /**
   * Registers a new project.
   *
   * @throws ProjectAlreadyExistsException if the id is taken, including by a concurrent create
   * @throws IllegalArgumentException if the draft fails validation
   */
  @Transactional
  public ContextProject create(ProjectDraft draft) {
    validate(draft);
    if (repository.existsById(draft.id())) {
      throw new ProjectAlreadyExistsException(draft.id());
    }
    ContextProject project = new ContextProject(draft.id(), draft.name(), draft.description());
    project.setSettings(draft.settings());
    ContextProject saved;
    try {
      saved = repository.saveAndFlush(project);
    } catch (DataIntegrityViolationException e) {
      // lost a race with a concurrent create of the same id
      throw new ProjectAlreadyExistsException(draft.id(), e);
    }
    log.info("Created project '{}'", saved.getId());
    return saved;
  }

  /**
   * Looks up an active project.
   *
   * @throws NotFoundException if absent or inactive
   */
  @Transactional(readOnly = true)
  public ContextProject get(String id) {
    return repository
        .findById(id)
        .filter(ContextProject::isActive)
        .orElseThrow(() -> notFound(id));
  }

  /** Projects in creation order. */
  @Transactional(readOnly = true)
  public List<ContextProject> list(boolean includeInactive, int limit, int offset) {
    if (limit < 0 || offset < 0) {
      throw new IllegalArgumentException(
          "limit and offset must be >= 0, got limit=%d offset=%d".formatted(limit, offset));
    }
    List<ContextProject> all =
        includeInactive
            ? repository.findAllByOrderByCreatedAtAscIdAsc()
            : repository.findByActiveTrueOrderByCreatedAtAscIdAsc();
    return all.stream().skip(offset).limit(limit).toList();
  }

  /**
   * Applies a partial update. Inactive projects can be updated, which is how they are reactivated.
   *
   * @throws NotFoundException if no project has this id
   */
  @Transactional
  public ContextProject update(String id, ProjectPatch patch) {
    validate(patch);
    ContextProject project = repository.findById(id).orElseThrow(() -> notFound(id));
    if (patch.name() != null) {
      project.setName(patch.name());
    }
    if (patch.description() != null) {
      project.setDescription(patch.description());
    }
    if (patch.settings() != null) {
      project.setSettings(patch.settings());
    }
    if (patch.active() != null) {
      project.setActive(patch.active());
    }
    return repository.save(project);
  }

  /**
   * Removes a project. Items that reference it are left untouched.
   *
   * @throws NotFoundException if no project has this id
   */
  @Transactional
  public void delete(String id) {
    if (!repository.existsById(id)) {
      throw notFound(id);
    }
    repository.deleteById(id);
    log.info("Deleted project '{}'", id);
  }

  public long countActive() {
    return repository.countByActiveTrue();
  }

  private static NotFoundException notFound(String id) {
    return new NotFoundException("Project '" + id + "' not found");
  }

  private <T> void validate(T input) {
    Set<ConstraintViolation<T>> violations = validator.validate(input);
    if (!violations.isEmpty()) {
      String messages =
          violations.stream()
              .map(v -> v.getPropertyPath() + ": " + v.getMessage())
              .sorted()
              .collect(Collectors.joining(", "));
      throw new IllegalArgumentException("Validation failed: " + messages);
    }
  }
}
