package dev.cortex.api;

import dev.cortex.project.ContextProject;
import dev.cortex.project.ProjectService;
import java.net.URI;
import java.util.List;
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

/** REST adapter for the project registry. */
@RestController
@RequestMapping("/api/projects")
public class ProjectController {

  private final ProjectService projectService;

  public ProjectController(ProjectService projectService) {
    this.projectService = projectService;
  }

  @PostMapping
  public ResponseEntity<ProjectResponse> create(@RequestBody ProjectRequest request) {
    ContextProject created = projectService.create(request.toDraft());
    return ResponseEntity.created(URI.create("/api/projects/" + created.getId()))
        .body(ProjectResponse.from(created));
  }

  @GetMapping("/{id}")
  public ProjectResponse get(@PathVariable String id) {
    return ProjectResponse.from(projectService.get(id));
  }

  @GetMapping
  public List<ProjectResponse> list(
      @RequestParam(name = "include_inactive", defaultValue = "false") boolean includeInactive,
      @RequestParam(name = "limit", defaultValue = "50") int limit,
      @RequestParam(name = "offset", defaultValue = "0") int offset) {
    return projectService.list(includeInactive, limit, offset).stream()
        .map(ProjectResponse::from)
        .toList();
  }

  @PutMapping("/{id}")
  public ProjectResponse update(@PathVariable String id, @RequestBody ProjectRequest request) {
    return ProjectResponse.from(projectService.update(id, request.toPatch()));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable String id) {
    projectService.delete(id);
    return ResponseEntity.noContent().build();
  }
}
