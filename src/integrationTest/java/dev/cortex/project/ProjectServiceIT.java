package dev.cortex.project;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.cortex.BaseIntegrationTest;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;

class ProjectServiceIT extends BaseIntegrationTest {

  @Autowired ProjectService projectService;

  @Autowired ProjectRepository projectRepository;

  @Test
  void createPersistsProjectWithTimestamps() {
    projectService.create(new ProjectDraft("lang", "Languages", "notes", Map.of("color", "red")));

    ContextProject stored = projectService.get("lang");
    assertThat(stored.getName()).isEqualTo("Languages");
    assertThat(stored.getSettings()).containsEntry("color", "red");
    assertThat(stored.getCreatedAt()).isNotNull();
  }

  @Test
  void secondInsertOfTakenIdHitsPrimaryKeyInsteadOfOverwriting() {
    projectService.create(new ProjectDraft("lang", "Languages", null, null));

    assertThatThrownBy(
            () -> projectRepository.saveAndFlush(new ContextProject("lang", "Impostor", null)))
        .isInstanceOf(DataIntegrityViolationException.class);
    assertThat(projectService.get("lang").getName()).isEqualTo("Languages");
  }

  @Test
  void duplicateCreateIsReportedAsConflict() {
    projectService.create(new ProjectDraft("lang", "Languages", null, null));

    assertThatThrownBy(() -> projectService.create(new ProjectDraft("lang", "Other", null, null)))
        .isInstanceOf(ProjectAlreadyExistsException.class);
  }
}
