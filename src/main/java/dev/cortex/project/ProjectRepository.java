package dev.cortex.project;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link ContextProject} entities. */
public interface ProjectRepository extends JpaRepository<ContextProject, String> {

  List<ContextProject> findByActiveTrueOrderByCreatedAtAscIdAsc();

  List<ContextProject> findAllByOrderByCreatedAtAscIdAsc();

  long countByActiveTrue();
}
