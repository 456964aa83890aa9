package dev.cortex.store;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Spring Data repository for {@link ContextItemEntity} rows.
 *
 * <p>The {@code findByIdGreaterThan...} methods are keyset pages over the primary key used by the
 * lazy scan: each call returns the next {@code pageable.getPageSize()} rows after {@code afterId}.
 */
public interface ContextItemRepository extends JpaRepository<ContextItemEntity, Long> {

  @Query(value = "SELECT nextval('context_item_id_seq')", nativeQuery = true)
  long nextId();

  /** Loads a row and locks it until the surrounding transaction ends. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT c FROM ContextItemEntity c WHERE c.id = :id")
  Optional<ContextItemEntity> findByIdForUpdate(@Param("id") long id);

  List<ContextItemEntity> findByIdGreaterThanOrderByIdAsc(long afterId, Pageable pageable);

  List<ContextItemEntity> findByIdGreaterThanAndActiveTrueOrderByIdAsc(
      long afterId, Pageable pageable);

  List<ContextItemEntity> findByIdGreaterThanAndProjectIdOrderByIdAsc(
      long afterId, String projectId, Pageable pageable);

  List<ContextItemEntity> findByIdGreaterThanAndActiveTrueAndProjectIdOrderByIdAsc(
      long afterId, String projectId, Pageable pageable);
}
