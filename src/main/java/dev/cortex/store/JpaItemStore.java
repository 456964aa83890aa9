package dev.cortex.store;

import dev.cortex.item.ContextItem;
import dev.cortex.item.ItemCriteria;
import dev.cortex.item.ItemStore;
import dev.cortex.item.StaleItemException;
import dev.cortex.item.StoreUnavailableException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * PostgreSQL-backed {@link ItemStore}.
 *
 * <p>Upserts run in their own transaction: the row is locked with {@code SELECT ... FOR UPDATE},
 * its version compared with the caller's, then content, vector and version are written in one
 * UPDATE. The lock is held only for that transaction; embedding never happens here.
 *
 * <p>Scans are keyset-paged over the primary key, pushing the project and activity filters down to
 * SQL. Content type and tag filters are left to the caller.
 */
@Repository
public class JpaItemStore implements ItemStore {

  private static final Logger log = LoggerFactory.getLogger(JpaItemStore.class);

  private final ContextItemRepository repository;
  private final TransactionTemplate transactionTemplate;
  private final int pageSize;

  public JpaItemStore(
      ContextItemRepository repository,
      PlatformTransactionManager transactionManager,
      @Value("${cortex.store.page-size:256}") int pageSize) {
    if (pageSize < 1) {
      throw new IllegalStateException("cortex.store.page-size must be positive, got: " + pageSize);
    }
    this.repository = repository;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.pageSize = pageSize;
  }

  @Override
  public Optional<ContextItem> get(long id) {
    return translate(() -> repository.findById(id).map(ContextItemEntity::toDomain));
  }

  @Override
  public Iterable<ContextItem> scan(ItemCriteria criteria) {
    return () -> new KeysetIterator(criteria);
  }

  @Override
  public ContextItem upsert(ContextItem item) {
    return translate(
        () -> transactionTemplate.execute(status -> upsertLocked(item)));
  }

  private ContextItem upsertLocked(ContextItem item) {
    Optional<ContextItemEntity> existing = repository.findByIdForUpdate(item.id());
    long storedVersion = item.version() + 1;
    ContextItemEntity entity;
    if (existing.isEmpty()) {
      if (item.version() != 0) {
        throw new StaleItemException(item.id(), item.version());
      }
      entity = ContextItemEntity.newRow(item, storedVersion);
    } else {
      entity = existing.get();
      if (entity.getVersion() != item.version()) {
        throw new StaleItemException(item.id(), item.version());
      }
      entity.copyFrom(item, storedVersion);
    }
    return repository.saveAndFlush(entity).toDomain();
  }

  @Override
  public long nextId() {
    return translate(repository::nextId);
  }

  @Override
  public boolean delete(long id) {
    return translate(
        () ->
            Boolean.TRUE.equals(
                transactionTemplate.execute(
                    status -> {
                      Optional<ContextItemEntity> existing = repository.findByIdForUpdate(id);
                      existing.ifPresent(repository::delete);
                      return existing.isPresent();
                    })));
  }

  private List<ContextItemEntity> fetchPage(ItemCriteria criteria, long afterId) {
    Pageable page = PageRequest.of(0, pageSize);
    String projectId = criteria.projectId();
    if (projectId == null) {
      return criteria.includeInactive()
          ? repository.findByIdGreaterThanOrderByIdAsc(afterId, page)
          : repository.findByIdGreaterThanAndActiveTrueOrderByIdAsc(afterId, page);
    }
    return criteria.includeInactive()
        ? repository.findByIdGreaterThanAndProjectIdOrderByIdAsc(afterId, projectId, page)
        : repository.findByIdGreaterThanAndActiveTrueAndProjectIdOrderByIdAsc(
            afterId, projectId, page);
  }

  private static <T> T translate(Supplier<T> call) {
    try {
      return call.get();
    } catch (DataAccessException | TransactionException e) {
      log.error("Item store failure: {}", e.getMessage());
      throw new StoreUnavailableException("Item store unavailable: " + e.getMessage(), e);
    }
  }

  /** Walks the table one keyset page at a time; a new page is fetched only when needed. */
  private final class KeysetIterator implements Iterator<ContextItem> {

    private final ItemCriteria criteria;
    private Iterator<ContextItemEntity> page = List.<ContextItemEntity>of().iterator();
    private long lastId = 0;
    private boolean exhausted;

    KeysetIterator(ItemCriteria criteria) {
      this.criteria = criteria;
    }

    @Override
    public boolean hasNext() {
      if (page.hasNext()) {
        return true;
      }
      if (exhausted) {
        return false;
      }
      List<ContextItemEntity> rows = translate(() -> fetchPage(criteria, lastId));
      if (rows.size() < pageSize) {
        exhausted = true;
      }
      page = rows.iterator();
      return page.hasNext();
    }

    @Override
    public ContextItem next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      ContextItemEntity row = page.next();
      lastId = row.getId();
      return row.toDomain();
    }
  }
}
