package com.pld.mft.catalog.service;

import com.pld.mft.catalog.exception.ReferentialIntegrityViolationException;
import com.pld.mft.catalog.exception.RowNotFoundException;
import com.pld.mft.catalog.exception.SchemaViolations;
import com.pld.mft.catalog.exception.UniquenessViolationException;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Create, update and delete for one table, with the schema's key, domain and foreign-key rules
 * checked inside the same transaction as the write.
 *
 * <p>Deletes are restricted: a row still referenced from another table is never removed, and
 * nothing cascades. Rules the database also enforces are checked here first. A database rejection
 * that still gets through (a concurrent writer, say) is translated by {@link SchemaViolations}.
 *
 * @param <E> entity type
 * @param <ID> primary key type, a String or an embedded composite key
 */
@Slf4j
public abstract class ConstrainedTableService<E, ID> {

  private final JpaRepository<E, ID> repository;
  private final String table;

  protected ConstrainedTableService(JpaRepository<E, ID> repository, String table) {
    this.repository = repository;
    this.table = table;
  }

  public String table() {
    return table;
  }

  @Transactional(readOnly = true)
  public Optional<E> find(ID id) {
    return repository.findById(id);
  }

  @Transactional(readOnly = true)
  public E get(ID id) {
    return repository.findById(id).orElseThrow(() -> new RowNotFoundException(table, describe(id)));
  }

  @Transactional(readOnly = true)
  public List<E> findAll() {
    return repository.findAll();
  }

  @Transactional(readOnly = true)
  public long count() {
    return repository.count();
  }

  @Transactional(readOnly = true)
  public boolean exists(ID id) {
    return id != null && repository.existsById(id);
  }

  @Transactional
  public E create(E row) {
    applyDefaults(row);
    ID id = idOf(row);
    checkKey(id);
    if (repository.existsById(id)) {
      log.warn("Rejected insert into {}: key {} already present", table, describe(id));
      throw new UniquenessViolationException(table, describe(id));
    }
    enforceConstraints(row);
    E saved = persist(row);
    log.debug("Inserted {} row {}", table, describe(id));
    return saved;
  }

  @Transactional
  public E update(E row) {
    ID id = idOf(row);
    if (id == null || !repository.existsById(id)) {
      throw new RowNotFoundException(table, describe(id));
    }
    enforceConstraints(row);
    E saved = persist(row);
    log.debug("Updated {} row {}", table, describe(id));
    return saved;
  }

  @Transactional
  public void delete(ID id) {
    E row = get(id);
    List<String> referencing = referencingTables(id);
    if (!referencing.isEmpty()) {
      log.warn(
          "Rejected delete from {}: {} still referenced from {}", table, describe(id), referencing);
      throw ReferentialIntegrityViolationException.stillReferenced(
          table, describe(id), referencing);
    }
    try {
      repository.delete(row);
      repository.flush();
    } catch (DataIntegrityViolationException e) {
      throw SchemaViolations.translate(table, e);
    }
    log.debug("Deleted {} row {}", table, describe(id));
  }

  protected abstract ID idOf(E row);

  /** Rejects a null or malformed key with a domain violation. */
  protected abstract void checkKey(ID id);

  /**
   * Checks (and normalizes, e.g. decimal scale) every non-key column and foreign key. Runs on both
   * insert and update.
   */
  protected abstract void enforceConstraints(E row);

  /** Fills generated values before an insert; the key among them when the caller left it empty. */
  protected void applyDefaults(E row) {}

  /** Tables holding at least one row that references {@code id}. */
  protected List<String> referencingTables(ID id) {
    return List.of();
  }

  protected String describe(ID id) {
    return String.valueOf(id);
  }

  private E persist(E row) {
    try {
      return repository.saveAndFlush(row);
    } catch (DataIntegrityViolationException e) {
      log.warn("Database rejected write to {}: {}", table, e.getMostSpecificCause().getMessage());
      throw SchemaViolations.translate(table, e);
    }
  }
}
