package io.supplyrisk.backend.multitenancy;

import io.supplyrisk.backend.exception.ResourceConflictException;
import io.supplyrisk.backend.exception.ResourceNotFoundException;
import jakarta.persistence.EntityManager;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.query.QueryUtils;
import org.springframework.orm.jpa.vendor.HibernateJpaDialect;
import org.springframework.web.ErrorResponseException;

/**
 * Criteria-based {@link EntityStore}. Subclasses decide how an operation is scoped: which
 * precondition it has, which predicate is ANDed into every filter, and what a new row is stamped
 * with before it is persisted.
 */
abstract class JpaEntityStore<T> implements EntityStore<T> {

  private static final String ID_ATTRIBUTE = "id";

  private final EntityManager entityManager;
  private final Class<T> entityType;
  private final HibernateJpaDialect jpaDialect;

  JpaEntityStore(EntityManager entityManager, Class<T> entityType, HibernateJpaDialect jpaDialect) {
    this.entityManager = entityManager;
    this.entityType = entityType;
    this.jpaDialect = jpaDialect;
  }

  /** Runs before anything touches storage. Returns the scope key handed to the other hooks. */
  protected abstract String beginOperation(String operation);

  /** Predicate ANDed into every lookup, or null for none. */
  protected abstract Predicate scopePredicate(Root<T> root, CriteriaBuilder cb, String scope);

  /** Prepares a new row for persisting. */
  protected abstract void stamp(T entity, String scope);

  @Override
  public Class<T> entityType() {
    return entityType;
  }

  @Override
  public T create(T entity) {
    String scope = beginOperation("create");
    return execute(
        () -> {
          stamp(entity, scope);
          entityManager.persist(entity);
          entityManager.flush();
          return entity;
        });
  }

  @Override
  public List<T> createAll(List<T> entities) {
    String scope = beginOperation("createAll");
    return execute(
        () -> {
          for (T entity : entities) {
            stamp(entity, scope);
            entityManager.persist(entity);
          }
          entityManager.flush();
          return entities;
        });
  }

  @Override
  public Optional<T> findById(UUID id) {
    String scope = beginOperation("findById");
    return execute(() -> selectFirst(byId(id), scope));
  }

  @Override
  public T getById(UUID id) {
    return findById(id)
        .orElseThrow(() -> new ResourceNotFoundException(entityType.getSimpleName(), id));
  }

  @Override
  public Optional<T> findFirst(Specification<T> filter) {
    String scope = beginOperation("findFirst");
    return execute(() -> selectFirst(filter, scope));
  }

  @Override
  public List<T> findAll(Specification<T> filter) {
    return findAll(filter, Sort.unsorted());
  }

  @Override
  public List<T> findAll(Specification<T> filter, Sort sort) {
    String scope = beginOperation("findAll");
    return execute(() -> select(filter, sort, scope, -1));
  }

  @Override
  public long count(Specification<T> filter) {
    String scope = beginOperation("count");
    return execute(
        () -> {
          CriteriaBuilder cb = entityManager.getCriteriaBuilder();
          CriteriaQuery<Long> query = cb.createQuery(Long.class);
          Root<T> root = query.from(entityType);
          query.select(cb.count(root)).where(where(root, query, cb, filter, scope));
          return entityManager.createQuery(query).getSingleResult();
        });
  }

  @Override
  public boolean exists(Specification<T> filter) {
    return count(filter) > 0;
  }

  @Override
  public <K> Map<K, Long> countBy(String attribute, Class<K> keyType, Specification<T> filter) {
    String scope = beginOperation("countBy");
    return execute(
        () -> {
          CriteriaBuilder cb = entityManager.getCriteriaBuilder();
          CriteriaQuery<Object[]> query = cb.createQuery(Object[].class);
          Root<T> root = query.from(entityType);
          Path<K> key = root.get(attribute);
          query
              .multiselect(key, cb.count(root))
              .where(where(root, query, cb, filter, scope))
              .groupBy(key);
          Map<K, Long> counts = new LinkedHashMap<>();
          for (Object[] row : entityManager.createQuery(query).getResultList()) {
            counts.put(keyType.cast(row[0]), (Long) row[1]);
          }
          return counts;
        });
  }

  @Override
  public long sum(String attribute, Specification<T> filter) {
    String scope = beginOperation("sum");
    return execute(
        () -> {
          CriteriaBuilder cb = entityManager.getCriteriaBuilder();
          CriteriaQuery<Long> query = cb.createQuery(Long.class);
          Root<T> root = query.from(entityType);
          query
              .select(cb.sumAsLong(root.get(attribute)))
              .where(where(root, query, cb, filter, scope));
          Long total = entityManager.createQuery(query).getSingleResult();
          return total != null ? total : 0L;
        });
  }

  @Override
  public T update(UUID id, Consumer<T> mutator) {
    String scope = beginOperation("update");
    return execute(
        () -> {
          T entity =
              selectFirst(byId(id), scope)
                  .orElseThrow(
                      () -> new ResourceNotFoundException(entityType.getSimpleName(), id));
          mutator.accept(entity);
          entityManager.flush();
          return entity;
        });
  }

  @Override
  public int updateAll(Specification<T> filter, Consumer<T> mutator) {
    String scope = beginOperation("updateAll");
    return execute(
        () -> {
          List<T> matches = select(filter, Sort.unsorted(), scope, -1);
          matches.forEach(mutator);
          entityManager.flush();
          return matches.size();
        });
  }

  @Override
  public T upsert(Specification<T> filter, Supplier<T> creator, Consumer<T> mutator) {
    String scope = beginOperation("upsert");
    return execute(
        () -> {
          Optional<T> existing = selectFirst(filter, scope);
          T entity;
          if (existing.isPresent()) {
            entity = existing.get();
            mutator.accept(entity);
          } else {
            entity = creator.get();
            stamp(entity, scope);
            entityManager.persist(entity);
          }
          entityManager.flush();
          return entity;
        });
  }

  @Override
  public void deleteById(UUID id) {
    String scope = beginOperation("deleteById");
    execute(
        () -> {
          T entity =
              selectFirst(byId(id), scope)
                  .orElseThrow(
                      () -> new ResourceNotFoundException(entityType.getSimpleName(), id));
          entityManager.remove(entity);
          entityManager.flush();
          return null;
        });
  }

  @Override
  public int deleteAll(Specification<T> filter) {
    String scope = beginOperation("deleteAll");
    return execute(
        () -> {
          List<T> matches = select(filter, Sort.unsorted(), scope, -1);
          matches.forEach(entityManager::remove);
          entityManager.flush();
          return matches.size();
        });
  }

  private Specification<T> byId(UUID id) {
    return (root, query, cb) -> cb.equal(root.get(ID_ATTRIBUTE), id);
  }

  private Optional<T> selectFirst(Specification<T> filter, String scope) {
    return select(filter, Sort.unsorted(), scope, 1).stream().findFirst();
  }

  private List<T> select(Specification<T> filter, Sort sort, String scope, int limit) {
    CriteriaBuilder cb = entityManager.getCriteriaBuilder();
    CriteriaQuery<T> query = cb.createQuery(entityType);
    Root<T> root = query.from(entityType);
    query.select(root).where(where(root, query, cb, filter, scope));
    if (sort.isSorted()) {
      query.orderBy(QueryUtils.toOrders(sort, root, cb));
    }
    var typed = entityManager.createQuery(query);
    if (limit > 0) {
      typed.setMaxResults(limit);
    }
    return typed.getResultList();
  }

  private Predicate[] where(
      Root<T> root,
      CriteriaQuery<?> query,
      CriteriaBuilder cb,
      Specification<T> filter,
      String scope) {
    List<Predicate> predicates = new ArrayList<>(2);
    Predicate scoped = scopePredicate(root, cb, scope);
    if (scoped != null) {
      predicates.add(scoped);
    }
    if (filter != null) {
      Predicate requested = filter.toPredicate(root, query, cb);
      if (requested != null) {
        predicates.add(requested);
      }
    }
    return predicates.toArray(Predicate[]::new);
  }

  private <R> R execute(Supplier<R> work) {
    try {
      return work.get();
    } catch (ErrorResponseException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      DataAccessException translated = jpaDialect.translateExceptionIfPossible(ex);
      if (translated instanceof DataIntegrityViolationException violation) {
        throw ResourceConflictException.fromViolation(entityType.getSimpleName(), violation);
      }
      throw translated != null ? translated : ex;
    }
  }
}
