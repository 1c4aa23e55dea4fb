package io.supplyrisk.backend.multitenancy;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

/**
 * The single entry point from services to storage for one entity type. Services never see the
 * {@code EntityManager}; they receive a store from {@link EntityStores}, which decides whether the
 * store is tenant-scoped.
 *
 * <p>A {@code null} filter means "no additional predicate". Writes flush immediately, so constraint
 * violations surface at the call that caused them as {@code ResourceConflictException}.
 */
public interface EntityStore<T> {

  Class<T> entityType();

  T create(T entity);

  List<T> createAll(List<T> entities);

  Optional<T> findById(UUID id);

  /** Like {@link #findById} but throws {@code ResourceNotFoundException} when absent. */
  T getById(UUID id);

  Optional<T> findFirst(Specification<T> filter);

  List<T> findAll(Specification<T> filter);

  List<T> findAll(Specification<T> filter, Sort sort);

  long count(Specification<T> filter);

  boolean exists(Specification<T> filter);

  /** Row counts grouped by the values of {@code attribute}. */
  <K> Map<K, Long> countBy(String attribute, Class<K> keyType, Specification<T> filter);

  /** Sum of a numeric {@code attribute}; zero when no rows match. */
  long sum(String attribute, Specification<T> filter);

  /** Applies {@code mutator} to the row with {@code id}; not-found when it is not visible. */
  T update(UUID id, Consumer<T> mutator);

  /** Applies {@code mutator} to every matching row and returns how many were changed. */
  int updateAll(Specification<T> filter, Consumer<T> mutator);

  /** Updates the first match of {@code filter}, or creates the row {@code creator} supplies. */
  T upsert(Specification<T> filter, Supplier<T> creator, Consumer<T> mutator);

  /** Removes the row with {@code id}; throws not-found when it is not visible. */
  void deleteById(UUID id);

  /** Removes every matching row and returns how many were removed. */
  int deleteAll(Specification<T> filter);
}
