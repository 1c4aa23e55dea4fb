package io.supplyrisk.backend.multitenancy;

import io.supplyrisk.backend.exception.MissingTenantContextException;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Holds the tenant on whose behalf the current request executes. Bound per thread, so concurrent
 * requests served by different threads never observe each other's tenant.
 *
 * <p>Prefer the scoped forms ({@link #open}, {@link #runWithTenant}, {@link #callWithTenant}):
 * they restore whatever tenant was active before, on every exit path.
 */
public final class TenantContext {

  private static final ThreadLocal<String> CURRENT_TENANT = new ThreadLocal<>();

  private TenantContext() {}

  public static void setActiveTenant(String tenantId) {
    CURRENT_TENANT.set(validate(tenantId));
  }

  public static Optional<String> getActiveTenant() {
    return Optional.ofNullable(CURRENT_TENANT.get());
  }

  public static void clearActiveTenant() {
    CURRENT_TENANT.remove();
  }

  /** Returns the active tenant. Throws if none is bound. */
  public static String requireActiveTenant() {
    String tenantId = CURRENT_TENANT.get();
    if (tenantId == null) {
      throw new MissingTenantContextException();
    }
    return tenantId;
  }

  /**
   * Binds {@code tenantId} until the returned scope is closed, then restores the previously bound
   * tenant (or clears the slot if there was none).
   */
  public static Scope open(String tenantId) {
    String previous = CURRENT_TENANT.get();
    CURRENT_TENANT.set(validate(tenantId));
    return new Scope(previous);
  }

  public static void runWithTenant(String tenantId, Runnable action) {
    try (var ignored = open(tenantId)) {
      action.run();
    }
  }

  public static <T> T callWithTenant(String tenantId, Supplier<T> action) {
    try (var ignored = open(tenantId)) {
      return action.get();
    }
  }

  private static String validate(String tenantId) {
    if (tenantId == null || tenantId.isBlank()) {
      throw new IllegalArgumentException("Tenant id must not be blank");
    }
    return tenantId;
  }

  /** Restores the tenant that was active when the scope was opened. */
  public static final class Scope implements AutoCloseable {

    private final String previous;
    private boolean closed;

    private Scope(String previous) {
      this.previous = previous;
    }

    @Override
    public void close() {
      if (closed) {
        return;
      }
      closed = true;
      if (previous != null) {
        CURRENT_TENANT.set(previous);
      } else {
        CURRENT_TENANT.remove();
      }
    }
  }
}
