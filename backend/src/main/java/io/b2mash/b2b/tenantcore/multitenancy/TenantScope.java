package io.b2mash.b2b.tenantcore.multitenancy;

import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.MDC;

/**
 * Per-unit-of-work tenant binding. Bound by {@code TenantFilter} for requests and by batch workers
 * for each tenant they process.
 *
 * <p>A unit of work is one thread between {@link #bind} and {@link Binding#close()}. The binding is
 * set once: binding again while bound fails, and it is never inherited by threads started from the
 * bound one.
 */
public final class TenantScope {

  static final String MDC_TENANT_ID = "tenantId";
  static final String MDC_TENANT_SCHEMA = "tenantSchema";

  private static final ThreadLocal<TenantContext> CURRENT = new ThreadLocal<>();

  private TenantScope() {}

  public static Binding setTenant(UUID tenantId, SchemaName schemaName, String slug) {
    return bind(new TenantContext(tenantId, schemaName, slug));
  }

  public static Binding bind(TenantContext context) {
    if (context == null) {
      throw new IllegalArgumentException("Tenant context must not be null");
    }
    TenantContext existing = CURRENT.get();
    if (existing != null) {
      throw new ContextMisuseException(
          "Tenant context already bound to "
              + existing.slug()
              + "; cannot bind "
              + context.slug()
              + " in the same unit of work");
    }
    CURRENT.set(context);
    MDC.put(MDC_TENANT_ID, context.tenantId().toString());
    MDC.put(MDC_TENANT_SCHEMA, context.schemaName().value());
    return new Binding(context);
  }

  public static Optional<TenantContext> current() {
    return Optional.ofNullable(CURRENT.get());
  }

  /** Returns the bound context. Throws if nothing is bound for this unit of work. */
  public static TenantContext require() {
    TenantContext context = CURRENT.get();
    if (context == null) {
      throw new ContextMisuseException(
          "No tenant context bound for this unit of work; tenant-scoped access is not allowed");
    }
    return context;
  }

  public static boolean isBound() {
    return CURRENT.get() != null;
  }

  public static void runWith(TenantContext context, Runnable action) {
    try (Binding ignored = bind(context)) {
      action.run();
    }
  }

  public static <T> T callWith(TenantContext context, Supplier<T> action) {
    try (Binding ignored = bind(context)) {
      return action.get();
    }
  }

  /** Ends the unit of work it was returned for. Closing twice is a no-op. */
  public static final class Binding implements AutoCloseable {

    private final TenantContext context;
    private boolean closed;

    private Binding(TenantContext context) {
      this.context = context;
    }

    public TenantContext context() {
      return context;
    }

    @Override
    public void close() {
      if (closed) {
        return;
      }
      closed = true;
      if (CURRENT.get() == context) {
        CURRENT.remove();
        MDC.remove(MDC_TENANT_ID);
        MDC.remove(MDC_TENANT_SCHEMA);
      }
    }
  }
}
