package io.b2mash.b2b.tenantcore.migration;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal for a tenant batch. Once cancelled, no further tenant is started; tenants
 * already in flight run to completion.
 */
public final class BatchCancellation {

  private final AtomicBoolean cancelled = new AtomicBoolean();

  public static BatchCancellation create() {
    return new BatchCancellation();
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
