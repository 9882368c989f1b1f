package io.b2mash.b2b.tenantcore.migration;

import io.b2mash.b2b.tenantcore.multitenancy.TenantContext;
import io.b2mash.b2b.tenantcore.multitenancy.TenantDescriptor;
import io.b2mash.b2b.tenantcore.multitenancy.TenantScope;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one task per tenant with bounded parallelism. Each task runs on a worker thread with its
 * own {@link TenantScope} binding; a failing tenant is recorded and never stops its siblings.
 */
public class TenantBatchExecutor {

  private static final Logger log = LoggerFactory.getLogger(TenantBatchExecutor.class);

  private final int parallelism;

  public TenantBatchExecutor(int parallelism) {
    if (parallelism < 1) {
      throw new IllegalArgumentException("Parallelism must be at least 1: " + parallelism);
    }
    this.parallelism = parallelism;
  }

  public int getParallelism() {
    return parallelism;
  }

  /** Work done for one tenant inside its bound unit of work. */
  @FunctionalInterface
  public interface TenantTask<R> {
    R execute(TenantContext tenant) throws Exception;
  }

  /** Result for one tenant: either {@code result} or {@code error} is set. */
  public record TenantOutcome<R>(TenantDescriptor tenant, R result, Exception error) {

    public boolean succeeded() {
      return error == null;
    }
  }

  /** Outcomes in tenant order, plus tenants never started because the batch was cancelled. */
  public record BatchOutcome<R>(List<TenantOutcome<R>> outcomes, List<TenantDescriptor> skipped) {}

  public <R> BatchOutcome<R> run(
      String batchName,
      List<TenantDescriptor> tenants,
      TenantTask<R> task,
      BatchCancellation cancellation) {
    if (tenants.isEmpty()) {
      return new BatchOutcome<>(List.of(), List.of());
    }

    int workers = Math.min(parallelism, tenants.size());
    ExecutorService executor = Executors.newFixedThreadPool(workers, threadFactory(batchName));
    Semaphore permits = new Semaphore(workers);
    List<Future<TenantOutcome<R>>> futures = new ArrayList<>();
    List<TenantDescriptor> skipped = new ArrayList<>();

    try {
      for (int i = 0; i < tenants.size(); i++) {
        TenantDescriptor tenant = tenants.get(i);
        if (!acquire(permits) || cancellation.isCancelled()) {
          skipped.addAll(tenants.subList(i, tenants.size()));
          log.warn(
              "{} cancelled, {} of {} tenants not started",
              batchName,
              skipped.size(),
              tenants.size());
          break;
        }
        futures.add(
            executor.submit(
                () -> {
                  try {
                    return runForTenant(batchName, tenant, task);
                  } finally {
                    permits.release();
                  }
                }));
      }
      return new BatchOutcome<>(collect(futures), List.copyOf(skipped));
    } finally {
      executor.shutdown();
    }
  }

  private <R> TenantOutcome<R> runForTenant(
      String batchName, TenantDescriptor tenant, TenantTask<R> task) {
    TenantContext context = tenant.toContext();
    try (TenantScope.Binding ignored = TenantScope.bind(context)) {
      R result = task.execute(context);
      return new TenantOutcome<>(tenant, result, null);
    } catch (Exception e) {
      log.error(
          "{} failed for tenant {} (schema {})", batchName, tenant.slug(), tenant.schemaName(), e);
      return new TenantOutcome<>(tenant, null, e);
    }
  }

  private static boolean acquire(Semaphore permits) {
    try {
      permits.acquire();
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static <R> List<TenantOutcome<R>> collect(List<Future<TenantOutcome<R>>> futures) {
    List<TenantOutcome<R>> outcomes = new ArrayList<>(futures.size());
    boolean interrupted = false;
    for (Future<TenantOutcome<R>> future : futures) {
      while (true) {
        try {
          outcomes.add(future.get());
          break;
        } catch (InterruptedException e) {
          // in-flight tenants always finish; remember the interrupt and keep waiting
          interrupted = true;
        } catch (ExecutionException e) {
          Throwable cause = e.getCause();
          if (cause instanceof Error error) {
            throw error;
          }
          throw new IllegalStateException("Tenant task escaped its error handling", cause);
        }
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
    return outcomes;
  }

  private static ThreadFactory threadFactory(String batchName) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, batchName + "-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
