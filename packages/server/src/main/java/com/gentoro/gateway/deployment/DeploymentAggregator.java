package com.gentoro.gateway.deployment;

import com.gentoro.gateway.deployment.model.DeploymentListing;
import com.gentoro.gateway.deployment.model.DeploymentPage;
import com.gentoro.gateway.deployment.model.TenantDeployments;
import com.gentoro.gateway.exception.ErrorDetails;
import com.gentoro.gateway.exception.ExceptionUtil;
import com.gentoro.gateway.tenancy.TenantScope;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.commons.configuration2.Configuration;

/**
 * Lists deployments of every tenant in a scope.
 *
 * <p>Tenants are queried in parallel on a bounded pool. A tenant whose credentials, token or
 * listing fails is left out of the result; the others are returned in scope order. The total count
 * is the sum of the upstream-reported counts.
 */
public class DeploymentAggregator implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.gateway.logging.LoggingService.getLogger(DeploymentAggregator.class);
  public static final int DEFAULT_PARALLELISM = 8;

  private final AiCoreClient client;
  private final ExecutorService executor;

  public DeploymentAggregator(AiCoreClient client, int parallelism) {
    this.client = client;
    this.executor =
        Executors.newFixedThreadPool(
            parallelism > 0 ? parallelism : DEFAULT_PARALLELISM, new AggregatorThreadFactory());
  }

  public DeploymentAggregator(AiCoreClient client, Configuration configuration) {
    this(client, configuration.getInt("gateway.aggregation.parallelism", DEFAULT_PARALLELISM));
  }

  public DeploymentListing listDeployments(TenantScope scope) {
    List<String> tenants = scope.tenants();
    List<CompletableFuture<Optional<DeploymentPage>>> branches = new ArrayList<>();
    for (String tenant : tenants) {
      branches.add(CompletableFuture.supplyAsync(() -> listTenant(tenant), executor));
    }

    int count = 0;
    List<TenantDeployments> result = new ArrayList<>();
    for (int i = 0; i < branches.size(); i++) {
      Optional<DeploymentPage> page = branches.get(i).join();
      if (page.isPresent()) {
        result.add(new TenantDeployments(tenants.get(i), page.get().resources()));
        count += page.get().count();
      }
    }
    log.debug(
        "Aggregated {} deployment(s) from {} of {} tenant(s)", count, result.size(), scope.size());
    return new DeploymentListing(count, result);
  }

  private Optional<DeploymentPage> listTenant(String tenant) {
    try {
      return Optional.of(client.listDeployments(tenant));
    } catch (RuntimeException e) {
      ErrorDetails details = ExceptionUtil.toErrorDetails(e);
      log.warn("Skipping tenant {}: [{}] {}", tenant, details.code, details.message);
      log.debug("Tenant {} failure trace: {}", tenant, ExceptionUtil.formatCompactStackTrace(e));
      return Optional.empty();
    }
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }

  private static final class AggregatorThreadFactory implements ThreadFactory {
    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(Runnable runnable) {
      Thread thread = new Thread(runnable, "deployment-aggregator-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
