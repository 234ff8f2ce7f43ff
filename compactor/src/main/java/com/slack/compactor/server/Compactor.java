package com.slack.compactor.server;

import com.google.common.annotations.VisibleForTesting;
import com.slack.compactor.backoff.BackoffConfig;
import com.slack.compactor.backoff.RetryAbortedException;
import com.slack.compactor.config.CompactorConfig;
import com.slack.compactor.config.CompactorRuntimeConfig;
import com.slack.compactor.metadata.catalog.Catalog;
import com.slack.compactor.metadata.catalog.ZookeeperCatalog;
import com.slack.compactor.metadata.core.CuratorBuilder;
import com.slack.compactor.proto.config.CompactorConfigs;
import com.slack.compactor.resolver.MissingCatalogRecordException;
import com.slack.compactor.resolver.ShardIdResolver;
import com.slack.compactor.util.FatalErrorHandler;
import com.slack.compactor.util.RuntimeHalterImpl;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.binder.jvm.ClassLoaderMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import java.nio.file.Path;
import java.util.Optional;
import org.apache.curator.x.async.AsyncCuratorFramework;
import org.apache.logging.log4j.LogManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main class of the compactor. Loads the config, connects to the catalog and resolves the shard
 * this process owns before anything else starts.
 *
 * <p>A topic or shard missing from the catalog is an operator error. It is reported to the {@link
 * FatalErrorHandler}, which stops the process in production.
 */
public class Compactor {
  private static final Logger LOG = LoggerFactory.getLogger(Compactor.class);

  private final CompactorConfigs.CompactorConfig compactorConfig;
  private final MeterRegistry meterRegistry;
  private final FatalErrorHandler fatalErrorHandler;
  protected AsyncCuratorFramework curatorFramework;
  private volatile CompactorRuntimeConfig runtimeConfig;

  @VisibleForTesting
  Compactor(
      CompactorConfigs.CompactorConfig compactorConfig,
      MeterRegistry meterRegistry,
      FatalErrorHandler fatalErrorHandler) {
    this.compactorConfig = compactorConfig;
    this.meterRegistry = meterRegistry;
    this.fatalErrorHandler = fatalErrorHandler;
    Metrics.addRegistry(meterRegistry);
    LOG.info("Started compactor process with config: {}", compactorConfig);
  }

  Compactor(
      CompactorConfigs.CompactorConfig compactorConfig,
      PrometheusMeterRegistry prometheusMeterRegistry) {
    this(compactorConfig, prometheusMeterRegistry, new RuntimeHalterImpl());
  }

  public static void main(String[] args) throws Exception {
    if (args.length == 0) {
      throw new IllegalArgumentException("Config file is needed as the first argument");
    }
    Path configFilePath = Path.of(args[0]);

    CompactorConfigs.CompactorConfig config = CompactorConfig.fromFile(configFilePath);
    Compactor compactor = new Compactor(config, initPrometheusMeterRegistry(config));
    compactor.start();
  }

  static PrometheusMeterRegistry initPrometheusMeterRegistry(
      CompactorConfigs.CompactorConfig config) {
    PrometheusMeterRegistry prometheusMeterRegistry =
        new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    prometheusMeterRegistry
        .config()
        .commonTags(
            "compactor_cluster_name",
            config.getClusterConfig().getClusterName(),
            "compactor_env",
            config.getClusterConfig().getEnv(),
            "compactor_component",
            "compactor");
    return prometheusMeterRegistry;
  }

  public void start() {
    setupSystemMetrics(meterRegistry);
    addShutdownHook();

    curatorFramework = CuratorBuilder.build(meterRegistry, compactorConfig.getZookeeperConfig());
    Catalog catalog =
        new ZookeeperCatalog(curatorFramework, compactorConfig.getZookeeperConfig(), meterRegistry);
    bootstrap(catalog);
  }

  /**
   * Resolve the shard id and build the runtime config. The runtime config is only published once
   * both are done, a failure leaves it unset.
   */
  @VisibleForTesting
  void bootstrap(Catalog catalog) {
    try {
      long shardId =
          ShardIdResolver.fetchShardId(
              catalog,
              BackoffConfig.fromConfig(compactorConfig.getBackoffConfig()),
              meterRegistry,
              compactorConfig.getTopicName(),
              compactorConfig.getShardIndex());
      runtimeConfig = CompactorRuntimeConfig.fromConfig(shardId, compactorConfig);
      LOG.info("Compactor bootstrapped with runtime config: {}", runtimeConfig);
    } catch (MissingCatalogRecordException e) {
      LOG.error("Compactor is not configured for a valid topic and shard: {}", e.getMessage());
      fatalErrorHandler.handleFatal(e);
    } catch (RetryAbortedException e) {
      LOG.error("Gave up resolving the compactor shard: {}", e.getMessage());
      fatalErrorHandler.handleFatal(e);
    } catch (IllegalArgumentException e) {
      LOG.error("Compactor config is invalid: {}", e.getMessage());
      fatalErrorHandler.handleFatal(e);
    }
  }

  public Optional<CompactorRuntimeConfig> getRuntimeConfig() {
    return Optional.ofNullable(runtimeConfig);
  }

  private void addShutdownHook() {
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  shutdown();
                  LOG.info("Shutting down LogManager");
                  LogManager.shutdown();
                }));
  }

  void shutdown() {
    LOG.info("Running shutdown hook.");
    if (curatorFramework == null) {
      return;
    }
    try {
      curatorFramework.unwrap().close();
    } catch (Exception e) {
      LOG.error("Error while closing curatorFramework ", e);
    }
  }

  private static void setupSystemMetrics(MeterRegistry meterRegistry) {
    // Expose JVM metrics.
    new ClassLoaderMetrics().bindTo(meterRegistry);
    new JvmMemoryMetrics().bindTo(meterRegistry);
    new JvmGcMetrics().bindTo(meterRegistry);
    new ProcessorMetrics().bindTo(meterRegistry);
    new JvmThreadMetrics().bindTo(meterRegistry);

    LOG.info("Done registering standard JVM metrics for compactor");
  }
}
