package com.slack.compactor.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import com.slack.compactor.backoff.RetryAbortedException;
import com.slack.compactor.config.CompactorRuntimeConfig;
import com.slack.compactor.metadata.catalog.ZookeeperCatalog;
import com.slack.compactor.metadata.core.CuratorBuilder;
import com.slack.compactor.metadata.shard.ShardMetadata;
import com.slack.compactor.metadata.topic.TopicMetadata;
import com.slack.compactor.proto.config.CompactorConfigs;
import com.slack.compactor.resolver.MissingCatalogRecordException;
import com.slack.compactor.testlib.CompactorConfigUtil;
import com.slack.compactor.util.CountingFatalErrorHandler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.apache.curator.test.TestingServer;
import org.apache.curator.x.async.AsyncCuratorFramework;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class CompactorTest {
  private TestingServer testingServer;
  private MeterRegistry meterRegistry;
  private AsyncCuratorFramework seedCuratorFramework;
  private CountingFatalErrorHandler fatalErrorHandler;
  private Compactor compactor;

  @BeforeEach
  public void setUp() throws Exception {
    testingServer = new TestingServer();
    meterRegistry = new SimpleMeterRegistry();
    fatalErrorHandler = new CountingFatalErrorHandler();

    // seed the catalog through a separate client, the way an operator would
    CompactorConfigs.ZookeeperConfig zkConfig =
        CompactorConfigUtil.makeZookeeperConfig(testingServer.getConnectString());
    seedCuratorFramework = CuratorBuilder.build(new SimpleMeterRegistry(), zkConfig);
    ZookeeperCatalog seedCatalog =
        new ZookeeperCatalog(seedCuratorFramework, zkConfig, new SimpleMeterRegistry());
    seedCatalog.createTopic(new TopicMetadata("sensors", 7));
    seedCatalog.createShard(new ShardMetadata(42, 7, 2));
  }

  @AfterEach
  public void tearDown() throws Exception {
    if (compactor != null) {
      compactor.shutdown();
    }
    seedCuratorFramework.unwrap().close();
    testingServer.close();
    Metrics.removeRegistry(meterRegistry);
    meterRegistry.close();
  }

  private Compactor makeCompactor(String topicName, int shardIndex) {
    CompactorConfigs.CompactorConfig config =
        CompactorConfigUtil.makeCompactorConfig(
            testingServer.getConnectString(), topicName, shardIndex);
    return new Compactor(config, meterRegistry, fatalErrorHandler);
  }

  @Test
  public void testStartResolvesShardId() {
    compactor = makeCompactor("sensors", 2);
    compactor.start();

    assertThat(fatalErrorHandler.getCount()).isZero();
    assertThat(compactor.getRuntimeConfig()).isPresent();
    CompactorRuntimeConfig runtimeConfig = compactor.getRuntimeConfig().get();
    assertThat(runtimeConfig.shardId).isEqualTo(42);
    assertThat(runtimeConfig.partitionConcurrency).isEqualTo(4);
    assertThat(runtimeConfig.jobConcurrency).isEqualTo(2);
    assertThat(runtimeConfig.splitPercentage)
        .isEqualTo(CompactorRuntimeConfig.DEFAULT_SPLIT_PERCENTAGE);
  }

  @Test
  public void testMissingTopicIsFatal() {
    compactor = makeCompactor("ghost", 0);
    compactor.start();

    assertThat(fatalErrorHandler.getCount()).isEqualTo(1);
    assertThat(fatalErrorHandler.getLastError())
        .isInstanceOf(MissingCatalogRecordException.class)
        .hasMessage("Topic ghost not found");
    assertThat(compactor.getRuntimeConfig()).isEmpty();
  }

  @Test
  public void testMissingShardIsFatal() {
    compactor = makeCompactor("sensors", 99);
    compactor.start();

    assertThat(fatalErrorHandler.getCount()).isEqualTo(1);
    assertThat(fatalErrorHandler.getLastError())
        .isInstanceOf(MissingCatalogRecordException.class)
        .hasMessage("Topic sensors and Shard Index 99 not found");
    assertThat(compactor.getRuntimeConfig()).isEmpty();
  }

  @Test
  public void testUnreachableCatalogIsFatalOnceRetriesRunOut() throws Exception {
    testingServer.stop();
    CompactorConfigs.CompactorConfig config =
        CompactorConfigUtil.makeCompactorConfig(testingServer.getConnectString(), "sensors", 2);
    config =
        config.toBuilder()
            .setBackoffConfig(config.getBackoffConfig().toBuilder().setMaxAttempts(2))
            .build();
    compactor = new Compactor(config, meterRegistry, fatalErrorHandler);

    compactor.start();

    assertThat(fatalErrorHandler.getCount()).isEqualTo(1);
    assertThat(fatalErrorHandler.getLastError())
        .isInstanceOfSatisfying(
            RetryAbortedException.class,
            e -> {
              assertThat(e.getReason())
                  .isEqualTo(RetryAbortedException.Reason.ATTEMPTS_EXHAUSTED);
              assertThat(e.getAttempts()).isEqualTo(2);
            });
    assertThat(compactor.getRuntimeConfig()).isEmpty();
  }

  @Test
  public void testInvalidTuningIsFatal() {
    CompactorConfigs.CompactorConfig config =
        CompactorConfigUtil.makeCompactorConfig(testingServer.getConnectString(), "sensors", 2)
            .toBuilder()
            .setSplitPercentage(100)
            .build();
    compactor = new Compactor(config, meterRegistry, fatalErrorHandler);

    compactor.start();

    assertThat(fatalErrorHandler.getCount()).isEqualTo(1);
    assertThat(fatalErrorHandler.getLastError())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("splitPercentage");
    assertThat(compactor.getRuntimeConfig()).isEmpty();
  }

  @Test
  public void testShutdownBeforeStart() {
    compactor = makeCompactor("sensors", 2);
    compactor.shutdown();

    assertThat(compactor.getRuntimeConfig()).isEmpty();
  }

  @Test
  public void testPrometheusRegistryCommonTags() {
    PrometheusMeterRegistry prometheusMeterRegistry =
        Compactor.initPrometheusMeterRegistry(
            CompactorConfigUtil.makeCompactorConfig("localhost:2181", "sensors", 2));
    prometheusMeterRegistry.counter("test_counter").increment();

    assertThat(prometheusMeterRegistry.scrape())
        .contains("compactor_cluster_name=\"test_cluster\"")
        .contains("compactor_env=\"test\"")
        .contains("compactor_component=\"compactor\"");
    prometheusMeterRegistry.close();
  }

  @Test
  public void testMainNeedsConfigFile() {
    assertThatIllegalArgumentException().isThrownBy(() -> Compactor.main(new String[0]));
  }
}
