package com.slack.compactor.metadata.core;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Strings;
import com.slack.compactor.proto.config.CompactorConfigs;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.curator.RetryPolicy;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.CuratorFrameworkFactory;
import org.apache.curator.framework.state.ConnectionState;
import org.apache.curator.retry.RetryUntilElapsed;
import org.apache.curator.x.async.AsyncCuratorFramework;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the curator client shared by the catalog stores.
 *
 * <p>Curator retries a single call only for as long as the store waits on it, the connection
 * timeout. Retrying a lookup across calls is done by {@link
 * com.slack.compactor.backoff.RetryingInvoker}.
 */
public class CuratorBuilder {
  private static final Logger LOG = LoggerFactory.getLogger(CuratorBuilder.class);

  public static final String METADATA_FAILED_COUNTER = "metadata.failed";
  public static final String CONNECTION_LOST_COUNTER = "compactor_zk_connection_lost";

  public static AsyncCuratorFramework build(
      MeterRegistry meterRegistry, CompactorConfigs.ZookeeperConfig zkConfig) {
    checkArgument(
        !Strings.isNullOrEmpty(zkConfig.getZkConnectString()),
        "zkConnectString can't be null or empty");
    checkArgument(
        !Strings.isNullOrEmpty(zkConfig.getZkPathPrefix()), "zkPathPrefix can't be null or empty");
    checkArgument(
        zkConfig.getZkSessionTimeoutMs() > 0, "sessionTimeoutMs should be a positive number");
    checkArgument(
        zkConfig.getZkConnectionTimeoutMs() > 0, "connectionTimeoutMs should be a positive number");

    Counter unhandledErrors = meterRegistry.counter(METADATA_FAILED_COUNTER);
    Counter connectionLost = meterRegistry.counter(CONNECTION_LOST_COUNTER);
    RetryPolicy callRetryPolicy =
        new RetryUntilElapsed(
            zkConfig.getZkConnectionTimeoutMs(), zkConfig.getSleepBetweenRetriesMs());

    CuratorFramework curator =
        CuratorFrameworkFactory.builder()
            .connectString(zkConfig.getZkConnectString())
            .namespace(zkConfig.getZkPathPrefix())
            .sessionTimeoutMs(zkConfig.getZkSessionTimeoutMs())
            .connectionTimeoutMs(zkConfig.getZkConnectionTimeoutMs())
            .retryPolicy(callRetryPolicy)
            .build();

    curator
        .getUnhandledErrorListenable()
        .addListener(
            (message, exception) -> {
              unhandledErrors.increment();
              LOG.error("Unhandled catalog client error: {}", message, exception);
            });

    curator
        .getConnectionStateListenable()
        .addListener(
            (client, newState) -> {
              if (newState == ConnectionState.LOST || newState == ConnectionState.SUSPENDED) {
                if (newState == ConnectionState.LOST) {
                  connectionLost.increment();
                }
                LOG.warn(
                    "Catalog connection to {} is {}, lookups will be retried",
                    zkConfig.getZkConnectString(),
                    newState);
              } else {
                LOG.info("Catalog connection to {} is {}", zkConfig.getZkConnectString(), newState);
              }
            });

    curator.start();
    LOG.info(
        "Started catalog client for {} under namespace {} "
            + "(session timeout {} ms, call timeout {} ms)",
        zkConfig.getZkConnectString(),
        zkConfig.getZkPathPrefix(),
        zkConfig.getZkSessionTimeoutMs(),
        zkConfig.getZkConnectionTimeoutMs());

    return AsyncCuratorFramework.wrap(curator);
  }
}
