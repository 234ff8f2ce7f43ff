package com.slack.compactor.metadata.core;

import com.google.common.base.Throwables;
import com.slack.compactor.proto.config.CompactorConfigs;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.curator.x.async.AsyncCuratorFramework;
import org.apache.curator.x.async.api.CreateOption;
import org.apache.curator.x.async.modeled.ModelSerializer;
import org.apache.curator.x.async.modeled.ModelSpec;
import org.apache.curator.x.async.modeled.ModeledFramework;
import org.apache.curator.x.async.modeled.ZPath;
import org.apache.zookeeper.CreateMode;
import org.apache.zookeeper.KeeperException;

/**
 * A folder of catalog records in Zookeeper, one node per record.
 *
 * <p>Every call waits at most the configured connection timeout and surfaces any failure as an
 * {@link InternalMetadataStoreException}. {@link #findSync(String)} reports a missing node as an
 * empty result instead of a failure.
 */
public class ZookeeperMetadataStore<T extends CompactorMetadata> {
  private static final String CREATE_CALL = "compactor_zk_create_call";
  private static final String GET_CALL = "compactor_zk_get_call";
  private static final String HAS_CALL = "compactor_zk_has_call";

  protected final String storeFolder;
  protected final ModeledFramework<T> modeledClient;

  private final ZPath zPath;
  private final long callTimeoutMs;

  private final Counter createCall;
  private final Counter getCall;
  private final Counter hasCall;

  public ZookeeperMetadataStore(
      AsyncCuratorFramework curator,
      CompactorConfigs.ZookeeperConfig zkConfig,
      CreateMode createMode,
      ModelSerializer<T> modelSerializer,
      String storeFolder,
      MeterRegistry meterRegistry) {
    this.storeFolder = storeFolder;
    this.zPath = ZPath.parseWithIds(storeFolder + "/{name}");
    this.callTimeoutMs = zkConfig.getZkConnectionTimeoutMs();

    String store = "/" + storeFolder.split("/")[1];
    this.createCall = meterRegistry.counter(CREATE_CALL, "store", store);
    this.getCall = meterRegistry.counter(GET_CALL, "store", store);
    this.hasCall = meterRegistry.counter(HAS_CALL, "store", store);

    ModelSpec<T> modelSpec =
        ModelSpec.builder(modelSerializer)
            .withPath(zPath)
            .withCreateOptions(
                Set.of(CreateOption.createParentsIfNeeded, CreateOption.createParentsAsContainers))
            .withCreateMode(createMode)
            .build();
    modeledClient = ModeledFramework.wrap(curator, modelSpec);
  }

  public void createSync(T metadataNode) {
    createCall.increment();
    // version 0 makes the create fail if the node already exists
    awaitOrThrow(modeledClient.set(metadataNode, 0), "creating node " + metadataNode);
  }

  /**
   * Fetch the node at the given path. A node that does not exist is a successful lookup with an
   * empty result, while a failed call throws.
   */
  public Optional<T> findSync(String path) {
    getCall.increment();
    try {
      return Optional.ofNullable(await(modeledClient.withPath(zPath.resolved(path)).read()));
    } catch (ExecutionException e) {
      if (isNoNode(e)) {
        return Optional.empty();
      }
      throw new InternalMetadataStoreException("Error fetching node at path " + path, e);
    } catch (TimeoutException e) {
      throw new InternalMetadataStoreException("Timed out fetching node at path " + path, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InternalMetadataStoreException("Interrupted fetching node at path " + path, e);
    }
  }

  public boolean hasSync(String path) {
    hasCall.increment();
    return awaitOrThrow(
        modeledClient.withPath(zPath.resolved(path)).checkExists().thenApply(stat -> stat != null),
        "checking node at path " + path);
  }

  private <R> R await(CompletionStage<R> stage)
      throws InterruptedException, ExecutionException, TimeoutException {
    return stage.toCompletableFuture().get(callTimeoutMs, TimeUnit.MILLISECONDS);
  }

  private <R> R awaitOrThrow(CompletionStage<R> stage, String action) {
    try {
      return await(stage);
    } catch (ExecutionException e) {
      throw new InternalMetadataStoreException("Error " + action, e);
    } catch (TimeoutException e) {
      throw new InternalMetadataStoreException("Timed out " + action, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InternalMetadataStoreException("Interrupted " + action, e);
    }
  }

  private static boolean isNoNode(ExecutionException e) {
    return Throwables.getCausalChain(e).stream()
        .anyMatch(t -> t instanceof KeeperException.NoNodeException);
  }
}
