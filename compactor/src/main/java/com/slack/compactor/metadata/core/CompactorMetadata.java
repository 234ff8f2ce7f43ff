package com.slack.compactor.metadata.core;

import static com.google.common.base.Preconditions.checkArgument;

import org.apache.curator.x.async.modeled.NodeName;

/** Base class of every node kept in the catalog. The name is the node name in Zookeeper. */
public abstract class CompactorMetadata implements NodeName {
  public final String name;

  public CompactorMetadata(String name) {
    checkArgument(name != null && !name.isEmpty(), "name can't be null or empty.");
    this.name = name;
  }

  public String getName() {
    return name;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof CompactorMetadata)) return false;
    CompactorMetadata that = (CompactorMetadata) o;
    return name.equals(that.name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String nodeName() {
    return name;
  }
}
