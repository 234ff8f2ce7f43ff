package com.slack.compactor.metadata.core;

/** A catalog call failed to complete. Says nothing about whether the node exists. */
public class InternalMetadataStoreException extends RuntimeException {
  public InternalMetadataStoreException(String msg) {
    super(msg);
  }

  public InternalMetadataStoreException(String msg, Throwable t) {
    super(msg, t);
  }
}
