package com.slack.compactor.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RuntimeHalterImpl implements FatalErrorHandler {
  private static final Logger LOG = LoggerFactory.getLogger(RuntimeHalterImpl.class);

  @Override
  public void handleFatal(Throwable t) {
    LOG.error(
        "Runtime halter is called on an unrecoverable error: {}. Stopping the VM.",
        t.getMessage(),
        t);
    System.exit(1);
  }
}
