package com.slack.compactor.testlib;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.search.MeterNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Returns 0 for a meter that has not been registered yet, so a test can assert on a counter the
// code under test never touched.
public class MetricsUtil {

  private static final Logger LOG = LoggerFactory.getLogger(MetricsUtil.class);

  public static double getCount(String counterName, MeterRegistry metricsRegistry) {
    try {
      return metricsRegistry.get(counterName).counter().count();
    } catch (MeterNotFoundException e) {
      LOG.warn("Metric not found", e);
      return 0;
    }
  }

  public static double getCount(
      String counterName, String tagKey, String tagValue, MeterRegistry metricsRegistry) {
    try {
      return metricsRegistry.get(counterName).tag(tagKey, tagValue).counter().count();
    } catch (MeterNotFoundException e) {
      LOG.warn("Metric not found", e);
      return 0;
    }
  }
}
