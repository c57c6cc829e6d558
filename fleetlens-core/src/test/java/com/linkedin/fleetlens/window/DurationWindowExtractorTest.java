/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.window;

import com.linkedin.fleetlens.common.config.ConfigException;
import com.linkedin.fleetlens.config.FleetLensConfig;
import com.linkedin.fleetlens.model.MetricSeries;
import java.util.List;
import java.util.Map;
import org.junit.Test;

import static com.linkedin.fleetlens.FleetLensUnitTestUtils.CLUSTER;
import static com.linkedin.fleetlens.FleetLensUnitTestUtils.CPU_USAGE;
import static com.linkedin.fleetlens.FleetLensUnitTestUtils.NODE;
import static com.linkedin.fleetlens.FleetLensUnitTestUtils.TENANT;
import static com.linkedin.fleetlens.FleetLensUnitTestUtils.rampSeries;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;


public class DurationWindowExtractorTest {
  private static final long MINUTE_MS = 60_000L;

  @Test
  public void testTumblingWindows() {
    // 11 points, one per minute.
    MetricSeries series = rampSeries(11);
    List<TimeWindow> windows = new DurationWindowExtractor(3 * MINUTE_MS, null, false).extract(series);
    assertEquals(4, windows.size());
    assertEquals(0, windows.get(0).startIndex());
    assertEquals(3, windows.get(0).endIndex());
    assertEquals(9, windows.get(3).startIndex());
    assertEquals(11, windows.get(3).endIndex());
    assertEquals(4, windows.get(3).sequenceNumber());
  }

  @Test
  public void testOverlappingWindows() {
    MetricSeries series = rampSeries(5);
    DurationWindowExtractor extractor = new DurationWindowExtractor(2 * MINUTE_MS, MINUTE_MS, false);
    List<TimeWindow> windows = extractor.extract(series);
    // Cursors at minutes 0, 1, 2, 3. The cursor at the last timestamp ends the extraction.
    assertEquals(4, windows.size());
    for (int i = 0; i < windows.size(); i++) {
      assertEquals(i, windows.get(i).startIndex());
      assertEquals(Math.min(i + 2, 5), windows.get(i).endIndex());
    }
    assertTrue(extractor.isOverlapping());
  }

  @Test
  public void testEmptyRangesAreSkipped() {
    long[] timestamps = {0L, MINUTE_MS, 10 * MINUTE_MS, 11 * MINUTE_MS};
    MetricSeries series = new MetricSeries(TENANT, CLUSTER, NODE, CPU_USAGE, timestamps, new double[]{1, 2, 3, 4});
    List<TimeWindow> windows = new DurationWindowExtractor(2 * MINUTE_MS, null, false).extract(series);
    assertEquals(2, windows.size());
    assertEquals(0, windows.get(0).startIndex());
    assertEquals(2, windows.get(0).endIndex());
    assertEquals(2, windows.get(1).startIndex());
    assertEquals(4, windows.get(1).endIndex());
    assertEquals(2, windows.get(1).sequenceNumber());
  }

  @Test
  public void testCursorAtLastTimestampEndsExtraction() {
    // Cursors at minutes 0, 3 and 6. The point at minute 9 is never covered.
    List<TimeWindow> windows = new DurationWindowExtractor(3 * MINUTE_MS, null, false).extract(rampSeries(10));
    assertEquals(3, windows.size());
    assertEquals(9, windows.get(2).endIndex());
  }

  @Test
  public void testSinglePointSeriesHasNoWindow() {
    assertTrue(new DurationWindowExtractor(MINUTE_MS, null, true).extract(rampSeries(1)).isEmpty());
  }

  @Test
  public void testInvalidConfiguration() {
    assertThrows(ConfigException.class, () -> new DurationWindowExtractor(0L, null, false));
    assertThrows(ConfigException.class, () -> new DurationWindowExtractor(MINUTE_MS, 0L, false));
  }

  @Test
  public void testCreateFromConfig() {
    FleetLensConfig config = new FleetLensConfig(Map.of(FleetLensConfig.WINDOW_MODE_CONFIG, "duration",
                                                        FleetLensConfig.WINDOW_DURATION_MS_CONFIG, "120000"), false);
    WindowExtractor extractor = WindowExtractors.create(config);
    assertTrue(extractor instanceof DurationWindowExtractor);
    assertEquals(120_000L, extractor.config().get("window_duration_ms"));
    assertEquals(120_000L, extractor.config().get("stride_ms"));
    assertTrue(WindowExtractors.create(new FleetLensConfig(Map.of(), false)) instanceof PointWindowExtractor);
  }
}
