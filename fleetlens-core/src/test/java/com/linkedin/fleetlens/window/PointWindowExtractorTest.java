/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.window;

import com.linkedin.fleetlens.common.config.ConfigException;
import com.linkedin.fleetlens.exception.InsufficientDataException;
import com.linkedin.fleetlens.model.MetricSeries;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;

import static com.linkedin.fleetlens.FleetLensUnitTestUtils.INTERVAL_MS;
import static com.linkedin.fleetlens.FleetLensUnitTestUtils.START_MS;
import static com.linkedin.fleetlens.FleetLensUnitTestUtils.rampSeries;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;


@RunWith(Parameterized.class)
public class PointWindowExtractorTest {
  private final int _seriesLength;
  private final int _windowSize;
  private final int _stride;

  public PointWindowExtractorTest(int seriesLength, int windowSize, int stride) {
    _seriesLength = seriesLength;
    _windowSize = windowSize;
    _stride = stride;
  }

  /**
   * @return (series length, window size, stride) combinations with full windows.
   */
  @Parameterized.Parameters(name = "{index}: L={0}, W={1}, S={2}")
  public static Collection<Object[]> data() {
    Collection<Object[]> params = new ArrayList<>();
    params.add(new Object[]{100, 100, 100});
    params.add(new Object[]{200, 100, 50});
    params.add(new Object[]{200, 100, 100});
    params.add(new Object[]{10, 4, 3});
    params.add(new Object[]{10, 4, 2});
    params.add(new Object[]{10, 4, 4});
    params.add(new Object[]{13, 5, 1});
    params.add(new Object[]{7, 1, 7});
    return params;
  }

  @Test
  public void testFullWindowCount() throws InsufficientDataException {
    List<TimeWindow> windows = new PointWindowExtractor(_windowSize, _stride, false).extract(rampSeries(_seriesLength));
    int expected = (_seriesLength - _windowSize) / _stride + 1;
    if ((_seriesLength - _windowSize) % _stride == 0) {
      assertEquals((int) Math.ceil((double) (_seriesLength - _windowSize) / _stride) + 1, expected);
    }
    assertEquals(expected, windows.size());
    for (int i = 0; i < windows.size(); i++) {
      TimeWindow window = windows.get(i);
      assertEquals(_windowSize, window.size());
      assertEquals(i * _stride, window.startIndex());
      assertEquals(i + 1, window.sequenceNumber());
      assertEquals(START_MS + window.startIndex() * INTERVAL_MS, window.startTimeMs());
      assertEquals(START_MS + (window.endIndex() - 1) * INTERVAL_MS, window.endTimeMs());
    }
  }

  @Test
  public void testExtractionIsIdempotent() throws InsufficientDataException {
    MetricSeries series = rampSeries(_seriesLength);
    PointWindowExtractor extractor = new PointWindowExtractor(_windowSize, _stride, true);
    assertEquals(extractor.extract(series), extractor.extract(series));
  }

  @Test
  public void testPartialWindowsCoverTheTail() throws InsufficientDataException {
    List<TimeWindow> windows = new PointWindowExtractor(_windowSize, _stride, true).extract(rampSeries(_seriesLength));
    int expected = (_seriesLength + _stride - 1) / _stride;
    assertEquals(expected, windows.size());
    if (_windowSize >= _stride) {
      assertEquals(_seriesLength, windows.get(windows.size() - 1).endIndex());
    }
  }

  @Test
  public void testShortSeriesWithoutPartialWindows() {
    PointWindowExtractor extractor = new PointWindowExtractor(10, null, false);
    assertThrows(InsufficientDataException.class, () -> extractor.extract(rampSeries(9)));
  }

  @Test
  public void testShortSeriesWithPartialWindows() throws InsufficientDataException {
    List<TimeWindow> windows = new PointWindowExtractor(10, null, true).extract(rampSeries(3));
    assertEquals(1, windows.size());
    assertEquals(new TimeWindow(0, 3, START_MS, START_MS + 2 * INTERVAL_MS, 1), windows.get(0));
  }

  @Test
  public void testInvalidConfiguration() {
    assertThrows(ConfigException.class, () -> new PointWindowExtractor(0, null, false));
    assertThrows(ConfigException.class, () -> new PointWindowExtractor(10, -1, false));
  }

  @Test
  public void testOverlapAndConfig() {
    PointWindowExtractor overlapping = new PointWindowExtractor(100, 50, false);
    assertTrue(overlapping.isOverlapping());
    assertEquals(Boolean.TRUE, overlapping.config().get("is_overlapping"));
    assertEquals(50, overlapping.config().get("stride_points"));
    PointWindowExtractor tumbling = new PointWindowExtractor(100, null, false);
    assertFalse(tumbling.isOverlapping());
    assertEquals(100, tumbling.stridePoints());
  }

  @Test
  public void testWindowData() throws InsufficientDataException {
    MetricSeries series = rampSeries(10);
    PointWindowExtractor extractor = new PointWindowExtractor(4, 3, false);
    TimeWindow second = extractor.extract(series).get(1);
    WindowData data = extractor.windowData(series, second);
    assertEquals(4, data.size());
    assertArrayEquals(new double[]{3.0, 4.0, 5.0, 6.0}, data.values(), 0.0);
    assertEquals(START_MS + 3 * INTERVAL_MS, data.timestamps()[0]);
    assertThrows(IllegalArgumentException.class,
                 () -> extractor.windowData(rampSeries(5), new TimeWindow(4, 8, START_MS, START_MS, 1)));
  }
}
