/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.model;

import com.linkedin.fleetlens.exception.OutOfRangeValueException;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;


public class AnomalyResultTest {

  @Test
  public void testIdentityAndLabel() {
    AnomalyResult result = new AnomalyResult("t", "c", "n", "cpu", 0L, 60_000L, 0.7, "trend");
    assertEquals(new NodeEntity("t", "c", "n"), result.node());
    assertEquals(AnomalyType.TREND, result.anomalyType());
    assertTrue(result.isAnomaly());
    assertNull(result.explanation());
    assertNull(result.magnitude());

    result.setClassification(AnomalyType.NORMAL, "quiet");
    assertEquals("normal", result.anomalyLabel());
    assertEquals("quiet", result.explanation());
    assertFalse(result.isAnomaly());
  }

  @Test
  public void testOutOfRangeValues() {
    assertThrows(OutOfRangeValueException.class, () -> new AnomalyResult("t", "c", "n", "cpu", 0L, 1L, 1.2, "spike"));
    assertThrows(OutOfRangeValueException.class, () -> new AnomalyResult("t", "c", "n", "cpu", 0L, 1L, -0.1, "spike"));
    assertThrows(OutOfRangeValueException.class, () -> new AnomalyResult("t", "c", "n", "cpu", 0L, 1L, 0.5, "dip"));
    assertThrows(OutOfRangeValueException.class,
                 () -> new AnomalyResult("t", "c", "n", "cpu", 0L, 1L, 0.5, "spike", 2.0, 0L, null));
  }

  @Test
  public void testInvalidIdentity() {
    assertThrows(IllegalArgumentException.class, () -> new AnomalyResult("", "c", "n", "cpu", 0L, 1L, 0.5, "spike"));
    assertThrows(IllegalArgumentException.class, () -> new AnomalyResult("t", "c", null, "cpu", 0L, 1L, 0.5, "spike"));
    assertThrows(IllegalArgumentException.class, () -> new AnomalyResult("t", "c", "n", "cpu", 5L, 1L, 0.5, "spike"));
  }
}
