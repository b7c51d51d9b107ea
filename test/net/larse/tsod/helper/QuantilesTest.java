package net.larse.tsod.helper;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class QuantilesTest {
  private static final double[] VALUES = {5, 1, 4, 2, 3};

  @Test
  public void testLinearInterpolatesBetweenOrderStatistics() {
    assertEquals(3.0, Quantiles.linear(VALUES, 0.5), 1e-12);
    assertEquals(4.6, Quantiles.linear(VALUES, 0.9), 1e-12);
    assertEquals(1.0, Quantiles.linear(VALUES, 0.0), 1e-12);
    assertEquals(5.0, Quantiles.linear(VALUES, 1.0), 1e-12);
  }

  @Test
  public void testHigherAndLower() {
    assertEquals(5.0, Quantiles.higher(VALUES, 0.9), 0);
    assertEquals(4.0, Quantiles.lower(VALUES, 0.9), 0);
    assertEquals(3.0, Quantiles.higher(VALUES, 0.5), 0);
    assertEquals(3.0, Quantiles.lower(VALUES, 0.5), 0);
  }

  @Test
  public void testInputIsNotSorted() {
    double[] values = VALUES.clone();
    Quantiles.linear(values, 0.3);
    assertArrayEquals(VALUES, values, 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptySample() {
    Quantiles.linear(new double[0], 0.5);
  }
}
