package net.larse.tsod.helper;

import static org.junit.Assert.assertArrayEquals;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class LevinsonDurbinTest {
  @Test
  public void testFirstOrder() {
    assertArrayEquals(new double[] {1, -0.5}, LevinsonDurbin.solve(new double[] {1, 0.5}, 1),
        1e-12);
  }

  @Test
  public void testSecondOrderSolvesYuleWalker() {
    // phi = (0.6, -0.2) gives c1 = 0.5, c2 = 0.1 for c0 = 1.
    double[] a = LevinsonDurbin.solve(new double[] {1, 0.5, 0.1}, 2);
    assertArrayEquals(new double[] {1, -0.6, 0.2}, a, 1e-12);
  }

  @Test
  public void testZeroVarianceGivesNoPrediction() {
    assertArrayEquals(new double[] {1, 0, 0}, LevinsonDurbin.solve(new double[] {0, 0, 0}, 2),
        0);
  }

  @Test
  public void testStopsAtUnstableReflection() {
    assertArrayEquals(new double[] {1, 0, 0}, LevinsonDurbin.solve(new double[] {1, 1, 1}, 2),
        0);
    assertArrayEquals(new double[] {1, -0.9, 0},
        LevinsonDurbin.solve(new double[] {1, 0.9, -0.9}, 2), 1e-12);
  }
}
