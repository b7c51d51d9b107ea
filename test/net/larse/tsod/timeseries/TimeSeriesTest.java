package net.larse.tsod.timeseries;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import net.larse.tsod.errors.DetectionException.Stage;
import net.larse.tsod.errors.InsufficientDataException;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TimeSeriesTest {
  private static final double NAN = Double.NaN;
  private static final long[] TIME = {0, 10, 20, 40, 50};
  private static final double[] GAPPY = {NAN, 1, NAN, 4, NAN};

  @Test(expected = IllegalArgumentException.class)
  public void testRejectsDuplicateTimestamps() {
    new TimeSeries("x", new long[] {0, 1, 1}, new double[3]);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRejectsLengthMismatch() {
    new TimeSeries("x", new long[] {0, 1}, new double[3]);
  }

  @Test
  public void testDefensiveCopies() {
    double[] values = {1, 2, 3};
    TimeSeries series = TimeSeries.of("x", values);
    values[0] = 100;
    series.getValues()[1] = 100;
    assertArrayEquals(new double[] {1, 2, 3}, series.getValues(), 0);
    assertEquals(2, series.getTimestamp(2));
  }

  @Test
  public void testForwardFill() throws Exception {
    TimeSeries filled = new TimeSeries("x", TIME, GAPPY).fill(MissingValuePolicy.FORWARD_FILL);
    assertArrayEquals(new double[] {1, 1, 1, 4, 4}, filled.getValues(), 0);
    assertEquals(0, filled.countMissing());
  }

  @Test
  public void testLinearInterpolationByTimestamp() throws Exception {
    TimeSeries filled =
        new TimeSeries("x", TIME, GAPPY).fill(MissingValuePolicy.LINEAR_INTERPOLATION);
    assertArrayEquals(new double[] {1, 1, 2, 4, 4}, filled.getValues(), 1e-12);
  }

  @Test
  public void testDropKeepsTimestamps() throws Exception {
    TimeSeries filled = new TimeSeries("x", TIME, GAPPY).fill(MissingValuePolicy.DROP);
    assertArrayEquals(new double[] {1, 4}, filled.getValues(), 0);
    assertArrayEquals(new long[] {10, 40}, filled.getTimestamps());
  }

  @Test
  public void testCompleteSeriesIsReturnedAsIs() throws Exception {
    TimeSeries series = TimeSeries.of("x", 1, 2, 3);
    assertSame(series, series.fill(MissingValuePolicy.DROP));
  }

  @Test
  public void testNothingToFillFrom() {
    try {
      TimeSeries.of("empty", NAN, NAN).fill(MissingValuePolicy.FORWARD_FILL);
      fail("expected InsufficientDataException");
    } catch (InsufficientDataException e) {
      assertEquals("empty", e.getColumn());
      assertEquals(Stage.FILLING, e.getStage());
    }
  }

  @Test
  public void testPolicyNames() {
    assertEquals(MissingValuePolicy.FORWARD_FILL, MissingValuePolicy.fromName("ffill"));
    assertEquals(MissingValuePolicy.LINEAR_INTERPOLATION,
        MissingValuePolicy.fromName("interpolate"));
    assertEquals(MissingValuePolicy.DROP, MissingValuePolicy.fromName("DROP"));
  }

  @Test
  public void testResidualSequence() {
    ResidualSequence residuals = new ResidualSequence(2, new double[] {0.5, -0.5});
    assertEquals(4, residuals.size());
    assertEquals(0.0, residuals.get(1), 0);
    assertEquals(-0.5, residuals.get(3), 0);
    assertArrayEquals(new double[] {0.5, -0.5}, residuals.getDefined(), 0);
  }
}
