package net.larse.tsod.models;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import net.larse.tsod.errors.DetectionException.Stage;
import net.larse.tsod.errors.InsufficientDataException;
import net.larse.tsod.errors.NonConvergenceException;
import net.larse.tsod.timeseries.ResidualSequence;
import net.larse.tsod.timeseries.TimeSeries;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ArModelTest {
  @Test
  public void testRecoversCoefficients() throws Exception {
    TimeSeries series =
        SyntheticSeries.arma(2000, 1.0, new double[] {0.5, -0.3}, new double[0], 11);
    FittedModel model = TimeSeriesModels.fit(series, ModelSpec.ar(2));

    assertArrayEquals(new double[] {0.5, -0.3}, model.getArCoefficients(), 0.1);
    assertEquals(1.0, model.getIntercept(), 0.15);
    assertEquals(0, model.getMaCoefficients().length);
  }

  @Test
  public void testResidualsStartAfterOrder() throws Exception {
    TimeSeries series =
        SyntheticSeries.arma(100, 0.0, new double[] {0.5, -0.3}, new double[0], 3);
    ResidualSequence residuals = TimeSeriesModels.fit(series, ModelSpec.ar(2)).getResiduals();

    assertEquals(100, residuals.size());
    assertEquals(98, residuals.definedCount());
    assertEquals(2, residuals.getOffset());
    assertFalse(residuals.isDefined(1));
    assertTrue(residuals.isDefined(2));
    assertEquals(0.0, residuals.get(0), 0);
  }

  @Test
  public void testConstantSeriesUsesMeanModel() throws Exception {
    double[] y = new double[50];
    Arrays.fill(y, 10.0);
    FittedModel model = TimeSeriesModels.fit(TimeSeries.of("flat", y), ModelSpec.ar(2));

    assertEquals(10.0, model.getIntercept(), 1e-12);
    assertArrayEquals(new double[] {0, 0}, model.getArCoefficients(), 0);
    for (double r : model.getResiduals().getDefined()) {
      assertEquals(0.0, r, 1e-12);
    }
  }

  @Test
  public void testTooShort() {
    try {
      TimeSeriesModels.fit(TimeSeries.of("short", 1, 2, 3), ModelSpec.ar(2));
      fail("expected InsufficientDataException");
    } catch (InsufficientDataException e) {
      assertEquals("short", e.getColumn());
      assertEquals(Stage.FITTING, e.getStage());
    } catch (NonConvergenceException e) {
      fail("unexpected " + e);
    }
  }

  @Test
  public void testUnderdeterminedFitFallsBackToTheMean() throws Exception {
    // AR(3) at n = 5 leaves two rows for four unknowns.
    FittedModel model =
        TimeSeriesModels.fit(TimeSeries.of("short", 1, 4, 2, 8, 5), ModelSpec.ar(3));
    assertEquals(4.0, model.getIntercept(), 1e-12);
    assertArrayEquals(new double[3], model.getArCoefficients(), 0.0);
    assertEquals(3, model.getResiduals().getOffset());
    assertArrayEquals(new double[] {4.0, 1.0}, model.getResiduals().getDefined(), 1e-12);
  }
}
