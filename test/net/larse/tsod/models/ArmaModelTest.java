package net.larse.tsod.models;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Random;
import net.larse.tsod.errors.InsufficientDataException;
import net.larse.tsod.timeseries.TimeSeries;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ArmaModelTest {
  @Test
  public void testArmaRecoversCoefficients() throws Exception {
    TimeSeries series =
        SyntheticSeries.arma(2000, 1.0, new double[] {0.6}, new double[] {0.3}, 42);
    FittedModel model = TimeSeriesModels.fit(series, ModelSpec.arma(1, 1));

    assertArrayEquals(new double[] {0.6}, model.getArCoefficients(), 0.1);
    assertArrayEquals(new double[] {0.3}, model.getMaCoefficients(), 0.1);
    assertEquals(1.0, model.getIntercept(), 0.15);
    assertEquals(1999, model.getResiduals().definedCount());
  }

  @Test
  public void testMaRecoversCoefficients() throws Exception {
    TimeSeries series =
        SyntheticSeries.arma(2000, 0.0, new double[0], new double[] {0.5, -0.3}, 7);
    FittedModel model = TimeSeriesModels.fit(series, ModelSpec.ma(2));

    assertArrayEquals(new double[] {0.5, -0.3}, model.getMaCoefficients(), 0.1);
    assertEquals(0, model.getArCoefficients().length);
    assertEquals(2, model.getResiduals().getOffset());
    assertEquals(1998, model.getResiduals().definedCount());
    assertTrue(model.getIterations() <= ModelSpec.DEFAULT_MAX_ITERATIONS);
  }

  @Test
  public void testResidualsMatchTheRecursion() throws Exception {
    TimeSeries series =
        SyntheticSeries.arma(300, 0.0, new double[0], new double[] {0.4}, 5);
    FittedModel model = TimeSeriesModels.fit(series, ModelSpec.ma(1));
    double c = model.getIntercept();
    double theta = model.getMaCoefficients()[0];

    double previous = 0;
    for (int t = 1; t < series.size(); t++) {
      double e = series.getValue(t) - c - theta * previous;
      assertEquals(e, model.getResiduals().get(t), 1e-9);
      previous = e;
    }
  }

  @Test
  public void testConstantSeries() throws Exception {
    double[] y = new double[40];
    Arrays.fill(y, 3.0);
    FittedModel model = TimeSeriesModels.fit(TimeSeries.of("flat", y), ModelSpec.ma(2));
    for (double r : model.getResiduals().getDefined()) {
      assertEquals(0.0, r, 1e-12);
    }
  }

  @Test(expected = InsufficientDataException.class)
  public void testTooShortForOrder() throws Exception {
    TimeSeriesModels.fit(TimeSeries.of("short", 1, 2, 3), ModelSpec.ma(2));
  }

  @Test(expected = InsufficientDataException.class)
  public void testTooShortForParameters() throws Exception {
    // ARMA(2, 2) has five parameters and four usable rows.
    TimeSeriesModels.fit(TimeSeries.of("short", 1, 3, 2, 5, 4, 6), ModelSpec.arma(2, 2));
  }

  @Test
  public void testNoisyTrendFitsInsideTheInvertibleRegion() throws Exception {
    Random random = new Random(11);
    double[] y = new double[300];
    for (int t = 0; t < y.length; t++) {
      y[t] = 100 + 0.5 * t + random.nextGaussian();
    }
    assertStationaryAndInvertible(TimeSeries.of("trend", y), ModelSpec.arma(1, 1));
    assertStationaryAndInvertible(TimeSeries.of("trend", y), ModelSpec.arma(2, 2));
  }

  @Test
  public void testSpikySeriesFitsInsideTheInvertibleRegion() throws Exception {
    double[] y = new double[200];
    for (int t = 0; t < y.length; t++) {
      y[t] = 10 + 0.5 * Math.sin(2 * Math.PI * t / 20.0) + (t % 40 == 20 ? 30 : 0);
    }
    assertStationaryAndInvertible(TimeSeries.of("spiky", y), ModelSpec.arma(1, 1));
    assertStationaryAndInvertible(TimeSeries.of("spiky", y), ModelSpec.arma(2, 2));
  }

  private static void assertStationaryAndInvertible(TimeSeries series, ModelSpec spec)
      throws Exception {
    FittedModel model = TimeSeriesModels.fit(series, spec);
    assertNotNull(PartialAutocorrelations.fromCoefficients(model.getArCoefficients()));
    double[] psi = model.getMaCoefficients().clone();
    for (int j = 0; j < psi.length; j++) {
      psi[j] = -psi[j];
    }
    assertNotNull(PartialAutocorrelations.fromCoefficients(psi));
    assertEquals(series.size() - spec.getOrder(), model.getResiduals().definedCount());
    for (double r : model.getResiduals().getDefined()) {
      assertTrue(Double.isFinite(r));
    }
    assertTrue(model.getIterations() <= spec.getMaxIterations());
  }
}
