package net.larse.tsod.models;

import java.util.Arrays;
import java.util.Random;
import net.larse.tsod.timeseries.TimeSeries;

/** Deterministic ARMA samples for the fit tests. */
final class SyntheticSeries {
  private static final int BURN_IN = 200;

  private SyntheticSeries() {}

  static TimeSeries arma(int n, double c, double[] phi, double[] theta, long seed) {
    Random random = new Random(seed);
    int total = n + BURN_IN;
    double[] y = new double[total];
    double[] e = new double[total];
    for (int t = 0; t < total; t++) {
      e[t] = random.nextGaussian();
      double value = c + e[t];
      for (int i = 0; i < phi.length; i++) {
        if (t - i - 1 >= 0) {
          value += phi[i] * y[t - i - 1];
        }
      }
      for (int j = 0; j < theta.length; j++) {
        if (t - j - 1 >= 0) {
          value += theta[j] * e[t - j - 1];
        }
      }
      y[t] = value;
    }
    return TimeSeries.of("synthetic", Arrays.copyOfRange(y, BURN_IN, total));
  }
}
