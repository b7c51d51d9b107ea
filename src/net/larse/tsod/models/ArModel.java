/*
 * Copyright (c) 2015 Zhiqiang Yang.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.larse.tsod.models;

import net.larse.tsod.errors.DetectionException.Stage;
import net.larse.tsod.errors.InsufficientDataException;
import net.larse.tsod.helper.FitGenerator;
import net.larse.tsod.timeseries.ResidualSequence;
import net.larse.tsod.timeseries.TimeSeries;
import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.math.stat.descriptive.DescriptiveStatistics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Autoregressive model fit by ordinary least squares with an intercept:
 * {@code y[t] = c + sum_i phi[i] * y[t-i]}.
 */
public final class ArModel {
  private static final Logger logger = LogManager.getLogger(ArModel.class);

  private static final double EPSILON = 1e-8;

  private final ModelSpec spec;

  public ArModel(ModelSpec spec) {
    this.spec = spec;
  }

  public FittedModel fit(TimeSeries series) throws InsufficientDataException {
    int q = spec.getArOrder();
    double[] y = series.getValues();
    int n = y.length;
    int rows = n - q;
    if (n <= q + 1) {
      throw new InsufficientDataException(series.getName(), Stage.FITTING, String.format(
          "AR(%d) needs more than %d samples, got %d", q, q + 1, n));
    }

    DescriptiveStatistics stats = series.statistics();
    // Fewer rows than [c, phi] leaves the regression underdetermined.
    double[] beta = stats.getVariance() <= EPSILON || rows < q + 1 ? null : leastSquares(y, q);
    if (beta == null) {
      double mean = stats.getMean();
      logger.warn("{}: AR({}) design matrix is rank deficient ({} rows), using the mean model",
          series.getName(), q, rows);
      return FittedModel.meanModel(spec, y, mean);
    }

    double intercept = beta[0];
    double[] phi = ArrayUtils.subarray(beta, 1, beta.length);
    double[] residuals = new double[rows];
    for (int t = q; t < n; t++) {
      double prediction = intercept;
      for (int i = 1; i <= q; i++) {
        prediction += phi[i - 1] * y[t - i];
      }
      residuals[t - q] = y[t] - prediction;
    }

    FittedModel model = new FittedModel(spec, intercept, phi, new double[0],
        new ResidualSequence(q, residuals), 0);
    logger.debug("{}: fitted {}", series.getName(), model);
    return model;
  }

  /**
   * Regresses y[t] on an intercept and y[t-1..t-q] for t >= q. Returns [c, phi_1..phi_q], or
   * null when the regression is degenerate.
   */
  static double[] leastSquares(double[] y, int q) {
    int rows = y.length - q;
    FitGenerator fit = new FitGenerator();
    fit.init(q + 1, rows);
    for (int r = 0; r < rows; r++) {
      int t = r + q;
      fit.setObservation(r, 0, 1.0);
      for (int i = 1; i <= q; i++) {
        fit.setObservation(r, i, y[t - i]);
      }
      fit.setTarget(r, y[t]);
    }
    return fit.linearFit();
  }
}
