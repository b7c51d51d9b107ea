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

import java.util.Arrays;
import net.larse.tsod.errors.DetectionException.Stage;
import net.larse.tsod.errors.InsufficientDataException;
import net.larse.tsod.errors.NonConvergenceException;
import net.larse.tsod.helper.FitGenerator;
import net.larse.tsod.timeseries.ResidualSequence;
import net.larse.tsod.timeseries.TimeSeries;
import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.math.FunctionEvaluationException;
import org.apache.commons.math.MathException;
import org.apache.commons.math.analysis.DifferentiableMultivariateVectorialFunction;
import org.apache.commons.math.analysis.MultivariateMatrixFunction;
import org.apache.commons.math.optimization.general.LevenbergMarquardtOptimizer;
import org.apache.commons.math.stat.descriptive.DescriptiveStatistics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * ARMA(p, q) fit by conditional least squares; MA(q) is the case p = 0.
 *
 * <p>The model is {@code y[t] = c + sum_i phi[i] y[t-i] + sum_j theta[j] e[t-j] + e[t]} with the
 * innovations before {@code order = max(p, q)} taken as zero. Under Gaussian innovations
 * minimizing the sum of squared innovations is the conditional maximum likelihood estimate.
 * Starting values come from the Hannan-Rissanen regression, refinement from Levenberg-Marquardt.
 *
 * <p>The AR part is kept stationary and the MA part invertible by searching over the partial
 * autocorrelations of both polynomials (see {@link PartialAutocorrelations}). Series whose best
 * fit lies on the boundary, such as a trend, end up next to it instead of drifting past it.
 *
 * <p>Parameter vectors are laid out as {@code [c, phi_1..phi_p, theta_1..theta_q]}.
 */
public final class ArmaModel {
  private static final Logger logger = LogManager.getLogger(ArmaModel.class);

  private static final double EPSILON = 1e-8;
  private static final double TOLERANCE = 1e-8;
  private static final int MIN_LONG_AR_ORDER = 8;

  private final ModelSpec spec;
  private final int p;
  private final int q;
  private final int order;

  public ArmaModel(ModelSpec spec) {
    this.spec = spec;
    this.p = spec.getArOrder();
    this.q = spec.getMaOrder();
    this.order = spec.getOrder();
  }

  public FittedModel fit(TimeSeries series)
      throws InsufficientDataException, NonConvergenceException {
    String column = series.getName();
    double[] y = series.getValues();
    int n = y.length;
    int numParams = 1 + p + q;
    if (n <= order + 1 || n - order < numParams) {
      throw new InsufficientDataException(column, Stage.FITTING, String.format(
          "%s(p=%d, q=%d) needs more than %d samples, got %d", spec.getType(), p, q,
          Math.max(order + 1, order + numParams - 1), n));
    }

    DescriptiveStatistics stats = series.statistics();
    if (stats.getVariance() <= EPSILON) {
      logger.warn("{}: constant series, using the mean model", column);
      return FittedModel.meanModel(spec, y, stats.getMean());
    }

    ConditionalSumOfSquares css = new ConditionalSumOfSquares(y, p, q);
    double[] start = css.toAngles(startingValues(y, stats.getMean()));
    double[] target = Arrays.copyOfRange(y, order, n);
    double[] weights = new double[target.length];
    Arrays.fill(weights, 1.0);

    LevenbergMarquardtOptimizer optimizer = new LevenbergMarquardtOptimizer();
    optimizer.setMaxIterations(spec.getMaxIterations());
    optimizer.setCostRelativeTolerance(TOLERANCE);
    optimizer.setParRelativeTolerance(TOLERANCE);
    double[] point;
    try {
      point = css.toParameters(optimizer.optimize(css, target, weights, start).getPoint());
    } catch (MathException e) {
      throw new NonConvergenceException(column, String.format(
          "%s fit did not converge within %d iterations: %s", spec.getType(),
          spec.getMaxIterations(), e.getMessage()), e);
    }

    double[] residuals = css.residuals(point);
    for (double e : residuals) {
      if (!Double.isFinite(e)) {
        throw new NonConvergenceException(column,
            spec.getType() + " residual recursion diverged");
      }
    }

    FittedModel model = new FittedModel(spec, point[0],
        ArrayUtils.subarray(point, 1, 1 + p),
        ArrayUtils.subarray(point, 1 + p, numParams),
        new ResidualSequence(order, residuals), optimizer.getIterations());
    logger.debug("{}: fitted {} in {} iterations", column, model, model.getIterations());
    return model;
  }

  /**
   * Hannan-Rissanen: a long autoregression gives provisional innovations, then y[t] is regressed
   * on its own lags and the lagged provisional innovations. Falls back to an AR(p) fit with a
   * zero MA part when either regression is degenerate.
   */
  double[] startingValues(double[] y, double mean) {
    int n = y.length;
    int longOrder = Math.min(Math.max(MIN_LONG_AR_ORDER, 2 * (p + q)), (n - 1) / 3);
    double[] start = null;
    if (longOrder >= 1) {
      double[] longAr = ArModel.leastSquares(y, longOrder);
      if (longAr != null) {
        start = hannanRissanen(y, longAr, longOrder);
      }
    }
    if (start == null) {
      logger.debug("Hannan-Rissanen regression unavailable, starting from AR({})", p);
      start = new double[1 + p + q];
      start[0] = mean;
      double[] ar = p > 0 ? ArModel.leastSquares(y, p) : null;
      if (ar != null) {
        System.arraycopy(ar, 0, start, 0, ar.length);
      }
    }
    return start;
  }
  private double[] hannanRissanen(double[] y, double[] longAr, int longOrder) {
    int n = y.length;
    double[] innovations = new double[n];
    for (int t = longOrder; t < n; t++) {
      double prediction = longAr[0];
      for (int i = 1; i <= longOrder; i++) {
        prediction += longAr[i] * y[t - i];
      }
      innovations[t] = y[t] - prediction;
    }

    int first = Math.max(longOrder + q, p);
    int rows = n - first;
    if (rows < 1 + p + q) {
      return null;
    }
    FitGenerator fit = new FitGenerator();
    fit.init(1 + p + q, rows);
    for (int r = 0; r < rows; r++) {
      int t = first + r;
      fit.setObservation(r, 0, 1.0);
      for (int i = 1; i <= p; i++) {
        fit.setObservation(r, i, y[t - i]);
      }
      for (int j = 1; j <= q; j++) {
        fit.setObservation(r, p + j, innovations[t - j]);
      }
      fit.setTarget(r, y[t]);
    }
    return fit.linearFit();
  }

  /**
   * One-step predictions of y[order..n-1] as a function of the search point
   * {@code [c, u_1..u_p, v_1..v_q]}, where u and v are the angles of the AR and MA partial
   * autocorrelations. The Jacobian differentiates the innovation recursion with respect to
   * {@code [c, phi, theta]} and chains it through the partial autocorrelation map.
   */
  static final class ConditionalSumOfSquares
      implements DifferentiableMultivariateVectorialFunction {
    private final double[] y;
    private final int p;
    private final int q;
    private final int order;

    private double[] cachedPoint;
    private double[] predictions;
    private double[][] jacobian;

    ConditionalSumOfSquares(double[] y, int p, int q) {
      this.y = y;
      this.p = p;
      this.q = q;
      this.order = Math.max(p, q);
    }

    @Override
    public double[] value(double[] point) throws FunctionEvaluationException {
      evaluate(point);
      return predictions.clone();
    }

    @Override
    public MultivariateMatrixFunction jacobian() {
      return new MultivariateMatrixFunction() {
        @Override
        public double[][] value(double[] point) throws FunctionEvaluationException {
          evaluate(point);
          double[][] copy = new double[jacobian.length][];
          for (int i = 0; i < jacobian.length; i++) {
            copy[i] = jacobian[i].clone();
          }
          return copy;
        }
      };
    }

    /** {@code [c, phi, theta]} at a search point. */
    double[] toParameters(double[] point) {
      double[] parameters = new double[point.length];
      parameters[0] = point[0];
      double[] phi = PartialAutocorrelations.toCoefficients(
          PartialAutocorrelations.fromAngles(ArrayUtils.subarray(point, 1, 1 + p)));
      double[] psi = PartialAutocorrelations.toCoefficients(
          PartialAutocorrelations.fromAngles(ArrayUtils.subarray(point, 1 + p, 1 + p + q)));
      System.arraycopy(phi, 0, parameters, 1, p);
      for (int j = 0; j < q; j++) {
        parameters[1 + p + j] = -psi[j];
      }
      return parameters;
    }

    /** Search point of starting parameters {@code [c, phi, theta]}. */
    double[] toAngles(double[] parameters) {
      double[] point = new double[parameters.length];
      point[0] = parameters[0];
      double[] u = PartialAutocorrelations.toAngles(ArrayUtils.subarray(parameters, 1, 1 + p));
      double[] psi = ArrayUtils.subarray(parameters, 1 + p, 1 + p + q);
      for (int j = 0; j < q; j++) {
        psi[j] = -psi[j];
      }
      double[] v = PartialAutocorrelations.toAngles(psi);
      System.arraycopy(u, 0, point, 1, p);
      System.arraycopy(v, 0, point, 1 + p, q);
      return point;
    }

    /** Innovations e[order..n-1] at the given parameters {@code [c, phi, theta]}. */
    double[] residuals(double[] parameters) {
      double[] e = new double[y.length];
      for (int t = order; t < y.length; t++) {
        double prediction = parameters[0];
        for (int i = 1; i <= p; i++) {
          prediction += parameters[i] * y[t - i];
        }
        for (int j = 1; j <= q; j++) {
          prediction += parameters[p + j] * e[t - j];
        }
        e[t] = y[t] - prediction;
      }
      return Arrays.copyOfRange(e, order, y.length);
    }

    /** d parameters[i] / d point[m]; block diagonal. */
    private double[][] chain(double[] point) {
      int k = point.length;
      double[][] chain = new double[k][k];
      chain[0][0] = 1.0;
      fillBlock(chain, ArrayUtils.subarray(point, 1, 1 + p), 1, 1.0);
      fillBlock(chain, ArrayUtils.subarray(point, 1 + p, 1 + p + q), 1 + p, -1.0);
      return chain;
    }

    private static void fillBlock(double[][] chain, double[] angles, int offset, double sign) {
      double[][] d = PartialAutocorrelations.coefficientJacobian(
          PartialAutocorrelations.fromAngles(angles));
      for (int j = 0; j < angles.length; j++) {
        for (int m = 0; m < angles.length; m++) {
          chain[offset + j][offset + m] =
              sign * d[j][m] * PartialAutocorrelations.BOUND * Math.cos(angles[m]);
        }
      }
    }

    private void evaluate(double[] point) throws FunctionEvaluationException {
      if (cachedPoint != null && Arrays.equals(cachedPoint, point)) {
        return;
      }
      double[] parameters = toParameters(point);
      double[][] chain = chain(point);
      int n = y.length;
      int k = point.length;
      double[] e = new double[n];
      double[][] de = new double[n][k];
      double[] pred = new double[n - order];
      double[][] jac = new double[n - order][];

      for (int t = order; t < n; t++) {
        double prediction = parameters[0];
        double[] d = new double[k];
        d[0] = 1.0;
        for (int i = 1; i <= p; i++) {
          prediction += parameters[i] * y[t - i];
          d[i] += y[t - i];
        }
        for (int j = 1; j <= q; j++) {
          double theta = parameters[p + j];
          prediction += theta * e[t - j];
          d[p + j] += e[t - j];
          for (int m = 0; m < k; m++) {
            d[m] += theta * de[t - j][m];
          }
        }
        if (!Double.isFinite(prediction)) {
          throw new FunctionEvaluationException(point);
        }

        e[t] = y[t] - prediction;
        for (int m = 0; m < k; m++) {
          de[t][m] = -d[m];
        }
        pred[t - order] = prediction;

        double[] row = new double[k];
        for (int m = 0; m < k; m++) {
          for (int i = 0; i < k; i++) {
            row[m] += d[i] * chain[i][m];
          }
        }
        jac[t - order] = row;
      }

      cachedPoint = point.clone();
      predictions = pred;
      jacobian = jac;
    }
  }
}
