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
package net.larse.tsod.algorithms;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Doubles;
import java.util.ArrayList;
import java.util.List;
import net.larse.tsod.errors.DegenerateVarianceException;
import net.larse.tsod.helper.AlgorithmBase;
import net.larse.tsod.helper.Quantiles;
import net.larse.tsod.timeseries.ResidualSequence;
import net.larse.tsod.timeseries.TimeSeries;

/**
 * Labels residuals of a fitted model.
 *
 * <p>The residual variance is tracked with an exponentially weighted moving average and each
 * residual is scored by its size in local standard deviations; scores in the top
 * {@code 1 - quantile} are outliers. A {@link ChangeFinder} runs over the same residuals and
 * scores in the top {@code 1 - changeQuantile} of its defined change scores are changes, which
 * take priority over outliers.
 */
public final class AdaptiveVarianceDetector {
  public static final String OUTLIER_THRESHOLD = "outlier_threshold";
  public static final String CHANGE_THRESHOLD = "change_threshold";

  private static final double EPSILON = 1e-8;

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Weight of the newest squared residual in the variance average.")
    @Optional
    public double alpha = 0.005;

    @Doc(help = "Quantile of the outlier scores used as the outlier threshold.")
    @Optional
    public double quantile = 0.995;

    @Doc(help = "Forgetting factor of the change score models.")
    @Optional
    public double factorOlvido = 0.02;

    @Doc(help = "Order of the change score models.")
    @Optional
    public int lagCambio = 2;

    @Doc(help = "Window of the moving average between the two change score stages.")
    @Optional
    public int suavizado = 7;

    @Doc(help = "Quantile of the change scores used as the change threshold.")
    @Optional
    public double changeQuantile = 0.99;

    public Args copy() {
      Args copy = new Args();
      copy.alpha = alpha;
      copy.quantile = quantile;
      copy.factorOlvido = factorOlvido;
      copy.lagCambio = lagCambio;
      copy.suavizado = suavizado;
      copy.changeQuantile = changeQuantile;
      return copy;
    }

    public void validate() {
      checkOpenUnit("alpha", alpha);
      checkOpenUnit("quantile", quantile);
      checkOpenUnit("factorOlvido", factorOlvido);
      checkOpenUnit("changeQuantile", changeQuantile);
      Preconditions.checkArgument(lagCambio >= 1, "lagCambio must be >= 1, got %s", lagCambio);
      Preconditions.checkArgument(suavizado >= 1, "suavizado must be >= 1, got %s", suavizado);
    }

    private static void checkOpenUnit(String name, double value) {
      Preconditions.checkArgument(value > 0 && value < 1, "%s must be in (0, 1), got %s",
          name, value);
    }
  }

  private final Args args;

  public AdaptiveVarianceDetector() {
    this(new Args());
  }

  public AdaptiveVarianceDetector(Args args) {
    args.validate();
    this.args = args.copy();
  }

  /**
   * @param residuals residuals of a model fit to {@code series}, aligned with its samples
   * @throws DegenerateVarianceException if no residual is defined
   */
  public DetectionResult detect(TimeSeries series, ResidualSequence residuals)
      throws DegenerateVarianceException {
    Preconditions.checkArgument(residuals.size() == series.size(),
        "%s residual positions for %s samples", residuals.size(), series.size());
    if (residuals.definedCount() == 0) {
      throw new DegenerateVarianceException(series.getName(),
          "no residual to estimate a variance from");
    }

    double[] r = residuals.getDefined();
    double[] scores = outlierScores(r, adaptiveVariance(r, args.alpha));
    double outlierThreshold = threshold(scores, args.quantile);

    ChangeFinder.Scores change =
        new ChangeFinder(args.factorOlvido, args.lagCambio, args.suavizado).score(r);
    double changeThreshold = threshold(change.getDefinedChangeScores(), args.changeQuantile);
    double[] changeScores = change.getChangeScores();

    int offset = residuals.getOffset();
    List<LabeledRecord> records = new ArrayList<>(series.size());
    for (int t = 0; t < offset; t++) {
      records.add(LabeledRecord.adaptive(series.getTimestamp(t), series.getValue(t),
          Label.NORMAL, 0.0, 0.0, 0.0));
    }
    for (int i = 0; i < r.length; i++) {
      Label label = Label.NORMAL;
      if (change.isDefined(i) && changeScores[i] >= changeThreshold) {
        label = Label.CHANGE;
      } else if (scores[i] >= outlierThreshold) {
        label = Label.OUTLIER;
      }
      int t = i + offset;
      records.add(LabeledRecord.adaptive(series.getTimestamp(t), series.getValue(t), label,
          r[i], scores[i], changeScores[i]));
    }
    return new DetectionResult(DetectorType.ADAPTIVE_VARIANCE, records,
        ImmutableMap.of(OUTLIER_THRESHOLD, outlierThreshold, CHANGE_THRESHOLD, changeThreshold));
  }

  /** sigma2[0] = r[0]^2, sigma2[t] = (1 - alpha) sigma2[t-1] + alpha r[t]^2. */
  static double[] adaptiveVariance(double[] residuals, double alpha) {
    double[] sigma2 = new double[residuals.length];
    if (residuals.length == 0) {
      return sigma2;
    }
    sigma2[0] = residuals[0] * residuals[0];
    for (int t = 1; t < residuals.length; t++) {
      sigma2[t] = (1 - alpha) * sigma2[t - 1] + alpha * residuals[t] * residuals[t];
    }
    return sigma2;
  }

  static double[] outlierScores(double[] residuals, double[] sigma2) {
    double[] scores = new double[residuals.length];
    for (int t = 0; t < scores.length; t++) {
      scores[t] = sigma2[t] < EPSILON ? 0.0 : Math.abs(residuals[t]) / Math.sqrt(sigma2[t]);
    }
    return scores;
  }

  /**
   * The quantile of the scores, or positive infinity when there are none or they are all equal
   * so that nothing reaches it.
   */
  static double threshold(double[] scores, double quantile) {
    if (scores.length == 0 || Doubles.max(scores) - Doubles.min(scores) <= EPSILON) {
      return Double.POSITIVE_INFINITY;
    }
    return Quantiles.linear(scores, quantile);
  }
}
