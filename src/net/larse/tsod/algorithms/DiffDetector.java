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
import java.util.ArrayList;
import java.util.List;
import net.larse.tsod.helper.AlgorithmBase;
import net.larse.tsod.helper.ArrayHelper;
import net.larse.tsod.helper.Quantiles;
import net.larse.tsod.timeseries.TimeSeries;
import org.apache.commons.lang3.ArrayUtils;

/**
 * Flags isolated spikes from the raw values.
 *
 * <p>For an interior sample the centered difference is its distance to the mean of its two
 * neighbours, the step differences are its distances to each neighbour. A sample is an outlier
 * when its centered difference reaches {@code lambdaCentrada} and it steps at least {@code k}
 * away from both neighbours. The first and last samples are never outliers.
 *
 * <p>Outliers are corrected by linear interpolation between the nearest non-outlier samples.
 */
public final class DiffDetector {
  public static final String LAMBDA_CENTRADA = "lambda_centrada";
  public static final String K = "k";

  private static final double UPPER_QUANTILE = 0.99;
  private static final double LOWER_QUANTILE = 0.01;
  private static final double EPSILON = 1e-8;

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Threshold on the centered difference. 0 derives it from the spread between the "
        + "1st and 99th percentile of the centered differences.")
    @Optional
    public double lambdaCentrada = 0;

    @Doc(help = "Threshold on the step to each neighbour. 0 derives it from the percentile "
        + "spread of the previous-step differences.")
    @Optional
    public double k = 0;

    public Args copy() {
      Args copy = new Args();
      copy.lambdaCentrada = lambdaCentrada;
      copy.k = k;
      return copy;
    }

    public void validate() {
      Preconditions.checkArgument(lambdaCentrada >= 0 && !Double.isNaN(lambdaCentrada),
          "lambdaCentrada must be >= 0, got %s", lambdaCentrada);
      Preconditions.checkArgument(k >= 0 && !Double.isNaN(k), "k must be >= 0, got %s", k);
    }
  }

  private final Args args;

  public DiffDetector() {
    this(new Args());
  }

  public DiffDetector(Args args) {
    args.validate();
    this.args = args.copy();
  }

  public DetectionResult detect(TimeSeries series) {
    int n = series.size();
    double[] v = series.getValues();
    long[] time = series.getTimestamps();
    double[] centered = new double[n];
    double[] previous = new double[n];
    double[] next = new double[n];
    for (int t = 1; t < n - 1; t++) {
      centered[t] = Math.abs(v[t] - (v[t - 1] + v[t + 1]) / 2.0);
      previous[t] = Math.abs(v[t] - v[t - 1]);
      next[t] = Math.abs(v[t] - v[t + 1]);
    }

    double lambda = args.lambdaCentrada;
    double k = args.k;
    if (n >= 3) {
      if (lambda == 0) {
        lambda = spread(ArrayUtils.subarray(centered, 1, n - 1));
      }
      if (k == 0) {
        k = spread(ArrayUtils.subarray(previous, 1, n - 1));
      }
    }

    boolean[] outlier = new boolean[n];
    for (int t = 1; t < n - 1; t++) {
      outlier[t] = centered[t] > EPSILON
          && centered[t] >= lambda
          && Math.min(previous[t], next[t]) >= k;
    }
    double[] corrected = correct(time, v, outlier);

    List<LabeledRecord> records = new ArrayList<>(n);
    for (int t = 0; t < n; t++) {
      records.add(LabeledRecord.diff(time[t], v[t], outlier[t] ? Label.OUTLIER : Label.NORMAL,
          corrected[t], centered[t], previous[t]));
    }
    return new DetectionResult(DetectorType.DIFF, records,
        ImmutableMap.of(LAMBDA_CENTRADA, lambda, K, k));
  }

  /** Upper minus lower percentile; never negative. */
  static double spread(double[] values) {
    return Math.max(0.0, Quantiles.higher(values, UPPER_QUANTILE)
        - Quantiles.lower(values, LOWER_QUANTILE));
  }

  /**
   * Replaces each outlier by interpolating between the nearest non-outlier samples. The
   * endpoints are never outliers so both neighbours always exist.
   */
  static double[] correct(long[] time, double[] v, boolean[] outlier) {
    double[] corrected = v.clone();
    int left = 0;
    for (int t = 1; t < v.length; t++) {
      if (outlier[t]) {
        continue;
      }
      for (int j = left + 1; j < t; j++) {
        corrected[j] = ArrayHelper.interpolate(time[left], v[left], time[t], v[t], time[j]);
      }
      left = t;
    }
    return corrected;
  }
}
