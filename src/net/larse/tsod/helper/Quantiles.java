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
package net.larse.tsod.helper;

import com.google.common.base.Preconditions;
import java.util.Arrays;

/**
 * Sample quantiles with the interpolation rules used by the detectors' thresholds.
 *
 * <p>Positions are {@code p * (n - 1)} on the sorted sample. {@link #linear} interpolates between
 * the neighbouring order statistics, {@link #lower} and {@link #higher} take the one below or
 * above the position.
 */
public final class Quantiles {
  private Quantiles() {}

  public static double linear(double[] values, double p) {
    double[] sorted = sorted(values, p);
    double pos = p * (sorted.length - 1);
    int lo = (int) Math.floor(pos);
    int hi = (int) Math.ceil(pos);
    return sorted[lo] + (sorted[hi] - sorted[lo]) * (pos - lo);
  }

  public static double lower(double[] values, double p) {
    double[] sorted = sorted(values, p);
    return sorted[(int) Math.floor(p * (sorted.length - 1))];
  }

  public static double higher(double[] values, double p) {
    double[] sorted = sorted(values, p);
    return sorted[(int) Math.ceil(p * (sorted.length - 1))];
  }

  private static double[] sorted(double[] values, double p) {
    Preconditions.checkArgument(values.length > 0, "quantile of an empty sample");
    Preconditions.checkArgument(p >= 0 && p <= 1, "quantile level %s outside [0, 1]", p);
    double[] sorted = values.clone();
    Arrays.sort(sorted);
    return sorted;
  }
}
