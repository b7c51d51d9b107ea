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

/**
 * Levinson-Durbin recursion for the Yule-Walker equations.
 *
 * <p>Given autocovariances c[0..order] it returns the prediction error filter
 * a[0..order] with a[0] = 1, so that the one-step prediction of a zero mean process is
 * {@code xhat[t] = -sum_{j>=1} a[j] * x[t-j]}.
 *
 * <p>Recursively estimated autocovariances are not always positive definite. The recursion stops
 * at the last order whose reflection coefficient is inside the unit circle and leaves the higher
 * coefficients at zero, which keeps the filter stable.
 */
public final class LevinsonDurbin {
  private static final double EPSILON = 1e-8;

  private LevinsonDurbin() {}

  public static double[] solve(double[] autocovariance, int order) {
    Preconditions.checkArgument(autocovariance.length > order,
        "need %s autocovariances, got %s", order + 1, autocovariance.length);
    double[] a = new double[order + 1];
    a[0] = 1.0;
    double error = autocovariance[0];
    if (error <= EPSILON) {
      return a;
    }

    double[] previous = new double[order + 1];
    for (int k = 1; k <= order; k++) {
      double acc = autocovariance[k];
      for (int j = 1; j < k; j++) {
        acc += a[j] * autocovariance[k - j];
      }
      double reflection = -acc / error;
      if (Math.abs(reflection) >= 1.0) {
        break;
      }

      System.arraycopy(a, 0, previous, 0, k);
      for (int j = 1; j < k; j++) {
        a[j] = previous[j] + reflection * previous[k - j];
      }
      a[k] = reflection;
      error *= 1.0 - reflection * reflection;
    }
    return a;
  }
}
