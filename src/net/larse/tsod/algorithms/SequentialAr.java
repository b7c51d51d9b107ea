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
import net.larse.tsod.helper.LevinsonDurbin;

/**
 * Sequentially discounted AR model: an autoregression whose mean, autocovariances and error
 * variance are exponentially weighted with forgetting factor {@code r}. Each {@link #update}
 * scores the new observation against the model built from the past, then absorbs it.
 *
 * <p>Until {@code 1 / r} observations have been seen the effective rate is {@code 1 / n}, which
 * makes the early estimates plain running averages.
 */
final class SequentialAr {
  private static final double EPSILON = 1e-8;
  private static final double LOG_TWO_PI = Math.log(2.0 * Math.PI);

  private final double forgettingFactor;
  private final int order;

  private int updates;
  private double mean;
  private final double[] autocovariance;
  private double variance;

  SequentialAr(double forgettingFactor, int order) {
    Preconditions.checkArgument(forgettingFactor > 0 && forgettingFactor < 1,
        "forgetting factor must be in (0, 1), got %s", forgettingFactor);
    Preconditions.checkArgument(order >= 1, "order must be at least 1, got %s", order);
    this.forgettingFactor = forgettingFactor;
    this.order = order;
    this.autocovariance = new double[order + 1];
  }

  /**
   * Absorbs x and returns its Gaussian negative log-likelihood under the model.
   *
   * @param history the previous {@code order} observations, most recent first
   */
  double update(double x, double[] history) {
    Preconditions.checkArgument(history.length >= order, "history shorter than the order");
    updates++;
    double r = Math.max(forgettingFactor, 1.0 / updates);

    mean = (1 - r) * mean + r * x;
    for (int j = 1; j <= order; j++) {
      autocovariance[j] = (1 - r) * autocovariance[j] + r * (x - mean) * (history[j - 1] - mean);
    }
    autocovariance[0] = (1 - r) * autocovariance[0] + r * (x - mean) * (x - mean);

    double[] a = LevinsonDurbin.solve(autocovariance, order);
    double prediction = mean;
    for (int j = 1; j <= order; j++) {
      prediction -= a[j] * (history[j - 1] - mean);
    }

    double error = x - prediction;
    variance = (1 - r) * variance + r * error * error;
    double sigma = Math.max(variance, EPSILON);
    return 0.5 * (LOG_TWO_PI + Math.log(sigma)) + 0.5 * error * error / sigma;
  }

  int getUpdates() {
    return updates;
  }

  double getMean() {
    return mean;
  }

  double getVariance() {
    return variance;
  }
}
