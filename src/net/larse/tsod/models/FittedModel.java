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
import net.larse.tsod.timeseries.ResidualSequence;

/** Coefficients of a fitted model and the residuals it leaves on the series it was fit to. */
public final class FittedModel {
  private final ModelSpec spec;
  private final double intercept;
  private final double[] arCoefficients;
  private final double[] maCoefficients;
  private final ResidualSequence residuals;
  private final int iterations;

  FittedModel(ModelSpec spec, double intercept, double[] arCoefficients,
      double[] maCoefficients, ResidualSequence residuals, int iterations) {
    this.spec = spec;
    this.intercept = intercept;
    this.arCoefficients = arCoefficients.clone();
    this.maCoefficients = maCoefficients.clone();
    this.residuals = residuals;
    this.iterations = iterations;
  }

  /**
   * The model predicting the mean for every sample: all lag coefficients zero, residuals
   * {@code y[t] - mean} for {@code t >= order}.
   */
  static FittedModel meanModel(ModelSpec spec, double[] y, double mean) {
    int order = spec.getOrder();
    double[] e = new double[Math.max(0, y.length - order)];
    for (int t = order; t < y.length; t++) {
      e[t - order] = y[t] - mean;
    }
    return new FittedModel(spec, mean, new double[spec.getArOrder()],
        new double[spec.getMaOrder()], new ResidualSequence(order, e), 0);
  }

  public ModelSpec getSpec() {
    return spec;
  }

  public double getIntercept() {
    return intercept;
  }

  public double[] getArCoefficients() {
    return arCoefficients.clone();
  }

  public double[] getMaCoefficients() {
    return maCoefficients.clone();
  }

  public ResidualSequence getResiduals() {
    return residuals;
  }

  /** Optimizer iterations used; 0 for closed form fits. */
  public int getIterations() {
    return iterations;
  }

  @Override
  public String toString() {
    return String.format("%s c=%.6g phi=%s theta=%s", spec.getType(), intercept,
        Arrays.toString(arCoefficients), Arrays.toString(maCoefficients));
  }
}
