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

/**
 * Maps between the coefficients of a polynomial {@code 1 - sum_j phi[j] z^j} and its partial
 * autocorrelations. Every vector of partial autocorrelations inside (-1, 1) maps to a polynomial
 * with all roots outside the unit circle, so searching over them keeps an AR part stationary and,
 * with the signs flipped, an MA part invertible.
 *
 * <p>The search itself runs over unbounded angles {@code u} with {@code r = BOUND * sin(u)}.
 */
final class PartialAutocorrelations {
  static final double BOUND = 0.995;
  // Starting values are pulled back from the boundary, where sin(u) is flat.
  static final double MAX_START = 0.9;

  private PartialAutocorrelations() {}

  /** Durbin-Levinson step-up: partial autocorrelations to coefficients. */
  static double[] toCoefficients(double[] r) {
    int p = r.length;
    double[] phi = new double[p];
    double[] previous = new double[p];
    for (int m = 0; m < p; m++) {
      System.arraycopy(phi, 0, previous, 0, m);
      for (int j = 0; j < m; j++) {
        phi[j] = previous[j] - r[m] * previous[m - 1 - j];
      }
      phi[m] = r[m];
    }
    return phi;
  }

  /** d phi[j] / d r[k] of {@link #toCoefficients}. */
  static double[][] coefficientJacobian(double[] r) {
    int p = r.length;
    double[] phi = new double[p];
    double[] previous = new double[p];
    double[][] d = new double[p][p];
    double[][] dPrevious = new double[p][p];
    for (int m = 0; m < p; m++) {
      System.arraycopy(phi, 0, previous, 0, m);
      for (int j = 0; j < m; j++) {
        System.arraycopy(d[j], 0, dPrevious[j], 0, p);
      }
      for (int j = 0; j < m; j++) {
        phi[j] = previous[j] - r[m] * previous[m - 1 - j];
        for (int k = 0; k < p; k++) {
          d[j][k] = dPrevious[j][k] - r[m] * dPrevious[m - 1 - j][k];
        }
        d[j][m] -= previous[m - 1 - j];
      }
      phi[m] = r[m];
      d[m][m] = 1.0;
    }
    return d;
  }

  /**
   * Durbin-Levinson step-down: coefficients to partial autocorrelations. Returns null when the
   * polynomial has a root on or inside the unit circle.
   */
  static double[] fromCoefficients(double[] phi) {
    int p = phi.length;
    double[] a = phi.clone();
    double[] r = new double[p];
    for (int m = p - 1; m >= 0; m--) {
      double rm = a[m];
      if (!(Math.abs(rm) < 1.0)) {
        return null;
      }
      r[m] = rm;
      double[] next = new double[m];
      for (int j = 0; j < m; j++) {
        next[j] = (a[j] + rm * a[m - 1 - j]) / (1.0 - rm * rm);
      }
      System.arraycopy(next, 0, a, 0, m);
    }
    return r;
  }

  static double[] fromAngles(double[] u) {
    double[] r = new double[u.length];
    for (int k = 0; k < u.length; k++) {
      r[k] = BOUND * Math.sin(u[k]);
    }
    return r;
  }

  /**
   * Angles of a starting polynomial. A polynomial that is not stationary starts from zero;
   * the others are clamped to {@link #MAX_START}.
   */
  static double[] toAngles(double[] phi) {
    double[] u = new double[phi.length];
    double[] r = fromCoefficients(phi);
    if (r == null) {
      return u;
    }
    for (int k = 0; k < r.length; k++) {
      double clamped = Math.max(-MAX_START, Math.min(MAX_START, r[k] / BOUND));
      u[k] = Math.asin(clamped);
    }
    return u;
  }
}
