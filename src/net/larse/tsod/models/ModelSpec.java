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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * Which model to fit and its orders. For AR and MA models {@code q} is the single order; ARMA
 * uses {@code p} for the autoregressive and {@code q} for the moving average part.
 */
public final class ModelSpec {
  public static final int DEFAULT_ORDER = 2;
  public static final int DEFAULT_ARMA_P = 1;
  public static final int DEFAULT_MAX_ITERATIONS = 200;

  private final ModelType type;
  private final int p;
  private final int q;
  private final int maxIterations;

  private ModelSpec(ModelType type, int p, int q, int maxIterations) {
    Preconditions.checkArgument(q >= 1, "order q must be at least 1, got %s", q);
    Preconditions.checkArgument(type != ModelType.ARMA || p >= 1,
        "ARMA order p must be at least 1, got %s", p);
    Preconditions.checkArgument(maxIterations >= 1, "maxIterations must be positive");
    this.type = type;
    this.p = p;
    this.q = q;
    this.maxIterations = maxIterations;
  }

  public static ModelSpec ar(int q) {
    return new ModelSpec(ModelType.AR, 0, q, DEFAULT_MAX_ITERATIONS);
  }

  public static ModelSpec ma(int q) {
    return new ModelSpec(ModelType.MA, 0, q, DEFAULT_MAX_ITERATIONS);
  }

  public static ModelSpec arma(int p, int q) {
    return new ModelSpec(ModelType.ARMA, p, q, DEFAULT_MAX_ITERATIONS);
  }

  public static ModelSpec of(ModelType type, int p, int q) {
    switch (type) {
      case AR:
        return ar(q);
      case MA:
        return ma(q);
      case ARMA:
        return arma(p, q);
      default:
        throw new IllegalArgumentException("Unsupported model " + type);
    }
  }

  public ModelSpec withMaxIterations(int maxIterations) {
    return new ModelSpec(type, p, q, maxIterations);
  }

  public ModelType getType() {
    return type;
  }

  public int getP() {
    return p;
  }

  public int getQ() {
    return q;
  }

  public int getMaxIterations() {
    return maxIterations;
  }

  /** Number of lagged values in the prediction. */
  public int getArOrder() {
    switch (type) {
      case AR:
        return q;
      case ARMA:
        return p;
      default:
        return 0;
    }
  }

  /** Number of lagged innovations in the prediction. */
  public int getMaOrder() {
    return type == ModelType.AR ? 0 : q;
  }

  /** Samples at the start of the series without a residual. */
  public int getOrder() {
    return Math.max(getArOrder(), getMaOrder());
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("type", type)
        .add("p", getArOrder())
        .add("q", getMaOrder())
        .add("maxIterations", maxIterations)
        .toString();
  }
}
