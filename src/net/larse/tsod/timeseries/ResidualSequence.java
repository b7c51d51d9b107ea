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
package net.larse.tsod.timeseries;

import com.google.common.base.Preconditions;

/**
 * One-step-ahead residuals aligned with the series they were computed from. The first
 * {@code offset} samples have no residual: they read as 0 and report {@code isDefined == false}.
 */
public final class ResidualSequence {
  private final int offset;
  private final double[] residuals;

  public ResidualSequence(int offset, double[] residuals) {
    Preconditions.checkArgument(offset >= 0, "negative offset %s", offset);
    this.offset = offset;
    this.residuals = residuals.clone();
  }

  /** Number of samples covered, defined or not. */
  public int size() {
    return offset + residuals.length;
  }

  public int getOffset() {
    return offset;
  }

  public int definedCount() {
    return residuals.length;
  }

  public boolean isDefined(int t) {
    return t >= offset && t < size();
  }

  public double get(int t) {
    Preconditions.checkElementIndex(t, size());
    return t < offset ? 0.0 : residuals[t - offset];
  }

  /** The defined residuals, starting at sample {@code offset}. */
  public double[] getDefined() {
    return residuals.clone();
  }
}
