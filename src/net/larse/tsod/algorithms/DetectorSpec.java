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

/**
 * A detector and its arguments. The arguments are copied and validated on construction, later
 * changes to the caller's {@code Args} do not affect the spec.
 */
public final class DetectorSpec {
  private final DetectorType type;
  private final DiffDetector.Args diffArgs;
  private final AdaptiveVarianceDetector.Args adaptiveArgs;

  private DetectorSpec(DetectorType type, DiffDetector.Args diffArgs,
      AdaptiveVarianceDetector.Args adaptiveArgs) {
    this.type = type;
    this.diffArgs = diffArgs;
    this.adaptiveArgs = adaptiveArgs;
  }

  public static DetectorSpec diff(DiffDetector.Args args) {
    DiffDetector.Args copy = args.copy();
    copy.validate();
    return new DetectorSpec(DetectorType.DIFF, copy, null);
  }

  public static DetectorSpec adaptiveVariance(AdaptiveVarianceDetector.Args args) {
    AdaptiveVarianceDetector.Args copy = args.copy();
    copy.validate();
    return new DetectorSpec(DetectorType.ADAPTIVE_VARIANCE, null, copy);
  }

  public DetectorType getType() {
    return type;
  }

  public DiffDetector.Args getDiffArgs() {
    Preconditions.checkState(type == DetectorType.DIFF, "not a diff detector: %s", type);
    return diffArgs.copy();
  }

  public AdaptiveVarianceDetector.Args getAdaptiveArgs() {
    Preconditions.checkState(type == DetectorType.ADAPTIVE_VARIANCE,
        "not an adaptive variance detector: %s", type);
    return adaptiveArgs.copy();
  }

  @Override
  public String toString() {
    return type.getName() + " " + (type == DetectorType.DIFF ? diffArgs : adaptiveArgs);
  }
}
