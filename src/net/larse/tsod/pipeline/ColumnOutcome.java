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
package net.larse.tsod.pipeline;

import net.larse.tsod.algorithms.DetectionResult;
import net.larse.tsod.errors.DetectionException;
import net.larse.tsod.models.FittedModel;

/** What happened to one column: a result, or the failure that stopped it. */
public final class ColumnOutcome {
  private final String column;
  private final String configKey;
  private final int missingValues;
  private final DetectionResult result;
  private final FittedModel fittedModel;
  private final DetectionException failure;

  private ColumnOutcome(String column, String configKey, int missingValues,
      DetectionResult result, FittedModel fittedModel, DetectionException failure) {
    this.column = column;
    this.configKey = configKey;
    this.missingValues = missingValues;
    this.result = result;
    this.fittedModel = fittedModel;
    this.failure = failure;
  }

  static ColumnOutcome success(String column, String configKey, int missingValues,
      DetectionResult result, FittedModel fittedModel) {
    return new ColumnOutcome(column, configKey, missingValues, result, fittedModel, null);
  }

  static ColumnOutcome failure(String column, String configKey, int missingValues,
      DetectionException failure) {
    return new ColumnOutcome(column, configKey, missingValues, null, null, failure);
  }

  public String getColumn() {
    return column;
  }

  /** The matching configuration key, or null if the column is not configured. */
  public String getConfigKey() {
    return configKey;
  }

  public int getMissingValues() {
    return missingValues;
  }

  public boolean isSuccess() {
    return failure == null;
  }

  public DetectionResult getResult() {
    return result;
  }

  public FittedModel getFittedModel() {
    return fittedModel;
  }

  public DetectionException getFailure() {
    return failure;
  }
}
