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

/**
 * The classification of one sample. Fields a detector does not produce are NaN: the diff
 * detector fills the corrected value and the differences, the adaptive variance detector the
 * residual and the scores.
 */
public final class LabeledRecord {
  private final long timestamp;
  private final double value;
  private final Label label;
  private final double correctedValue;
  private final double centeredDiff;
  private final double previousDiff;
  private final double residual;
  private final double outlierScore;
  private final double changeScore;

  private LabeledRecord(long timestamp, double value, Label label, double correctedValue,
      double centeredDiff, double previousDiff, double residual, double outlierScore,
      double changeScore) {
    this.timestamp = timestamp;
    this.value = value;
    this.label = label;
    this.correctedValue = correctedValue;
    this.centeredDiff = centeredDiff;
    this.previousDiff = previousDiff;
    this.residual = residual;
    this.outlierScore = outlierScore;
    this.changeScore = changeScore;
  }

  public static LabeledRecord diff(long timestamp, double value, Label label,
      double correctedValue, double centeredDiff, double previousDiff) {
    return new LabeledRecord(timestamp, value, label, correctedValue, centeredDiff, previousDiff,
        Double.NaN, Double.NaN, Double.NaN);
  }

  public static LabeledRecord adaptive(long timestamp, double value, Label label,
      double residual, double outlierScore, double changeScore) {
    return new LabeledRecord(timestamp, value, label, Double.NaN, Double.NaN, Double.NaN,
        residual, outlierScore, changeScore);
  }

  public long getTimestamp() {
    return timestamp;
  }

  public double getValue() {
    return value;
  }

  public Label getLabel() {
    return label;
  }

  public double getCorrectedValue() {
    return correctedValue;
  }

  public double getCenteredDiff() {
    return centeredDiff;
  }

  public double getPreviousDiff() {
    return previousDiff;
  }

  public double getResidual() {
    return residual;
  }

  public double getOutlierScore() {
    return outlierScore;
  }

  public double getChangeScore() {
    return changeScore;
  }

  @Override
  public String toString() {
    return String.format("%d %s %s", timestamp, value, label.getName());
  }
}
