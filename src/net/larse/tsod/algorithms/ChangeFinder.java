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
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import java.util.Arrays;

/**
 * Two stage change score. The first {@link SequentialAr} scores each input against its recent
 * past (the anomaly score), the scores are smoothed with a trailing moving average and a second
 * {@link SequentialAr} scores the smoothed sequence. A persistent level shift raises the second
 * score, an isolated spike is averaged away.
 *
 * <p>The change score of a sample is defined once the second stage has seen
 * {@code ceil(1 / forgettingFactor)} values.
 */
public final class ChangeFinder {
  private final double forgettingFactor;
  private final int order;
  private final int smoothing;
  private final int warmUp;

  public ChangeFinder(double forgettingFactor, int order, int smoothing) {
    Preconditions.checkArgument(smoothing >= 1, "smoothing window must be at least 1");
    this.forgettingFactor = forgettingFactor;
    this.order = order;
    this.smoothing = smoothing;
    this.warmUp = (int) Math.ceil(1.0 / forgettingFactor);
  }

  public static class Scores {
    private final double[] anomalyScores;
    private final double[] changeScores;
    private final int firstDefined;

    Scores(double[] anomalyScores, double[] changeScores, int firstDefined) {
      this.anomalyScores = anomalyScores;
      this.changeScores = changeScores;
      this.firstDefined = firstDefined;
    }

    /** First stage scores, 0 where the stage had no history yet. */
    public double[] getAnomalyScores() {
      return anomalyScores.clone();
    }

    /** Second stage scores, 0 where undefined. */
    public double[] getChangeScores() {
      return changeScores.clone();
    }

    /** Index of the first defined change score, or the input length if there is none. */
    public int getFirstDefined() {
      return firstDefined;
    }

    public boolean isDefined(int t) {
      return t >= firstDefined;
    }

    public double[] getDefinedChangeScores() {
      return Arrays.copyOfRange(changeScores, firstDefined, changeScores.length);
    }
  }

  public Scores score(double[] x) {
    int n = x.length;
    double[] anomaly = new double[n];
    double[] change = new double[n];
    int firstDefined = n;

    SequentialAr first = new SequentialAr(forgettingFactor, order);
    SequentialAr second = new SequentialAr(forgettingFactor, order);
    double[] history = new double[order];
    double[] smoothedHistory = new double[order];
    int historySize = 0;
    int smoothedHistorySize = 0;
    DoubleArrayList window = new DoubleArrayList(smoothing);

    for (int t = 0; t < n; t++) {
      if (historySize == order) {
        anomaly[t] = first.update(x[t], history);
        if (window.size() == smoothing) {
          window.removeDouble(0);
        }
        window.add(anomaly[t]);
        double smoothed = mean(window);

        if (smoothedHistorySize == order) {
          double score = second.update(smoothed, smoothedHistory);
          if (second.getUpdates() > warmUp) {
            change[t] = score;
            firstDefined = Math.min(firstDefined, t);
          }
        }
        smoothedHistorySize = push(smoothedHistory, smoothedHistorySize, smoothed);
      }
      historySize = push(history, historySize, x[t]);
    }
    return new Scores(anomaly, change, firstDefined);
  }

  private static double mean(DoubleArrayList values) {
    double sum = 0;
    for (int i = 0; i < values.size(); i++) {
      sum += values.getDouble(i);
    }
    return sum / values.size();
  }

  /** Shifts value in at the front of a most-recent-first buffer, returns the new fill. */
  private static int push(double[] buffer, int size, double value) {
    System.arraycopy(buffer, 0, buffer, 1, buffer.length - 1);
    buffer[0] = value;
    return Math.min(size + 1, buffer.length);
  }
}
