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

/** Static array manipulation functions. */
public class ArrayHelper {
  private ArrayHelper() {}

  /**
   * Count the number of NaN entries in array.
   */
  public static int countMissing(double[] array) {
    int count = 0;
    for (double value : array) {
      if (Double.isNaN(value)) {
        count++;
      }
    }
    return count;
  }

  /**
   * Find the first non-NaN entry in array, between start (incl) and end (excl). if end is
   * negative, it is taken as the number of entries from the end (ie: -1 = len-1).
   */
  public static int firstObserved(double[] array, int start, int end) {
    if (end < 0) {
      end = array.length + end;
    }
    for (int i = start; i < end; i++) {
      if (!Double.isNaN(array[i])) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Find the last non-NaN entry in array, between start (incl) and end (excl). if end is
   * negative, it is taken as the number of entries from the end (ie: -1 = len-1).
   */
  public static int lastObserved(double[] array, int start, int end) {
    if (end < 0) {
      end = array.length + end;
    }
    for (int i = end - 1; i >= start; i--) {
      if (!Double.isNaN(array[i])) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Replaces each NaN with the last observed value before it. Leading NaNs take the first
   * observed value. The array must contain at least one observation.
   */
  public static double[] forwardFill(double[] values) {
    double[] filled = values.clone();
    int first = firstObserved(filled, 0, filled.length);
    for (int i = 0; i < first; i++) {
      filled[i] = filled[first];
    }
    for (int i = first + 1; i < filled.length; i++) {
      if (Double.isNaN(filled[i])) {
        filled[i] = filled[i - 1];
      }
    }
    return filled;
  }

  /**
   * Replaces each NaN by linear interpolation over x between the observed neighbours. NaNs
   * before the first or after the last observation take the nearest observed value. The array
   * must contain at least one observation.
   */
  public static double[] interpolate(long[] x, double[] values) {
    double[] filled = values.clone();
    int first = firstObserved(filled, 0, filled.length);
    int last = lastObserved(filled, 0, filled.length);
    for (int i = 0; i < first; i++) {
      filled[i] = filled[first];
    }
    for (int i = last + 1; i < filled.length; i++) {
      filled[i] = filled[last];
    }
    int left = first;
    for (int i = first + 1; i <= last; i++) {
      if (Double.isNaN(filled[i])) {
        continue;
      }
      for (int j = left + 1; j < i; j++) {
        filled[j] = interpolate(x[left], filled[left], x[i], filled[i], x[j]);
      }
      left = i;
    }
    return filled;
  }

  /**
   * The value at x on the line through (x0, y0) and (x1, y1).
   */
  public static double interpolate(long x0, double y0, long x1, double y1, long x) {
    if (x1 == x0) {
      return y0;
    }
    double w = (double) (x - x0) / (double) (x1 - x0);
    return y0 + w * (y1 - y0);
  }
}
