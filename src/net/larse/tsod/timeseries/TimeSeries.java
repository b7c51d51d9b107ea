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
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import net.larse.tsod.errors.DetectionException.Stage;
import net.larse.tsod.errors.InsufficientDataException;
import net.larse.tsod.helper.ArrayHelper;
import org.apache.commons.math.stat.descriptive.DescriptiveStatistics;

/**
 * The samples of one column in chronological order. Timestamps are strictly increasing ordinals;
 * values may be NaN until the series is filled.
 */
public final class TimeSeries {
  private final String name;
  private final long[] timestamps;
  private final double[] values;

  public TimeSeries(String name, long[] timestamps, double[] values) {
    Preconditions.checkNotNull(name, "name");
    Preconditions.checkArgument(timestamps.length == values.length,
        "%s timestamps for %s values", timestamps.length, values.length);
    for (int i = 1; i < timestamps.length; i++) {
      Preconditions.checkArgument(timestamps[i] > timestamps[i - 1],
          "timestamps must be strictly increasing, got %s after %s", timestamps[i],
          timestamps[i - 1]);
    }
    this.name = name;
    this.timestamps = timestamps.clone();
    this.values = values.clone();
  }

  /** A series whose timestamps are the positions 0..n-1. */
  public static TimeSeries of(String name, double... values) {
    long[] timestamps = new long[values.length];
    for (int i = 0; i < timestamps.length; i++) {
      timestamps[i] = i;
    }
    return new TimeSeries(name, timestamps, values);
  }

  public String getName() {
    return name;
  }

  public int size() {
    return values.length;
  }

  public long getTimestamp(int i) {
    return timestamps[i];
  }

  public double getValue(int i) {
    return values[i];
  }

  public long[] getTimestamps() {
    return timestamps.clone();
  }

  public double[] getValues() {
    return values.clone();
  }

  public int countMissing() {
    return ArrayHelper.countMissing(values);
  }

  public DescriptiveStatistics statistics() {
    DescriptiveStatistics stats = new DescriptiveStatistics();
    for (double value : values) {
      if (!Double.isNaN(value)) {
        stats.addValue(value);
      }
    }
    return stats;
  }

  /**
   * Returns a series without missing values, filled according to the policy. A series without
   * gaps is returned as is.
   *
   * @throws InsufficientDataException if the series has no observation to fill from
   */
  public TimeSeries fill(MissingValuePolicy policy) throws InsufficientDataException {
    int missing = countMissing();
    if (missing == 0) {
      return this;
    }
    if (missing == values.length) {
      throw new InsufficientDataException(name, Stage.FILLING,
          "no observed value among " + values.length + " samples");
    }

    switch (policy) {
      case FORWARD_FILL:
        return new TimeSeries(name, timestamps, ArrayHelper.forwardFill(values));
      case LINEAR_INTERPOLATION:
        return new TimeSeries(name, timestamps, ArrayHelper.interpolate(timestamps, values));
      case DROP:
        LongArrayList keptTimestamps = new LongArrayList(values.length - missing);
        DoubleArrayList keptValues = new DoubleArrayList(values.length - missing);
        for (int i = 0; i < values.length; i++) {
          if (!Double.isNaN(values[i])) {
            keptTimestamps.add(timestamps[i]);
            keptValues.add(values[i]);
          }
        }
        return new TimeSeries(name, keptTimestamps.toLongArray(), keptValues.toDoubleArray());
      default:
        throw new IllegalArgumentException("Unsupported policy " + policy);
    }
  }
}
