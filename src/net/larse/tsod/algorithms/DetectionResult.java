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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Labeled records of one series with the thresholds that produced them. */
public final class DetectionResult {
  private final DetectorType detectorType;
  private final ImmutableList<LabeledRecord> records;
  private final ImmutableMap<String, Double> thresholds;
  private final Map<Label, Integer> counts = new EnumMap<>(Label.class);

  public DetectionResult(DetectorType detectorType, List<LabeledRecord> records,
      Map<String, Double> thresholds) {
    this.detectorType = detectorType;
    this.records = ImmutableList.copyOf(records);
    this.thresholds = ImmutableMap.copyOf(thresholds);
    for (Label label : Label.values()) {
      counts.put(label, 0);
    }
    for (LabeledRecord record : records) {
      counts.merge(record.getLabel(), 1, Integer::sum);
    }
  }

  public DetectorType getDetectorType() {
    return detectorType;
  }

  public List<LabeledRecord> getRecords() {
    return records;
  }

  public int size() {
    return records.size();
  }

  public LabeledRecord get(int i) {
    return records.get(i);
  }

  public Map<String, Double> getThresholds() {
    return thresholds;
  }

  public double getThreshold(String name) {
    Double value = thresholds.get(name);
    Preconditions.checkArgument(value != null, "no threshold named %s", name);
    return value;
  }

  public int count(Label label) {
    return counts.get(label);
  }

  public Label[] labels() {
    Label[] labels = new Label[records.size()];
    for (int i = 0; i < labels.length; i++) {
      labels[i] = records.get(i).getLabel();
    }
    return labels;
  }
}
