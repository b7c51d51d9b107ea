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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.larse.tsod.timeseries.MissingValuePolicy;

public final class RunSummary {
  private final MissingValuePolicy fillPolicy;
  private final ImmutableList<ColumnOutcome> outcomes;

  RunSummary(MissingValuePolicy fillPolicy, List<ColumnOutcome> outcomes) {
    this.fillPolicy = fillPolicy;
    this.outcomes = ImmutableList.copyOf(outcomes);
  }

  public MissingValuePolicy getFillPolicy() {
    return fillPolicy;
  }

  /** One outcome per column, in processing order. */
  public List<ColumnOutcome> getOutcomes() {
    return outcomes;
  }

  public int processed() {
    int count = 0;
    for (ColumnOutcome outcome : outcomes) {
      if (outcome.isSuccess()) {
        count++;
      }
    }
    return count;
  }

  public int errors() {
    return outcomes.size() - processed();
  }

  public ColumnOutcome getOutcome(String column) {
    for (ColumnOutcome outcome : outcomes) {
      if (outcome.getColumn().equals(column)) {
        return outcome;
      }
    }
    return null;
  }
}
