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

import com.google.common.base.Preconditions;
import net.larse.tsod.algorithms.AdaptiveVarianceDetector;
import net.larse.tsod.algorithms.DetectionResult;
import net.larse.tsod.algorithms.DetectorSpec;
import net.larse.tsod.algorithms.DiffDetector;
import net.larse.tsod.errors.DetectionException;
import net.larse.tsod.models.FittedModel;
import net.larse.tsod.models.ModelSpec;
import net.larse.tsod.models.TimeSeriesModels;
import net.larse.tsod.timeseries.TimeSeries;

/**
 * Runs the configured model and detector over one filled series. A session runs once; its model
 * and detector state do not outlive it.
 */
public final class DetectionSession {
  public enum State {
    CONFIGURED,
    FITTING,
    DETECTING,
    DONE,
    FAILED
  }

  private final TimeSeries series;
  private final ModelSpec modelSpec;
  private final DetectorSpec detectorSpec;

  private State state = State.CONFIGURED;
  private FittedModel fittedModel;
  private DetectionException failure;

  /**
   * @param modelSpec the model to fit; may be null when the detector works on raw values
   */
  public DetectionSession(TimeSeries series, ModelSpec modelSpec, DetectorSpec detectorSpec) {
    Preconditions.checkArgument(series.countMissing() == 0,
        "%s: fill missing values before detection", series.getName());
    Preconditions.checkArgument(
        modelSpec != null || !detectorSpec.getType().requiresResiduals(),
        "%s needs a time series model", detectorSpec.getType().getName());
    this.series = series;
    this.modelSpec = modelSpec;
    this.detectorSpec = detectorSpec;
  }

  public DetectionResult run() throws DetectionException {
    Preconditions.checkState(state == State.CONFIGURED, "session already ran (%s)", state);
    try {
      DetectionResult result;
      switch (detectorSpec.getType()) {
        case DIFF:
          state = State.DETECTING;
          result = new DiffDetector(detectorSpec.getDiffArgs()).detect(series);
          break;
        case ADAPTIVE_VARIANCE:
          state = State.FITTING;
          fittedModel = TimeSeriesModels.fit(series, modelSpec);
          state = State.DETECTING;
          result = new AdaptiveVarianceDetector(detectorSpec.getAdaptiveArgs())
              .detect(series, fittedModel.getResiduals());
          break;
        default:
          throw new IllegalStateException("Unsupported detector " + detectorSpec.getType());
      }
      state = State.DONE;
      return result;
    } catch (DetectionException e) {
      state = State.FAILED;
      failure = e;
      throw e;
    }
  }

  public State getState() {
    return state;
  }

  /** The fitted model, or null if none was fit. */
  public FittedModel getFittedModel() {
    return fittedModel;
  }

  /** The failure that ended the run, or null. */
  public DetectionException getFailure() {
    return failure;
  }
}
