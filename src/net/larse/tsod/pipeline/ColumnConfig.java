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

import com.google.common.base.MoreObjects;
import com.google.gson.annotations.SerializedName;
import net.larse.tsod.algorithms.AdaptiveVarianceDetector;
import net.larse.tsod.algorithms.DetectorSpec;
import net.larse.tsod.algorithms.DetectorType;
import net.larse.tsod.algorithms.DiffDetector;
import net.larse.tsod.errors.ConfigMismatchException;
import net.larse.tsod.models.ModelSpec;
import net.larse.tsod.models.ModelType;

/**
 * The configuration entry of one column as stored in the JSON file. Absent keys stay null and
 * take their defaults when the specs are built, so a file round trips unchanged.
 */
public class ColumnConfig {
  static final String DEFAULT_MODEL = "MA";
  static final String DEFAULT_DETECTOR = "adaptive_variance";

  @SerializedName("ts_model")
  String tsModel;

  @SerializedName("ts_params")
  TsParams tsParams;

  @SerializedName("outlier_detector")
  String outlierDetector;

  @SerializedName("outlier_params")
  OutlierParams outlierParams;

  /** Model orders and the adaptive variance detector's arguments. */
  public static class TsParams {
    Integer q;
    Integer p;
    Double alpha;
    Double quantile;

    @SerializedName("factor_olvido")
    Double factorOlvido;

    @SerializedName("lag_cambio")
    Integer lagCambio;

    Integer suavizado;

    @SerializedName("change_quantile")
    Double changeQuantile;

    @SerializedName("max_iterations")
    Integer maxIterations;
  }

  /** The diff detector's arguments; a null lambda_centrada means automatic. */
  public static class OutlierParams {
    @SerializedName("lambda_centrada")
    Double lambdaCentrada;

    Double k;
  }

  public String getTsModel() {
    return MoreObjects.firstNonNull(tsModel, DEFAULT_MODEL);
  }

  public String getOutlierDetector() {
    return MoreObjects.firstNonNull(outlierDetector, DEFAULT_DETECTOR);
  }

  public DetectorType detectorType(String column) throws ConfigMismatchException {
    try {
      return DetectorType.fromName(getOutlierDetector());
    } catch (IllegalArgumentException e) {
      throw new ConfigMismatchException(column, e.getMessage(), e);
    }
  }

  public ModelSpec toModelSpec(String column) throws ConfigMismatchException {
    ModelType type;
    try {
      type = ModelType.fromName(getTsModel());
    } catch (IllegalArgumentException e) {
      throw new ConfigMismatchException(column, e.getMessage(), e);
    }
    TsParams params = tsParams == null ? new TsParams() : tsParams;
    try {
      return ModelSpec.of(type,
          MoreObjects.firstNonNull(params.p, ModelSpec.DEFAULT_ARMA_P),
          MoreObjects.firstNonNull(params.q, ModelSpec.DEFAULT_ORDER))
          .withMaxIterations(
              MoreObjects.firstNonNull(params.maxIterations, ModelSpec.DEFAULT_MAX_ITERATIONS));
    } catch (IllegalArgumentException e) {
      throw new ConfigMismatchException(column, "invalid ts_params: " + e.getMessage(), e);
    }
  }

  public DetectorSpec toDetectorSpec(String column) throws ConfigMismatchException {
    DetectorType type = detectorType(column);
    try {
      switch (type) {
        case DIFF:
          return DetectorSpec.diff(diffArgs());
        case ADAPTIVE_VARIANCE:
          return DetectorSpec.adaptiveVariance(adaptiveArgs());
        default:
          throw new ConfigMismatchException(column, "Unsupported detector " + type);
      }
    } catch (IllegalArgumentException e) {
      throw new ConfigMismatchException(column,
          "invalid " + type.getName() + " parameters: " + e.getMessage(), e);
    }
  }

  private DiffDetector.Args diffArgs() {
    DiffDetector.Args args = new DiffDetector.Args();
    if (outlierParams != null) {
      args.lambdaCentrada = MoreObjects.firstNonNull(outlierParams.lambdaCentrada, 0.0);
      args.k = MoreObjects.firstNonNull(outlierParams.k, 0.0);
    }
    return args;
  }

  private AdaptiveVarianceDetector.Args adaptiveArgs() {
    AdaptiveVarianceDetector.Args args = new AdaptiveVarianceDetector.Args();
    if (tsParams != null) {
      args.alpha = MoreObjects.firstNonNull(tsParams.alpha, args.alpha);
      args.quantile = MoreObjects.firstNonNull(tsParams.quantile, args.quantile);
      args.factorOlvido = MoreObjects.firstNonNull(tsParams.factorOlvido, args.factorOlvido);
      args.lagCambio = MoreObjects.firstNonNull(tsParams.lagCambio, args.lagCambio);
      args.suavizado = MoreObjects.firstNonNull(tsParams.suavizado, args.suavizado);
      args.changeQuantile =
          MoreObjects.firstNonNull(tsParams.changeQuantile, args.changeQuantile);
    }
    return args;
  }
}
