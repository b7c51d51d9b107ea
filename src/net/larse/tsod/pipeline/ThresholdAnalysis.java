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

import com.google.common.base.Joiner;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.annotations.SerializedName;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import net.larse.tsod.algorithms.AdaptiveVarianceDetector;
import net.larse.tsod.algorithms.DetectionResult;
import net.larse.tsod.algorithms.DetectorType;
import net.larse.tsod.algorithms.DiffDetector;
import net.larse.tsod.algorithms.Label;
import net.larse.tsod.errors.DetectionException;
import net.larse.tsod.models.FittedModel;
import net.larse.tsod.models.ModelSpec;
import net.larse.tsod.models.TimeSeriesModels;
import net.larse.tsod.timeseries.MissingValuePolicy;
import net.larse.tsod.timeseries.TimeSeries;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Grid search over detector parameters. For each column it runs the configured detector over a
 * grid of thresholds and recommends the most sensitive setting whose outlier ratio falls in the
 * target band, or the setting closest to the band's midpoint. The configuration is not changed.
 */
public final class ThresholdAnalysis {
  private static final Logger logger = LogManager.getLogger(ThresholdAnalysis.class);

  static final double[] DIFF_LAMBDA_GRID = {5, 8, 10, 12, 15, 18, 20, 25};
  static final double[] DIFF_K_GRID = {0, 2, 5, 8, 12};
  static final double[] ADAPTIVE_ALPHA_GRID = {0.001, 0.003, 0.005, 0.007, 0.01};
  static final double[] ADAPTIVE_QUANTILE_GRID = {0.99, 0.995, 0.997, 0.999};

  static final double TARGET_MIN = 0.005;
  static final double TARGET_MAX = 0.05;
  static final double MAX_CHANGE_RATIO = 0.01;
  static final int MIN_DIFF_POINTS = 30;
  static final int MIN_ADAPTIVE_POINTS = 80;

  public static final String IN_TARGET_BAND = "in_target_band";
  public static final String CLOSEST_TO_TARGET = "closest_to_target";
  public static final String TOO_FEW_POINTS = "too_few_points";
  public static final String FIT_FAILED = "fit_failed";

  /** One grid setting and the label ratios it produced. */
  public static class GridPoint {
    @SerializedName("lambda_centrada")
    Double lambdaCentrada;

    Double k;
    Double alpha;
    Double quantile;

    @SerializedName("outlier_ratio")
    double outlierRatio;

    @SerializedName("change_ratio")
    Double changeRatio;

    String note;

    GridPoint copy() {
      GridPoint copy = new GridPoint();
      copy.lambdaCentrada = lambdaCentrada;
      copy.k = k;
      copy.alpha = alpha;
      copy.quantile = quantile;
      copy.outlierRatio = outlierRatio;
      copy.changeRatio = changeRatio;
      copy.note = note;
      return copy;
    }

    public Double getLambdaCentrada() {
      return lambdaCentrada;
    }

    public Double getK() {
      return k;
    }

    public Double getAlpha() {
      return alpha;
    }

    public Double getQuantile() {
      return quantile;
    }

    public double getOutlierRatio() {
      return outlierRatio;
    }

    public Double getChangeRatio() {
      return changeRatio;
    }
  }

  public static class ColumnAnalysis {
    transient String column;
    String detector;
    String note;
    GridPoint recommendation;
    List<GridPoint> grid = new ArrayList<>();

    public String getColumn() {
      return column;
    }

    public String getNote() {
      return note;
    }

    /** The recommended setting, or null when the column could not be analyzed. */
    public GridPoint getRecommendation() {
      return recommendation;
    }

    public List<GridPoint> getGrid() {
      return grid;
    }
  }

  public ColumnAnalysis analyzeDiff(TimeSeries series) {
    ColumnAnalysis analysis = newAnalysis(series, DetectorType.DIFF);
    TimeSeries observed = dropMissing(series);
    if (observed == null || observed.size() < MIN_DIFF_POINTS) {
      analysis.note = TOO_FEW_POINTS;
      return analysis;
    }

    for (double lambda : DIFF_LAMBDA_GRID) {
      for (double k : DIFF_K_GRID) {
        DiffDetector.Args args = new DiffDetector.Args();
        args.lambdaCentrada = lambda;
        args.k = k;
        DetectionResult result = new DiffDetector(args).detect(observed);
        GridPoint point = new GridPoint();
        point.lambdaCentrada = lambda;
        point.k = k;
        point.outlierRatio = ratio(result, Label.OUTLIER);
        analysis.grid.add(point);
      }
    }
    recommend(analysis, false);
    return analysis;
  }

  /** Runs the adaptive variance grid on the residuals of an MA(2) fit. */
  public ColumnAnalysis analyzeAdaptive(TimeSeries series) {
    ColumnAnalysis analysis = newAnalysis(series, DetectorType.ADAPTIVE_VARIANCE);
    TimeSeries observed = dropMissing(series);
    if (observed == null || observed.size() < MIN_ADAPTIVE_POINTS) {
      analysis.note = TOO_FEW_POINTS;
      return analysis;
    }

    try {
      FittedModel model = TimeSeriesModels.fit(observed, ModelSpec.ma(2));
      for (double alpha : ADAPTIVE_ALPHA_GRID) {
        for (double quantile : ADAPTIVE_QUANTILE_GRID) {
          AdaptiveVarianceDetector.Args args = new AdaptiveVarianceDetector.Args();
          args.alpha = alpha;
          args.quantile = quantile;
          DetectionResult result =
              new AdaptiveVarianceDetector(args).detect(observed, model.getResiduals());
          GridPoint point = new GridPoint();
          point.alpha = alpha;
          point.quantile = quantile;
          point.outlierRatio = ratio(result, Label.OUTLIER);
          point.changeRatio = ratio(result, Label.CHANGE);
          analysis.grid.add(point);
        }
      }
    } catch (DetectionException e) {
      logger.warn("Threshold analysis skipped {}", e.describe());
      analysis.note = FIT_FAILED;
      analysis.grid.clear();
      return analysis;
    }
    recommend(analysis, true);
    return analysis;
  }

  /**
   * Analyzes the requested columns, or every configured column present in the table when
   * requested is null. Columns configured for the diff detector get the diff grid, all others
   * the adaptive variance grid.
   */
  public List<ColumnAnalysis> run(CsvTable table, DetectionConfig config, List<String> requested) {
    List<String> columns = new ArrayList<>();
    if (requested == null) {
      for (String key : config.keys()) {
        if (table.hasColumn(key)) {
          columns.add(key);
        }
      }
    } else {
      for (String column : requested) {
        if (table.hasColumn(column)) {
          columns.add(column);
        } else {
          logger.warn("{}: not in the table, skipped", column);
        }
      }
    }

    List<ColumnAnalysis> analyses = new ArrayList<>();
    for (String column : columns) {
      ColumnConfig columnConfig = config.findKey(column).map(config::get).orElse(null);
      boolean diff = columnConfig != null
          && DetectorType.DIFF.getName().equals(columnConfig.getOutlierDetector());
      TimeSeries series = table.toTimeSeries(column);
      ColumnAnalysis analysis = diff ? analyzeDiff(series) : analyzeAdaptive(series);
      logger.info("{}: {} {}", column, analysis.detector, analysis.note);
      analyses.add(analysis);
    }
    return analyses;
  }

  /** Writes {@code <prefix>_summary.csv} and {@code <prefix>_details.json} to outputDir. */
  public void write(Path outputDir, String prefix, List<ColumnAnalysis> analyses)
      throws IOException {
    Files.createDirectories(outputDir);
    Path summaryPath = outputDir.resolve(prefix + "_summary.csv");
    Joiner csv = Joiner.on(',').useForNull("");
    try (BufferedWriter writer = Files.newBufferedWriter(summaryPath, StandardCharsets.UTF_8)) {
      writer.write("column,detector,status,lambda_centrada,k,alpha,quantile,outlier_ratio,"
          + "change_ratio");
      writer.newLine();
      for (ColumnAnalysis analysis : analyses) {
        GridPoint rec = analysis.recommendation;
        if (rec == null) {
          writer.write(csv.join(ResultWriter.escape(analysis.column), analysis.detector,
              analysis.note, null, null, null, null, null, null));
        } else {
          writer.write(csv.join(ResultWriter.escape(analysis.column), analysis.detector,
              analysis.note, rec.lambdaCentrada, rec.k, rec.alpha, rec.quantile,
              rec.outlierRatio, rec.changeRatio));
        }
        writer.newLine();
      }
    }

    JsonObject details = new JsonObject();
    for (ColumnAnalysis analysis : analyses) {
      details.add(analysis.column, DetectionConfig.GSON.toJsonTree(analysis));
    }
    JsonArray band = new JsonArray();
    band.add(TARGET_MIN);
    band.add(TARGET_MAX);
    JsonObject report = new JsonObject();
    report.addProperty("generated_at_utc", Instant.now().toString());
    report.add("target_band", band);
    report.add("details", details);

    Path detailsPath = outputDir.resolve(prefix + "_details.json");
    try (Writer writer = Files.newBufferedWriter(detailsPath, StandardCharsets.UTF_8)) {
      DetectionConfig.GSON.toJson(report, writer);
    }
    logger.info("Threshold report written to {} and {}", summaryPath, detailsPath);
  }

  private static ColumnAnalysis newAnalysis(TimeSeries series, DetectorType type) {
    ColumnAnalysis analysis = new ColumnAnalysis();
    analysis.column = series.getName();
    analysis.detector = type.getName();
    return analysis;
  }

  private static TimeSeries dropMissing(TimeSeries series) {
    if (series.countMissing() == series.size()) {
      return null;
    }
    try {
      return series.fill(MissingValuePolicy.DROP);
    } catch (DetectionException e) {
      throw new IllegalStateException("series with observations could not be filled", e);
    }
  }

  private static double ratio(DetectionResult result, Label label) {
    return result.size() == 0 ? 0.0 : (double) result.count(label) / result.size();
  }

  /**
   * The first in-band setting in grid order (thresholds ascending), else the one closest to the
   * band midpoint, ties broken by the lower change ratio.
   */
  private static void recommend(ColumnAnalysis analysis, boolean limitChanges) {
    GridPoint best = null;
    for (GridPoint point : analysis.grid) {
      boolean inBand = point.outlierRatio >= TARGET_MIN && point.outlierRatio <= TARGET_MAX;
      if (inBand && (!limitChanges || point.changeRatio <= MAX_CHANGE_RATIO)) {
        best = point;
        break;
      }
    }
    if (best != null) {
      analysis.note = IN_TARGET_BAND;
    } else {
      double mid = (TARGET_MIN + TARGET_MAX) / 2;
      for (GridPoint point : analysis.grid) {
        if (best == null || closer(point, best, mid)) {
          best = point;
        }
      }
      analysis.note = CLOSEST_TO_TARGET;
    }
    analysis.recommendation = best.copy();
    analysis.recommendation.note = analysis.note;
  }

  private static boolean closer(GridPoint a, GridPoint b, double mid) {
    double da = Math.abs(a.outlierRatio - mid);
    double db = Math.abs(b.outlierRatio - mid);
    if (da != db) {
      return da < db;
    }
    return a.changeRatio != null && b.changeRatio != null && a.changeRatio < b.changeRatio;
  }
}
