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

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import net.larse.tsod.algorithms.DetectionResult;
import net.larse.tsod.algorithms.DetectorSpec;
import net.larse.tsod.algorithms.DetectorType;
import net.larse.tsod.algorithms.DiffDetector;
import net.larse.tsod.algorithms.Label;
import net.larse.tsod.errors.ConfigMismatchException;
import net.larse.tsod.errors.DetectionException;
import net.larse.tsod.errors.DetectionException.Stage;
import net.larse.tsod.errors.InsufficientDataException;
import net.larse.tsod.helper.AlgorithmBase;
import net.larse.tsod.models.ModelSpec;
import net.larse.tsod.timeseries.MissingValuePolicy;
import net.larse.tsod.timeseries.TimeSeries;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs a {@link DetectionSession} for each configured column of a table. A column that fails is
 * logged and reported in the summary; the others carry on.
 */
public final class DetectionPipeline {
  private static final Logger logger = LogManager.getLogger(DetectionPipeline.class);

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "How missing values are filled before modeling.")
    @Optional
    public MissingValuePolicy fillPolicy = MissingValuePolicy.FORWARD_FILL;

    @Doc(help = "Worker threads; 1 processes the columns one after another.")
    @Optional
    public int threads = 1;

    @Doc(help = "Columns with fewer observed values are not processed.")
    @Optional
    public int minObservations = 10;
  }

  private final DetectionConfig config;
  private final Args args;

  public DetectionPipeline(DetectionConfig config) {
    this(config, new Args());
  }

  public DetectionPipeline(DetectionConfig config, Args args) {
    this.config = config;
    this.args = args;
  }

  /**
   * @param requested columns to process, or null for every table column with a configuration
   */
  public RunSummary run(CsvTable table, List<String> requested) {
    List<ColumnOutcome> outcomes = new ArrayList<>();
    List<String> columns = new ArrayList<>();
    List<String> keys = new ArrayList<>();

    if (requested == null) {
      for (String column : table.getDataColumns()) {
        String key = config.findKey(column).orElse(null);
        if (key != null) {
          columns.add(column);
          keys.add(key);
        }
      }
      logger.info("Processing all configured columns ({})", columns.size());
    } else {
      logger.info("Processing requested columns {}", requested);
      for (String column : requested) {
        String key = config.findKey(column).orElse(null);
        if (key == null) {
          outcomes.add(mismatch(column, null, "not found in the configuration"));
        } else if (!table.hasColumn(column)) {
          outcomes.add(mismatch(column, key, "not found in the table"));
        } else {
          columns.add(column);
          keys.add(key);
        }
      }
    }
    if (columns.isEmpty()) {
      logger.warn("No columns to process");
    }

    if (args.threads <= 1 || columns.size() <= 1) {
      for (int i = 0; i < columns.size(); i++) {
        outcomes.add(processColumn(table, columns.get(i), keys.get(i)));
      }
    } else {
      ExecutorService executor = Executors.newFixedThreadPool(
          Math.min(args.threads, columns.size()),
          new ThreadFactoryBuilder().setNameFormat("tsod-worker-%d").build());
      try {
        List<Future<ColumnOutcome>> futures = new ArrayList<>();
        for (int i = 0; i < columns.size(); i++) {
          String column = columns.get(i);
          String key = keys.get(i);
          futures.add(executor.submit(() -> processColumn(table, column, key)));
        }
        for (Future<ColumnOutcome> future : futures) {
          outcomes.add(Futures.getUnchecked(future));
        }
      } finally {
        executor.shutdown();
      }
    }

    RunSummary summary = new RunSummary(args.fillPolicy, outcomes);
    logger.info("Pipeline finished: {} columns processed, {} errors, missing values: {}",
        summary.processed(), summary.errors(), args.fillPolicy.getName());
    return summary;
  }

  ColumnOutcome processColumn(CsvTable table, String column, String key) {
    TimeSeries raw = table.toTimeSeries(column);
    int missing = raw.countMissing();
    try {
      ColumnConfig columnConfig = config.get(key);
      if (columnConfig == null) {
        throw new ConfigMismatchException(column, "configuration entry " + key + " is null");
      }
      DetectorSpec detectorSpec = columnConfig.toDetectorSpec(column);
      ModelSpec modelSpec = detectorSpec.getType().requiresResiduals()
          ? columnConfig.toModelSpec(column)
          : null;

      int observed = raw.size() - missing;
      if (observed < args.minObservations) {
        throw new InsufficientDataException(column, Stage.FILLING, String.format(
            "only %d observed values, at least %d needed", observed, args.minObservations));
      }
      TimeSeries series = raw.fill(args.fillPolicy);
      if (missing > 0) {
        logger.info("{}: filled {} missing values ({})", column, missing,
            args.fillPolicy.getName());
      }

      logger.info("{}: {}{}", column, detectorSpec,
          modelSpec == null ? "" : ", model " + modelSpec);
      DetectionSession session = new DetectionSession(series, modelSpec, detectorSpec);
      DetectionResult result = session.run();
      logResult(column, result);
      return ColumnOutcome.success(column, key, missing, result, session.getFittedModel());
    } catch (DetectionException e) {
      logger.error("Error processing {}", e.describe());
      return ColumnOutcome.failure(column, key, missing, e);
    }
  }

  private static ColumnOutcome mismatch(String column, String key, String reason) {
    ConfigMismatchException e = new ConfigMismatchException(column, "column " + reason);
    logger.warn("{}", e.describe());
    return ColumnOutcome.failure(column, key, 0, e);
  }

  private static void logResult(String column, DetectionResult result) {
    if (result.getDetectorType() == DetectorType.DIFF) {
      logger.info("{}: normal {}, outliers {}, lambda_centrada {}, k {}", column,
          result.count(Label.NORMAL), result.count(Label.OUTLIER),
          String.format("%.4f", result.getThreshold(DiffDetector.LAMBDA_CENTRADA)),
          String.format("%.4f", result.getThreshold(DiffDetector.K)));
    } else {
      logger.info("{}: normal {}, outliers {}, changes {}", column, result.count(Label.NORMAL),
          result.count(Label.OUTLIER), result.count(Label.CHANGE));
    }
  }
}
