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

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Writes a configuration with a default entry for every data column of a table. */
public final class ConfigGenerator {
  private static final Logger logger = LogManager.getLogger(ConfigGenerator.class);

  private final Map<String, ColumnConfig> presets;

  public ConfigGenerator() {
    this(Collections.emptyMap());
  }

  /** @param presets entries used instead of the default for the named columns */
  public ConfigGenerator(Map<String, ColumnConfig> presets) {
    this.presets = presets;
  }

  /**
   * The entry given to columns without a preset: AR(2) with the adaptive variance defaults in
   * ts_params, and the diff detector with lambda_centrada 12 and automatic k.
   */
  public static ColumnConfig defaultEntry() {
    ColumnConfig entry = new ColumnConfig();
    entry.tsModel = "AR";
    entry.tsParams = new ColumnConfig.TsParams();
    entry.tsParams.q = 2;
    entry.tsParams.alpha = 0.005;
    entry.tsParams.quantile = 0.995;
    entry.tsParams.factorOlvido = 0.02;
    entry.tsParams.lagCambio = 2;
    entry.tsParams.suavizado = 7;
    entry.tsParams.changeQuantile = 0.99;
    entry.outlierDetector = "diff";
    entry.outlierParams = new ColumnConfig.OutlierParams();
    entry.outlierParams.lambdaCentrada = 12.0;
    entry.outlierParams.k = 0.0;
    return entry;
  }

  public DetectionConfig generate(List<String> header) {
    Map<String, ColumnConfig> columns = new LinkedHashMap<>();
    for (String column : header) {
      if (CsvTable.DATE_TIME.equals(column)) {
        continue;
      }
      ColumnConfig preset = presets.get(column);
      columns.put(column, preset != null ? preset : defaultEntry());
    }
    return new DetectionConfig(columns);
  }

  /**
   * Generates the configuration for the table and saves it.
   *
   * @throws FileAlreadyExistsException if output exists and overwrite is false
   */
  public DetectionConfig generate(CsvTable table, Path output, boolean overwrite)
      throws IOException {
    if (Files.exists(output) && !overwrite) {
      throw new FileAlreadyExistsException(output.toString(), null,
          "configuration exists, pass --overwrite to replace it");
    }
    DetectionConfig config = generate(table.getHeader());
    config.save(output);
    logger.info("Configuration written to {}: {} columns, {} excluded", output, config.size(),
        table.getHeader().size() - config.size());
    return config;
  }
}
