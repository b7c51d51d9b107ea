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

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import net.larse.tsod.algorithms.DetectionResult;
import net.larse.tsod.algorithms.DetectorType;
import net.larse.tsod.algorithms.LabeledRecord;

/** Writes {@code <column>_labeled.csv} files. */
public final class ResultWriter {
  private static final Joiner CSV = Joiner.on(',');
  private static final CharMatcher NEEDS_QUOTES = CharMatcher.anyOf(",\"\r\n");

  private final Path outputDir;

  public ResultWriter(Path outputDir) {
    this.outputDir = outputDir;
  }

  /**
   * @param table the table the column came from, for the date_time labels; may be null
   * @return the written file
   */
  public Path write(String column, DetectionResult result, CsvTable table) throws IOException {
    Files.createDirectories(outputDir);
    Path path = outputDir.resolve(fileName(column));
    boolean withDateTime = table != null && table.hasDateTime();
    boolean diff = result.getDetectorType() == DetectorType.DIFF;

    List<String> header = new ArrayList<>();
    if (withDateTime) {
      header.add(CsvTable.DATE_TIME);
    }
    header.add("index");
    header.add("value");
    if (diff) {
      header.add("corrected_value");
    } else {
      header.add("residual");
      header.add("outlier_score");
      header.add("change_score");
    }
    header.add("label");

    try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      writer.write(CSV.join(header));
      writer.newLine();
      List<String> cells = new ArrayList<>(header.size());
      for (int i = 0; i < result.size(); i++) {
        LabeledRecord record = result.get(i);
        cells.clear();
        if (withDateTime) {
          cells.add(escape(table.getDateTimeLabel(record.getTimestamp())));
        }
        cells.add(Integer.toString(i));
        cells.add(Double.toString(record.getValue()));
        if (diff) {
          cells.add(Double.toString(record.getCorrectedValue()));
        } else {
          cells.add(Double.toString(record.getResidual()));
          cells.add(Double.toString(record.getOutlierScore()));
          cells.add(Double.toString(record.getChangeScore()));
        }
        cells.add(record.getLabel().getName());
        writer.write(CSV.join(cells));
        writer.newLine();
      }
    }
    return path;
  }

  static String fileName(String column) {
    return CharMatcher.anyOf("/\\").replaceFrom(column, '_') + "_labeled.csv";
  }

  static String escape(String cell) {
    if (cell == null) {
      return "";
    }
    if (NEEDS_QUOTES.matchesAnyOf(cell)) {
      return '"' + cell.replace("\"", "\"\"") + '"';
    }
    return cell;
  }
}
