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
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import net.larse.tsod.timeseries.TimeSeries;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A comma separated table with a header row. An optional {@code date_time} column supplies the
 * timestamps; without it, or when it cannot be parsed into increasing instants, rows are
 * numbered from 0.
 */
public final class CsvTable {
  private static final Logger logger = LogManager.getLogger(CsvTable.class);

  public static final String DATE_TIME = "date_time";

  private static final List<DateTimeFormatter> DATE_TIME_FORMATS = ImmutableList.of(
      DateTimeFormatter.ISO_LOCAL_DATE_TIME,
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
      DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss"),
      DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss"),
      DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm"));

  private final ImmutableList<String> header;
  private final List<String[]> rows;
  private final Charset charset;
  private final int dateTimeColumn;
  private final long[] timestamps;
  private final Long2ObjectOpenHashMap<String> dateTimeLabels = new Long2ObjectOpenHashMap<>();

  private CsvTable(List<String> header, List<String[]> rows, Charset charset) {
    this.header = ImmutableList.copyOf(header);
    this.rows = rows;
    this.charset = charset;
    this.dateTimeColumn = header.indexOf(DATE_TIME);
    this.timestamps = parseTimestamps();
    if (dateTimeColumn >= 0) {
      for (int i = 0; i < rows.size(); i++) {
        dateTimeLabels.put(timestamps[i], rows.get(i)[dateTimeColumn]);
      }
    }
  }

  /** Reads the file as UTF-8, falling back to ISO-8859-1 when it is not valid UTF-8. */
  public static CsvTable read(Path path) throws IOException {
    byte[] bytes = Files.readAllBytes(path);
    String text;
    Charset charset = StandardCharsets.UTF_8;
    try {
      text = StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString();
    } catch (CharacterCodingException e) {
      logger.warn("{} is not valid UTF-8, reading it as ISO-8859-1", path);
      charset = StandardCharsets.ISO_8859_1;
      text = new String(bytes, charset);
    }
    CsvTable table = parse(text, charset);
    logger.info("Loaded {}: {} rows, {} columns", path, table.rowCount(), table.header.size());
    return table;
  }

  public static CsvTable parse(String text) throws IOException {
    return parse(text, StandardCharsets.UTF_8);
  }

  private static CsvTable parse(String text, Charset charset) throws IOException {
    if (text.startsWith("\uFEFF")) {
      text = text.substring(1);
    }
    List<List<String>> records = records(text);
    if (records.isEmpty()) {
      throw new IOException("CSV input has no header row");
    }
    List<String> header = new ArrayList<>();
    for (String name : records.get(0)) {
      header.add(name.trim());
    }
    List<String[]> rows = new ArrayList<>(records.size() - 1);
    for (int r = 1; r < records.size(); r++) {
      List<String> record = records.get(r);
      if (record.size() > header.size()) {
        throw new IOException(String.format("row %d has %d fields, the header has %d", r,
            record.size(), header.size()));
      }
      String[] row = new String[header.size()];
      for (int c = 0; c < row.length; c++) {
        row[c] = c < record.size() ? record.get(c) : "";
      }
      rows.add(row);
    }
    return new CsvTable(header, rows, charset);
  }

  /** Splits text into records of fields. Quoted fields may hold commas, quotes and newlines. */
  static List<List<String>> records(String text) throws IOException {
    List<List<String>> records = new ArrayList<>();
    List<String> fields = new ArrayList<>();
    StringBuilder field = new StringBuilder();
    boolean quoted = false;
    boolean blankLine = true;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (quoted) {
        if (c == '"') {
          if (i + 1 < text.length() && text.charAt(i + 1) == '"') {
            field.append('"');
            i++;
          } else {
            quoted = false;
          }
        } else {
          field.append(c);
        }
        continue;
      }
      switch (c) {
        case '"':
          quoted = true;
          blankLine = false;
          break;
        case ',':
          fields.add(field.toString());
          field.setLength(0);
          blankLine = false;
          break;
        case '\r':
          break;
        case '\n':
          if (!blankLine) {
            fields.add(field.toString());
            records.add(fields);
          }
          fields = new ArrayList<>();
          field.setLength(0);
          blankLine = true;
          break;
        default:
          field.append(c);
          blankLine = false;
      }
    }
    if (quoted) {
      throw new IOException("unterminated quoted field");
    }
    if (!blankLine) {
      fields.add(field.toString());
      records.add(fields);
    }
    return records;
  }

  private long[] parseTimestamps() {
    long[] parsed = new long[rows.size()];
    boolean usable = dateTimeColumn >= 0;
    for (int i = 0; i < parsed.length && usable; i++) {
      Long instant = parseDateTime(rows.get(i)[dateTimeColumn].trim());
      usable = instant != null && (i == 0 || instant > parsed[i - 1]);
      parsed[i] = usable ? instant : 0;
    }
    if (usable) {
      return parsed;
    }
    if (dateTimeColumn >= 0) {
      logger.warn("{} values are not increasing date-times, using row numbers as timestamps",
          DATE_TIME);
    }
    for (int i = 0; i < parsed.length; i++) {
      parsed[i] = i;
    }
    return parsed;
  }

  /** Epoch milliseconds (UTC) of a date-time or date, or null if no known format matches. */
  static Long parseDateTime(String text) {
    for (DateTimeFormatter format : DATE_TIME_FORMATS) {
      try {
        return LocalDateTime.parse(text, format).toInstant(ZoneOffset.UTC).toEpochMilli();
      } catch (DateTimeParseException e) {
        logger.trace("'{}' does not match {}", text, format);
      }
    }
    try {
      return LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC).toEpochMilli();
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  public List<String> getHeader() {
    return header;
  }

  /** The header without the date_time column. */
  public List<String> getDataColumns() {
    List<String> columns = new ArrayList<>(header);
    columns.remove(DATE_TIME);
    return columns;
  }

  public boolean hasColumn(String name) {
    return header.contains(name);
  }

  public boolean hasDateTime() {
    return dateTimeColumn >= 0;
  }

  public int rowCount() {
    return rows.size();
  }

  public Charset getCharset() {
    return charset;
  }

  /** The date_time text of the row with this timestamp, or null without a date_time column. */
  public String getDateTimeLabel(long timestamp) {
    return dateTimeLabels.get(timestamp);
  }

  /** Cell values as doubles; blank and non-numeric cells are NaN. */
  public double[] getNumericColumn(String name) {
    int column = header.indexOf(name);
    if (column < 0) {
      throw new IllegalArgumentException("No column named " + name);
    }
    double[] values = new double[rows.size()];
    int unparsed = 0;
    for (int i = 0; i < values.length; i++) {
      String cell = rows.get(i)[column].trim();
      if (cell.isEmpty()) {
        values[i] = Double.NaN;
        continue;
      }
      try {
        values[i] = Double.parseDouble(cell);
      } catch (NumberFormatException e) {
        values[i] = Double.NaN;
        unparsed++;
      }
    }
    if (unparsed > 0) {
      logger.warn("{}: {} non-numeric cells read as missing", name, unparsed);
    }
    return values;
  }

  public TimeSeries toTimeSeries(String name) {
    return new TimeSeries(name, timestamps, getNumericColumn(name));
  }
}
