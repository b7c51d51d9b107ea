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

import com.google.common.collect.ImmutableSet;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Column name to {@link ColumnConfig}, in file order. */
public final class DetectionConfig {
  static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
  private static final Type TYPE = new TypeToken<LinkedHashMap<String, ColumnConfig>>() {}
      .getType();

  private final LinkedHashMap<String, ColumnConfig> columns;

  public DetectionConfig(Map<String, ColumnConfig> columns) {
    this.columns = new LinkedHashMap<>(columns);
  }

  public static DetectionConfig load(Path path) throws IOException {
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return fromJson(GSON.fromJson(reader, TYPE), path.toString());
    } catch (JsonParseException e) {
      throw new IOException("Malformed configuration " + path + ": " + e.getMessage(), e);
    }
  }

  public static DetectionConfig parse(String json) throws IOException {
    try {
      return fromJson(GSON.fromJson(json, TYPE), "configuration");
    } catch (JsonParseException e) {
      throw new IOException("Malformed configuration: " + e.getMessage(), e);
    }
  }

  private static DetectionConfig fromJson(Map<String, ColumnConfig> parsed, String source)
      throws IOException {
    if (parsed == null) {
      throw new IOException(source + " is empty");
    }
    return new DetectionConfig(parsed);
  }

  public void save(Path path) throws IOException {
    try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      GSON.toJson(columns, TYPE, writer);
    }
  }

  public String toJson() {
    return GSON.toJson(columns, TYPE);
  }

  public Set<String> keys() {
    return ImmutableSet.copyOf(columns.keySet());
  }

  public int size() {
    return columns.size();
  }

  public ColumnConfig get(String key) {
    return columns.get(key);
  }

  /** The configuration key for a table column, matched exactly or after normalization. */
  public Optional<String> findKey(String column) {
    return ColumnNames.match(column, columns.keySet());
  }
}
