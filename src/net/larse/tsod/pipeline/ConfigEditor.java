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
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import net.larse.tsod.errors.ConfigMismatchException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Edits a configuration as a JSON tree, so keys the engine does not read survive a save.
 *
 * <p>Parameters are addressed by dotted paths inside a column entry, e.g. {@code ts_params.q} or
 * {@code outlier_params.lambda_centrada}. Every segment of a path must already exist, which
 * rejects misspelled keys. A value replacing a number is parsed as a number of the same kind.
 */
public final class ConfigEditor {
  private static final Logger logger = LogManager.getLogger(ConfigEditor.class);
  private static final Splitter PATH_SPLITTER = Splitter.on('.');

  private final JsonObject root;

  ConfigEditor(JsonObject root) {
    this.root = root;
  }

  public static ConfigEditor load(Path path) throws IOException {
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return fromJson(JsonParser.parseReader(reader), path.toString());
    } catch (JsonParseException e) {
      throw new IOException("Malformed configuration " + path + ": " + e.getMessage(), e);
    }
  }

  public static ConfigEditor parse(String json) throws IOException {
    try {
      return fromJson(JsonParser.parseString(json), "configuration");
    } catch (JsonParseException e) {
      throw new IOException("Malformed configuration: " + e.getMessage(), e);
    }
  }

  private static ConfigEditor fromJson(JsonElement parsed, String source) throws IOException {
    if (!parsed.isJsonObject()) {
      throw new IOException(source + " is not a JSON object");
    }
    return new ConfigEditor(parsed.getAsJsonObject());
  }

  public List<String> list() {
    return ImmutableList.copyOf(root.keySet());
  }

  /** The entry of a column as indented JSON. */
  public String show(String column) {
    return DetectionConfig.GSON.toJson(entry(column));
  }

  public void set(String column, String path, String value) {
    List<String> parts = PATH_SPLITTER.splitToList(path);
    JsonObject current = entry(column);
    for (String part : parts.subList(0, parts.size() - 1)) {
      JsonElement child = current.get(part);
      Preconditions.checkArgument(child != null && child.isJsonObject(),
          "%s: %s is missing or not an object", column, part);
      current = child.getAsJsonObject();
    }
    String last = parts.get(parts.size() - 1);
    JsonElement previous = current.get(last);
    Preconditions.checkArgument(previous != null, "%s: no parameter %s", column, path);
    current.add(last, convert(previous, value, column + "." + path));
    logger.info("Updated {}.{} = {}", column, path, value);
  }

  /**
   * Sets the same parameter on several columns. Columns that are absent or lack the parameter
   * are skipped with a warning.
   *
   * @return the number of columns updated
   */
  public int bulkSet(String path, String value, List<String> columns) {
    int updated = 0;
    for (String column : columns) {
      try {
        set(column, path, value);
        updated++;
      } catch (IllegalArgumentException e) {
        logger.warn("Skipped {}", e.getMessage());
      }
    }
    logger.info("Bulk update of {}: {}/{} columns", path, updated, columns.size());
    return updated;
  }

  /** Replaces the entry of target with a copy of the entry of source. */
  public void copy(String source, String target) {
    JsonObject copy = entry(source).deepCopy();
    entry(target);
    root.add(target, copy);
    logger.info("Copied {} -> {}", source, target);
  }

  /**
   * The edited configuration, after checking that every entry still builds its detector and
   * model.
   *
   * @throws IllegalArgumentException naming the first column whose entry is invalid
   */
  public DetectionConfig toConfig() throws IOException {
    DetectionConfig config = DetectionConfig.parse(root.toString());
    for (String key : config.keys()) {
      ColumnConfig entry = config.get(key);
      Preconditions.checkArgument(entry != null, "%s: entry is null", key);
      try {
        if (entry.toDetectorSpec(key).getType().requiresResiduals()) {
          entry.toModelSpec(key);
        }
      } catch (ConfigMismatchException e) {
        throw new IllegalArgumentException(e.describe(), e);
      }
    }
    return config;
  }

  /**
   * Validates and writes the edited configuration. With backup set, the file at original is
   * first copied to {@code <name>.bak.json} next to it.
   */
  public void save(Path output, Path original, boolean backup) throws IOException {
    toConfig();
    if (backup && original != null && Files.exists(original)) {
      String name = original.getFileName().toString();
      String stem = name.endsWith(".json") ? name.substring(0, name.length() - 5) : name;
      Path backupPath = original.resolveSibling(stem + ".bak.json");
      Files.copy(original, backupPath, StandardCopyOption.REPLACE_EXISTING);
      logger.info("Backed up {} to {}", original, backupPath);
    }
    try (Writer writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
      DetectionConfig.GSON.toJson(root, writer);
    }
    logger.info("Configuration saved to {}", output);
  }

  private JsonObject entry(String column) {
    JsonElement entry = root.get(column);
    Preconditions.checkArgument(entry != null, "no column %s in the configuration", column);
    Preconditions.checkArgument(entry.isJsonObject(), "%s: entry is not an object", column);
    return entry.getAsJsonObject();
  }

  private static JsonElement convert(JsonElement previous, String value, String where) {
    if (!previous.isJsonPrimitive() || !previous.getAsJsonPrimitive().isNumber()) {
      return new JsonPrimitive(value);
    }
    String text = previous.getAsString();
    boolean integral = text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0;
    try {
      return integral
          ? new JsonPrimitive(Long.parseLong(value.trim()))
          : new JsonPrimitive(Double.parseDouble(value.trim()));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(String.format("%s: expected %s, got '%s'", where,
          integral ? "an integer" : "a number", value), e);
    }
  }
}
