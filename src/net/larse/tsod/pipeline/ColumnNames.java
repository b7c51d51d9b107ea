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
import java.text.Normalizer;
import java.util.Optional;

/**
 * Matching of table column names against configuration keys. Files written on different systems
 * spell accented names with composed or decomposed characters and vary in whitespace.
 */
public final class ColumnNames {
  private ColumnNames() {}

  /** NFKD form with whitespace runs collapsed to one space and trimmed. */
  public static String normalize(String name) {
    String decomposed = Normalizer.normalize(name, Normalizer.Form.NFKD);
    return CharMatcher.whitespace().trimAndCollapseFrom(decomposed, ' ');
  }

  /** The key equal to column, else the first key equal to it after normalization. */
  public static Optional<String> match(String column, Iterable<String> keys) {
    for (String key : keys) {
      if (key.equals(column)) {
        return Optional.of(key);
      }
    }
    String normalized = normalize(column);
    for (String key : keys) {
      if (normalize(key).equals(normalized)) {
        return Optional.of(key);
      }
    }
    return Optional.empty();
  }
}
