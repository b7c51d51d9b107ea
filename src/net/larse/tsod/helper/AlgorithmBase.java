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
package net.larse.tsod.helper;

import com.google.common.base.CaseFormat;
import com.google.common.base.MoreObjects;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;

/**
 * Base for the parameter holders used by the algorithms.
 *
 * <p>Each algorithm declares a nested {@code Args} class whose public fields carry their
 * defaults and are annotated with {@link ArgsBase.Doc} and {@link ArgsBase.Optional}. The
 * annotations drive the parameter help printed by the command line.
 */
public final class AlgorithmBase {
  private AlgorithmBase() {}

  public abstract static class ArgsBase {
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.FIELD)
    public @interface Doc {
      String help();
    }

    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.FIELD)
    public @interface Optional {}

    /**
     * One line per documented argument: its configuration key, default and help text.
     */
    public List<String> describe() {
      List<String> lines = new ArrayList<>();
      for (Field field : argumentFields()) {
        Doc doc = field.getAnnotation(Doc.class);
        if (doc != null) {
          lines.add(String.format("%s = %s: %s", configKey(field), valueOf(field), doc.help()));
        }
      }
      return lines;
    }

    @Override
    public String toString() {
      MoreObjects.ToStringHelper helper = MoreObjects.toStringHelper(this);
      for (Field field : argumentFields()) {
        helper.add(field.getName(), valueOf(field));
      }
      return helper.toString();
    }

    /** lambdaCentrada is written lambda_centrada in the configuration file. */
    private static String configKey(Field field) {
      return CaseFormat.LOWER_CAMEL.to(CaseFormat.LOWER_UNDERSCORE, field.getName());
    }

    private List<Field> argumentFields() {
      List<Field> fields = new ArrayList<>();
      for (Field field : getClass().getFields()) {
        if (!Modifier.isStatic(field.getModifiers())) {
          fields.add(field);
        }
      }
      return fields;
    }

    private Object valueOf(Field field) {
      try {
        return field.get(this);
      } catch (IllegalAccessException e) {
        throw new IllegalStateException("Cannot read argument " + field.getName(), e);
      }
    }
  }
}
