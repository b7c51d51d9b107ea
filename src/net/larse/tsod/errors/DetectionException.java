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
package net.larse.tsod.errors;

/**
 * A failure while processing one column. Carries the column name and the stage of the run in
 * which it happened so the pipeline can report it and move on to the next column.
 */
public class DetectionException extends Exception {
  private static final long serialVersionUID = 1L;

  public enum Stage {
    CONFIGURATION,
    FILLING,
    FITTING,
    DETECTING
  }

  private final String column;
  private final Stage stage;

  public DetectionException(String column, Stage stage, String message) {
    super(message);
    this.column = column;
    this.stage = stage;
  }

  public DetectionException(String column, Stage stage, String message, Throwable cause) {
    super(message, cause);
    this.column = column;
    this.stage = stage;
  }

  public String getColumn() {
    return column;
  }

  public Stage getStage() {
    return stage;
  }

  /** "column [STAGE]: message", the form used in logs and run summaries. */
  public String describe() {
    return String.format("%s [%s]: %s", column, stage, getMessage());
  }
}
