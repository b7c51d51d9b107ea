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
package net.larse.tsod.timeseries;

/** How missing (NaN) values are filled before a series is modeled. */
public enum MissingValuePolicy {
  /** Carry the last observation forward; leading gaps take the first observation. */
  FORWARD_FILL("ffill"),
  /** Interpolate by timestamp; gaps at either end take the nearest observation. */
  LINEAR_INTERPOLATION("interpolate"),
  /** Remove samples without an observation. */
  DROP("drop");

  private final String name;

  MissingValuePolicy(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public static MissingValuePolicy fromName(String name) {
    for (MissingValuePolicy policy : values()) {
      if (policy.name.equalsIgnoreCase(name) || policy.name().equalsIgnoreCase(name)) {
        return policy;
      }
    }
    throw new IllegalArgumentException("Unknown missing value policy: " + name);
  }
}
