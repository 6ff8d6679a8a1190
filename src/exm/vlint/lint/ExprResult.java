/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.vlint.lint;

/**
 * Outcome of evaluating an expression: its inferred width and, when it
 * could be folded, its constant value.
 */
public class ExprResult {

  private final Long value;
  private final int width;

  private ExprResult(Long value, int width) {
    this.value = value;
    this.width = width;
  }

  public static ExprResult constant(long value, int width) {
    return new ExprResult(value, width);
  }

  public static ExprResult unknown(int width) {
    return new ExprResult(null, width);
  }

  public boolean isConstant() {
    return value != null;
  }

  /**
   * @return the folded value, or null if not constant
   */
  public Long getValue() {
    return value;
  }

  public int getWidth() {
    return width;
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof ExprResult)) {
      return false;
    }
    ExprResult o = (ExprResult)other;
    if (width != o.width) {
      return false;
    }
    return value == null ? o.value == null : value.equals(o.value);
  }

  @Override
  public int hashCode() {
    return (value == null ? 0 : value.hashCode()) * 31 + width;
  }

  @Override
  public String toString() {
    return (value == null ? "?" : Long.toUnsignedString(value)) +
           " (" + width + " bits)";
  }
}
