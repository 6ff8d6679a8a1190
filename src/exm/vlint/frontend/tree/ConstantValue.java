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
package exm.vlint.frontend.tree;

/**
 * A compile-time constant with its bit width.  The value is an unsigned
 * 64-bit quantity stored in a long.
 */
public final class ConstantValue {

  private final long value;
  private final int width;

  public ConstantValue(long value, int width) {
    this.value = value;
    this.width = width;
  }

  public long getValue() {
    return value;
  }

  public int getWidth() {
    return width;
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof ConstantValue)) {
      return false;
    }
    ConstantValue o = (ConstantValue)other;
    return value == o.value && width == o.width;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(value) * 31 + width;
  }

  @Override
  public String toString() {
    return width + "'d" + Long.toUnsignedString(value);
  }
}
