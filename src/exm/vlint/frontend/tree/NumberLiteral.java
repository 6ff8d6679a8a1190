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

import com.google.common.base.Preconditions;

/**
 * Numeric literal, kept as written.  See {@link Literals#parseNumber}.
 */
public final class NumberLiteral extends Expression {

  private final String text;

  public NumberLiteral(String text) {
    this.text = Preconditions.checkNotNull(text);
  }

  public String getText() {
    return text;
  }

  @Override
  public ExpressionKind kind() {
    return ExpressionKind.NUMBER;
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof NumberLiteral)) {
      return false;
    }
    return text.equals(((NumberLiteral)other).text);
  }

  @Override
  public int hashCode() {
    return text.hashCode();
  }

  @Override
  public String toString() {
    return text;
  }
}
