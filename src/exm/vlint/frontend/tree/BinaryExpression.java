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

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

import exm.vlint.common.lang.Operators;
import exm.vlint.common.lang.Operators.BinaryOp;

public final class BinaryExpression extends Expression {

  private final String symbol;
  private final Expression left;
  private final Expression right;

  public BinaryExpression(String symbol, Expression left, Expression right) {
    this.symbol = Preconditions.checkNotNull(symbol);
    this.left = Preconditions.checkNotNull(left);
    this.right = Preconditions.checkNotNull(right);
  }

  public String getSymbol() {
    return symbol;
  }

  /**
   * @return the operator, or null if the symbol is not one we know
   */
  public BinaryOp getOp() {
    return Operators.fromSymbol(symbol);
  }

  public Expression getLeft() {
    return left;
  }

  public Expression getRight() {
    return right;
  }

  @Override
  public ExpressionKind kind() {
    return ExpressionKind.BINARY;
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof BinaryExpression)) {
      return false;
    }
    BinaryExpression o = (BinaryExpression)other;
    return symbol.equals(o.symbol) && left.equals(o.left) &&
           right.equals(o.right);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(symbol, left, right);
  }

  @Override
  public String toString() {
    return "(" + left + " " + symbol + " " + right + ")";
  }
}
