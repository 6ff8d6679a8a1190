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

import exm.vlint.common.lang.Operators.BinaryOp;
import exm.vlint.frontend.LogHelper;
import exm.vlint.frontend.tree.BinaryExpression;
import exm.vlint.frontend.tree.ConstantValue;
import exm.vlint.frontend.tree.Expression;
import exm.vlint.frontend.tree.Identifier;
import exm.vlint.frontend.tree.Literals;
import exm.vlint.frontend.tree.NumberLiteral;

/**
 * Infers the width of expressions and folds constant additions and
 * subtractions.  Overflowing constant additions are reported to the
 * lint state.
 */
public class ExprEvaluator {

  /** Width assumed for parameters and unknown names */
  public static final int DEFAULT_WIDTH = 32;

  private final LintState state;

  public ExprEvaluator(LintState state) {
    this.state = state;
  }

  public ExprResult evaluate(Expression expr) {
    switch (expr.kind()) {
      case IDENTIFIER:
        return evalIdentifier((Identifier)expr);
      case NUMBER:
        return evalNumber((NumberLiteral)expr);
      case BINARY:
        return evalBinary((BinaryExpression)expr);
      default:
        throw new IllegalStateException("Unexpected kind " + expr.kind());
    }
  }

  private ExprResult evalIdentifier(Identifier id) {
    Long paramVal = state.getParamValue(id.getName());
    if (paramVal != null) {
      return ExprResult.constant(paramVal, DEFAULT_WIDTH);
    }
    Integer width = state.getWidth(id.getName());
    if (width != null) {
      return ExprResult.unknown(width);
    }
    return ExprResult.unknown(DEFAULT_WIDTH);
  }

  private ExprResult evalNumber(NumberLiteral num) {
    ConstantValue c = Literals.parseNumber(num.getText());
    if (c == null) {
      // e.g. 4'b10x0
      return ExprResult.unknown(DEFAULT_WIDTH);
    }
    return ExprResult.constant(c.getValue(), c.getWidth());
  }

  private ExprResult evalBinary(BinaryExpression bin) {
    ExprResult left = evaluate(bin.getLeft());
    ExprResult right = evaluate(bin.getRight());
    BinaryOp op = bin.getOp();
    if (op == null) {
      LogHelper.trace(2, "Unknown operator " + bin.getSymbol());
    }

    int operandWidth = Math.max(left.getWidth(), right.getWidth());
    int resultWidth = resultWidth(op, left.getWidth(), right.getWidth());

    if (left.isConstant() && right.isConstant()) {
      long l = left.getValue();
      long r = right.getValue();
      if (op == BinaryOp.PLUS) {
        if (Long.compareUnsigned(l, mask(operandWidth) - r) > 0) {
          state.report(Violation.constantOverflow(l, r));
        }
        return ExprResult.constant((l + r) & mask(resultWidth), resultWidth);
      } else if (op == BinaryOp.MINUS) {
        return ExprResult.constant((l - r) & mask(resultWidth), resultWidth);
      }
    }
    return ExprResult.unknown(resultWidth);
  }

  /**
   * Width of a binary operation's result given its operand widths
   * @param op the operator, or null if unknown
   */
  static int resultWidth(BinaryOp op, int leftWidth, int rightWidth) {
    int operandWidth = Math.max(leftWidth, rightWidth);
    if (op == null) {
      return operandWidth;
    }
    switch (op) {
      case PLUS:
      case MINUS:
        // Room for the carry or borrow
        return operandWidth + 1;
      case MULT:
        return leftWidth + rightWidth;
      default:
        if (op.isShift()) {
          return leftWidth;
        }
        return op.isBoolean() ? 1 : operandWidth;
    }
  }

  /**
   * @return a value with the low width bits set
   */
  static long mask(int width) {
    if (width >= 64) {
      return -1L;
    }
    return (1L << width) - 1;
  }
}
