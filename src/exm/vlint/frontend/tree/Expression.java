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

import exm.vlint.ast.VlogAST;
import exm.vlint.ast.antlr.VLintParser;
import exm.vlint.common.exceptions.VLintRuntimeError;
import exm.vlint.common.lang.Operators;
import exm.vlint.frontend.LogHelper;

/**
 * An expression in the Verilog subset: identifier, numeric literal or
 * binary operation.  Expressions are immutable and compare structurally.
 */
public abstract class Expression {

  public static enum ExpressionKind {
    IDENTIFIER,
    NUMBER,
    BINARY,
    ;
  }

  public abstract ExpressionKind kind();

  public static Expression fromAST(VlogAST tree) {
    switch (tree.getType()) {
      case VLintParser.ID:
        return new Identifier(tree.getText());
      case VLintParser.NUMBER:
        return new NumberLiteral(tree.getText());
      default:
        if (tree.childCount() == 2 &&
            Operators.fromSymbol(tree.getText()) != null) {
          return new BinaryExpression(tree.getText(),
                    fromAST(tree.child(0)), fromAST(tree.child(1)));
        }
        throw new VLintRuntimeError("Unexpected expression token: " +
                                    LogHelper.tokName(tree.getType()));
    }
  }
}
