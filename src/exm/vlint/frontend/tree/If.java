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

import exm.vlint.ast.VlogAST;
import exm.vlint.common.exceptions.VLintRuntimeError;

public final class If extends Statement {

  private final Expression condition;
  private final Statement thenStmt;
  private final Statement elseStmt;

  public If(Expression condition, Statement thenStmt, Statement elseStmt) {
    this.condition = Preconditions.checkNotNull(condition);
    this.thenStmt = Preconditions.checkNotNull(thenStmt);
    this.elseStmt = elseStmt;
  }

  public Expression getCondition() {
    return condition;
  }

  public Statement getThen() {
    return thenStmt;
  }

  /**
   * @return else branch, or null if none
   */
  public Statement getElse() {
    return elseStmt;
  }

  public boolean hasElse() {
    return elseStmt != null;
  }

  @Override
  public StatementKind kind() {
    return StatementKind.IF;
  }

  public static If fromAST(VlogAST tree) {
    int count = tree.getChildCount();
    if (count < 2 || count > 3)
      throw new VLintRuntimeError("if: child count > 3 or < 2");
    Expression condition = Expression.fromAST(tree.child(0));
    Statement thenStmt = Statement.fromAST(tree.child(1));

    boolean hasElse = (count == 3);
    Statement elseStmt = hasElse ? Statement.fromAST(tree.child(2)) : null;

    return new If(condition, thenStmt, elseStmt);
  }
}
