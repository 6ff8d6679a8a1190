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
import exm.vlint.ast.antlr.VLintParser;
import exm.vlint.common.exceptions.VLintRuntimeError;
import exm.vlint.frontend.LogHelper;

/**
 * Procedural assignment: blocking (=) or non-blocking (<=)
 */
public final class Assignment extends Statement {

  private final Expression lhs;
  private final Expression rhs;
  private final boolean blocking;

  public Assignment(Expression lhs, Expression rhs, boolean blocking) {
    this.lhs = Preconditions.checkNotNull(lhs);
    this.rhs = Preconditions.checkNotNull(rhs);
    this.blocking = blocking;
  }

  public Expression getLhs() {
    return lhs;
  }

  public Expression getRhs() {
    return rhs;
  }

  public boolean isBlocking() {
    return blocking;
  }

  @Override
  public StatementKind kind() {
    return StatementKind.ASSIGNMENT;
  }

  public static Assignment fromAST(VlogAST tree) {
    assert(tree.getType() == VLintParser.ASSIGNMENT);
    if (tree.childCount() != 3) {
      throw new VLintRuntimeError("assignment: expected 3 children, got " +
                                  tree.childCount());
    }
    boolean blocking;
    int opTok = tree.child(0).getType();
    switch (opTok) {
      case VLintParser.EQ_ASSIGN:
        blocking = true;
        break;
      case VLintParser.LTE:
        blocking = false;
        break;
      default:
        throw new VLintRuntimeError("Unknown assign op: " +
                                    LogHelper.tokName(opTok));
    }
    return new Assignment(Expression.fromAST(tree.child(1)),
                          Expression.fromAST(tree.child(2)), blocking);
  }
}
