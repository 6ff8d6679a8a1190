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

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.vlint.ast.VlogAST;
import exm.vlint.ast.antlr.VLintParser;
import exm.vlint.common.exceptions.VLintRuntimeError;
import exm.vlint.frontend.LogHelper;

public final class Case extends Statement {

  /** One labelled arm of a case statement */
  public static final class Branch {
    private final Expression value;
    private final Statement body;

    public Branch(Expression value, Statement body) {
      this.value = Preconditions.checkNotNull(value);
      this.body = Preconditions.checkNotNull(body);
    }

    public Expression getValue() {
      return value;
    }

    public Statement getBody() {
      return body;
    }
  }

  private final Expression condition;
  private final ImmutableList<Branch> branches;
  private final Statement defaultStmt;

  public Case(Expression condition, List<Branch> branches,
              Statement defaultStmt) {
    this.condition = Preconditions.checkNotNull(condition);
    this.branches = ImmutableList.copyOf(branches);
    this.defaultStmt = defaultStmt;
  }

  public Expression getCondition() {
    return condition;
  }

  public List<Branch> getBranches() {
    return branches;
  }

  /**
   * @return default branch, or null if none
   */
  public Statement getDefault() {
    return defaultStmt;
  }

  public boolean hasDefault() {
    return defaultStmt != null;
  }

  @Override
  public StatementKind kind() {
    return StatementKind.CASE;
  }

  public static Case fromAST(VlogAST tree) {
    assert(tree.getType() == VLintParser.CASE_STATEMENT);
    if (tree.childCount() < 1) {
      throw new VLintRuntimeError("case: missing condition");
    }
    Expression condition = Expression.fromAST(tree.child(0));
    ImmutableList.Builder<Branch> branches = ImmutableList.builder();
    Statement defaultStmt = null;
    for (VlogAST item: tree.children(1)) {
      switch (item.getType()) {
        case VLintParser.CASE_ITEM:
          branches.add(new Branch(Expression.fromAST(item.child(0)),
                                  Statement.fromAST(item.child(1))));
          break;
        case VLintParser.DEFAULT_ITEM:
          // A repeated default replaces the earlier one
          defaultStmt = Statement.fromAST(item.child(0));
          break;
        default:
          throw new VLintRuntimeError("Unexpected case item: " +
                                      LogHelper.tokName(item.getType()));
      }
    }
    return new Case(condition, branches.build(), defaultStmt);
  }
}
