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

/**
 * "assign lhs = rhs;".  Each instance is a separate driver, so equality
 * is identity.
 */
public final class ContinuousAssignment implements ModuleItem {

  private final Expression lhs;
  private final Expression rhs;

  public ContinuousAssignment(Expression lhs, Expression rhs) {
    this.lhs = Preconditions.checkNotNull(lhs);
    this.rhs = Preconditions.checkNotNull(rhs);
  }

  public Expression getLhs() {
    return lhs;
  }

  public Expression getRhs() {
    return rhs;
  }

  @Override
  public ModuleItemKind kind() {
    return ModuleItemKind.CONTINUOUS_ASSIGNMENT;
  }

  public static ContinuousAssignment fromAST(VlogAST tree) {
    assert(tree.getType() == VLintParser.CONTINUOUS_ASSIGNMENT);
    assert(tree.childCount() == 2);
    return new ContinuousAssignment(Expression.fromAST(tree.child(0)),
                                    Expression.fromAST(tree.child(1)));
  }
}
