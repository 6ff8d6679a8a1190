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

import com.google.common.collect.ImmutableList;

import exm.vlint.ast.VlogAST;
import exm.vlint.ast.antlr.VLintParser;

/**
 * begin ... end
 */
public final class Block extends Statement {

  private final ImmutableList<Statement> statements;

  public Block(List<Statement> statements) {
    this.statements = ImmutableList.copyOf(statements);
  }

  public List<Statement> getStatements() {
    return statements;
  }

  @Override
  public StatementKind kind() {
    return StatementKind.BLOCK;
  }

  public static Block fromAST(VlogAST tree) {
    assert(tree.getType() == VLintParser.BLOCK);
    ImmutableList.Builder<Statement> stmts = ImmutableList.builder();
    for (VlogAST child: tree.children()) {
      stmts.add(Statement.fromAST(child));
    }
    return new Block(stmts.build());
  }
}
