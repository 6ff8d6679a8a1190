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
import exm.vlint.frontend.LogHelper;

/**
 * A procedural statement inside an always block
 */
public abstract class Statement {

  public static enum StatementKind {
    ASSIGNMENT,
    IF,
    BLOCK,
    CASE,
    ;
  }

  public abstract StatementKind kind();

  public static Statement fromAST(VlogAST tree) {
    switch (tree.getType()) {
      case VLintParser.ASSIGNMENT:
        return Assignment.fromAST(tree);
      case VLintParser.IF_STATEMENT:
        return If.fromAST(tree);
      case VLintParser.BLOCK:
        return Block.fromAST(tree);
      case VLintParser.CASE_STATEMENT:
        return Case.fromAST(tree);
      default:
        throw new VLintRuntimeError("Unexpected statement token: " +
                                    LogHelper.tokName(tree.getType()));
    }
  }
}
