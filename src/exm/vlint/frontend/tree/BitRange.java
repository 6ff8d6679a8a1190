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
 * [msb:lsb] range on a port or signal declaration
 */
public final class BitRange {

  private final Expression msb;
  private final Expression lsb;

  public BitRange(Expression msb, Expression lsb) {
    this.msb = Preconditions.checkNotNull(msb);
    this.lsb = Preconditions.checkNotNull(lsb);
  }

  public Expression getMsb() {
    return msb;
  }

  public Expression getLsb() {
    return lsb;
  }

  public static BitRange fromAST(VlogAST tree) {
    assert(tree.getType() == VLintParser.BIT_RANGE);
    assert(tree.childCount() == 2);
    return new BitRange(Expression.fromAST(tree.child(0)),
                        Expression.fromAST(tree.child(1)));
  }
}
