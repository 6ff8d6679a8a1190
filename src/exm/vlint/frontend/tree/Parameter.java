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

public final class Parameter {

  private final String name;
  private final Expression value;

  public Parameter(String name, Expression value) {
    this.name = Preconditions.checkNotNull(name);
    this.value = Preconditions.checkNotNull(value);
  }

  public String getName() {
    return name;
  }

  /** Default value expression */
  public Expression getValue() {
    return value;
  }

  public static Parameter fromAST(VlogAST tree) {
    assert(tree.getType() == VLintParser.PARAM_DEF);
    assert(tree.childCount() == 2);
    return new Parameter(tree.child(0).getText(),
                         Expression.fromAST(tree.child(1)));
  }
}
