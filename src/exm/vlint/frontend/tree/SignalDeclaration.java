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
import exm.vlint.common.exceptions.VLintRuntimeError;
import exm.vlint.frontend.LogHelper;

/**
 * reg or wire declaration in a module body, e.g. "reg [3:0] a, b;"
 */
public final class SignalDeclaration implements ModuleItem {

  private final boolean reg;
  private final BitRange range;
  private final ImmutableList<String> names;

  public SignalDeclaration(boolean reg, BitRange range, List<String> names) {
    this.reg = reg;
    this.range = range;
    this.names = ImmutableList.copyOf(names);
  }

  public boolean isReg() {
    return reg;
  }

  /**
   * @return range, or null for single-bit signals
   */
  public BitRange getRange() {
    return range;
  }

  public List<String> getNames() {
    return names;
  }

  @Override
  public ModuleItemKind kind() {
    return ModuleItemKind.SIGNAL_DECLARATION;
  }

  public static SignalDeclaration fromAST(VlogAST tree) {
    assert(tree.getType() == VLintParser.SIGNAL_DECL);
    boolean reg;
    int kindTok = tree.child(0).getType();
    if (kindTok == VLintParser.REG) {
      reg = true;
    } else if (kindTok == VLintParser.WIRE) {
      reg = false;
    } else {
      throw new VLintRuntimeError("Unknown net kind: " +
                                  LogHelper.tokName(kindTok));
    }

    BitRange range = null;
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (VlogAST child: tree.children(1)) {
      if (child.getType() == VLintParser.BIT_RANGE) {
        range = BitRange.fromAST(child);
      } else {
        assert(child.getType() == VLintParser.ID);
        names.add(child.getText());
      }
    }
    return new SignalDeclaration(reg, range, names.build());
  }
}
