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

/**
 * always @(...) statement.  Each block is a distinct driver: equality is
 * identity, so two textually identical blocks are still two drivers.
 */
public final class AlwaysBlock implements ModuleItem {

  public static enum Edge {
    NONE,
    POSEDGE,
    NEGEDGE,
    ;
  }

  /** Signal name recorded for @* and @(*) */
  public static final String WILDCARD = "*";

  public static final class Sensitivity {
    private final Edge edge;
    private final String signal;

    public Sensitivity(Edge edge, String signal) {
      this.edge = Preconditions.checkNotNull(edge);
      this.signal = Preconditions.checkNotNull(signal);
    }

    public Edge getEdge() {
      return edge;
    }

    public String getSignal() {
      return signal;
    }

    @Override
    public String toString() {
      return edge == Edge.NONE ? signal :
                  edge.name().toLowerCase() + " " + signal;
    }
  }

  private final ImmutableList<Sensitivity> sensitivities;
  private final Statement body;

  public AlwaysBlock(List<Sensitivity> sensitivities, Statement body) {
    this.sensitivities = ImmutableList.copyOf(sensitivities);
    this.body = Preconditions.checkNotNull(body);
  }

  public List<Sensitivity> getSensitivities() {
    return sensitivities;
  }

  public Statement getBody() {
    return body;
  }

  /**
   * @return true if no entry in the sensitivity list is edge-triggered
   */
  public boolean isCombinational() {
    for (Sensitivity s: sensitivities) {
      if (s.getEdge() != Edge.NONE) {
        return false;
      }
    }
    return true;
  }

  @Override
  public ModuleItemKind kind() {
    return ModuleItemKind.ALWAYS_BLOCK;
  }

  public static AlwaysBlock fromAST(VlogAST tree) {
    assert(tree.getType() == VLintParser.ALWAYS_BLOCK);
    assert(tree.childCount() == 2);
    VlogAST sensList = tree.child(0);
    assert(sensList.getType() == VLintParser.SENSITIVITY_LIST);

    ImmutableList.Builder<Sensitivity> sens = ImmutableList.builder();
    for (VlogAST entry: sensList.children()) {
      sens.add(sensitivityFromAST(entry));
    }
    return new AlwaysBlock(sens.build(), Statement.fromAST(tree.child(1)));
  }

  private static Sensitivity sensitivityFromAST(VlogAST entry) {
    assert(entry.getType() == VLintParser.SENSITIVITY);
    if (entry.childCount() == 1) {
      VlogAST sig = entry.child(0);
      if (sig.getType() == VLintParser.MULT) {
        return new Sensitivity(Edge.NONE, WILDCARD);
      }
      return new Sensitivity(Edge.NONE, sig.getText());
    } else if (entry.childCount() == 2) {
      Edge edge;
      int edgeTok = entry.child(0).getType();
      switch (edgeTok) {
        case VLintParser.POSEDGE:
          edge = Edge.POSEDGE;
          break;
        case VLintParser.NEGEDGE:
          edge = Edge.NEGEDGE;
          break;
        default:
          throw new VLintRuntimeError("Unknown edge: " +
                                      LogHelper.tokName(edgeTok));
      }
      return new Sensitivity(edge, entry.child(1).getText());
    } else {
      throw new VLintRuntimeError("sensitivity: child count " +
                                  entry.childCount());
    }
  }
}
