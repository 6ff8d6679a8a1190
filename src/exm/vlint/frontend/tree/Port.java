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

public final class Port {

  public static enum Direction {
    INPUT,
    OUTPUT,
    INOUT,
    ;
  }

  private final Direction direction;
  private final boolean reg;
  private final BitRange range;
  private final String name;

  public Port(Direction direction, boolean reg, BitRange range, String name) {
    this.direction = Preconditions.checkNotNull(direction);
    this.reg = reg;
    this.range = range;
    this.name = Preconditions.checkNotNull(name);
  }

  public Direction getDirection() {
    return direction;
  }

  public boolean isReg() {
    return reg;
  }

  /**
   * @return range, or null for a single-bit port
   */
  public BitRange getRange() {
    return range;
  }

  public String getName() {
    return name;
  }

  /**
   * A grouped declaration such as "input [7:0] a, b" gives one port
   * per name.
   */
  public static List<Port> fromAST(VlogAST tree) {
    assert(tree.getType() == VLintParser.PORT_DEF);
    Direction direction;
    int dirTok = tree.child(0).getType();
    switch (dirTok) {
      case VLintParser.INPUT:
        direction = Direction.INPUT;
        break;
      case VLintParser.OUTPUT:
        direction = Direction.OUTPUT;
        break;
      case VLintParser.INOUT:
        direction = Direction.INOUT;
        break;
      default:
        throw new VLintRuntimeError("Unknown port direction: " +
                                    LogHelper.tokName(dirTok));
    }

    boolean reg = false;
    BitRange range = null;
    ImmutableList.Builder<Port> ports = ImmutableList.builder();
    for (VlogAST child: tree.children(1)) {
      switch (child.getType()) {
        case VLintParser.REG:
          reg = true;
          break;
        case VLintParser.WIRE:
          break;
        case VLintParser.BIT_RANGE:
          range = BitRange.fromAST(child);
          break;
        case VLintParser.ID:
          ports.add(new Port(direction, reg, range, child.getText()));
          break;
        default:
          throw new VLintRuntimeError("Unexpected token in port: " +
                                      LogHelper.tokName(child.getType()));
      }
    }
    return ports.build();
  }
}
