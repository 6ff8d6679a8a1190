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
package exm.vlint.common.lang;

import java.util.HashMap;
import java.util.Map;

/**
 * This class defines the binary operators understood by the linter
 */
public class Operators {

  public static enum BinaryOp {
    PLUS("+"), MINUS("-"), MULT("*"), DIV("/"), MOD("%"),
    SHIFT_LEFT("<<"), SHIFT_RIGHT(">>"),
    EQ("=="), NEQ("!="), GTE(">="), LTE("<="),
    AND("&&"), OR("||"),
    BIT_AND("&"), BIT_OR("|"), BIT_XOR("^"),
    ;

    private final String symbol;

    private BinaryOp(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }

    /**
     * True for operators whose result is a single bit
     */
    public boolean isBoolean() {
      switch (this) {
        case EQ:
        case NEQ:
        case GTE:
        case LTE:
        case AND:
        case OR:
          return true;
        default:
          return false;
      }
    }

    public boolean isShift() {
      return this == SHIFT_LEFT || this == SHIFT_RIGHT;
    }
  }

  private static final Map<String, BinaryOp> bySymbol =
                                    new HashMap<String, BinaryOp>();

  static {
    for (BinaryOp op: BinaryOp.values()) {
      bySymbol.put(op.symbol(), op);
    }
  }

  /**
   * @param symbol operator as written in source, e.g. "<<"
   * @return the operator, or null if not a known operator
   */
  public static BinaryOp fromSymbol(String symbol) {
    return bySymbol.get(symbol);
  }
}
