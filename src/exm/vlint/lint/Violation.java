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
package exm.vlint.lint;

import com.google.common.base.Preconditions;

/**
 * A single diagnostic: its category and the human-readable message
 */
public class Violation {

  private final ViolationKind kind;
  private final String message;

  public Violation(ViolationKind kind, String message) {
    this.kind = Preconditions.checkNotNull(kind);
    this.message = Preconditions.checkNotNull(message);
  }

  public ViolationKind getKind() {
    return kind;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public String toString() {
    return kind + ": " + message;
  }

  public static Violation assignmentStyle(String target, boolean blocking) {
    if (blocking) {
      return new Violation(ViolationKind.ASSIGNMENT_STYLE,
          "Blocking Assignment in Sequential Logic: '" + target +
          "' assigned with '=' inside an edge-triggered block.");
    } else {
      return new Violation(ViolationKind.ASSIGNMENT_STYLE,
          "Non-Blocking Assignment in Combinational Logic: '" + target +
          "' assigned with '<=' inside a combinational block.");
    }
  }

  public static Violation multiDriver(String target) {
    return new Violation(ViolationKind.MULTI_DRIVER,
        "Multi-Driven Register: '" + target +
        "' is driven by multiple blocks.");
  }

  public static Violation widthMismatch(int resultWidth, int targetWidth,
                                        String target) {
    return new Violation(ViolationKind.WIDTH_MISMATCH,
        "Structural Width Mismatch (Carry Overflow): Assigning a " +
        resultWidth + "-bit mathematical result to a " + targetWidth +
        "-bit register '" + target + "'.");
  }

  public static Violation constantOverflow(long left, long right) {
    return new Violation(ViolationKind.CONSTANT_OVERFLOW,
        "Constant Math Overflow: " + Long.toUnsignedString(left) + " + " +
        Long.toUnsignedString(right));
  }

  public static Violation unreachableBlock() {
    return new Violation(ViolationKind.UNREACHABLE_BLOCK,
        "Unreachable Block: 'if' condition evaluates to false (0).");
  }

  public static Violation latchInference() {
    return new Violation(ViolationKind.LATCH_INFERENCE,
        "Infer Latch: 'if' statement without 'else' branch.");
  }

  public static Violation nonFullCase() {
    return new Violation(ViolationKind.NON_FULL_CASE,
        "Non Full/Parallel Case: 'case' missing 'default'.");
  }

  public static Violation unreachableFsmState(String param) {
    return new Violation(ViolationKind.UNREACHABLE_FSM_STATE,
        "Unreachable Finite State Machine State: Parameter '" + param +
        "' never used.");
  }

  public static Violation uninitializedRegister(String reg) {
    return new Violation(ViolationKind.UNINITIALIZED_REGISTER,
        "Un-initialized Register: '" + reg + "' declared but never driven.");
  }
}
