package exm.vlint.lint;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;

import org.junit.Test;

import exm.vlint.common.exceptions.InvalidSyntaxException;
import exm.vlint.frontend.ParsedModule;
import exm.vlint.frontend.tree.BitRange;
import exm.vlint.frontend.tree.Identifier;
import exm.vlint.frontend.tree.Module;
import exm.vlint.frontend.tree.NumberLiteral;

public class ModuleLinterTest {

  private static Module parse(String... lines)
      throws InvalidSyntaxException {
    StringBuilder sb = new StringBuilder();
    for (String line: lines) {
      sb.append(line).append('\n');
    }
    return ParsedModule.parse("test.v", sb.toString()).buildModule();
  }

  private static List<String> messages(List<Violation> vs) {
    List<String> result = new ArrayList<String>();
    for (Violation v: vs) {
      result.add(v.getMessage());
    }
    return result;
  }

  private static List<String> lint(Module m) {
    return messages(new ModuleLinter().analyzeModule(m));
  }

  @Test
  public void testCarryOverflowIntoNarrowRegister() throws Exception {
    Module m = parse(
        "module adder(input clk, input [7:0] a, input [7:0] b,",
        "             output reg [3:0] result);",
        "  always @(posedge clk) begin",
        "    result <= a + b;",
        "  end",
        "endmodule");
    assertEquals(Collections.singletonList(
        "Structural Width Mismatch (Carry Overflow): Assigning a 9-bit " +
        "mathematical result to a 4-bit register 'result'."), lint(m));
  }

  @Test
  public void testCleanIncrementer() throws Exception {
    Module m = parse(
        "module inc(input clk, input rst_n, input [7:0] a,",
        "           output reg [8:0] next);",
        "  always @(posedge clk or negedge rst_n)",
        "    if (rst_n == 1'b0)",
        "      next <= 9'd0;",
        "    else",
        "      next <= a + 8'd1; // 9 bits fit",
        "endmodule");
    assertEquals(Collections.<String>emptyList(), lint(m));
  }

  @Test
  public void testMultiDrivenRegister() throws Exception {
    Module m = parse(
        "module md(input clk, input d, output reg q);",
        "  always @(posedge clk) q <= d;",
        "  always @(posedge clk) q <= 1'b0;",
        "endmodule");
    assertEquals(Collections.singletonList(
        "Multi-Driven Register: 'q' is driven by multiple blocks."), lint(m));
  }

  @Test
  public void testIdenticalBlocksAreSeparateDrivers() throws Exception {
    Module m = parse(
        "module md(input clk, input d, output reg q);",
        "  always @(posedge clk) q <= d;",
        "  always @(posedge clk) q <= d;",
        "  always @(posedge clk) q <= d;",
        "endmodule");
    // One violation per extra driving block
    assertEquals(2, lint(m).size());
  }

  @Test
  public void testContinuousAssignmentsDrive() throws Exception {
    Module m = parse(
        "module c(input a, input b, output y);",
        "  assign y = a;",
        "  assign y = b;",
        "endmodule");
    assertEquals(Collections.singletonList(
        "Multi-Driven Register: 'y' is driven by multiple blocks."), lint(m));
  }

  @Test
  public void testContinuousAssignmentWidth() throws Exception {
    Module m = parse(
        "module c(input [3:0] a, input [3:0] b, output [3:0] sum);",
        "  assign sum = a + b;",
        "endmodule");
    assertEquals(Collections.singletonList(
        "Structural Width Mismatch (Carry Overflow): Assigning a 5-bit " +
        "mathematical result to a 4-bit register 'sum'."), lint(m));
  }

  @Test
  public void testUnreachableFsmState() throws Exception {
    Module m = parse(
        "module fsm #(parameter STATE_IDLE = 0, parameter STATE_RUN = 1,",
        "             parameter STATE_HALT = 2)",
        "  (input clk, output reg busy);",
        "  reg [31:0] state;",
        "  always @(posedge clk) begin",
        "    case (state)",
        "      STATE_IDLE: begin busy <= 1'b0; state <= STATE_RUN; end",
        "      STATE_RUN: begin busy <= 1'b1; state <= STATE_IDLE; end",
        "      default: state <= STATE_IDLE;",
        "    endcase",
        "  end",
        "endmodule");
    assertEquals(Collections.singletonList(
        "Unreachable Finite State Machine State: Parameter 'STATE_HALT' " +
        "never used."), lint(m));
  }

  @Test
  public void testBodyLocalparamsAreFsmCandidates() throws Exception {
    Module m = parse(
        "module fsm(input clk, output reg [31:0] st);",
        "  localparam STATE_A = 0, STATE_B = 1;",
        "  parameter STATE_C = 2;",
        "  always @(posedge clk)",
        "    case (st)",
        "      STATE_B: st <= STATE_A;",
        "      default: st <= STATE_B;",
        "    endcase",
        "endmodule");
    assertEquals(Arrays.asList(
        "Unreachable Finite State Machine State: Parameter 'STATE_A' " +
        "never used.",
        "Unreachable Finite State Machine State: Parameter 'STATE_C' " +
        "never used."), lint(m));
  }

  @Test
  public void testUninitializedOutputRegister() throws Exception {
    Module m = parse(
        "module u(input clk, output reg q, output reg r);",
        "  always @(posedge clk) q <= 1'b1;",
        "endmodule");
    assertEquals(Collections.singletonList(
        "Un-initialized Register: 'r' declared but never driven."), lint(m));
  }

  @Test
  public void testUninitializedInDeclarationOrder() throws Exception {
    Module m = parse(
        "module u(input clk, output reg z);",
        "  reg m;",
        "  reg [3:0] a, b;",
        "  wire w;",
        "  always @(posedge clk) a <= 4'd1;",
        "endmodule");
    assertEquals(Arrays.asList(
        "Un-initialized Register: 'z' declared but never driven.",
        "Un-initialized Register: 'm' declared but never driven.",
        "Un-initialized Register: 'b' declared but never driven."), lint(m));
  }

  @Test
  public void testDeclarationAfterWriteKeepsFlag() throws Exception {
    Module m = parse(
        "module u(input clk, input d);",
        "  always @(posedge clk) q <= d;",
        "  reg q;",
        "endmodule");
    assertEquals(Collections.<String>emptyList(), lint(m));
  }

  @Test
  public void testCombinationalChecks() throws Exception {
    Module m = parse(
        "module comb(input en, input [1:0] sel, input d, output reg y,",
        "            output reg z);",
        "  always @(*) begin",
        "    if (en) y = d;",
        "    case (sel)",
        "      2'd0: z = 1'b0;",
        "      2'd1: z <= 1'b1;",
        "    endcase",
        "  end",
        "endmodule");
    assertEquals(Arrays.asList(
        "Infer Latch: 'if' statement without 'else' branch.",
        "Non Full/Parallel Case: 'case' missing 'default'.",
        "Non-Blocking Assignment in Combinational Logic: 'z' assigned " +
        "with '<=' inside a combinational block."), lint(m));
  }

  @Test
  public void testWildcardSensitivityWithoutParens() throws Exception {
    Module m = parse(
        "module comb(input en, input d, output reg y);",
        "  always @* if (en) y = d; else y = 1'b0;",
        "endmodule");
    assertEquals(Collections.<String>emptyList(), lint(m));
  }

  @Test
  public void testUnreachableAndOverflow() throws Exception {
    Module m = parse(
        "module k(input clk, output reg [8:0] q);",
        "  localparam LIMIT = 8'hFF + 8'h01;",
        "  parameter DEBUG = 1 - 1;",
        "  always @(posedge clk) begin",
        "    if (DEBUG) q <= 9'd0; else q <= LIMIT;",
        "  end",
        "endmodule");
    assertEquals(Arrays.asList(
        "Constant Math Overflow: 255 + 1",
        "Unreachable Block: 'if' condition evaluates to false (0).",
        "Structural Width Mismatch (Carry Overflow): Assigning a 32-bit " +
        "mathematical result to a 9-bit register 'q'."), lint(m));
  }

  @Test
  public void testParameterizedWidths() throws Exception {
    Module m = parse(
        "module p #(parameter W = 8) (input clk, input [W-1:0] a,",
        "                             output reg [W:0] s);",
        "  always @(posedge clk) s <= a + a;",
        "endmodule");
    assertEquals(Collections.<String>emptyList(), lint(m));
  }

  @Test
  public void testLinterReusable() throws Exception {
    Module m = parse(
        "module u(input clk, output reg q, output reg r);",
        "  always @(posedge clk) q <= 1'b1;",
        "  always @(posedge clk) q <= 1'b0;",
        "endmodule");
    ModuleLinter linter = new ModuleLinter();
    List<String> first = messages(linter.analyzeModule(m));
    List<String> second = messages(linter.analyzeModule(m));
    assertEquals(2, first.size());
    assertEquals(first, second);
  }

  @Test
  public void testDisabledChecksAndMarker() throws Exception {
    Module m = parse(
        "module fsm(input clk, output reg [31:0] st, output reg x);",
        "  localparam ST_IDLE = 0, STATE_OTHER = 1;",
        "  always @(posedge clk) st <= ST_IDLE;",
        "endmodule");
    ModuleLinter linter = new ModuleLinter(
        EnumSet.complementOf(EnumSet.of(ViolationKind.UNINITIALIZED_REGISTER)),
        "ST_");
    assertEquals(Collections.singletonList(
        "Unreachable Finite State Machine State: Parameter 'ST_IDLE' " +
        "never used."), messages(linter.analyzeModule(m)));
  }

  @Test
  public void testRangeWidth() {
    LintState state = new LintState();
    ExprEvaluator eval = new ExprEvaluator(state);
    assertEquals(1, ModuleLinter.rangeWidth(null, eval));
    assertEquals(8, ModuleLinter.rangeWidth(range("7", "0"), eval));
    // Ascending ranges count the same way
    assertEquals(8, ModuleLinter.rangeWidth(range("0", "7"), eval));
    assertEquals(1, ModuleLinter.rangeWidth(
        new BitRange(new Identifier("N"), new NumberLiteral("0")), eval));
    assertTrue(state.getViolations().isEmpty());
  }

  @Test
  public void testRangeWidthSaturates() {
    ExprEvaluator eval = new ExprEvaluator(new LintState());
    assertEquals(Integer.MAX_VALUE,
                 ModuleLinter.rangeWidth(range("32'hFFFFFFFF", "0"), eval));
    assertEquals(Integer.MAX_VALUE,
                 ModuleLinter.rangeWidth(range("0", "64'hFFFFFFFFFFFFFFFF"),
                                         eval));
    assertEquals(32, ModuleLinter.rangeWidth(range("31", "0"), eval));
  }

  @Test
  public void testWideRegisterNotMismatched() throws Exception {
    Module m = parse(
        "module w(input clk, input [7:0] a, output reg [32'hFFFFFFFF:0] q);",
        "  always @(posedge clk) q <= a + a;",
        "endmodule");
    assertEquals(Collections.<String>emptyList(), lint(m));
  }

  private static BitRange range(String msb, String lsb) {
    return new BitRange(new NumberLiteral(msb), new NumberLiteral(lsb));
  }
}
