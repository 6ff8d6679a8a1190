package exm.vlint.lint;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Before;
import org.junit.Test;

import exm.vlint.frontend.tree.BinaryExpression;
import exm.vlint.frontend.tree.Expression;
import exm.vlint.frontend.tree.Identifier;
import exm.vlint.frontend.tree.NumberLiteral;

public class ExprEvaluatorTest {

  private LintState state;
  private ExprEvaluator eval;

  @Before
  public void setUp() {
    state = new LintState();
    eval = new ExprEvaluator(state);
  }

  private static Expression num(String text) {
    return new NumberLiteral(text);
  }

  private static Expression id(String name) {
    return new Identifier(name);
  }

  private static Expression bin(Expression l, String op, Expression r) {
    return new BinaryExpression(op, l, r);
  }

  @Test
  public void testIdentifiers() {
    state.setParamValue("WIDTH", 8);
    state.setWidth("data", 16);

    assertEquals(ExprResult.constant(8, 32), eval.evaluate(id("WIDTH")));
    assertEquals(ExprResult.unknown(16), eval.evaluate(id("data")));
    assertEquals(ExprResult.unknown(32), eval.evaluate(id("mystery")));
  }

  @Test
  public void testLiterals() {
    assertEquals(ExprResult.constant(255, 8), eval.evaluate(num("8'hFF")));
    assertEquals(ExprResult.unknown(32), eval.evaluate(num("4'b10x0")));
  }

  @Test
  public void testAdditionFoldsToResultWidth() {
    ExprResult r = eval.evaluate(bin(num("4'd3"), "+", num("4'd4")));
    assertEquals(ExprResult.constant(7, 5), r);
    assertTrue(state.getViolations().isEmpty());
  }

  @Test
  public void testAdditionOverflow() {
    ExprResult r = eval.evaluate(bin(num("8'hFF"), "+", num("8'h01")));
    // Carry bit kept in the 9-bit result
    assertEquals(ExprResult.constant(256, 9), r);
    assertEquals(1, state.getViolations().size());
    Violation v = state.getViolations().get(0);
    assertEquals(ViolationKind.CONSTANT_OVERFLOW, v.getKind());
    assertEquals("Constant Math Overflow: 255 + 1", v.getMessage());
  }

  @Test
  public void testAdditionAt64Bits() {
    ExprResult r = eval.evaluate(bin(num("64'hFFFFFFFFFFFFFFFF"), "+",
                                     num("64'h1")));
    assertEquals(ExprResult.constant(0, 65), r);
    assertEquals(1, state.getViolations().size());
    assertEquals("Constant Math Overflow: 18446744073709551615 + 1",
                 state.getViolations().get(0).getMessage());
  }

  @Test
  public void testSubtractionWraps() {
    ExprResult r = eval.evaluate(bin(num("4'd2"), "-", num("4'd3")));
    assertEquals(ExprResult.constant(31, 5), r);
    assertTrue(state.getViolations().isEmpty());
  }

  @Test
  public void testWidthRules() {
    state.setWidth("a", 8);
    state.setWidth("b", 4);
    assertEquals(ExprResult.unknown(9), eval.evaluate(bin(id("a"), "+", id("b"))));
    assertEquals(ExprResult.unknown(9), eval.evaluate(bin(id("a"), "-", id("b"))));
    assertEquals(ExprResult.unknown(12), eval.evaluate(bin(id("a"), "*", id("b"))));
    assertEquals(ExprResult.unknown(4), eval.evaluate(bin(id("b"), "<<", id("a"))));
    assertEquals(ExprResult.unknown(8), eval.evaluate(bin(id("a"), ">>", id("b"))));
    assertEquals(ExprResult.unknown(8), eval.evaluate(bin(id("a"), "&", id("b"))));
    assertEquals(ExprResult.unknown(8), eval.evaluate(bin(id("a"), "/", id("b"))));
    for (String op: new String[] {"==", "!=", ">=", "<=", "&&", "||"}) {
      assertEquals(op, ExprResult.unknown(1),
                   eval.evaluate(bin(id("a"), op, id("b"))));
    }
  }

  @Test
  public void testOnlyAddAndSubtractFold() {
    ExprResult r = eval.evaluate(bin(num("4'd3"), "*", num("4'd2")));
    assertFalse(r.isConstant());
    assertEquals(8, r.getWidth());

    r = eval.evaluate(bin(num("4'd3"), "==", num("4'd3")));
    assertFalse(r.isConstant());
    assertEquals(1, r.getWidth());
  }

  @Test
  public void testUnknownOperator() {
    state.setWidth("a", 6);
    ExprResult r = eval.evaluate(bin(id("a"), "<->", num("2'd1")));
    assertEquals(ExprResult.unknown(6), r);
    r = eval.evaluate(bin(num("2'd1"), "<->", num("2'd1")));
    assertEquals(ExprResult.unknown(2), r);
  }

  @Test
  public void testNestedFolding() {
    state.setParamValue("BASE", 10);
    ExprResult r = eval.evaluate(bin(bin(id("BASE"), "+", num("1")), "-",
                                     num("3")));
    // 32-bit operands: + gives 33 bits, - gives 34
    assertEquals(ExprResult.constant(8, 34), r);
  }

  @Test
  public void testMask() {
    assertEquals(0xFL, ExprEvaluator.mask(4));
    assertEquals(-1L, ExprEvaluator.mask(64));
    assertEquals(-1L, ExprEvaluator.mask(65));
  }
}
