package exm.vlint.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import exm.vlint.ast.antlr.VLintParser;
import exm.vlint.common.exceptions.InvalidSyntaxException;
import exm.vlint.frontend.tree.ContinuousAssignment;

public class ParsedModuleTest {

  @Test
  public void testParseTree() throws InvalidSyntaxException {
    ParsedModule pm = ParsedModule.parse("m.v",
        "module m(input a, output y);\n" +
        "  // comment\n" +
        "  /* block\n comment */\n" +
        "  assign y = a;\n" +
        "endmodule\n");
    assertEquals("m.v", pm.sourceName);
    assertEquals(VLintParser.MODULE_DEF, pm.ast.getType());
    assertEquals(4, pm.ast.childCount());
    assertEquals("m", pm.ast.child(0).getText());
    assertEquals(VLintParser.PARAM_LIST, pm.ast.child(1).getType());
    assertEquals(0, pm.ast.child(1).childCount());
    assertEquals(2, pm.ast.child(2).childCount());
    assertEquals(VLintParser.CONTINUOUS_ASSIGNMENT,
                 pm.ast.child(3).child(0).getType());
  }

  @Test
  public void testOperatorPrecedence() throws InvalidSyntaxException {
    ParsedModule pm = ParsedModule.parse("m.v",
        "module m(output y);\n" +
        "  assign y = 1 + 2 * 3 == 7 && (1 | 0) << 2;\n" +
        "endmodule\n");
    ContinuousAssignment ca =
        (ContinuousAssignment)pm.buildModule().getItems().get(0);
    assertEquals("(((1 + (2 * 3)) == 7) && ((1 | 0) << 2))",
                 ca.getRhs().toString());
  }

  @Test
  public void testMissingSemicolon() {
    try {
      ParsedModule.parse("bad.v",
          "module m(input a, output y);\n" +
          "  assign y = a\n" +
          "endmodule\n");
      fail("expected syntax error");
    } catch (InvalidSyntaxException e) {
      assertTrue(e.getMessage(), e.getMessage().startsWith("bad.v:3:"));
    }
  }

  @Test
  public void testBadCharacter() {
    try {
      ParsedModule.parse("bad.v",
          "module m(input a, output y);\n" +
          "  assign y = a ? a : a;\n" +
          "endmodule\n");
      fail("expected syntax error");
    } catch (InvalidSyntaxException e) {
      assertTrue(e.getMessage(), e.getMessage().startsWith("bad.v:"));
    }
  }

  @Test(expected=InvalidSyntaxException.class)
  public void testTrailingInput() throws InvalidSyntaxException {
    ParsedModule.parse("bad.v",
        "module m(input a);\nendmodule\nmodule n(input b);\nendmodule\n");
  }

  @Test(expected=InvalidSyntaxException.class)
  public void testEmptyInput() throws InvalidSyntaxException {
    ParsedModule.parse("empty.v", "");
  }
}
