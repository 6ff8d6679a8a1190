package exm.vlint;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Test;

import exm.vlint.common.Settings;
import exm.vlint.common.exceptions.InvalidSyntaxException;
import exm.vlint.lint.ViolationKind;
import exm.vlint.lint.ViolationReport;

public class VLinterTest {

  private static final String LATCHY =
      "module l(input en, input d, output reg y, output reg unused);\n" +
      "  always @(*) begin\n" +
      "    if (en) y = d;\n" +
      "  end\n" +
      "endmodule\n";

  @After
  public void tearDown() {
    System.clearProperty(Settings.CHECK_LATCH_INFERENCE);
    Settings.restoreDefaults();
  }

  @Test
  public void testLintSource() throws Exception {
    ViolationReport report = new VLinter().lint("l.v", LATCHY);
    assertFalse(report.isClean());
    assertEquals(2, report.getViolations().size());
    assertEquals(ViolationKind.LATCH_INFERENCE,
                 report.getViolations().get(0).getKind());
    assertEquals(ViolationKind.UNINITIALIZED_REGISTER,
                 report.getViolations().get(1).getKind());
    assertTrue(report.render().contains(
        " [2] Un-initialized Register: 'unused' declared but never driven."));
  }

  @Test
  public void testCleanSource() throws Exception {
    ViolationReport report = new VLinter().lint("ok.v",
        "module ok(input a, output y);\n  assign y = a;\nendmodule\n");
    assertTrue(report.isClean());
    assertTrue(report.render().contains("No violations found. Clean code!"));
  }

  @Test
  public void testFromSettings() throws Exception {
    System.setProperty(Settings.CHECK_LATCH_INFERENCE, "false");
    ViolationReport report = VLinter.fromSettings().lint("l.v", LATCHY);
    assertEquals(1, report.getViolations().size());
    assertEquals(ViolationKind.UNINITIALIZED_REGISTER,
                 report.getViolations().get(0).getKind());
  }

  @Test(expected=InvalidSyntaxException.class)
  public void testSyntaxError() throws Exception {
    new VLinter().lint("bad.v", "module m(input a)\nendmodule\n");
  }
}
