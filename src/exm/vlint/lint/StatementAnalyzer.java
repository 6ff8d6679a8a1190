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

import exm.vlint.frontend.LogHelper;
import exm.vlint.frontend.tree.Assignment;
import exm.vlint.frontend.tree.Block;
import exm.vlint.frontend.tree.Case;
import exm.vlint.frontend.tree.Expression;
import exm.vlint.frontend.tree.Expression.ExpressionKind;
import exm.vlint.frontend.tree.Identifier;
import exm.vlint.frontend.tree.If;
import exm.vlint.frontend.tree.Statement;

/**
 * Walks procedural statements and applies the statement-level checks.
 * Never aborts: everything found is reported to the lint state.
 */
public class StatementAnalyzer {

  private final LintState state;
  private final ExprEvaluator evaluator;

  public StatementAnalyzer(LintState state, ExprEvaluator evaluator) {
    this.state = state;
    this.evaluator = evaluator;
  }

  public void analyze(Statement stmt, BlockContext context) {
    switch (stmt.kind()) {
      case ASSIGNMENT:
        analyzeAssignment((Assignment)stmt, context);
        break;
      case IF:
        analyzeIf((If)stmt, context);
        break;
      case BLOCK:
        for (Statement inner: ((Block)stmt).getStatements()) {
          analyze(inner, context);
        }
        break;
      case CASE:
        analyzeCase((Case)stmt, context);
        break;
      default:
        throw new IllegalStateException("Unexpected kind " + stmt.kind());
    }
  }

  private void analyzeAssignment(Assignment assign, BlockContext context) {
    LogHelper.trace(4, assign.getLhs() + (assign.isBlocking() ? " = " : " <= ")
                       + assign.getRhs());
    ExprResult rhs = evaluator.evaluate(assign.getRhs());

    if (assign.isBlocking() && !context.isCombinational()) {
      state.report(Violation.assignmentStyle(assign.getLhs().toString(), true));
    } else if (!assign.isBlocking() && context.isCombinational()) {
      state.report(Violation.assignmentStyle(assign.getLhs().toString(),
                                             false));
    }

    recordWrite(assign.getLhs(), rhs, context.getDriver());
  }

  /**
   * Bookkeeping shared by procedural and continuous assignments: the
   * written flag, the driver check and the width check.
   */
  void recordWrite(Expression lhs, ExprResult rhs, Object driver) {
    if (lhs.kind() != ExpressionKind.IDENTIFIER) {
      return;
    }
    String target = ((Identifier)lhs).getName();
    state.markWritten(target);

    Object prevDriver = state.getDriver(target);
    if (prevDriver != null && prevDriver != driver) {
      state.report(Violation.multiDriver(target));
    }
    state.setDriver(target, driver);

    Integer targetWidth = state.getWidth(target);
    if (targetWidth != null && rhs.getWidth() > targetWidth) {
      state.report(Violation.widthMismatch(rhs.getWidth(), targetWidth,
                                           target));
    }
  }

  private void analyzeIf(If ifStmt, BlockContext context) {
    ExprResult cond = evaluator.evaluate(ifStmt.getCondition());
    if (cond.isConstant() && cond.getValue() == 0L) {
      state.report(Violation.unreachableBlock());
    }
    if (context.isCombinational() && !ifStmt.hasElse()) {
      state.report(Violation.latchInference());
    }
    analyze(ifStmt.getThen(), context);
    if (ifStmt.hasElse()) {
      analyze(ifStmt.getElse(), context);
    }
  }

  private void analyzeCase(Case caseStmt, BlockContext context) {
    evaluator.evaluate(caseStmt.getCondition());
    if (!caseStmt.hasDefault()) {
      state.report(Violation.nonFullCase());
    } else {
      analyze(caseStmt.getDefault(), context);
    }

    for (Case.Branch branch: caseStmt.getBranches()) {
      Expression value = branch.getValue();
      if (value.kind() == ExpressionKind.IDENTIFIER) {
        state.markCaseValueUsed(((Identifier)value).getName());
      }
      analyze(branch.getBody(), context);
    }
  }
}
