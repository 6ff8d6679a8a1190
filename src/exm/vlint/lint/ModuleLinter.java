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

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;

import exm.vlint.common.Logging;
import exm.vlint.common.Settings;
import exm.vlint.common.exceptions.InvalidOptionException;
import exm.vlint.frontend.LogHelper;
import exm.vlint.frontend.tree.AlwaysBlock;
import exm.vlint.frontend.tree.BitRange;
import exm.vlint.frontend.tree.ContinuousAssignment;
import exm.vlint.frontend.tree.Module;
import exm.vlint.frontend.tree.ModuleItem;
import exm.vlint.frontend.tree.Parameter;
import exm.vlint.frontend.tree.Port;
import exm.vlint.frontend.tree.SignalDeclaration;

/**
 * Runs all lint passes over a module.
 *
 * The passes are:
 * <ol>
 * <li>Parameters: resolve constant values and remember FSM candidates.</li>
 * <li>Ports: seed widths and track output registers.</li>
 * <li>Module items, in source order.</li>
 * <li>Module-wide checks: unused FSM states and undriven registers.</li>
 * </ol>
 * Each call to {@link #analyzeModule(Module)} starts from a clean state,
 * so a linter can be reused across modules.
 */
public class ModuleLinter {

  public static final String DEFAULT_STATE_MARKER = "STATE";

  private static final Logger logger = Logging.getVLintLogger();

  private final Set<ViolationKind> enabledChecks;
  private final String stateMarker;

  /**
   * Linter with every check enabled
   */
  public ModuleLinter() {
    this(EnumSet.allOf(ViolationKind.class), DEFAULT_STATE_MARKER);
  }

  public ModuleLinter(Set<ViolationKind> enabledChecks, String stateMarker) {
    this.enabledChecks = EnumSet.noneOf(ViolationKind.class);
    this.enabledChecks.addAll(enabledChecks);
    this.stateMarker = Preconditions.checkNotNull(stateMarker);
  }

  /**
   * Create a linter configured from the vlint.check.* and
   * vlint.fsm.state-marker settings
   * @throws InvalidOptionException if a setting is malformed
   */
  public static ModuleLinter fromSettings() throws InvalidOptionException {
    Set<ViolationKind> enabled = EnumSet.noneOf(ViolationKind.class);
    for (ViolationKind kind: ViolationKind.values()) {
      if (Settings.getBoolean(kind.settingKey())) {
        enabled.add(kind);
      } else {
        logger.debug("Check disabled: " + kind);
      }
    }
    return new ModuleLinter(enabled,
                            Settings.get(Settings.FSM_STATE_MARKER));
  }

  public List<Violation> analyzeModule(Module module) {
    logger.debug("Linting module " + module.getName());
    LintState state = new LintState(enabledChecks);
    ExprEvaluator evaluator = new ExprEvaluator(state);
    StatementAnalyzer analyzer = new StatementAnalyzer(state, evaluator);

    analyzeParameters(module, state, evaluator);
    analyzePorts(module, state, evaluator);
    analyzeItems(module, state, evaluator, analyzer);
    checkFsmStates(state);
    checkUninitialized(state);

    List<Violation> result = state.getViolations();
    logger.debug("Module " + module.getName() + ": " + result.size() +
                 " violation(s)");
    return result;
  }

  private void analyzeParameters(Module module, LintState state,
                                 ExprEvaluator evaluator) {
    LogHelper.debug(1, "Pass 1: " + module.getParameters().size() +
                       " parameter(s)");
    for (Parameter param: module.getParameters()) {
      state.addFsmCandidate(param.getName());
      ExprResult value = evaluator.evaluate(param.getValue());
      if (value.isConstant()) {
        state.setParamValue(param.getName(), value.getValue());
        LogHelper.trace(2, param.getName() + " = " + value);
      }
    }
  }

  private void analyzePorts(Module module, LintState state,
                            ExprEvaluator evaluator) {
    LogHelper.debug(1, "Pass 2: " + module.getPorts().size() + " port(s)");
    for (Port port: module.getPorts()) {
      state.setWidth(port.getName(), rangeWidth(port.getRange(), evaluator));
      if (port.getDirection() == Port.Direction.OUTPUT && port.isReg()) {
        state.trackRegister(port.getName());
      }
    }
  }

  private void analyzeItems(Module module, LintState state,
                  ExprEvaluator evaluator, StatementAnalyzer analyzer) {
    LogHelper.debug(1, "Pass 3: " + module.getItems().size() + " item(s)");
    for (ModuleItem item: module.getItems()) {
      switch (item.kind()) {
        case ALWAYS_BLOCK: {
          AlwaysBlock block = (AlwaysBlock)item;
          LogHelper.trace(2, "always @(" +
              Joiner.on(" or ").join(block.getSensitivities()) + ")");
          analyzer.analyze(block.getBody(),
                  new BlockContext(block, block.isCombinational()));
          break;
        }
        case SIGNAL_DECLARATION: {
          SignalDeclaration decl = (SignalDeclaration)item;
          int width = rangeWidth(decl.getRange(), evaluator);
          for (String name: decl.getNames()) {
            state.setWidth(name, width);
            if (decl.isReg()) {
              state.trackRegister(name);
            }
          }
          break;
        }
        case CONTINUOUS_ASSIGNMENT: {
          ContinuousAssignment assign = (ContinuousAssignment)item;
          LogHelper.trace(2, "assign " + assign.getLhs() + " = " +
                             assign.getRhs());
          ExprResult rhs = evaluator.evaluate(assign.getRhs());
          analyzer.recordWrite(assign.getLhs(), rhs, assign);
          break;
        }
        default:
          throw new IllegalStateException("Unexpected item " + item.kind());
      }
    }
  }

  private void checkFsmStates(LintState state) {
    for (String param: state.getFsmCandidates()) {
      if (param.contains(stateMarker) && !state.isCaseValueUsed(param)) {
        state.report(Violation.unreachableFsmState(param));
      }
    }
  }

  private void checkUninitialized(LintState state) {
    for (String reg: state.unwrittenRegisters()) {
      state.report(Violation.uninitializedRegister(reg));
    }
  }

  /**
   * Width of a declared range: |msb - lsb| + 1 if both ends are constant,
   * otherwise 1.  No range means a single bit.  Saturates at
   * Integer.MAX_VALUE.
   */
  static int rangeWidth(BitRange range, ExprEvaluator evaluator) {
    if (range == null) {
      return 1;
    }
    ExprResult msb = evaluator.evaluate(range.getMsb());
    ExprResult lsb = evaluator.evaluate(range.getLsb());
    if (msb.isConstant() && lsb.isConstant()) {
      long hi = msb.getValue();
      long lo = lsb.getValue();
      if (Long.compareUnsigned(hi, lo) < 0) {
        hi = lsb.getValue();
        lo = msb.getValue();
      }
      // Bounds are unsigned, so is the difference
      long diff = hi - lo;
      if (Long.compareUnsigned(diff, Integer.MAX_VALUE) >= 0) {
        return Integer.MAX_VALUE;
      }
      return (int)diff + 1;
    }
    return 1;
  }
}
