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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import exm.vlint.frontend.LogHelper;

/**
 * Mutable facts gathered while linting a single module.  A new instance
 * is used for each module.
 */
public class LintState {

  /** Resolved parameter values */
  private final Map<String, Long> paramValues = new HashMap<String, Long>();

  /** Inferred signal and port widths */
  private final Map<String, Integer> widths = new HashMap<String, Integer>();

  /** Last block to drive each register */
  private final Map<String, Object> drivers = new HashMap<String, Object>();

  /** Tracked registers and whether they have been written, in
   *  declaration order */
  private final Map<String, Boolean> written =
                                  new LinkedHashMap<String, Boolean>();

  /** Parameter names in declaration order */
  private final List<String> fsmCandidates = new ArrayList<String>();

  /** Identifiers that appeared as case branch values */
  private final Set<String> usedCaseValues = new HashSet<String>();

  private final List<Violation> violations = new ArrayList<Violation>();

  private final Set<ViolationKind> enabledChecks;

  public LintState() {
    this(EnumSet.allOf(ViolationKind.class));
  }

  public LintState(Set<ViolationKind> enabledChecks) {
    this.enabledChecks = EnumSet.noneOf(ViolationKind.class);
    this.enabledChecks.addAll(enabledChecks);
  }

  /**
   * Record a violation, unless its kind has been switched off
   */
  public void report(Violation v) {
    if (!enabledChecks.contains(v.getKind())) {
      LogHelper.debug(2, "Suppressed: " + v);
      return;
    }
    LogHelper.debug(2, "Violation: " + v);
    violations.add(v);
  }

  public List<Violation> getViolations() {
    return Collections.unmodifiableList(violations);
  }

  public void setParamValue(String name, long value) {
    paramValues.put(name, value);
  }

  /**
   * @return the parameter's value, or null if not a resolved parameter
   */
  public Long getParamValue(String name) {
    return paramValues.get(name);
  }

  public void setWidth(String name, int width) {
    widths.put(name, width);
  }

  /**
   * @return the signal width, or null if not a known signal
   */
  public Integer getWidth(String name) {
    return widths.get(name);
  }

  /**
   * Start tracking a register as not yet written.  If it is already
   * tracked its flag is kept.
   */
  public void trackRegister(String name) {
    if (!written.containsKey(name)) {
      written.put(name, false);
    }
  }

  public void markWritten(String name) {
    written.put(name, true);
  }

  public boolean isWritten(String name) {
    Boolean w = written.get(name);
    return w != null && w;
  }

  /**
   * @return registers that were never written, in declaration order
   */
  public List<String> unwrittenRegisters() {
    List<String> result = new ArrayList<String>();
    for (Map.Entry<String, Boolean> e: written.entrySet()) {
      if (!e.getValue()) {
        result.add(e.getKey());
      }
    }
    return result;
  }

  /**
   * @return the previous driver of the register, or null if none
   */
  public Object getDriver(String name) {
    return drivers.get(name);
  }

  public void setDriver(String name, Object driver) {
    drivers.put(name, driver);
  }

  public void addFsmCandidate(String name) {
    fsmCandidates.add(name);
  }

  public List<String> getFsmCandidates() {
    return Collections.unmodifiableList(fsmCandidates);
  }

  public void markCaseValueUsed(String name) {
    usedCaseValues.add(name);
  }

  public boolean isCaseValueUsed(String name) {
    return usedCaseValues.contains(name);
  }
}
