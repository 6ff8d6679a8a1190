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
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Ordered collection of violations for one module, with a plain text
 * rendering for display.
 */
public class ViolationReport {

  private static final String RULE = StringUtils.repeat('=', 36);
  private static final String TITLE = "LINTER VIOLATION REPORT";

  private final List<Violation> violations = new ArrayList<Violation>();

  public ViolationReport() {
  }

  public ViolationReport(List<Violation> violations) {
    addAll(violations);
  }

  public void add(Violation v) {
    violations.add(v);
  }

  public void addAll(List<Violation> vs) {
    violations.addAll(vs);
  }

  public boolean isClean() {
    return violations.isEmpty();
  }

  public List<Violation> getViolations() {
    return Collections.unmodifiableList(violations);
  }

  /**
   * @return violation messages in the order they were found
   */
  public List<String> getMessages() {
    List<String> msgs = new ArrayList<String>(violations.size());
    for (Violation v: violations) {
      msgs.add(v.getMessage());
    }
    return msgs;
  }

  public String render() {
    StringBuilder sb = new StringBuilder();
    sb.append('\n');
    sb.append(RULE).append('\n');
    sb.append(StringUtils.rightPad(StringUtils.leftPad(TITLE, 31), 38))
      .append('\n');
    sb.append(RULE).append('\n');
    if (violations.isEmpty()) {
      sb.append("  No violations found. Clean code!\n");
    } else {
      for (int i = 0; i < violations.size(); i++) {
        sb.append(" [").append(i + 1).append("] ")
          .append(violations.get(i).getMessage()).append('\n');
      }
    }
    sb.append(RULE).append("\n\n");
    return sb.toString();
  }

  @Override
  public String toString() {
    return render();
  }
}
