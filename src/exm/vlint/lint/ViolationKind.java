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

import exm.vlint.common.Settings;

/**
 * Categories of lint violation.  Each can be switched off through the
 * matching vlint.check.* setting.
 */
public enum ViolationKind {
  ASSIGNMENT_STYLE(Settings.CHECK_ASSIGNMENT_STYLE),
  MULTI_DRIVER(Settings.CHECK_MULTI_DRIVER),
  WIDTH_MISMATCH(Settings.CHECK_WIDTH_MISMATCH),
  CONSTANT_OVERFLOW(Settings.CHECK_CONSTANT_OVERFLOW),
  LATCH_INFERENCE(Settings.CHECK_LATCH_INFERENCE),
  UNREACHABLE_BLOCK(Settings.CHECK_UNREACHABLE_BLOCK),
  NON_FULL_CASE(Settings.CHECK_NON_FULL_CASE),
  UNREACHABLE_FSM_STATE(Settings.CHECK_UNREACHABLE_FSM_STATE),
  UNINITIALIZED_REGISTER(Settings.CHECK_UNINITIALIZED_REGISTER),
  ;

  private final String settingKey;

  private ViolationKind(String settingKey) {
    this.settingKey = settingKey;
  }

  /**
   * @return name of the setting that enables this check
   */
  public String settingKey() {
    return settingKey;
  }
}
