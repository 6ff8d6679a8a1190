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
 * What the statement analyzer needs to know about the enclosing driver
 */
public class BlockContext {

  private final Object driver;
  private final boolean combinational;

  /**
   * @param driver the always block or continuous assignment that owns the
   *        statements.  Compared by identity.
   * @param combinational true if no edge appears in the sensitivity list
   */
  public BlockContext(Object driver, boolean combinational) {
    this.driver = Preconditions.checkNotNull(driver);
    this.combinational = combinational;
  }

  public Object getDriver() {
    return driver;
  }

  public boolean isCombinational() {
    return combinational;
  }
}
