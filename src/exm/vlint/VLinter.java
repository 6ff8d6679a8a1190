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
package exm.vlint;

import org.apache.log4j.Logger;

import exm.vlint.common.Logging;
import exm.vlint.common.Settings;
import exm.vlint.common.exceptions.InvalidOptionException;
import exm.vlint.common.exceptions.InvalidSyntaxException;
import exm.vlint.frontend.ParsedModule;
import exm.vlint.frontend.tree.Module;
import exm.vlint.lint.ModuleLinter;
import exm.vlint.lint.ViolationReport;

/**
 * Entry point: parse Verilog source text, lint it and collect the
 * violations into a report.
 */
public class VLinter {

  private static final Logger logger = Logging.getVLintLogger();

  private final ModuleLinter linter;

  public VLinter() {
    this(new ModuleLinter());
  }

  public VLinter(ModuleLinter linter) {
    this.linter = linter;
  }

  /**
   * Create a linter configured from Java system properties, and set up
   * logging as they request
   * @throws InvalidOptionException if a vlint.* property is malformed
   */
  public static VLinter fromSettings() throws InvalidOptionException {
    Settings.initVLintProperties();
    Logging.setupLogging();
    return new VLinter(ModuleLinter.fromSettings());
  }

  /**
   * @param sourceName name to use in syntax error messages
   * @param sourceText text of a single module
   * @throws InvalidSyntaxException if the text could not be parsed
   */
  public ViolationReport lint(String sourceName, String sourceText)
      throws InvalidSyntaxException {
    logger.debug("Parsing " + sourceName);
    ParsedModule parsed = ParsedModule.parse(sourceName, sourceText);
    Module module = parsed.buildModule();
    return lint(module);
  }

  public ViolationReport lint(Module module) {
    return new ViolationReport(linter.analyzeModule(module));
  }
}
