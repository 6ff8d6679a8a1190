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
package exm.vlint.frontend;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import exm.vlint.ast.antlr.VLintParser;
import exm.vlint.common.Logging;

/**
 * Helper functions for indented log output while walking trees.
 */
public class LogHelper {
  static final Logger logger = Logging.getVLintLogger();

  /**
   * @param tokenNum token number from AST
   * @return descriptive string containing token name, or token number if
   *        unknown token type
   */
  public static String tokName(int tokenNum) {
    if (tokenNum < 0 || tokenNum > VLintParser.tokenNames.length - 1) {
      return "Invalid token number (" + tokenNum + ")";
    } else {
      return VLintParser.tokenNames[tokenNum];
    }
  }

  /**
     DEBUG-level with indentation for nice output
   */
  public static void debug(int indent, String msg) {
    log(indent, Level.DEBUG, msg);
  }

  /**
     TRACE-level with indentation for nice output
   */
  public static void trace(int indent, String msg) {
    log(indent, Level.TRACE, msg);
  }

  public static void log(int indent, Level level, String msg) {
    logger.log(level, logMsg(indent, msg));
  }

  private static String logMsg(int indent, String msg) {
    StringBuilder sb = new StringBuilder(256);
    for (int i = 0; i < indent; i++)
      sb.append(' ');
    sb.append(msg);
    return sb.toString();
  }

  public static boolean isDebugEnabled() {
    return logger.isDebugEnabled();
  }

  public static boolean isTraceEnabled() {
    return logger.isTraceEnabled();
  }
}
