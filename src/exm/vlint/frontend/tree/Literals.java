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
package exm.vlint.frontend.tree;

import org.apache.commons.lang3.StringUtils;

import exm.vlint.frontend.LogHelper;

public class Literals {

  /** Width of an unsized literal such as 255 or 'hFF */
  public static final int DEFAULT_WIDTH = 32;

  /**
   * Parse a Verilog numeric literal such as 255, 8'hFF, 4'b1010 or
   * 'o17.  Underscores in the digits are ignored.
   * @param text literal as written
   * @return the value and width, or null if the literal can't be parsed
   */
  public static ConstantValue parseNumber(String text) {
    if (StringUtils.isEmpty(text)) {
      return null;
    }

    int tick = text.indexOf('\'');
    if (tick < 0) {
      Long value = parseDigits(StringUtils.remove(text, '_'), 10);
      return value == null ? null : new ConstantValue(value, DEFAULT_WIDTH);
    }

    int width = parseWidth(text.substring(0, tick));
    if (tick + 1 >= text.length()) {
      return null;
    }
    int base = baseFor(text.charAt(tick + 1));
    String digits = StringUtils.remove(text.substring(tick + 2), '_');

    Long value;
    if (base == 2) {
      value = parseBinary(digits);
    } else {
      value = parseDigits(digits, base);
    }
    if (value == null) {
      LogHelper.trace(0, "Could not parse numeric literal " + text);
      return null;
    }
    return new ConstantValue(value, width);
  }

  private static int parseWidth(String prefix) {
    if (!StringUtils.isNumeric(prefix)) {
      if (!prefix.isEmpty()) {
        LogHelper.trace(0, "Ignoring malformed literal width " + prefix);
      }
      return DEFAULT_WIDTH;
    }
    try {
      return Integer.parseInt(prefix);
    } catch (NumberFormatException e) {
      LogHelper.trace(0, "Ignoring malformed literal width " + prefix);
      return DEFAULT_WIDTH;
    }
  }

  /**
   * Unknown base characters are read as decimal
   */
  private static int baseFor(char baseChar) {
    switch (Character.toLowerCase(baseChar)) {
      case 'h':
        return 16;
      case 'b':
        return 2;
      case 'o':
        return 8;
      default:
        return 10;
    }
  }

  private static Long parseBinary(String digits) {
    if (digits.isEmpty()) {
      return null;
    }
    long value = 0;
    for (int i = 0; i < digits.length(); i++) {
      char c = digits.charAt(i);
      if (c == '0' || c == '1') {
        value = (value << 1) | (c - '0');
      } else {
        return null;
      }
    }
    return value;
  }

  /**
   * @return the value, or null if digits is empty, signed or not valid
   *         in base
   */
  private static Long parseDigits(String digits, int base) {
    if (!StringUtils.isAlphanumeric(digits)) {
      // Rejects signs, which parseUnsignedLong would accept
      return null;
    }
    try {
      return Long.parseUnsignedLong(digits, base);
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
