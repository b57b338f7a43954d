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
package exm.minic.frontend.tree;

import java.math.BigInteger;

import exm.minic.common.exceptions.MiniCRuntimeError;

public class Literals {

  /** Integer literals are reduced modulo this */
  private static final BigInteger UINT_MODULUS = BigInteger.ONE.shiftLeft(32);

  /**
   * Parse an integer literal lexeme with the correct radix: a 0x or 0X
   * prefix is hexadecimal, a leading 0 followed by more digits is octal,
   * anything else is decimal.  Values that don't fit in 32 bits wrap.
   * @param lexeme literal as written in the source
   * @return value in [0, 2^32)
   */
  public static long parseIntLiteral(String lexeme) {
    if (lexeme.startsWith("0x") || lexeme.startsWith("0X")) {
      return parseIntLiteral(lexeme.substring(2), 16, "hexadecimal");
    } else if (lexeme.startsWith("0") && lexeme.length() > 1) {
      return parseIntLiteral(lexeme.substring(1), 8, "octal");
    } else {
      return parseIntLiteral(lexeme, 10, "decimal");
    }
  }

  private static long parseIntLiteral(String number, int base,
                                      String literalType) {
    try {
      return new BigInteger(number, base).mod(UINT_MODULUS).longValue();
    } catch (NumberFormatException e) {
      // The lexer only passes through well-formed literals
      throw new MiniCRuntimeError("Invalid " + literalType + " literal: "
                                  + number);
    }
  }
}
