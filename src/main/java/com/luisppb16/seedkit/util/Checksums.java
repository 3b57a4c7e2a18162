/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.util;

import lombok.experimental.UtilityClass;

@UtilityClass
public class Checksums {

  /**
   * Computes the Luhn check digit for a string of decimal digits.
   *
   * @param digits the digits to protect, without the check digit
   * @return the check digit as a single-character string
   * @throws IllegalArgumentException if {@code digits} holds a non-digit character
   */
  public static String luhn(final String digits) {
    int check = 0;
    for (int i = 0; i < digits.length(); i++) {
      final char c = digits.charAt(digits.length() - 1 - i);
      if (c < '0' || c > '9') {
        throw new IllegalArgumentException("Not a digit: '" + c + "' in " + digits);
      }
      int sx = c - '0';
      if (i % 2 == 0) {
        sx *= 2;
      }
      if (sx > 9) {
        sx -= 9;
      }
      check += sx;
    }
    return String.valueOf(check * 9 % 10);
  }
}
