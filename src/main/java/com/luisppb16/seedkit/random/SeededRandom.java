/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.random;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * The random generator every provider draws from.
 *
 * <p>Extends {@link Random} with the selection and mask helpers generators need. All helpers
 * consume the underlying sequence, so two instances seeded alike produce identical results for
 * identical call sequences.
 */
public class SeededRandom extends Random {

  private static final long serialVersionUID = 1L;

  public SeededRandom() {
    super();
  }

  public SeededRandom(final long seed) {
    super(seed);
  }

  /** Returns a random integer in the closed range {@code [a, b]}. */
  public int randint(final int a, final int b) {
    if (a > b) {
      throw new IllegalArgumentException("Empty range [" + a + ", " + b + "]");
    }
    return a + nextInt(b - a + 1);
  }

  public <T> T choice(final List<T> items) {
    if (items == null || items.isEmpty()) {
      throw new IllegalArgumentException("Cannot choose from an empty sequence");
    }
    return items.get(nextInt(items.size()));
  }

  /** Picks {@code k} items with replacement. */
  public <T> List<T> choices(final List<T> items, final int k) {
    if (k < 0) {
      throw new IllegalArgumentException("Number of choices must be non-negative, got " + k);
    }
    final List<T> picked = new ArrayList<>(k);
    for (int i = 0; i < k; i++) {
      picked.add(choice(items));
    }
    return picked;
  }

  public String generateString(final String alphabet, final int length) {
    if (alphabet == null || alphabet.isEmpty()) {
      throw new IllegalArgumentException("Alphabet cannot be empty");
    }
    if (length < 0) {
      throw new IllegalArgumentException("Length must be non-negative, got " + length);
    }
    final StringBuilder sb = new StringBuilder(length);
    for (int i = 0; i < length; i++) {
      sb.append(alphabet.charAt(nextInt(alphabet.length())));
    }
    return sb.toString();
  }

  /**
   * Fills a mask, replacing {@code charCode} with a random upper-case ASCII letter and {@code
   * digitCode} with a random decimal digit. Other characters are copied as they are.
   *
   * @param mask the mask, e.g. {@code "@###"}
   * @param charCode placeholder for letters
   * @param digitCode placeholder for digits
   * @return the filled code
   * @throws IllegalArgumentException if both placeholders are the same character
   */
  public String customCode(final String mask, final char charCode, final char digitCode) {
    if (charCode == digitCode) {
      throw new IllegalArgumentException(
          "The same placeholder can not be used for digits and chars: '" + charCode + "'");
    }
    final StringBuilder sb = new StringBuilder(mask.length());
    for (int i = 0; i < mask.length(); i++) {
      final char c = mask.charAt(i);
      if (c == charCode) {
        sb.append((char) ('A' + nextInt(26)));
      } else if (c == digitCode) {
        sb.append((char) ('0' + nextInt(10)));
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }

  public String customCode(final String mask) {
    return customCode(mask, '@', '#');
  }
}
