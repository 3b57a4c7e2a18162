/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.random;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/**
 * Process-wide seed shared by every provider.
 *
 * <p>Initialised once from the {@value #PROPERTY} system property, falling back to the {@value
 * #ENV_VARIABLE} environment variable. The value {@code none} selects {@link Seed#none()}, an
 * integer selects a numeric seed and any other text a string seed. Test harnesses may replace it
 * through {@link #set(Seed)}.
 */
@Slf4j
@UtilityClass
public class GlobalSeed {

  public static final String PROPERTY = "seedkit.seed";
  public static final String ENV_VARIABLE = "SEEDKIT_SEED";

  private static volatile Seed current = fromEnvironment();

  public static Seed get() {
    return current;
  }

  public static void set(final Seed seed) {
    current = seed == null ? Seed.unset() : seed;
    log.debug("Global seed set to {}", current);
  }

  public static void clear() {
    set(Seed.unset());
  }

  static Seed parse(final String raw) {
    if (raw == null || raw.isBlank()) {
      return Seed.unset();
    }
    final String trimmed = raw.trim();
    if ("none".equalsIgnoreCase(trimmed)) {
      return Seed.none();
    }
    try {
      return Seed.of(Long.parseLong(trimmed));
    } catch (final NumberFormatException e) {
      return Seed.of(trimmed);
    }
  }

  private static Seed fromEnvironment() {
    String raw = System.getProperty(PROPERTY);
    if (raw == null) {
      raw = System.getenv(ENV_VARIABLE);
    }
    return parse(raw);
  }
}
