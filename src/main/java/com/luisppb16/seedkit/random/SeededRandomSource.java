/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.random;

import com.luisppb16.seedkit.util.TypeMismatchException;
import java.security.SecureRandom;
import java.util.Random;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Owner of one provider's {@link SeededRandom} and of the seed it was last given.
 *
 * <p>Key responsibilities include:
 *
 * <ul>
 *   <li>Adopting a caller-built generator after checking it is a {@link SeededRandom}
 *   <li>Creating a private generator otherwise, seeded from {@link GlobalSeed} when no instance
 *       seed is given
 *   <li>Reseeding on demand, where an unset seed leaves the generator untouched and a none seed
 *       pulls fresh entropy
 *   <li>Reporting whether output is reproducible, taking the global seed into account
 * </ul>
 *
 * <p>Instances are not thread-safe; each provider owns exactly one.
 */
@Slf4j
public class SeededRandomSource {

  private static final SecureRandom ENTROPY = new SecureRandom();

  @Getter private final SeededRandom random;
  @Getter private Seed seed;

  public SeededRandomSource(final Seed seed) {
    this(seed, null);
  }

  public SeededRandomSource(final Seed seed, final Random external) {
    final Seed requested = seed == null ? Seed.unset() : seed;
    if (external == null) {
      this.random = new SeededRandom();
    } else if (external instanceof SeededRandom adopted) {
      this.random = adopted;
    } else {
      throw new TypeMismatchException(
          "The random must be an instance of "
              + SeededRandom.class.getName()
              + ", got "
              + external.getClass().getName());
    }
    this.seed = requested;

    if (requested.isUnset() && external == null) {
      final Seed global = GlobalSeed.get();
      if (!global.isUnset()) {
        apply(global);
      }
    } else {
      reseed(requested);
    }
  }

  /**
   * Reseeds the generator. An unset (or {@code null}) seed is a no-op. Any other seed, {@link
   * Seed#none()} included, becomes the instance seed.
   */
  public void reseed(final Seed newSeed) {
    if (newSeed == null || newSeed.isUnset()) {
      return;
    }
    this.seed = newSeed;
    apply(newSeed);
  }

  /**
   * Whether output is reproducible. A concrete instance seed wins; an unset or none instance seed
   * defers to {@link GlobalSeed}.
   */
  public boolean hasEffectiveSeed() {
    if (seed.isConcrete()) {
      return true;
    }
    return GlobalSeed.get().isConcrete();
  }

  private void apply(final Seed target) {
    final long value = target.isNone() ? ENTROPY.nextLong() : target.getValue();
    random.setSeed(value);
    log.debug("Reseeded random source with {}", target);
  }
}
