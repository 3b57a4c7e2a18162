/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.random;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;
import lombok.EqualsAndHashCode;

/**
 * Seed value for a {@link SeededRandomSource}.
 *
 * <p>A seed is in one of three states. {@link #unset()} is the default and means "leave the
 * generator alone". {@link #none()} asks for a reseed from system entropy. A concrete seed built
 * through one of the {@code of} factories reseeds deterministically. String and byte seeds are
 * reduced to 64 bits through SHA-256, so equal inputs always yield equal sequences.
 */
@EqualsAndHashCode(onlyExplicitlyIncluded = true, doNotUseGetters = true)
public final class Seed {

  private enum Kind {
    UNSET,
    NONE,
    CONCRETE
  }

  private static final Seed UNSET = new Seed(Kind.UNSET, 0L, "unset");
  private static final Seed NONE = new Seed(Kind.NONE, 0L, "none");

  @EqualsAndHashCode.Include private final Kind kind;
  @EqualsAndHashCode.Include private final long value;
  private final String label;

  private Seed(final Kind kind, final long value, final String label) {
    this.kind = kind;
    this.value = value;
    this.label = label;
  }

  public static Seed unset() {
    return UNSET;
  }

  public static Seed none() {
    return NONE;
  }

  public static Seed of(final long value) {
    return new Seed(Kind.CONCRETE, value, Long.toString(value));
  }

  public static Seed of(final String value) {
    Objects.requireNonNull(value, "String seed cannot be null");
    return new Seed(Kind.CONCRETE, digest(value.getBytes(StandardCharsets.UTF_8)), value);
  }

  public static Seed of(final byte[] value) {
    Objects.requireNonNull(value, "Byte seed cannot be null");
    return new Seed(Kind.CONCRETE, digest(value), "bytes[" + value.length + "]");
  }

  public boolean isUnset() {
    return kind == Kind.UNSET;
  }

  public boolean isNone() {
    return kind == Kind.NONE;
  }

  public boolean isConcrete() {
    return kind == Kind.CONCRETE;
  }

  /**
   * Returns the 64-bit seed handed to the generator.
   *
   * @throws IllegalStateException if this seed is unset or none
   */
  public long getValue() {
    if (kind != Kind.CONCRETE) {
      throw new IllegalStateException("Seed '" + label + "' has no concrete value");
    }
    return value;
  }

  private static long digest(final byte[] bytes) {
    try {
      final byte[] hash = MessageDigest.getInstance("SHA-256").digest(bytes);
      return ByteBuffer.wrap(hash).getLong();
    } catch (final NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 is not available", e);
    }
  }

  @Override
  public String toString() {
    return label;
  }
}
