/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.provider;

import com.luisppb16.seedkit.model.ValuedEnum;
import com.luisppb16.seedkit.random.SeededRandom;
import com.luisppb16.seedkit.util.EnumResolutionException;
import java.util.Arrays;
import java.util.List;
import lombok.experimental.UtilityClass;

/**
 * Turns loosely typed generator arguments into enum values.
 *
 * <p>An argument is accepted in one of three forms: absent ({@code null}, a random member is
 * picked), a member of the target enum, or a string naming a member in any case. The result is
 * the member's value, see {@link ValuedEnum}; members of enums without a value stand for
 * themselves.
 */
@UtilityClass
public class EnumCoercion {

  /**
   * Coerces {@code item} against {@code enumType}.
   *
   * @throws EnumResolutionException if {@code enumType} is not an enum with at least one member,
   *     or {@code item} matches none of its members
   */
  public static Object coerce(
      final Object item, final Class<?> enumType, final SeededRandom random) {
    return valueOf(resolve(item, enumType, random));
  }

  /** Like {@link #coerce} but returns the member itself. */
  public static Enum<?> resolve(
      final Object item, final Class<?> enumType, final SeededRandom random) {
    if (enumType == null || !enumType.isEnum()) {
      throw new EnumResolutionException(
          item, enumType == null ? "null" : enumType.getSimpleName());
    }
    final List<Enum<?>> members =
        Arrays.stream(enumType.getEnumConstants()).<Enum<?>>map(m -> (Enum<?>) m).toList();
    if (members.isEmpty()) {
      throw new EnumResolutionException(item, enumType.getSimpleName());
    }

    if (item == null) {
      return random.choice(members);
    }
    if (enumType.isInstance(item)) {
      return (Enum<?>) item;
    }
    if (item instanceof String name) {
      for (final Enum<?> member : members) {
        if (member.name().equalsIgnoreCase(name.trim())) {
          return member;
        }
      }
    }
    throw new EnumResolutionException(item, enumType.getSimpleName());
  }

  private static Object valueOf(final Enum<?> member) {
    return member instanceof ValuedEnum<?> valued ? valued.getValue() : member;
  }
}
