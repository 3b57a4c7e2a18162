/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.dataset;

import com.luisppb16.seedkit.util.TypeMismatchException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.experimental.UtilityClass;

/**
 * Recursive merging of dataset trees.
 *
 * <p>Unlike the top-level composition of base and exact-locale files done by {@link
 * DatasetStore}, a merge descends into every key where both sides hold a mapping. Everywhere else
 * the incoming value replaces the existing one, whatever the two types are.
 */
@UtilityClass
public class DatasetMerger {

  /**
   * Merges {@code other} into {@code initial} in place.
   *
   * @param initial the mapping to update
   * @param other the patch; must be a {@link Map}
   * @return {@code initial}
   * @throws TypeMismatchException if {@code other} is not a mapping
   */
  public static Map<String, Object> merge(final Map<String, Object> initial, final Object other) {
    Objects.requireNonNull(initial, "Merge target cannot be null");
    if (!(other instanceof Map<?, ?> patch)) {
      throw new TypeMismatchException(
          "Dataset patch must be a mapping, got "
              + (other == null ? "null" : other.getClass().getSimpleName()));
    }
    patch.forEach(
        (key, value) -> {
          final String name = String.valueOf(key);
          if (initial.get(name) instanceof Map<?, ?> existing && value instanceof Map<?, ?>) {
            merge(asMutableTree(existing), value);
          } else {
            initial.put(name, deepCopy(value));
          }
        });
    return initial;
  }

  /**
   * Copies a JSON tree into fresh mutable containers. Leaves are shared; they are immutable
   * scalars.
   */
  @SuppressWarnings("unchecked")
  public static <T> T deepCopy(final T tree) {
    if (tree instanceof Map<?, ?> map) {
      final Map<String, Object> copy = new LinkedHashMap<>();
      map.forEach((k, v) -> copy.put(String.valueOf(k), deepCopy(v)));
      return (T) copy;
    }
    if (tree instanceof List<?> list) {
      final List<Object> copy = new ArrayList<>(list.size());
      list.forEach(v -> copy.add(deepCopy(v)));
      return (T) copy;
    }
    return tree;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> asMutableTree(final Map<?, ?> map) {
    return (Map<String, Object>) map;
  }
}
