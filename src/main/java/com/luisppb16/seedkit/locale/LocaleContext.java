/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.locale;

import com.luisppb16.seedkit.dataset.DatasetMerger;
import com.luisppb16.seedkit.dataset.DatasetStore;
import com.luisppb16.seedkit.model.Locale;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Current locale of a data provider together with the dataset loaded for it.
 *
 * <p>The dataset always matches the locale: it is the file set loaded for the locale plus the
 * patches applied since the locale was set. {@link #setLocale(Object)} loads before it swaps, so a
 * failed load leaves both untouched.
 *
 * <p>Not thread-safe. An {@link #override(Object)} mutates this context for the length of its
 * scope, so concurrent callers must use one provider each or serialize access.
 */
@Slf4j
public class LocaleContext {

  private final DatasetStore store;
  private final String providerKey;

  private Locale locale;
  private Map<String, Object> dataset = new LinkedHashMap<>();
  private List<Map<String, Object>> patches = new ArrayList<>();

  public LocaleContext(final DatasetStore store, final String providerKey) {
    this.store = Objects.requireNonNull(store, "Dataset store cannot be null");
    this.providerKey = Objects.requireNonNull(providerKey, "Provider key cannot be null");
  }

  /**
   * Validates {@code candidate}, loads its dataset and makes both current.
   *
   * @throws com.luisppb16.seedkit.util.UnsupportedLocaleException if the locale is unknown
   * @throws com.luisppb16.seedkit.util.DatasetNotFoundException if no dataset exists for it
   */
  public void setLocale(final Object candidate) {
    final Locale validated = Locale.validate(candidate);
    final Map<String, Object> loaded = store.load(validated, providerKey);
    if (locale != null && locale != validated) {
      log.debug("Switching {} from {} to {}", providerKey, locale, validated);
    }
    this.locale = validated;
    this.dataset = loaded;
    this.patches = new ArrayList<>();
  }

  /**
   * Merges {@code patch} into the current dataset and remembers it, so it survives the locale
   * being restored after an override.
   *
   * <p>Remembered patches live until the next {@link #setLocale(Object)}. A patch drops every
   * earlier one whose top-level keys it all replaces with non-mapping values, so repeatedly
   * setting the same keys does not grow the history.
   */
  @SuppressWarnings("unchecked")
  public void patch(final Object patch) {
    DatasetMerger.merge(dataset, patch);
    final Map<String, Object> recorded = (Map<String, Object>) DatasetMerger.deepCopy(patch);
    patches.removeIf(earlier -> replacesEveryKey(recorded, earlier));
    patches.add(recorded);
  }

  private static boolean replacesEveryKey(
      final Map<String, Object> later, final Map<String, Object> earlier) {
    return earlier.keySet().stream()
        .allMatch(key -> later.containsKey(key) && !(later.get(key) instanceof Map));
  }

  /**
   * Switches to {@code candidate} until the returned scope is closed.
   *
   * <pre>{@code
   * try (LocaleOverride ignored = context.override(Locale.FR)) {
   *   ...
   * }
   * }</pre>
   *
   * @throws IllegalStateException if no locale has been set yet
   */
  public LocaleOverride override(final Object candidate) {
    if (locale == null) {
      throw new IllegalStateException(
          "Cannot override the locale of " + providerKey + " before one is set");
    }
    final LocaleOverride scope = new LocaleOverride(this, locale, List.copyOf(patches));
    setLocale(candidate);
    return scope;
  }

  void restore(final Locale previous, final List<Map<String, Object>> previousPatches) {
    setLocale(previous);
    previousPatches.forEach(this::patch);
  }

  int patchCount() {
    return patches.size();
  }

  public Locale getLocale() {
    return locale;
  }

  /** Live view of the current dataset. Callers must not modify it. */
  public Map<String, Object> getDataset() {
    return dataset;
  }
}
