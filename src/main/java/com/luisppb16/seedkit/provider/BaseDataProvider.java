/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.provider;

import com.luisppb16.seedkit.config.ProviderConfig;
import com.luisppb16.seedkit.config.ProviderMeta;
import com.luisppb16.seedkit.dataset.DatasetMerger;
import com.luisppb16.seedkit.locale.LocaleContext;
import com.luisppb16.seedkit.locale.LocaleOverride;
import com.luisppb16.seedkit.model.Locale;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Base class of providers whose data depends on a locale.
 *
 * <p>On construction the provider validates {@link ProviderConfig#locale()} and loads {@code
 * <locale>/<name>.json}, falling back to the root locale for composite locales. The dataset can
 * then be queried with {@link #extract(List, Object)}, patched with {@link
 * #updateDataset(Object)} and temporarily switched with {@link #overrideLocale(Object)}.
 */
public abstract class BaseDataProvider extends BaseProvider {

  private final LocaleContext localeContext;

  protected BaseDataProvider(final ProviderMeta meta, final ProviderConfig config) {
    super(meta, config);
    this.localeContext = new LocaleContext(getDatasetStore(), meta.name());
    localeContext.setLocale(config.locale());
  }

  /**
   * Walks the dataset along {@code keys}. Mappings and lists are returned as copies; use
   * {@link #updateDataset(Object)} to change the dataset.
   *
   * @param keys the key path, outermost first
   * @param defaultValue returned when a key is missing or an intermediate value is not a mapping
   * @throws IllegalArgumentException if {@code keys} is empty
   */
  @SuppressWarnings("unchecked")
  public <T> T extract(final List<String> keys, final T defaultValue) {
    if (keys == null || keys.isEmpty()) {
      throw new IllegalArgumentException("The list of keys must not be empty.");
    }
    Object current = localeContext.getDataset();
    for (final String key : keys) {
      if (!(current instanceof Map<?, ?> map) || !map.containsKey(key)) {
        return defaultValue;
      }
      current = map.get(key);
    }
    return (T) DatasetMerger.deepCopy(current);
  }

  public <T> T extract(final String... keys) {
    return extract(List.of(keys), null);
  }

  /**
   * Deep-merges {@code patch} into the dataset of the current locale.
   *
   * @throws com.luisppb16.seedkit.util.TypeMismatchException if {@code patch} is not a mapping
   */
  public void updateDataset(final Object patch) {
    localeContext.patch(patch);
  }

  /** Read-only snapshot of the current dataset. Nested containers are detached copies. */
  public Map<String, Object> getDataset() {
    return Collections.unmodifiableMap(DatasetMerger.deepCopy(localeContext.getDataset()));
  }

  public Locale getLocale() {
    return localeContext.getLocale();
  }

  public String getCurrentLocale() {
    return localeContext.getLocale().getValue();
  }

  /**
   * Switches this provider to {@code locale} until the returned scope is closed. Meant for
   * try-with-resources; the previous locale is restored on every exit path.
   */
  public LocaleOverride overrideLocale(final Object locale) {
    return localeContext.override(locale);
  }

  @Override
  protected java.util.Locale fakerLocale() {
    return localeContext == null ? super.fakerLocale() : getLocale().toJavaLocale();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + " <" + getCurrentLocale() + ">";
  }
}
