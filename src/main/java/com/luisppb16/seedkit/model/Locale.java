/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.model;

import com.luisppb16.seedkit.util.ConfigurationException;
import com.luisppb16.seedkit.util.UnsupportedLocaleException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Closed set of locales datasets are published for.
 *
 * <p>A tag is either a root ({@code en}) or a root and a suffix joined by {@link #SEPARATOR}
 * ({@code en-gb}).
 */
@Getter
@RequiredArgsConstructor
public enum Locale implements ValuedEnum<String> {
  CS("cs"),
  DA("da"),
  DE("de"),
  DE_AT("de-at"),
  DE_CH("de-ch"),
  EL("el"),
  EN("en"),
  EN_AU("en-au"),
  EN_CA("en-ca"),
  EN_GB("en-gb"),
  ES("es"),
  ES_MX("es-mx"),
  ET("et"),
  FA("fa"),
  FI("fi"),
  FR("fr"),
  HR("hr"),
  HU("hu"),
  IS("is"),
  IT("it"),
  JA("ja"),
  KK("kk"),
  KO("ko"),
  NL("nl"),
  NL_BE("nl-be"),
  NO("no"),
  PL("pl"),
  PT("pt"),
  PT_BR("pt-br"),
  RU("ru"),
  SK("sk"),
  SV("sv"),
  TR("tr"),
  UK("uk"),
  ZH("zh");

  public static final Locale DEFAULT = EN;
  public static final String SEPARATOR = "-";

  private final String value;

  public boolean isComposite() {
    return value.contains(SEPARATOR);
  }

  /** The root tag; for a root locale this is the tag itself. */
  public String getRoot() {
    final int idx = value.indexOf(SEPARATOR);
    return idx < 0 ? value : value.substring(0, idx);
  }

  /** The suffix after the separator, or {@code null} for a root locale. */
  public String getSuffix() {
    final int idx = value.indexOf(SEPARATOR);
    return idx < 0 ? null : value.substring(idx + 1);
  }

  public java.util.Locale toJavaLocale() {
    return java.util.Locale.forLanguageTag(value);
  }

  /**
   * Resolves a locale given as a {@link Locale} member, a tag ({@code "en-GB"}) or a member name
   * ({@code "EN_GB"}). Matching ignores case.
   *
   * @throws ConfigurationException if {@code locale} is {@code null}
   * @throws UnsupportedLocaleException if {@code locale} is of another type or names no supported
   *     locale
   */
  public static Locale validate(final Object locale) {
    if (locale == null) {
      throw new ConfigurationException("The locale parameter is required.");
    }
    if (locale instanceof Locale known) {
      return known;
    }
    if (!(locale instanceof String tag)) {
      throw new UnsupportedLocaleException(
          locale,
          "Locale must be a string or Locale member, got " + locale.getClass().getSimpleName());
    }
    final String normalized = tag.trim();
    for (final Locale candidate : values()) {
      if (candidate.value.equalsIgnoreCase(normalized)
          || candidate.name().equalsIgnoreCase(normalized)) {
        return candidate;
      }
    }
    throw new UnsupportedLocaleException(tag);
  }

  @Override
  public String toString() {
    return value;
  }
}
