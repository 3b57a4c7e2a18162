/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.provider;

import com.luisppb16.seedkit.config.ProviderConfig;
import com.luisppb16.seedkit.config.ProviderMeta;
import com.luisppb16.seedkit.model.EanFormat;
import com.luisppb16.seedkit.model.IsbnFormat;
import com.luisppb16.seedkit.model.Locale;
import com.luisppb16.seedkit.util.Checksums;
import java.util.List;
import java.util.Map;

/** Codes: ISSN, ISBN, EAN, IMEI, PIN and MS-LCID locale codes. */
public class Code extends BaseProvider {

  private static final ProviderMeta META = ProviderMeta.of("code");
  private static final String TABLES_FILE = "codes.json";
  private static final String DEFAULT_ISBN_GROUP = "default";

  private final Tables tables;

  public Code() {
    this(ProviderConfig.defaults());
  }

  public Code(final ProviderConfig config) {
    super(META, config);
    this.tables = readGlobalResource(TABLES_FILE, Tables.class);
  }

  public String localeCode() {
    return getRandom().choice(tables.localeCodes());
  }

  public String issn(final String mask) {
    return fillMask(mask);
  }

  public String issn() {
    return issn("####-####");
  }

  /**
   * Generates an ISBN whose registration group matches {@code locale}.
   *
   * @param format an {@link IsbnFormat}, its name, or {@code null} for a random format
   * @param locale a {@link Locale} or locale tag
   */
  public String isbn(final Object format, final Object locale) {
    final String key = (String) coerceEnum(format, IsbnFormat.class);
    final Locale resolved = Locale.validate(locale);
    final String group =
        tables
            .isbnGroups()
            .getOrDefault(resolved.getValue(), tables.isbnGroups().get(DEFAULT_ISBN_GROUP));
    final String mask = tables.isbnMasks().get(key).replace("{0}", group);
    return fillMask(mask);
  }

  public String isbn() {
    return isbn(null, Locale.DEFAULT);
  }

  /** @param format an {@link EanFormat}, its name, or {@code null} for a random format */
  public String ean(final Object format) {
    final String key = (String) coerceEnum(format, EanFormat.class);
    return fillMask(tables.eanMasks().get(key));
  }

  public String ean() {
    return ean(null);
  }

  /** A 15-digit IMEI: a type allocation code, a serial number and a Luhn check digit. */
  public String imei() {
    final String tac = getRandom().choice(tables.imeiTacs());
    final String body = tac + getRandom().randint(100000, 999999);
    return body + Checksums.luhn(body);
  }

  public String pin(final String mask) {
    return fillMask(mask);
  }

  public String pin() {
    return pin("####");
  }

  public record Tables(
      List<String> localeCodes,
      List<String> imeiTacs,
      Map<String, String> isbnGroups,
      Map<String, String> isbnMasks,
      Map<String, String> eanMasks) {}
}
