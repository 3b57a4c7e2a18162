/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.provider;

import com.luisppb16.seedkit.config.ProviderConfig;
import com.luisppb16.seedkit.config.ProviderMeta;
import com.luisppb16.seedkit.model.MeasureUnit;
import com.luisppb16.seedkit.model.MetricPrefixSign;
import java.util.List;
import java.util.Map;

/** Pseudo-scientific data: nucleotide sequences, SI units and metric prefixes. */
public class Science extends BaseProvider {

  private static final ProviderMeta META = ProviderMeta.of("science");
  private static final String TABLES_FILE = "science.json";
  private static final String RNA_NUCLEOTIDES = "AGUC";
  private static final String DNA_NUCLEOTIDES = "AGTC";

  private final Tables tables;

  public Science() {
    this(ProviderConfig.defaults());
  }

  public Science(final ProviderConfig config) {
    super(META, config);
    this.tables = readGlobalResource(TABLES_FILE, Tables.class);
  }

  public String rnaSequence(final int length) {
    return getRandom().generateString(RNA_NUCLEOTIDES, length);
  }

  public String rnaSequence() {
    return rnaSequence(10);
  }

  public String dnaSequence(final int length) {
    return getRandom().generateString(DNA_NUCLEOTIDES, length);
  }

  public String dnaSequence() {
    return dnaSequence(10);
  }

  /**
   * @param unit a {@link MeasureUnit}, its name, or {@code null} for a random unit
   * @param symbol return the symbol instead of the name
   */
  public String measureUnit(final Object unit, final boolean symbol) {
    final MeasureUnit.Unit resolved = (MeasureUnit.Unit) coerceEnum(unit, MeasureUnit.class);
    return symbol ? resolved.symbol() : resolved.name();
  }

  public String measureUnit() {
    return measureUnit(null, false);
  }

  /**
   * @param sign a {@link MetricPrefixSign}, its name, or {@code null} for a random sign
   * @param symbol return the symbol instead of the name
   */
  public String metricPrefix(final Object sign, final boolean symbol) {
    final String key = (String) coerceEnum(sign, MetricPrefixSign.class);
    final Map<String, List<String>> prefixes =
        symbol ? tables.siPrefixSymbols() : tables.siPrefixes();
    return getRandom().choice(prefixes.get(key));
  }

  public String metricPrefix() {
    return metricPrefix(null, false);
  }

  public record Tables(
      Map<String, List<String>> siPrefixes, Map<String, List<String>> siPrefixSymbols) {}
}
