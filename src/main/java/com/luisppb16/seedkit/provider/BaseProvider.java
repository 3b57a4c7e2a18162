/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.provider;

import com.luisppb16.seedkit.config.ProviderConfig;
import com.luisppb16.seedkit.config.ProviderMeta;
import com.luisppb16.seedkit.dataset.DatasetStore;
import com.luisppb16.seedkit.random.Seed;
import com.luisppb16.seedkit.random.SeededRandom;
import com.luisppb16.seedkit.random.SeededRandomSource;
import com.luisppb16.seedkit.util.ConfigurationException;
import lombok.Getter;
import net.datafaker.Faker;

/**
 * Base class of every provider.
 *
 * <p>Key responsibilities include:
 *
 * <ul>
 *   <li>Owning the provider's {@link SeededRandom}, built or adopted from {@link ProviderConfig}
 *   <li>Reseeding it and reporting whether output is reproducible
 *   <li>Coercing loosely typed enum arguments through {@link EnumCoercion}
 *   <li>Reading locale-independent files from the {@code global} dataset namespace
 *   <li>Handing out a Datafaker {@link Faker} that draws from the same generator
 * </ul>
 *
 * <p>Subclasses pass a constant {@link ProviderMeta} naming their datasets. Providers are not
 * thread-safe; use one instance per task.
 */
public abstract class BaseProvider {

  @Getter private final ProviderMeta meta;
  private final SeededRandomSource randomSource;
  private final DatasetStore datasetStore;

  private Faker faker;
  private java.util.Locale fakerLocale;

  protected BaseProvider(final ProviderMeta meta, final ProviderConfig config) {
    if (meta == null) {
      throw new ConfigurationException("Provider metadata is required.");
    }
    if (config == null) {
      throw new ConfigurationException("Provider configuration is required.");
    }
    this.meta = meta;
    this.randomSource = new SeededRandomSource(config.seed(), config.random());
    this.datasetStore = new DatasetStore(config.resource());
  }

  /**
   * Reseeds the generator. {@link Seed#unset()} leaves it alone, {@link Seed#none()} reseeds
   * from system entropy.
   */
  public void reseed(final Seed seed) {
    randomSource.reseed(seed);
  }

  public void reseed(final long seed) {
    reseed(Seed.of(seed));
  }

  public SeededRandom getRandom() {
    return randomSource.getRandom();
  }

  public Seed getSeed() {
    return randomSource.getSeed();
  }

  /** Whether output is reproducible, taking the global seed into account. */
  public boolean hasSeed() {
    return randomSource.hasEffectiveSeed();
  }

  /** See {@link EnumCoercion#coerce(Object, Class, SeededRandom)}. */
  public Object coerceEnum(final Object item, final Class<?> enumType) {
    return EnumCoercion.coerce(item, enumType, getRandom());
  }

  /**
   * Reads {@code global/<fileName>}.
   *
   * @throws com.luisppb16.seedkit.util.DatasetNotFoundException if the file does not exist
   */
  public Object readGlobalResource(final String fileName) {
    return datasetStore.readGlobal(fileName);
  }

  protected <T> T readGlobalResource(final String fileName, final Class<T> type) {
    return datasetStore.readGlobal(fileName, type);
  }

  /**
   * A Datafaker instance drawing from this provider's generator, so reseeding the provider also
   * fixes what the faker returns. Rebuilt when the provider's locale changes.
   */
  public Faker faker() {
    final java.util.Locale target = fakerLocale();
    if (faker == null || !target.equals(fakerLocale)) {
      faker = new Faker(target, getRandom());
      fakerLocale = target;
    }
    return faker;
  }

  /**
   * Fills {@code mask} through {@link #faker()}: {@code #} becomes a digit and {@code @} an
   * upper-case letter. Masks holding a literal {@code ?}, which Datafaker would also replace, go
   * through {@link SeededRandom#customCode(String)} instead.
   */
  protected String fillMask(final String mask) {
    if (mask.indexOf('?') >= 0) {
      return getRandom().customCode(mask);
    }
    return faker().bothify(mask.replace('@', '?'), true);
  }

  protected java.util.Locale fakerLocale() {
    return java.util.Locale.ENGLISH;
  }

  protected DatasetStore getDatasetStore() {
    return datasetStore;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName();
  }
}
