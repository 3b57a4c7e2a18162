/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.config;

import com.luisppb16.seedkit.dataset.ClasspathDatasetResource;
import com.luisppb16.seedkit.dataset.DatasetResource;
import com.luisppb16.seedkit.model.Locale;
import com.luisppb16.seedkit.random.Seed;
import java.util.Random;
import lombok.Builder;

/**
 * Construction parameters of a provider.
 *
 * @param locale a {@link Locale} or a locale tag; {@link Locale#DEFAULT} when omitted. Ignored by
 *     locale-independent providers.
 * @param seed the seed; {@link Seed#unset()} when omitted
 * @param random a caller-built generator to adopt, or {@code null} for a private one
 * @param resource where datasets are read from; the classpath under {@code /datasets} when
 *     omitted
 */
@Builder(toBuilder = true)
public record ProviderConfig(Object locale, Seed seed, Random random, DatasetResource resource) {

  public ProviderConfig {
    locale = locale == null ? Locale.DEFAULT : locale;
    seed = seed == null ? Seed.unset() : seed;
    resource = resource == null ? ClasspathDatasetResource.defaultResource() : resource;
  }

  public static ProviderConfig defaults() {
    return ProviderConfig.builder().build();
  }

  public static ProviderConfig withSeed(final long seed) {
    return ProviderConfig.builder().seed(Seed.of(seed)).build();
  }
}
