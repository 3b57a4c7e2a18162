/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.config;

import com.luisppb16.seedkit.util.ConfigurationException;

/**
 * Per-provider constants. {@code name} keys the provider's dataset files: a provider named {@code
 * person} reads {@code <locale>/person.json}.
 */
public record ProviderMeta(String name) {

  public ProviderMeta {
    if (name == null || name.isBlank()) {
      throw new ConfigurationException("Provider name is required.");
    }
  }

  public static ProviderMeta of(final String name) {
    return new ProviderMeta(name);
  }
}
