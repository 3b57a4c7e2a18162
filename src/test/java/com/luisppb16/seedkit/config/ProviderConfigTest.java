/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.luisppb16.seedkit.dataset.ClasspathDatasetResource;
import com.luisppb16.seedkit.dataset.InMemoryDatasetResource;
import com.luisppb16.seedkit.model.Locale;
import com.luisppb16.seedkit.random.Seed;
import org.junit.jupiter.api.Test;

class ProviderConfigTest {

  @Test
  void defaults() {
    final ProviderConfig config = ProviderConfig.defaults();
    assertThat(config.locale()).isEqualTo(Locale.DEFAULT);
    assertThat(config.seed()).isEqualTo(Seed.unset());
    assertThat(config.random()).isNull();
    assertThat(config.resource()).isSameAs(ClasspathDatasetResource.defaultResource());
  }

  @Test
  void toBuilderKeepsOtherFields() {
    final InMemoryDatasetResource resource = new InMemoryDatasetResource();
    final ProviderConfig base =
        ProviderConfig.builder().locale("fr").seed(Seed.of(1)).resource(resource).build();
    final ProviderConfig changed = base.toBuilder().seed(Seed.none()).build();

    assertThat(changed.locale()).isEqualTo("fr");
    assertThat(changed.seed()).isEqualTo(Seed.none());
    assertThat(changed.resource()).isSameAs(resource);
  }

  @Test
  void withSeed() {
    assertThat(ProviderConfig.withSeed(5).seed()).isEqualTo(Seed.of(5));
  }

  @Test
  void metaName() {
    assertThat(ProviderMeta.of("person").name()).isEqualTo("person");
  }
}
