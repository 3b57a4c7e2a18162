/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.luisppb16.seedkit.dataset.DatasetStore;
import com.luisppb16.seedkit.dataset.InMemoryDatasetResource;
import com.luisppb16.seedkit.model.Locale;
import com.luisppb16.seedkit.util.DatasetNotFoundException;
import com.luisppb16.seedkit.util.DatasetReadException;
import com.luisppb16.seedkit.util.UnsupportedLocaleException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LocaleContextTest {

  private InMemoryDatasetResource resource;
  private LocaleContext context;

  @BeforeEach
  void setUp() {
    resource =
        new InMemoryDatasetResource()
            .put("en", "food.json", Map.of("dish", "pie", "drink", "tea"))
            .put("fr", "food.json", Map.of("dish", "crêpe"))
            .put("it", "food.json", Map.of("dish", "pasta"));
    context = new LocaleContext(new DatasetStore(resource), "food");
  }

  @Test
  void setLocaleLoadsMatchingDataset() {
    context.setLocale("en");
    assertThat(context.getLocale()).isEqualTo(Locale.EN);
    assertThat(context.getDataset()).containsEntry("dish", "pie");

    context.setLocale(Locale.FR);
    assertThat(context.getLocale()).isEqualTo(Locale.FR);
    assertThat(context.getDataset()).isEqualTo(Map.of("dish", "crêpe"));
  }

  @Test
  @DisplayName("A failed switch leaves locale and dataset as they were")
  void failedSwitchKeepsState() {
    context.setLocale(Locale.EN);

    assertThatThrownBy(() -> context.setLocale(Locale.JA))
        .isInstanceOf(DatasetNotFoundException.class);
    assertThatThrownBy(() -> context.setLocale("klingon"))
        .isInstanceOf(UnsupportedLocaleException.class);

    assertThat(context.getLocale()).isEqualTo(Locale.EN);
    assertThat(context.getDataset()).containsEntry("dish", "pie");
  }

  @Test
  void overrideBeforeAnyLocaleFails() {
    assertThatThrownBy(() -> context.override(Locale.FR))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("food");
  }

  @Test
  void overrideRestoresOnNormalExit() {
    context.setLocale(Locale.EN);

    try (LocaleOverride scope = context.override(Locale.FR)) {
      assertThat(scope.getPrevious()).isEqualTo(Locale.EN);
      assertThat(context.getLocale()).isEqualTo(Locale.FR);
      assertThat(context.getDataset()).containsEntry("dish", "crêpe");
    }

    assertThat(context.getLocale()).isEqualTo(Locale.EN);
    assertThat(context.getDataset()).isEqualTo(Map.of("dish", "pie", "drink", "tea"));
  }

  @Test
  void overrideRestoresWhenScopeThrows() {
    context.setLocale(Locale.EN);

    assertThatThrownBy(
            () -> {
              try (LocaleOverride ignored = context.override(Locale.FR)) {
                throw new IllegalArgumentException("boom");
              }
            })
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("boom");

    assertThat(context.getLocale()).isEqualTo(Locale.EN);
    assertThat(context.getDataset()).containsEntry("dish", "pie");
  }

  @Test
  void failedOverrideLeavesStateUntouched() {
    context.setLocale(Locale.EN);
    assertThatThrownBy(() -> context.override(Locale.DE))
        .isInstanceOf(DatasetNotFoundException.class);
    assertThat(context.getLocale()).isEqualTo(Locale.EN);
  }

  @Test
  void nestedOverridesUnwindInOrder() {
    context.setLocale(Locale.EN);

    try (LocaleOverride outer = context.override(Locale.FR)) {
      try (LocaleOverride inner = context.override(Locale.IT)) {
        assertThat(context.getDataset()).containsEntry("dish", "pasta");
      }
      assertThat(context.getLocale()).isEqualTo(Locale.FR);
      assertThat(context.getDataset()).containsEntry("dish", "crêpe");
    }
    assertThat(context.getLocale()).isEqualTo(Locale.EN);
  }

  @Test
  @DisplayName("Restoring reloads the previous locale and reapplies its patches")
  void restoreReappliesPatches() {
    context.setLocale(Locale.EN);
    context.patch(Map.of("dish", "scone"));

    try (LocaleOverride ignored = context.override(Locale.FR)) {
      context.patch(Map.of("dish", "tarte"));
      assertThat(context.getDataset()).containsEntry("dish", "tarte");
    }

    assertThat(context.getDataset()).isEqualTo(Map.of("dish", "scone", "drink", "tea"));
  }

  @Test
  void restoreReadsTheFileAgain() {
    context.setLocale(Locale.EN);

    try (LocaleOverride ignored = context.override(Locale.FR)) {
      resource.put("en", "food.json", Map.of("dish", "stew"));
    }

    assertThat(context.getDataset()).isEqualTo(Map.of("dish", "stew"));
  }

  @Test
  void setLocaleDropsPatches() {
    context.setLocale(Locale.EN);
    context.patch(Map.of("dish", "scone"));
    context.setLocale(Locale.EN);
    assertThat(context.getDataset()).containsEntry("dish", "pie");
  }

  @Test
  void closingTwiceRestoresOnce() {
    context.setLocale(Locale.EN);
    final LocaleOverride scope = context.override(Locale.FR);
    scope.close();
    context.setLocale(Locale.IT);
    scope.close();
    assertThat(context.getLocale()).isEqualTo(Locale.IT);
  }

  @Test
  @DisplayName("Patches fully replaced by a later one are forgotten")
  void repeatedPatchesDoNotAccumulate() {
    context.setLocale(Locale.EN);
    for (int i = 0; i < 50; i++) {
      context.patch(Map.of("dish", "dish-" + i));
    }
    assertThat(context.patchCount()).isEqualTo(1);

    context.patch(Map.of("dish", Map.of("name", "scone")));
    context.patch(Map.of("dish", Map.of("size", "small")));
    assertThat(context.patchCount()).isEqualTo(3);

    try (LocaleOverride ignored = context.override(Locale.FR)) {
      assertThat(context.getDataset()).containsEntry("dish", "crêpe");
    }
    assertThat(context.getDataset())
        .isEqualTo(Map.of("dish", Map.of("name", "scone", "size", "small"), "drink", "tea"));
  }

  @Test
  void failedCloseCanBeRetried() {
    context.setLocale(Locale.EN);
    final LocaleOverride scope = context.override(Locale.FR);
    resource.put("en", "food.json", List.of("not", "an", "object"));

    assertThatThrownBy(scope::close).isInstanceOf(DatasetReadException.class);
    assertThat(context.getLocale()).isEqualTo(Locale.FR);

    resource.put("en", "food.json", Map.of("dish", "pie"));
    scope.close();
    assertThat(context.getLocale()).isEqualTo(Locale.EN);
    assertThat(context.getDataset()).containsEntry("dish", "pie");
  }
}
