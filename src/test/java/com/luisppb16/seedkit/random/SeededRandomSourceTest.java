/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.luisppb16.seedkit.util.TypeMismatchException;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SeededRandomSourceTest {

  private Seed savedGlobal;

  @BeforeEach
  void isolateGlobalSeed() {
    savedGlobal = GlobalSeed.get();
    GlobalSeed.clear();
  }

  @AfterEach
  void restoreGlobalSeed() {
    GlobalSeed.set(savedGlobal);
  }

  private static List<Long> draw(final SeededRandomSource source, final int count) {
    return IntStream.range(0, count).mapToObj(i -> source.getRandom().nextLong()).toList();
  }

  @Nested
  class Determinism {

    @Test
    @DisplayName("Sources built with the same concrete seed produce the same sequence")
    void sameSeedSameSequence() {
      assertThat(draw(new SeededRandomSource(Seed.of(42)), 50))
          .isEqualTo(draw(new SeededRandomSource(Seed.of(42)), 50));
      assertThat(draw(new SeededRandomSource(Seed.of("fixture")), 50))
          .isEqualTo(draw(new SeededRandomSource(Seed.of("fixture")), 50));
      assertThat(draw(new SeededRandomSource(Seed.of(new byte[] {9, 8, 7})), 50))
          .isEqualTo(draw(new SeededRandomSource(Seed.of(new byte[] {9, 8, 7})), 50));
    }

    @Test
    void differentSeedsDiverge() {
      assertThat(draw(new SeededRandomSource(Seed.of(1)), 20))
          .isNotEqualTo(draw(new SeededRandomSource(Seed.of(2)), 20));
    }

    @Test
    void reseedRestartsTheSequence() {
      final SeededRandomSource source = new SeededRandomSource(Seed.of(5));
      final List<Long> first = draw(source, 10);
      source.reseed(Seed.of(5));
      assertThat(draw(source, 10)).isEqualTo(first);
    }
  }

  @Nested
  class Reseeding {

    @Test
    @DisplayName("Reseeding with an unset seed leaves the generator state untouched")
    void unsetIsNoop() {
      final SeededRandomSource source = new SeededRandomSource(Seed.of(7));
      final SeededRandomSource twin = new SeededRandomSource(Seed.of(7));
      draw(source, 3);
      draw(twin, 3);

      source.reseed(Seed.unset());
      source.reseed(null);

      assertThat(draw(source, 10)).isEqualTo(draw(twin, 10));
      assertThat(source.getSeed()).isEqualTo(Seed.of(7));
    }

    @Test
    @DisplayName("Reseeding with none pulls fresh entropy instead of doing nothing")
    void noneReseeds() {
      final SeededRandomSource source = new SeededRandomSource(Seed.of(7));
      final SeededRandomSource twin = new SeededRandomSource(Seed.of(7));

      source.reseed(Seed.none());

      assertThat(draw(source, 10)).isNotEqualTo(draw(twin, 10));
      assertThat(source.getSeed()).isEqualTo(Seed.none());
    }

    @Test
    void concreteReseedBecomesInstanceSeed() {
      final SeededRandomSource source = new SeededRandomSource(Seed.unset());
      source.reseed(Seed.of(99));
      assertThat(source.getSeed()).isEqualTo(Seed.of(99));
      assertThat(draw(source, 5)).isEqualTo(draw(new SeededRandomSource(Seed.of(99)), 5));
    }
  }

  @Nested
  class ExternalRandom {

    @Test
    void adoptedAsIsWhenSeedUnset() {
      final SeededRandom external = new SeededRandom(3);
      external.nextInt();
      final SeededRandom twin = new SeededRandom(3);
      twin.nextInt();

      final SeededRandomSource source = new SeededRandomSource(Seed.unset(), external);

      assertThat(source.getRandom()).isSameAs(external);
      assertThat(source.getRandom().nextLong()).isEqualTo(twin.nextLong());
    }

    @Test
    void reseededWhenSeedGiven() {
      final SeededRandom external = new SeededRandom();
      final SeededRandomSource source = new SeededRandomSource(Seed.of(8), external);
      assertThat(draw(source, 5)).isEqualTo(draw(new SeededRandomSource(Seed.of(8)), 5));
    }

    @Test
    void rejectsForeignRandom() {
      final Random plain = new Random();
      assertThatThrownBy(() -> new SeededRandomSource(Seed.unset(), plain))
          .isInstanceOf(TypeMismatchException.class)
          .hasMessageContaining("java.util.Random");
    }

    @Test
    void globalSeedNotAppliedToAdoptedRandom() {
      GlobalSeed.set(Seed.of(1));
      final SeededRandom external = new SeededRandom(3);
      new SeededRandomSource(Seed.unset(), external);
      assertThat(external.nextLong()).isEqualTo(new SeededRandom(3).nextLong());
    }
  }

  @Nested
  class EffectiveSeed {

    @Test
    void concreteInstanceSeed() {
      assertThat(new SeededRandomSource(Seed.of(1)).hasEffectiveSeed()).isTrue();
      assertThat(new SeededRandomSource(Seed.of("x")).hasEffectiveSeed()).isTrue();
    }

    @Test
    void unsetOrNoneWithoutGlobalSeed() {
      assertThat(new SeededRandomSource(Seed.unset()).hasEffectiveSeed()).isFalse();
      assertThat(new SeededRandomSource(Seed.none()).hasEffectiveSeed()).isFalse();
    }

    @Test
    void unsetOrNoneDeferToGlobalSeed() {
      GlobalSeed.set(Seed.of(10));
      assertThat(new SeededRandomSource(Seed.unset()).hasEffectiveSeed()).isTrue();
      assertThat(new SeededRandomSource(Seed.none()).hasEffectiveSeed()).isTrue();

      GlobalSeed.set(Seed.none());
      assertThat(new SeededRandomSource(Seed.unset()).hasEffectiveSeed()).isFalse();
    }

    @Test
    void globalSeedMakesUnsetSourcesReproducible() {
      GlobalSeed.set(Seed.of(2024));
      assertThat(draw(new SeededRandomSource(Seed.unset()), 10))
          .isEqualTo(draw(new SeededRandomSource(Seed.unset()), 10))
          .isEqualTo(draw(new SeededRandomSource(Seed.of(2024)), 10));
    }
  }
}
