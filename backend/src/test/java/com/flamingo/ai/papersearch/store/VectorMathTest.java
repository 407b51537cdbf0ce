package com.flamingo.ai.papersearch.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("VectorMath Tests")
class VectorMathTest {

  @Test
  @DisplayName("Should compute cosine similarity independent of magnitude")
  void shouldComputeCosine() {
    assertThat(VectorMath.cosine(List.of(2f, 0f), List.of(5f, 0f))).isCloseTo(1.0, within(1e-9));
    assertThat(VectorMath.cosine(List.of(1f, 0f), List.of(0f, 3f))).isCloseTo(0.0, within(1e-9));
    assertThat(VectorMath.cosine(List.of(1f, 0f), List.of(-1f, 0f)))
        .isCloseTo(-1.0, within(1e-9));
  }

  @Test
  @DisplayName("Should return zero when either vector has zero norm")
  void shouldReturnZero_whenZeroNorm() {
    assertThat(VectorMath.cosine(List.of(0f, 0f), List.of(1f, 1f))).isZero();
  }

  @Test
  @DisplayName("Should reject vectors of different dimension")
  void shouldThrow_whenDimensionsDiffer() {
    assertThatThrownBy(() -> VectorMath.cosine(List.of(1f), List.of(1f, 2f)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
