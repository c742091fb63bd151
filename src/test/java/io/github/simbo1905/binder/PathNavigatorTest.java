// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binder;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PathNavigatorTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  private static final Map<String, Object> DATA = Map.of(
      "a", Map.of("b", Map.of("c", 1)),
      "flat", "value",
      "n", 2
  );

  @Test
  void hasFindsNestedKeys() {
    assertThat(PathNavigator.has("a", DATA)).isTrue();
    assertThat(PathNavigator.has("a.b", DATA)).isTrue();
    assertThat(PathNavigator.has("a.b.c", DATA)).isTrue();
    assertThat(PathNavigator.has("flat", DATA)).isTrue();
  }

  @Test
  void hasIsFalseForMissingOrNonMapSegments() {
    assertThat(PathNavigator.has("x", DATA)).isFalse();
    assertThat(PathNavigator.has("a.x", DATA)).isFalse();
    assertThat(PathNavigator.has("x.y.z", DATA)).isFalse();
    assertThat(PathNavigator.has("flat.deeper", DATA)).isFalse();
    assertThat(PathNavigator.has("a.b.c.d", DATA)).isFalse();
  }

  @Test
  void hasIsTrueForPresentNull() {
    final Map<String, Object> data = new HashMap<>();
    data.put("nothing", null);
    assertThat(PathNavigator.has("nothing", data)).isTrue();
    assertThat(PathNavigator.get("nothing", data, "default")).isNull();
  }

  @Test
  void getReturnsValueAtPath() {
    assertThat(PathNavigator.get("a.b.c", DATA)).isEqualTo(1);
    assertThat(PathNavigator.get("a.b", DATA)).isEqualTo(Map.of("c", 1));
    assertThat(PathNavigator.get("n", DATA)).isEqualTo(2);
  }

  @Test
  void getReturnsDefaultForMissingSegments() {
    assertThat(PathNavigator.get("a.b.x", DATA, "default")).isEqualTo("default");
    assertThat(PathNavigator.get("x.y", DATA, "default")).isEqualTo("default");
    assertThat(PathNavigator.get("x", DATA, null)).isNull();
  }

  @Test
  void getWithoutDefaultRaisesForMissingKey() {
    assertThatThrownBy(() -> PathNavigator.get("a.x", DATA))
        .isInstanceOf(PathLookupException.class)
        .hasMessage("missing key in path \"a.x\"");
  }

  @Test
  void getOrElseThrowRaisesTheSuppliedException() {
    assertThatThrownBy(() -> PathNavigator.getOrElseThrow("missing", DATA, () -> new MissingValueException("missing")))
        .isInstanceOf(MissingValueException.class)
        .hasMessage("missing value for field \"missing\"");
  }

  @Test
  void nonMapIntermediateIsAStructuralFaultEvenWithDefault() {
    assertThatThrownBy(() -> PathNavigator.get("flat.deeper", DATA, "default"))
        .isInstanceOf(PathLookupException.class)
        .hasMessage("element is not a map: flat in path \"flat.deeper\"");
  }

  @Test
  void singlePathSpecKeepsStructuralFault() {
    assertThatThrownBy(() -> PathNavigator.resolve(PathSpec.of("n.m"), DATA, "default"))
        .isInstanceOf(PathLookupException.class);
    assertThat(PathNavigator.resolve(PathSpec.of("a.b.c"), DATA, "default")).isEqualTo(1);
    assertThat(PathNavigator.resolve(PathSpec.of("a.q"), DATA, "default")).isEqualTo("default");
  }

  @Test
  void firstPresentCandidateWins() {
    assertThat(PathNavigator.resolve(PathSpec.anyOf("a.b.c", "n"), DATA, null)).isEqualTo(1);
    assertThat(PathNavigator.resolve(PathSpec.anyOf("n", "a.b.c"), DATA, null)).isEqualTo(2);
    assertThat(PathNavigator.resolve(PathSpec.anyOf("x", "a.b"), DATA, null)).isEqualTo(Map.of("c", 1));
  }

  @Test
  void candidatesSkipStructuralFaults() {
    assertThat(PathNavigator.resolve(PathSpec.anyOf("flat.deeper", "n"), DATA, null)).isEqualTo(2);
  }

  @Test
  void candidatesFallBackToDefaultOrException() {
    assertThat(PathNavigator.resolve(PathSpec.anyOf("x", "flat.deeper"), DATA, "default")).isEqualTo("default");
    assertThatThrownBy(() -> PathNavigator.resolveOrElseThrow(PathSpec.anyOf("x", "y"), DATA,
        () -> new MissingValueException("field")))
        .isInstanceOf(MissingValueException.class);
  }

  @Test
  void anyOfRequiresACandidate() {
    assertThatThrownBy(() -> PathSpec.anyOf()).isInstanceOf(IllegalArgumentException.class);
  }
}
