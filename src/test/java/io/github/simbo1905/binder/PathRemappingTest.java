// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binder;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import javax.annotation.Nullable;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PathRemappingTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  public record Renamed(@Nullable String s1, @DefaultValue("default") String s2) {
  }

  public record Candidates(String a, int b) {
  }

  public record City(String city) {
  }

  public record Flattened(String name, City home) {
  }

  public record Required(String x) {
  }

  public record Skipped(@DefaultValue("d") String v) {
  }

  public record Lowered(@DefaultValue("Default") String s) {
  }

  @Test
  void renamedField() {
    final Config config = Config.builder().path(Renamed.class, "s2", "foo").build();
    final Renamed result = Binder.fromMapping(Renamed.class, Map.of("s1", "same_name", "foo", "diff_name"), config);
    assertThat(result).isEqualTo(new Renamed("same_name", "diff_name"));
  }

  @Test
  void renamedFieldIgnoresItsOwnName() {
    final Config config = Config.builder().path(Renamed.class, "s2", "foo").build();
    final Renamed result = Binder.fromMapping(Renamed.class, Map.of("s2", "ignored"), config);
    assertThat(result).isEqualTo(new Renamed(null, "default"));
  }

  @Test
  void candidatePaths() {
    final Config config = Config.builder()
        .path(Candidates.class, "a", PathSpec.anyOf("str", "foo.bar"))
        .path(Candidates.class, "b", PathSpec.anyOf("baz.blat", "int"))
        .build();
    final Candidates result = Binder.fromMapping(Candidates.class, Map.of("str", "val", "int", -1), config);
    assertThat(result).isEqualTo(new Candidates("val", -1));
  }

  @Test
  void moreSpecificCandidateListedFirstWins() {
    final Config config = Config.builder()
        .path(Candidates.class, "a", PathSpec.anyOf("foo.bar", "str"))
        .path(Candidates.class, "b", "int")
        .build();
    final Candidates result = Binder.fromMapping(Candidates.class,
        Map.of("str", "shallow", "foo", Map.of("bar", "deep"), "int", 1), config);
    assertThat(result.a()).isEqualTo("deep");
  }

  @Test
  void deepPathIntoNestedComposite() {
    final Config config = Config.builder().path(Flattened.class, "home", "location.address").build();
    final Flattened result = Binder.fromMapping(Flattened.class, Map.of(
        "name", "n",
        "location", Map.of("address", Map.of("city", "Bath"))), config);
    assertThat(result).isEqualTo(new Flattened("n", new City("Bath")));
  }

  @Test
  void errorsBehindAPathCarryTheFieldName() {
    final Config config = Config.builder().path(Flattened.class, "home", "location.address").build();
    assertThatThrownBy(() -> Binder.fromMapping(Flattened.class, Map.of(
        "name", "n",
        "location", Map.of("address", Map.of("city", 1))), config))
        .isInstanceOf(WrongTypeException.class)
        .extracting(e -> ((FieldBindingException) e).fieldPath())
        .isEqualTo("home.city");
  }

  @Test
  void pathValueIsTypeChecked() {
    final Config config = Config.builder().path(Candidates.class, "b", "nested.b").build();
    assertThatThrownBy(() -> Binder.fromMapping(Candidates.class, Map.of("a", "x", "nested", Map.of("b", "1")), config))
        .isInstanceOf(WrongTypeException.class)
        .hasMessageContaining("field \"b\"");
  }

  @Test
  void missingPathWithoutDefault() {
    final Config config = Config.builder().path(Required.class, "x", "deep.x").build();
    assertThatThrownBy(() -> Binder.fromMapping(Required.class, Map.of("x", "not here"), config))
        .isInstanceOf(MissingValueException.class)
        .hasMessage("missing value for field \"x\"");
  }

  @Test
  void pathThroughNonMapIsAStructuralFault() {
    final Config config = Config.builder().path(Required.class, "x", "deep.x").build();
    assertThatThrownBy(() -> Binder.fromMapping(Required.class, Map.of("deep", "text"), config))
        .isInstanceOf(PathLookupException.class)
        .hasMessage("element is not a map: deep in path \"deep.x\"");
  }

  @Test
  void skipUsesTheDefault() {
    final Config config = Config.builder().path(Skipped.class, "v", PathSpec.skip()).build();
    assertThat(Binder.fromMapping(Skipped.class, Map.of("v", "given"), config).v()).isEqualTo("d");
    assertThat(Binder.fromMapping(Skipped.class, Map.of("v", "given")).v()).isEqualTo("given");
  }

  @Test
  void defaultBehindAPathIsBuiltLikeInput() {
    final Config config = Config.builder()
        .path(Lowered.class, "s", "foo")
        .typeHook(String.class, raw -> ((String) raw).toLowerCase())
        .build();
    assertThat(Binder.fromMapping(Lowered.class, Map.of(), config).s()).isEqualTo("default");
    assertThat(Binder.fromMapping(Lowered.class, Map.of("foo", "Given"), config).s()).isEqualTo("given");
  }

  @Test
  void defaultWithoutAPathIsUsedAsDeclared() {
    final Config config = Config.builder().typeHook(String.class, raw -> ((String) raw).toLowerCase()).build();
    assertThat(Binder.fromMapping(Lowered.class, Map.of(), config).s()).isEqualTo("Default");
    final Config skipping = config.toBuilder().path(Lowered.class, "s", PathSpec.skip()).build();
    assertThat(Binder.fromMapping(Lowered.class, Map.of("s", "Given"), skipping).s()).isEqualTo("Default");
  }
}
