// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binder;

import java.util.*;
import java.util.function.Function;

/// Immutable policy for a conversion. Safe to share between threads as long as the type hooks are.
/// @param typeHooks transforms applied to raw data before a value of exactly that class is built
/// @param castTargets types that force a conversion of any value whose declared type is the same or a subtype; the first match wins
/// @param forwardReferences classes that `@ForwardRef` names resolve to
/// @param checkTypes verify every field value read from the input against its declared type
/// @param strict reject input keys that match no declared field
/// @param strictUnionsMatch fail when more than one union member matches
/// @param allowSuperclasses accept a value whose class is a superclass of the declared type
/// @param followTypeHints parse strings into `Integer`, `Long`, `Float` or `Double` when the field wants a number
/// @param fieldPaths per composite type, where to find each remapped field in the input
public record Config(
    Map<Class<?>, Function<Object, Object>> typeHooks,
    List<Class<?>> castTargets,
    Map<String, Class<?>> forwardReferences,
    boolean checkTypes,
    boolean strict,
    boolean strictUnionsMatch,
    boolean allowSuperclasses,
    boolean followTypeHints,
    Map<Class<?>, Map<String, PathSpec>> fieldPaths
) {

  /// Type checking on, everything else off
  public static final Config DEFAULT = builder().build();

  public Config {
    typeHooks = Map.copyOf(typeHooks);
    castTargets = List.copyOf(castTargets);
    forwardReferences = Map.copyOf(forwardReferences);
    final Map<Class<?>, Map<String, PathSpec>> paths = new HashMap<>();
    fieldPaths.forEach((type, specs) -> paths.put(type, Map.copyOf(specs)));
    fieldPaths = Map.copyOf(paths);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    final var builder = new Builder();
    builder.typeHooks.putAll(typeHooks);
    builder.castTargets.addAll(castTargets);
    builder.forwardReferences.putAll(forwardReferences);
    builder.checkTypes = checkTypes;
    builder.strict = strict;
    builder.strictUnionsMatch = strictUnionsMatch;
    builder.allowSuperclasses = allowSuperclasses;
    builder.followTypeHints = followTypeHints;
    fieldPaths.forEach((type, specs) -> builder.fieldPaths.put(type, new HashMap<>(specs)));
    return builder;
  }

  public static final class Builder {
    private final Map<Class<?>, Function<Object, Object>> typeHooks = new HashMap<>();
    private final List<Class<?>> castTargets = new ArrayList<>();
    private final Map<String, Class<?>> forwardReferences = new HashMap<>();
    private boolean checkTypes = true;
    private boolean strict;
    private boolean strictUnionsMatch;
    private boolean allowSuperclasses;
    private boolean followTypeHints;
    private final Map<Class<?>, Map<String, PathSpec>> fieldPaths = new HashMap<>();

    private Builder() {
    }

    /// Register a transform of the raw data for values declared exactly as `type`.
    /// The hook receives the raw data, which is not yet an instance of `type`.
    @SuppressWarnings("unchecked")
    public Builder typeHook(Class<?> type, Function<Object, ?> hook) {
      Objects.requireNonNull(type, "type must not be null");
      Objects.requireNonNull(hook, "hook must not be null");
      typeHooks.put(type, (Function<Object, Object>) hook);
      return this;
    }

    public Builder cast(Class<?>... targets) {
      castTargets.addAll(Arrays.asList(targets));
      return this;
    }

    public Builder forwardReference(String name, Class<?> type) {
      forwardReferences.put(Objects.requireNonNull(name), Objects.requireNonNull(type));
      return this;
    }

    public Builder checkTypes(boolean checkTypes) {
      this.checkTypes = checkTypes;
      return this;
    }

    public Builder strict(boolean strict) {
      this.strict = strict;
      return this;
    }

    public Builder strictUnionsMatch(boolean strictUnionsMatch) {
      this.strictUnionsMatch = strictUnionsMatch;
      return this;
    }

    public Builder allowSuperclasses(boolean allowSuperclasses) {
      this.allowSuperclasses = allowSuperclasses;
      return this;
    }

    public Builder followTypeHints(boolean followTypeHints) {
      this.followTypeHints = followTypeHints;
      return this;
    }

    /// Read `field` of `type` from the given path spec instead of from the key named after the field
    public Builder path(Class<?> type, String field, PathSpec spec) {
      fieldPaths.computeIfAbsent(type, t -> new HashMap<>()).put(field, Objects.requireNonNull(spec));
      return this;
    }

    public Builder path(Class<?> type, String field, String path) {
      return path(type, field, PathSpec.of(path));
    }

    public Config build() {
      return new Config(typeHooks, castTargets, forwardReferences, checkTypes, strict, strictUnionsMatch,
          allowSuperclasses, followTypeHints, fieldPaths);
    }
  }
}
