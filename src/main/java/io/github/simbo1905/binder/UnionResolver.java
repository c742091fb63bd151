// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binder;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static io.github.simbo1905.binder.Binder.LOGGER;

/// Picks the member of a union that a raw value builds into. Members are tried in declaration order
/// and any member that fails to build is passed over.
final class UnionResolver {

  private final ValueBuilder builder;
  private final Config config;

  UnionResolver(ValueBuilder builder, Config config) {
    this.builder = builder;
    this.config = config;
  }

  /// A type or null: only the wrapped type is built
  Object resolveOptional(TypeExpr.OptionalNode optional, Object value) {
    final Object present = optional.javaOptional() && value instanceof Optional<?> wrapped ? wrapped.orElse(null) : value;
    if (present == null) {
      return optional.nullValue();
    }
    final Object built = builder.build(optional.wrapped(), present);
    return optional.javaOptional() ? Optional.ofNullable(built) : built;
  }

  Object resolve(TypeExpr.UnionNode union, Object value) {
    final Map<TypeExpr, Object> matches = new LinkedHashMap<>();
    for (TypeExpr member : union.members()) {
      final Object built;
      try {
        built = builder.build(member, value);
      } catch (RuntimeException e) {
        LOGGER.finer(() -> "Union member " + member.toTreeString() + " rejected " + Companion.typeName(value)
            + ": " + e.getMessage());
        continue;
      }
      if (accepts(member, built)) {
        if (!config.strictUnionsMatch()) {
          LOGGER.finer(() -> "Union " + union.toTreeString() + " matched " + member.toTreeString());
          return built;
        }
        matches.put(member, built);
      }
    }
    if (matches.size() > 1) {
      throw new StrictUnionMatchException(matches.keySet().stream().map(TypeExpr::toTreeString).toList());
    }
    if (matches.size() == 1) {
      return matches.values().iterator().next();
    }
    if (!config.checkTypes()) {
      return value;
    }
    throw new UnionMatchException(union, value);
  }

  private boolean accepts(TypeExpr member, Object built) {
    if (member.conforms(built)) {
      return true;
    }
    final Class<?> target = member.targetClass();
    return config.allowSuperclasses() && built != null && target != null && built.getClass().isAssignableFrom(target);
  }
}
