// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binder;

import java.util.Map;
import java.util.function.Function;

import static io.github.simbo1905.binder.Binder.LOGGER;

/// Builds the value of a single declared type from raw data. Applies a type hook, short-circuits
/// null for nullable types, dispatches on the shape of the type, then applies the first matching
/// cast and finally the numeric type hints.
final class ValueBuilder {

  private final Config config;
  private final UnionResolver unions;
  private final CollectionBuilder collections;
  private final ObjectAssembler assembler;

  ValueBuilder(Config config, TypeReflector reflector, Instantiator instantiator) {
    this.config = config;
    this.unions = new UnionResolver(this, config);
    this.collections = new CollectionBuilder(this);
    this.assembler = new ObjectAssembler(this, config, reflector, instantiator);
  }

  ObjectAssembler assembler() {
    return assembler;
  }

  @SuppressWarnings("unchecked")
  Object build(TypeExpr type, Object raw) {
    Object value = applyHook(type, raw);
    if (type.isNullable() && value == null) {
      return type.nullValue();
    }
    if (type instanceof TypeExpr.OptionalNode optional) {
      value = unions.resolveOptional(optional, value);
    } else if (type instanceof TypeExpr.UnionNode union) {
      value = unions.resolve(union, value);
    } else if (type instanceof TypeExpr.CollectionNode collection) {
      value = collections.build(collection, value);
    } else if (type instanceof TypeExpr.CompositeNode composite && value instanceof Map<?, ?> map) {
      value = assembler.instantiate(composite.javaType(), (Map<String, ?>) map);
    }
    final Class<?> castTarget = castTargetFor(type);
    if (castTarget != null) {
      return cast(type, castTarget, value);
    }
    if (config.followTypeHints() && type instanceof TypeExpr.LeafNode leaf && value instanceof String text) {
      return parseNumber(leaf, text);
    }
    return value;
  }

  private Object applyHook(TypeExpr type, Object raw) {
    final Function<Object, Object> hook = hookFor(type);
    if (hook == null) {
      return raw;
    }
    LOGGER.finer(() -> "Applying type hook for " + type.toTreeString());
    return hook.apply(raw);
  }

  private Function<Object, Object> hookFor(TypeExpr type) {
    final Map<Class<?>, Function<Object, Object>> hooks = config.typeHooks();
    if (hooks.isEmpty()) {
      return null;
    }
    if (type instanceof TypeExpr.LeafNode leaf) {
      final Function<Object, Object> exact = hooks.get(leaf.javaType());
      return exact != null ? exact : hooks.get(Companion.box(leaf.javaType()));
    }
    if (type instanceof TypeExpr.CompositeNode composite) {
      return hooks.get(composite.javaType());
    }
    if (type instanceof TypeExpr.UnionNode union && union.declared() != Object.class) {
      return hooks.get(union.declared());
    }
    return null;
  }

  /// The first cast target that is the declared class or one of its ancestors
  private Class<?> castTargetFor(TypeExpr type) {
    if (type instanceof TypeExpr.OptionalNode || type instanceof TypeExpr.UnionNode) {
      return null;
    }
    final Class<?> target = type.targetClass();
    if (target == null) {
      return null;
    }
    return config.castTargets().stream()
        .filter(castTarget -> castTarget.isAssignableFrom(target))
        .findFirst()
        .orElse(null);
  }

  private Object cast(TypeExpr type, Class<?> castTarget, Object value) {
    final Class<?> target = type.targetClass();
    if (value == null || (target != null && target.isInstance(value))) {
      return value;
    }
    LOGGER.finer(() -> "Casting " + Companion.typeName(value) + " to " + type.toTreeString() + " matched by "
        + castTarget.getSimpleName());
    if (type instanceof TypeExpr.CollectionNode collection) {
      return collections.cast(collection, value);
    }
    return Companion.construct(target, value);
  }

  private static Object parseNumber(TypeExpr.LeafNode leaf, String text) {
    final Class<?> target = Companion.box(leaf.javaType());
    if (target == Integer.class) {
      return Integer.valueOf(text);
    }
    if (target == Long.class) {
      return Long.valueOf(text);
    }
    if (target == Double.class) {
      return Double.valueOf(text);
    }
    if (target == Float.class) {
      return Float.valueOf(text);
    }
    return text;
  }
}
