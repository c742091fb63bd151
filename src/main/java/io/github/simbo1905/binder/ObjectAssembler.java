// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binder;

import java.util.*;
import java.util.stream.Collectors;

import static io.github.simbo1905.binder.Binder.LOGGER;

/// Resolves the value of every field of a composite type from a raw map, then hands the values to the
/// [Instantiator]. Field values come from a configured path, else the key named after the field, else
/// the field default.
final class ObjectAssembler {

  /// Marks a field the input does not supply
  private static final Object ABSENT = new Object();

  /// Field values split by how they reach the instance
  /// @param construction values passed to the constructor, keyed by field name
  /// @param postConstruction values assigned after construction
  record Assembly(Map<String, Object> construction, Map<FieldDescriptor, Object> postConstruction) {
  }

  private final ValueBuilder builder;
  private final Config config;
  private final TypeReflector reflector;
  private final Instantiator instantiator;

  ObjectAssembler(ValueBuilder builder, Config config, TypeReflector reflector, Instantiator instantiator) {
    this.builder = builder;
    this.config = config;
    this.reflector = reflector;
    this.instantiator = instantiator;
  }

  Object instantiate(Class<?> type, Map<String, ?> data) {
    final Assembly assembly = assemble(type, data);
    final List<FieldDescriptor> constructionFields = reflector.fields(type, config).stream()
        .filter(FieldDescriptor::participatesInConstruction)
        .toList();
    final Object instance = instantiator.construct(type, constructionFields, assembly.construction());
    assembly.postConstruction().forEach((field, value) -> instantiator.assign(instance, field, value));
    return instance;
  }

  Assembly assemble(Class<?> type, Map<String, ?> data) {
    final List<FieldDescriptor> fields = reflector.fields(type, config);
    if (config.strict()) {
      final Set<String> unexpected = unexpectedKeys(data, fields);
      if (!unexpected.isEmpty()) {
        throw new UnexpectedDataException(unexpected);
      }
    }
    final Map<String, PathSpec> paths = config.fieldPaths().getOrDefault(type, Map.of());
    final boolean frozen = reflector.isFrozen(type);
    final Map<String, Object> construction = new LinkedHashMap<>();
    final Map<FieldDescriptor, Object> postConstruction = new LinkedHashMap<>();
    for (FieldDescriptor field : fields) {
      final PathSpec spec = paths.get(field.name());
      final Object found = find(field, spec, data);
      final Object value;
      if (found != ABSENT) {
        value = buildField(field, found);
      } else if (field.hasDefault()) {
        // a remapped field builds its default like any value found at the path
        value = isRemapped(spec) ? buildField(field, field.defaultValue()) : field.defaultValue();
      } else if (field.participatesInConstruction()) {
        throw new MissingValueException(field.name());
      } else {
        LOGGER.finer(() -> type.getSimpleName() + "." + field.name() + " left unset");
        continue;
      }
      if (field.participatesInConstruction()) {
        construction.put(field.name(), value);
      } else if (!frozen) {
        postConstruction.put(field, value);
      } else if (found != ABSENT) {
        throw new FrozenFieldException(field.name(), type);
      }
    }
    LOGGER.finer(() -> "Assembled " + type.getSimpleName() + " construction=" + construction.keySet()
        + " postConstruction=" + postConstruction.keySet().stream().map(FieldDescriptor::name).toList());
    return new Assembly(construction, postConstruction);
  }

  private static boolean isRemapped(PathSpec spec) {
    return spec != null && spec != PathSpec.Skip.INSTANCE;
  }

  private static Object find(FieldDescriptor field, PathSpec spec, Map<String, ?> data) {
    if (spec == null) {
      return data.containsKey(field.name()) ? data.get(field.name()) : ABSENT;
    }
    if (spec == PathSpec.Skip.INSTANCE) {
      return ABSENT;
    }
    return PathNavigator.resolve(spec, data, ABSENT);
  }

  private Object buildField(FieldDescriptor field, Object raw) {
    final Object value;
    try {
      value = builder.build(field.type(), raw);
    } catch (FieldBindingException e) {
      throw e.prependPath(field.name());
    }
    if (config.checkTypes() && !isValidType(field.type(), value)) {
      throw new WrongTypeException(field.name(), field.type(), value);
    }
    return value;
  }

  private boolean isValidType(TypeExpr type, Object value) {
    if (config.allowSuperclasses() && type instanceof TypeExpr.UnionNode union) {
      return union.conforms(value) || union.members().stream().anyMatch(member -> isAncestorOf(value, member));
    }
    if (type instanceof TypeExpr.ListNode list && List.class.isAssignableFrom(list.container())) {
      return value instanceof List<?> items && (items.isEmpty() || list.element().conforms(items.get(0)));
    }
    if (config.allowSuperclasses() && (type instanceof TypeExpr.LeafNode || type instanceof TypeExpr.CompositeNode)) {
      return type.conforms(value) || isAncestorOf(value, type);
    }
    return type.conforms(value);
  }

  /// True when the value's class is the declared class or one of its superclasses
  private static boolean isAncestorOf(Object value, TypeExpr type) {
    final Class<?> target = type.targetClass();
    return value != null && target != null && value.getClass().isAssignableFrom(target);
  }

  private static Set<String> unexpectedKeys(Map<?, ?> data, List<FieldDescriptor> fields) {
    final Set<String> names = fields.stream().map(FieldDescriptor::name).collect(Collectors.toSet());
    final Set<String> unexpected = new LinkedHashSet<>();
    for (Object key : data.keySet()) {
      if (!names.contains(String.valueOf(key))) {
        unexpected.add(String.valueOf(key));
      }
    }
    return unexpected;
  }
}
