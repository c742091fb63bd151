// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binder;

import java.lang.annotation.Annotation;
import java.lang.reflect.*;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static io.github.simbo1905.binder.Binder.LOGGER;

/// Reflects records through their record components and `@Composite` classes through their widest
/// constructor plus their assignable instance fields. Results are cached per type and set of
/// forward references, so a type is only reflected once per configuration.
final class ReflectingTypeReflector implements TypeReflector {

  static final ReflectingTypeReflector INSTANCE = new ReflectingTypeReflector();

  private record CacheKey(Class<?> type, Map<String, Class<?>> forwardReferences) {
  }

  private final Map<CacheKey, List<FieldDescriptor>> cache = new ConcurrentHashMap<>();

  @Override
  public List<FieldDescriptor> fields(Class<?> type, Config config) {
    Objects.requireNonNull(type, "type must not be null");
    return cache.computeIfAbsent(new CacheKey(type, config.forwardReferences()),
        key -> reflect(key.type(), key.forwardReferences()));
  }

  @Override
  public boolean isFrozen(Class<?> type) {
    if (type.isRecord()) {
      return true;
    }
    final Composite composite = type.getAnnotation(Composite.class);
    return composite != null && composite.frozen();
  }

  private List<FieldDescriptor> reflect(Class<?> type, Map<String, Class<?>> forwardReferences) {
    final List<FieldDescriptor> fields;
    if (type.isRecord()) {
      fields = Arrays.stream(type.getRecordComponents())
          .map(component -> describe(type, component.getName(), component.getGenericType(),
              annotationsOf(component, component.getAccessor()), true, forwardReferences))
          .toList();
    } else if (type.isAnnotationPresent(Composite.class)) {
      final Constructor<?> creator = Companion.creatorOf(type);
      final Map<String, Field> instanceFields = instanceFields(type);
      final List<FieldDescriptor> constructed = Arrays.stream(creator.getParameters())
          .map(parameter -> {
            if (!parameter.isNamePresent()) {
              throw new IllegalStateException("Constructor parameter names of " + type.getName()
                  + " are not available, compile with -parameters");
            }
            final Field field = instanceFields.get(parameter.getName());
            final List<Annotation> annotations = field == null ? annotationsOf(parameter) : annotationsOf(parameter, field);
            return describe(type, parameter.getName(), parameter.getParameterizedType(), annotations, true, forwardReferences);
          })
          .toList();
      final Set<String> constructorNames = constructed.stream().map(FieldDescriptor::name).collect(Collectors.toSet());
      final List<FieldDescriptor> assigned = instanceFields.values().stream()
          .filter(field -> !constructorNames.contains(field.getName()))
          .filter(field -> !Modifier.isFinal(field.getModifiers()))
          .map(field -> describe(type, field.getName(), field.getGenericType(), annotationsOf(field), false, forwardReferences))
          .toList();
      fields = Stream.concat(constructed.stream(), assigned.stream()).toList();
    } else {
      throw new IllegalArgumentException("Not a record or @Composite class: " + type.getName());
    }
    LOGGER.fine(() -> "Reflected " + type.getSimpleName() + " fields: " + fields.stream()
        .map(f -> f.name() + ":" + f.type().toTreeString() + (f.participatesInConstruction() ? "" : "(assigned)"))
        .collect(Collectors.joining(", ")));
    return fields;
  }

  private FieldDescriptor describe(Class<?> owner,
                                   String name,
                                   Type declared,
                                   List<Annotation> annotations,
                                   boolean participatesInConstruction,
                                   Map<String, Class<?>> forwardReferences) {
    final TypeExpr type = TypeExpr.analyzeType(declared, annotations,
        reference -> resolveForwardReference(owner, reference, forwardReferences));
    return new FieldDescriptor(name, type, participatesInConstruction, defaultRule(owner, name, type, annotations));
  }

  private static Class<?> resolveForwardReference(Class<?> owner, String name, Map<String, Class<?>> forwardReferences) {
    final Class<?> known = forwardReferences.get(name);
    if (known != null) {
      return known;
    }
    final String notDefined = "name '" + name + "' is not defined";
    if (!name.contains(".")) {
      throw new ForwardReferenceException(notDefined, null);
    }
    try {
      return Class.forName(name, false, owner.getClassLoader());
    } catch (ClassNotFoundException e) {
      throw new ForwardReferenceException(notDefined, e);
    }
  }

  private static FieldDescriptor.DefaultRule defaultRule(Class<?> owner, String name, TypeExpr type, List<Annotation> annotations) {
    for (Annotation annotation : annotations) {
      if (annotation instanceof DefaultValue defaultValue) {
        return new FieldDescriptor.DefaultRule.Value(literal(owner, name, type, defaultValue.value()));
      }
      if (annotation instanceof DefaultFactory defaultFactory) {
        return new FieldDescriptor.DefaultRule.Factory(supplier(defaultFactory.value()));
      }
    }
    return FieldDescriptor.DefaultRule.NONE;
  }

  /// Convert a `@DefaultValue` literal with the leaf type's own constructor or `valueOf`
  private static Object literal(Class<?> owner, String name, TypeExpr type, String text) {
    if (type instanceof TypeExpr.OptionalNode optional) {
      final Object value = literal(owner, name, optional.wrapped(), text);
      return optional.javaOptional() ? Optional.of(value) : value;
    }
    if (type instanceof TypeExpr.LeafNode leaf && leaf.javaType() != Object.class) {
      return Companion.construct(leaf.javaType(), text);
    }
    if (type instanceof TypeExpr.LeafNode) {
      return text;
    }
    throw new IllegalArgumentException("@DefaultValue on " + owner.getSimpleName() + "." + name
        + " needs a leaf type but found " + type.toTreeString() + ", use @DefaultFactory");
  }

  private static Supplier<?> supplier(Class<? extends Supplier<?>> supplierClass) {
    try {
      final Constructor<? extends Supplier<?>> constructor = supplierClass.getDeclaredConstructor();
      constructor.setAccessible(true);
      return constructor.newInstance();
    } catch (ReflectiveOperationException e) {
      throw new IllegalArgumentException("Failed to create default factory " + supplierClass.getName(), e);
    }
  }

  /// Non-static, non-transient instance fields, superclass fields first
  private static Map<String, Field> instanceFields(Class<?> type) {
    final Deque<Class<?>> hierarchy = new ArrayDeque<>();
    for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
      hierarchy.push(current);
    }
    final Map<String, Field> fields = new LinkedHashMap<>();
    hierarchy.forEach(declaring -> Arrays.stream(declaring.getDeclaredFields())
        .filter(field -> !field.isSynthetic())
        .filter(field -> !Modifier.isStatic(field.getModifiers()) && !Modifier.isTransient(field.getModifiers()))
        .forEach(field -> fields.put(field.getName(), field)));
    return fields;
  }

  /// Annotations of several declarations of the same field, first occurrence of each annotation type wins
  private static List<Annotation> annotationsOf(AnnotatedElement... elements) {
    final Map<Class<? extends Annotation>, Annotation> byType = new LinkedHashMap<>();
    for (AnnotatedElement element : elements) {
      for (Annotation annotation : element.getAnnotations()) {
        byType.putIfAbsent(annotation.annotationType(), annotation);
      }
    }
    return List.copyOf(byType.values());
  }
}
