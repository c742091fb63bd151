// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binder;

import org.jetbrains.annotations.NotNull;

import java.lang.reflect.*;
import java.util.*;
import java.util.stream.IntStream;

import static io.github.simbo1905.binder.Binder.LOGGER;

/// This is the static helpers of the binder
sealed interface Companion permits Companion.Nothing {

  record Nothing() implements Companion {
  }

  Map<Class<?>, Class<?>> BOXED_PRIMITIVES = Map.of(
      boolean.class, Boolean.class,
      byte.class, Byte.class,
      short.class, Short.class,
      char.class, Character.class,
      int.class, Integer.class,
      long.class, Long.class,
      float.class, Float.class,
      double.class, Double.class,
      void.class, Void.class
  );

  /// Primitive widening conversions allowed when a boxed value is passed to a primitive parameter (JLS 5.1.2)
  Map<Class<?>, Set<Class<?>>> WIDENS_TO = Map.of(
      byte.class, Set.of(byte.class, short.class, int.class, long.class, float.class, double.class),
      short.class, Set.of(short.class, int.class, long.class, float.class, double.class),
      char.class, Set.of(char.class, int.class, long.class, float.class, double.class),
      int.class, Set.of(int.class, long.class, float.class, double.class),
      long.class, Set.of(long.class, float.class, double.class),
      float.class, Set.of(float.class, double.class),
      double.class, Set.of(double.class),
      boolean.class, Set.of(boolean.class)
  );

  static Class<?> box(Class<?> type) {
    return type.isPrimitive() ? BOXED_PRIMITIVES.get(type) : type;
  }

  static Class<?> unbox(Class<?> type) {
    return BOXED_PRIMITIVES.entrySet().stream()
        .filter(e -> e.getValue() == type)
        .map(Map.Entry::getKey)
        .findFirst()
        .orElse(type);
  }

  /// Records and classes annotated with [Composite] are bound field by field
  static boolean isComposite(Class<?> type) {
    return type.isRecord() || type.isAnnotationPresent(Composite.class);
  }

  /// The canonical constructor of a record, else the public constructor with the most parameters
  static Constructor<?> creatorOf(Class<?> type) {
    if (type.isRecord()) {
      final Class<?>[] parameterTypes = Arrays.stream(type.getRecordComponents())
          .map(RecordComponent::getType)
          .toArray(Class<?>[]::new);
      try {
        return type.getDeclaredConstructor(parameterTypes);
      } catch (NoSuchMethodException e) {
        throw new IllegalStateException("No canonical constructor for " + type.getName(), e);
      }
    }
    final Constructor<?>[] publicConstructors = type.getConstructors();
    return Arrays.stream(publicConstructors.length > 0 ? publicConstructors : type.getDeclaredConstructors())
        .max(Comparator.comparingInt(Constructor::getParameterCount))
        .orElseThrow(() -> new IllegalArgumentException("No constructor for " + type.getName()));
  }

  static String typeName(Object value) {
    return value == null ? "null" : value.getClass().getSimpleName();
  }

  /// Could the value be passed to a parameter of this type by reflection, including unboxing and widening?
  static boolean isAssignable(Class<?> parameterType, Object value) {
    if (value == null) {
      return !parameterType.isPrimitive();
    }
    if (parameterType.isPrimitive()) {
      final Class<?> valuePrimitive = unbox(value.getClass());
      return valuePrimitive.isPrimitive() && WIDENS_TO.getOrDefault(valuePrimitive, Set.of()).contains(parameterType);
    }
    return parameterType.isInstance(value);
  }

  /// Lists, sets, queues and arrays (including primitive arrays) can be walked element by element
  static boolean isIterableLike(Object value) {
    return value instanceof Collection<?> || (value != null && value.getClass().isArray());
  }

  /// Ordered sequences that can be paired positionally with tuple element types
  static boolean isSequenceLike(Object value) {
    return value instanceof List<?> || (value != null && value.getClass().isArray());
  }

  static List<Object> elementsOf(Object value) {
    if (value instanceof Collection<?> collection) {
      return new ArrayList<>(collection);
    }
    if (value != null && value.getClass().isArray()) {
      final int length = Array.getLength(value);
      final List<Object> items = new ArrayList<>(length);
      IntStream.range(0, length).forEach(i -> items.add(Array.get(value, i)));
      return items;
    }
    if (value instanceof Iterable<?> iterable) {
      final List<Object> items = new ArrayList<>();
      iterable.forEach(items::add);
      return items;
    }
    throw new IllegalArgumentException("Not an iterable or array: " + typeName(value));
  }

  /// Create an empty, mutable collection for a declared container type
  @SuppressWarnings("unchecked")
  static @NotNull Collection<Object> newCollection(Class<?> container) {
    if (!container.isInterface() && !Modifier.isAbstract(container.getModifiers())) {
      return (Collection<Object>) instantiate(container);
    }
    if (container.isAssignableFrom(ArrayList.class)) {
      return new ArrayList<>();
    }
    if (container.isAssignableFrom(LinkedHashSet.class)) {
      return new LinkedHashSet<>();
    }
    if (container.isAssignableFrom(TreeSet.class)) {
      return new TreeSet<>();
    }
    if (container.isAssignableFrom(ArrayDeque.class)) {
      return new ArrayDeque<>();
    }
    throw new IllegalArgumentException("Unsupported collection type: " + container.getName());
  }

  /// Create an empty, mutable map for a declared container type
  @SuppressWarnings("unchecked")
  static @NotNull Map<Object, Object> newMap(Class<?> container) {
    if (!container.isInterface() && !Modifier.isAbstract(container.getModifiers())) {
      return (Map<Object, Object>) instantiate(container);
    }
    if (container.isAssignableFrom(LinkedHashMap.class)) {
      return new LinkedHashMap<>();
    }
    if (container.isAssignableFrom(TreeMap.class)) {
      return new TreeMap<>();
    }
    throw new IllegalArgumentException("Unsupported map type: " + container.getName());
  }

  private static Object instantiate(Class<?> type) {
    try {
      return type.getConstructor().newInstance();
    } catch (ReflectiveOperationException e) {
      throw new IllegalArgumentException("Failed to create " + type.getName() + " with a no-argument constructor", e);
    }
  }

  /// Convert a value into an instance of the target type.
  /// Uses a public single-argument constructor that accepts the value, else a public static
  /// `valueOf` that accepts it. Exceptions thrown by either are rethrown as they are.
  static Object construct(Class<?> target, Object value) {
    Objects.requireNonNull(value, "Can not cast null");
    final Class<?> type = box(target);
    if (type.isInstance(value)) {
      return value;
    }
    final Optional<Constructor<?>> constructor = Arrays.stream(type.getConstructors())
        .filter(c -> c.getParameterCount() == 1 && isAssignable(c.getParameterTypes()[0], value))
        .min(Comparator.comparingInt(c -> rank(c.getParameterTypes()[0], value)));
    if (constructor.isPresent()) {
      LOGGER.finer(() -> "Casting " + typeName(value) + " with " + constructor.get());
      return invoke(() -> constructor.get().newInstance(value));
    }
    final Optional<Method> valueOf = Arrays.stream(type.getMethods())
        .filter(m -> Modifier.isStatic(m.getModifiers()) && m.getName().equals("valueOf"))
        .filter(m -> m.getParameterCount() == 1 && isAssignable(m.getParameterTypes()[0], value))
        .filter(m -> type.isAssignableFrom(box(m.getReturnType())))
        .min(Comparator.comparingInt(m -> rank(m.getParameterTypes()[0], value)));
    if (valueOf.isPresent()) {
      LOGGER.finer(() -> "Casting " + typeName(value) + " with " + valueOf.get());
      return invoke(() -> valueOf.get().invoke(null, value));
    }
    throw new IllegalArgumentException("Can not cast value \"" + value + "\" of type \"" + typeName(value)
        + "\" to " + type.getName() + ": no single-argument constructor or valueOf accepts it");
  }

  /// Exact matches first, then wider reference types, then primitive conversions
  private static int rank(Class<?> parameterType, Object value) {
    if (box(parameterType) == value.getClass()) {
      return 0;
    }
    if (parameterType == Object.class) {
      return 3;
    }
    return parameterType.isPrimitive() ? 2 : 1;
  }

  @FunctionalInterface
  interface Reflective {
    Object call() throws ReflectiveOperationException;
  }

  private static Object invoke(Reflective reflective) {
    try {
      return reflective.call();
    } catch (InvocationTargetException e) {
      final Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new IllegalStateException(cause.getMessage(), cause);
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException(e.getMessage(), e);
    }
  }
}
