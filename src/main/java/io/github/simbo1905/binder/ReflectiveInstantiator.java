// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binder;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import static io.github.simbo1905.binder.Binder.LOGGER;

/// Invokes the canonical constructor of a record, or the widest constructor of a `@Composite` class,
/// through a cached method handle and assigns the remaining fields reflectively.
final class ReflectiveInstantiator implements Instantiator {

  static final ReflectiveInstantiator INSTANCE = new ReflectiveInstantiator();

  private record Creator(MethodHandle handle, Class<?>[] parameterTypes) {
  }

  private final Map<Class<?>, Creator> creators = new ConcurrentHashMap<>();

  @Override
  public Object construct(Class<?> type, List<FieldDescriptor> constructionFields, Map<String, Object> values) {
    Objects.requireNonNull(type);
    final Creator creator = creators.computeIfAbsent(type, ReflectiveInstantiator::creator);
    if (creator.parameterTypes().length != constructionFields.size()) {
      throw new IllegalStateException("Constructor of " + type.getName() + " takes " + creator.parameterTypes().length
          + " arguments but " + constructionFields.size() + " construction fields were given");
    }
    final Object[] arguments = new Object[constructionFields.size()];
    for (int i = 0; i < arguments.length; i++) {
      final FieldDescriptor field = constructionFields.get(i);
      final Object value = values.get(field.name());
      // a Java field can only hold a value of its own type, whatever the type checking policy
      if (!Companion.isAssignable(creator.parameterTypes()[i], value)) {
        throw new WrongTypeException(field.name(), field.type(), value);
      }
      arguments[i] = value;
    }
    LOGGER.fine(() -> "Constructing " + type.getSimpleName() + " with " + Arrays.toString(arguments));
    try {
      return creator.handle().invokeWithArguments(arguments);
    } catch (RuntimeException | Error e) {
      throw e;
    } catch (Throwable e) {
      throw new BindingException("Failed to construct " + type.getName() + ": " + e.getMessage(), e);
    }
  }

  @Override
  public void assign(Object instance, FieldDescriptor descriptor, Object value) {
    final Field field = findField(instance.getClass(), descriptor.name());
    if (Modifier.isFinal(field.getModifiers())) {
      throw new FrozenFieldException(descriptor.name(), instance.getClass());
    }
    if (!Companion.isAssignable(field.getType(), value)) {
      throw new WrongTypeException(descriptor.name(), descriptor.type(), value);
    }
    LOGGER.finer(() -> "Assigning " + instance.getClass().getSimpleName() + "." + descriptor.name() + " = " + value);
    try {
      field.setAccessible(true);
      field.set(instance, value);
    } catch (IllegalAccessException e) {
      throw new BindingException("Failed to assign " + descriptor.name() + " of " + instance.getClass().getName(), e);
    }
  }

  private static Creator creator(Class<?> type) {
    final Constructor<?> constructor = Companion.creatorOf(type);
    try {
      constructor.setAccessible(true);
      return new Creator(MethodHandles.lookup().unreflectConstructor(constructor), constructor.getParameterTypes());
    } catch (Exception e) {
      throw new IllegalStateException("Failed to create constructor handle for " + type, e);
    }
  }

  private static Field findField(Class<?> type, String name) {
    for (Class<?> current = type; current != null; current = current.getSuperclass()) {
      try {
        return current.getDeclaredField(name);
      } catch (NoSuchFieldException e) {
        final String declaring = current.getName();
        LOGGER.finest(() -> name + " is not declared by " + declaring);
      }
    }
    throw new IllegalStateException("No field " + name + " in " + type.getName());
  }
}
