// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binder;

import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Main interface of the binder. Converts a tree of maps, lists and scalars, as produced by any JSON,
/// YAML or query-string parser, into an instance of a record or `@Composite` class, recursively
/// rebuilding nested composites, collections, optionals and sealed unions.
///
/// A binder is immutable and may be shared between threads.
public sealed interface Binder<T> permits CompositeBinder {

  Logger LOGGER = Logger.getLogger(Binder.class.getName());

  /// Convert raw data into an instance of the bound type
  /// @param data the raw data, keyed by field name
  /// @return a new instance
  /// @throws BindingException on any mismatch between the data and the declared types
  T fromMapping(Map<String, ?> data);

  /// @return the type this binder creates
  Class<T> type();

  /// @return the policy this binder applies
  Config config();

  /// Create a binder with the default configuration
  /// @param type a record or a class annotated with [Composite]
  static <T> Binder<T> forClass(Class<T> type) {
    return forClass(type, Config.DEFAULT);
  }

  /// Create a binder
  /// @param type a record or a class annotated with [Composite]
  /// @param config the conversion policy
  static <T> Binder<T> forClass(Class<T> type, Config config) {
    Objects.requireNonNull(type, "Class must not be null");
    Objects.requireNonNull(config, "Config must not be null");
    if (!Companion.isComposite(type)) {
      throw new IllegalArgumentException("Class must be a record or annotated with @Composite: " + type);
    }
    LOGGER.fine(() -> "Creating binder for " + type.getName() + " with " + config);
    return new CompositeBinder<>(type, config, ReflectingTypeReflector.INSTANCE, ReflectiveInstantiator.INSTANCE);
  }

  /// One-shot conversion with the default configuration
  static <T> T fromMapping(Class<T> type, Map<String, ?> data) {
    return forClass(type).fromMapping(data);
  }

  /// One-shot conversion
  static <T> T fromMapping(Class<T> type, Map<String, ?> data, Config config) {
    return forClass(type, config).fromMapping(data);
  }
}
