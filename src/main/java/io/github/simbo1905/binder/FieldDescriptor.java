// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binder;

import java.util.Objects;
import java.util.function.Supplier;

/// One declared field of a composite type, as reported by a [TypeReflector].
/// @param name the key the field is read from and the name it is constructed or assigned by
/// @param type the declared type
/// @param participatesInConstruction true for record components and constructor parameters,
///                                   false for fields assigned after construction
/// @param defaultRule how to obtain a value when the input has none
record FieldDescriptor(String name, TypeExpr type, boolean participatesInConstruction, DefaultRule defaultRule) {

  FieldDescriptor {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(defaultRule, "defaultRule must not be null");
  }

  /// An explicit default, then a factory, then null for a nullable type
  boolean hasDefault() {
    return !(defaultRule instanceof DefaultRule.NoDefault) || type.isNullable();
  }

  /// @throws IllegalStateException when [#hasDefault()] is false
  Object defaultValue() {
    if (defaultRule instanceof DefaultRule.Value value) {
      return value.value();
    }
    if (defaultRule instanceof DefaultRule.Factory factory) {
      return factory.supplier().get();
    }
    if (type.isNullable()) {
      return type.nullValue();
    }
    throw new IllegalStateException("No default for field " + name);
  }

  sealed interface DefaultRule permits DefaultRule.Value, DefaultRule.Factory, DefaultRule.NoDefault {

    DefaultRule NONE = new NoDefault();

    record Value(Object value) implements DefaultRule {
    }

    record Factory(Supplier<?> supplier) implements DefaultRule {
      public Factory {
        Objects.requireNonNull(supplier, "supplier must not be null");
      }
    }

    record NoDefault() implements DefaultRule {
    }
  }
}
