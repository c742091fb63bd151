// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binder;

import org.jetbrains.annotations.Nullable;

/// A binding failure that is located by a dotted field path such as `order.customer.name`.
/// The path grows from the leaf upwards as the failure unwinds through nested composites.
public abstract class FieldBindingException extends BindingException {

  private String fieldPath;

  protected FieldBindingException(@Nullable String fieldPath) {
    super(null);
    this.fieldPath = fieldPath;
  }

  /// @return the dotted path of the failing field, or null when the failure was raised before any field was known
  public @Nullable String fieldPath() {
    return fieldPath;
  }

  /// Prefix the location with the name of the enclosing field.
  FieldBindingException prependPath(String parentField) {
    fieldPath = (fieldPath == null || fieldPath.isEmpty()) ? parentField : parentField + "." + fieldPath;
    return this;
  }

  abstract String describe();

  @Override
  public String getMessage() {
    return describe();
  }
}
