// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binder;

/// A value does not conform to the declared type of its field.
public final class WrongTypeException extends FieldBindingException {

  private final transient TypeExpr fieldType;
  private final transient Object value;

  WrongTypeException(String fieldPath, TypeExpr fieldType, Object value) {
    super(fieldPath);
    this.fieldType = fieldType;
    this.value = value;
  }

  public String fieldTypeName() {
    return fieldType.toTreeString();
  }

  public Object value() {
    return value;
  }

  @Override
  String describe() {
    return "wrong value type for field \"" + fieldPath() + "\" - should be \"" + fieldType.toTreeString()
        + "\" instead of value \"" + value + "\" of type \"" + Companion.typeName(value) + "\"";
  }
}
