// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binder;

/// No member of a union accepted the value.
public final class UnionMatchException extends FieldBindingException {

  private final transient TypeExpr union;
  private final transient Object value;

  UnionMatchException(TypeExpr union, Object value) {
    super(null);
    this.union = union;
    this.value = value;
  }

  public Object value() {
    return value;
  }

  @Override
  String describe() {
    return "can not match type \"" + Companion.typeName(value) + "\" to any type of \"" + fieldPath()
        + "\" union: " + union.toTreeString();
  }
}
