// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binder;

/// The input supplied a post-construction field of a frozen type, which can not be assigned.
public final class FrozenFieldException extends FieldBindingException {

  private final Class<?> type;

  FrozenFieldException(String fieldPath, Class<?> type) {
    super(fieldPath);
    this.type = type;
  }

  @Override
  String describe() {
    return "can not assign field \"" + fieldPath() + "\" of frozen type \"" + type.getSimpleName()
        + "\" after construction";
  }
}
