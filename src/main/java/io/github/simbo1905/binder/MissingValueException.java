// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binder;

/// A constructor field is absent from the input and has no default.
public final class MissingValueException extends FieldBindingException {

  MissingValueException(String fieldPath) {
    super(fieldPath);
  }

  @Override
  String describe() {
    return "missing value for field \"" + fieldPath() + "\"";
  }
}
