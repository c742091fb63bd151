// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binder;

import java.util.Set;
import java.util.stream.Collectors;

/// Strict mode found input keys that match no declared field.
public final class UnexpectedDataException extends FieldBindingException {

  private final Set<String> keys;
  private final String formatted;

  UnexpectedDataException(Set<String> keys) {
    super(null);
    this.keys = Set.copyOf(keys);
    this.formatted = keys.stream().map(k -> "\"" + k + "\"").collect(Collectors.joining(", "));
  }

  /// @return the unmatched keys
  public Set<String> keys() {
    return keys;
  }

  @Override
  String describe() {
    final var message = "can not match " + formatted + " to any composite field";
    return fieldPath() == null ? message : message + " of \"" + fieldPath() + "\"";
  }
}
