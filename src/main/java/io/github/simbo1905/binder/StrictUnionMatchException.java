// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binder;

import java.util.List;

/// More than one member of a union accepted the value while strict union matching is on.
public final class StrictUnionMatchException extends FieldBindingException {

  private final List<String> matchingTypes;

  StrictUnionMatchException(List<String> matchingTypes) {
    super(null);
    this.matchingTypes = List.copyOf(matchingTypes);
  }

  /// @return the names of every member type that matched, in declaration order
  public List<String> matchingTypes() {
    return matchingTypes;
  }

  @Override
  String describe() {
    return "can not choose between possible Union matches for field \"" + fieldPath() + "\": "
        + String.join(", ", matchingTypes);
  }
}
