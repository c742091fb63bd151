// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binder;

import java.util.List;
import java.util.Map;

/// Builds composite instances once every field value is known.
interface Instantiator {

  /// Construct an instance.
  /// @param constructionFields the fields that participate in construction, in constructor order
  /// @param values the value of every construction field keyed by field name
  Object construct(Class<?> type, List<FieldDescriptor> constructionFields, Map<String, Object> values);

  /// Assign a field that does not participate in construction.
  /// @throws FrozenFieldException when the field can not be assigned
  void assign(Object instance, FieldDescriptor field, Object value);
}
