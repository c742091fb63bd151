// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binder;

import java.util.List;

/// Describes the fields of composite types.
interface TypeReflector {

  /// @return the fields of the composite type in declaration order, constructor fields first
  /// @throws ForwardReferenceException when a `@ForwardRef` name can not be resolved
  List<FieldDescriptor> fields(Class<?> type, Config config);

  /// @return true when post-construction assignment is impossible
  boolean isFrozen(Class<?> type);
}
