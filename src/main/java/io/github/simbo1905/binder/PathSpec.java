// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binder;

import java.util.List;
import java.util.Objects;

/// Where a field's raw value lives in the input when it is not under the field's own name.
/// Paths are dotted keys into nested maps, e.g. `customer.address.city`.
public sealed interface PathSpec permits PathSpec.Single, PathSpec.AnyOf, PathSpec.Skip {

  /// A single dotted path.
  static PathSpec of(String path) {
    return new Single(path);
  }

  /// Candidate paths tried in order; the first one present wins.
  /// When one candidate is a prefix of another list the more specific one first.
  static PathSpec anyOf(String... paths) {
    return new AnyOf(List.of(paths));
  }

  /// Ignore both the input and any remapping and use the field's default.
  static PathSpec skip() {
    return Skip.INSTANCE;
  }

  record Single(String path) implements PathSpec {
    public Single {
      Objects.requireNonNull(path, "path must not be null");
    }
  }

  record AnyOf(List<String> paths) implements PathSpec {
    public AnyOf {
      paths = List.copyOf(paths);
      if (paths.isEmpty()) {
        throw new IllegalArgumentException("At least one candidate path is required");
      }
    }
  }

  enum Skip implements PathSpec {
    INSTANCE
  }
}
