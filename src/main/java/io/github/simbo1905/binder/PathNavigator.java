// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binder;

import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

import static io.github.simbo1905.binder.Binder.LOGGER;

/// Reads values out of nested maps by dotted path, e.g. `x_renamed.deep.deeper`.
/// The maps are only ever read, never copied or modified.
final class PathNavigator {

  /// Marks a path that is absent, as opposed to present with a null value
  private static final Object ABSENT = new Object();

  private PathNavigator() {
  }

  /// True when every intermediate segment is a nested map and the last segment is a key of the last map.
  /// Never throws.
  static boolean has(String path, Map<String, ?> data) {
    final String[] segments = path.split("\\.", -1);
    Map<?, ?> current = data;
    for (int i = 0; i < segments.length - 1; i++) {
      if (!current.containsKey(segments[i]) || !(current.get(segments[i]) instanceof Map<?, ?> next)) {
        return false;
      }
      current = next;
    }
    return current.containsKey(segments[segments.length - 1]);
  }

  /// @throws PathLookupException when the path is absent or passes through a value that is not a map
  static Object get(String path, Map<String, ?> data) {
    return getOrElseThrow(path, data, () -> new PathLookupException(path, "missing key"));
  }

  /// @return the value at the path, or the default when any segment is absent
  /// @throws PathLookupException when an intermediate segment is present but is not a map
  static Object get(String path, Map<String, ?> data, Object defaultValue) {
    final Object found = lookup(path, data);
    return found == ABSENT ? defaultValue : found;
  }

  /// @return the value at the path
  /// @throws RuntimeException the supplied exception when any segment is absent
  /// @throws PathLookupException when an intermediate segment is present but is not a map
  static Object getOrElseThrow(String path, Map<String, ?> data, Supplier<? extends RuntimeException> missing) {
    final Object found = lookup(path, data);
    if (found == ABSENT) {
      throw missing.get();
    }
    return found;
  }

  /// Resolve a path spec, falling back to the default when nothing is found.
  /// A single path keeps the structural failure of [#get(String, Map, Object)]; a list of candidates
  /// tries each in order, skips any that fail, and the first one found wins.
  static Object resolve(PathSpec spec, Map<String, ?> data, Object defaultValue) {
    final Object found = resolveInner(spec, data);
    return found == ABSENT ? defaultValue : found;
  }

  /// Resolve a path spec, raising the supplied exception when nothing is found.
  static Object resolveOrElseThrow(PathSpec spec, Map<String, ?> data, Supplier<? extends RuntimeException> missing) {
    final Object found = resolveInner(spec, data);
    if (found == ABSENT) {
      throw missing.get();
    }
    return found;
  }

  private static Object resolveInner(PathSpec spec, Map<String, ?> data) {
    Objects.requireNonNull(data, "data must not be null");
    if (spec instanceof PathSpec.Single single) {
      return lookup(single.path(), data);
    }
    if (spec instanceof PathSpec.AnyOf anyOf) {
      for (String path : anyOf.paths()) {
        try {
          final Object found = lookup(path, data);
          if (found != ABSENT) {
            LOGGER.finer(() -> "Resolved candidate path " + path + " of " + anyOf.paths());
            return found;
          }
        } catch (PathLookupException e) {
          LOGGER.finer(() -> "Skipping candidate path " + path + ": " + e.getMessage());
        }
      }
      return ABSENT;
    }
    throw new IllegalArgumentException("Expected either a path or a list of paths but got " + spec);
  }

  private static Object lookup(String path, Map<String, ?> data) {
    final String[] segments = path.split("\\.", -1);
    Map<?, ?> current = data;
    for (int i = 0; i < segments.length - 1; i++) {
      if (!current.containsKey(segments[i])) {
        return ABSENT;
      }
      final Object next = current.get(segments[i]);
      if (!(next instanceof Map<?, ?> nextMap)) {
        throw new PathLookupException(path, "element is not a map: " + segments[i]);
      }
      current = nextMap;
    }
    final String last = segments[segments.length - 1];
    return current.containsKey(last) ? current.get(last) : ABSENT;
  }
}
