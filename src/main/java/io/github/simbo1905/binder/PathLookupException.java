// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binder;

/// A dotted path could not be followed through nested maps.
public final class PathLookupException extends BindingException {

  private final String path;

  PathLookupException(String path, String reason) {
    super(reason + " in path \"" + path + "\"");
    this.path = path;
  }

  public String path() {
    return path;
  }
}
