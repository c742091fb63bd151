// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binder;

/// Root of every failure raised by the binder itself.
/// Exceptions thrown by caller supplied code (type hooks, cast constructors, record constructors)
/// are never wrapped in this type.
public class BindingException extends RuntimeException {

  public BindingException(String message) {
    super(message);
  }

  public BindingException(String message, Throwable cause) {
    super(message, cause);
  }
}
