// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binder;

/// A `@ForwardRef` name could not be resolved to a class.
public final class ForwardReferenceException extends BindingException {

  ForwardReferenceException(String message, Throwable cause) {
    super("can not resolve forward reference: " + message, cause);
  }
}
