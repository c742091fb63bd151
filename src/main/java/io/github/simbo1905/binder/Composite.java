// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binder;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/// Marks a class that is not a record as a composite type the binder may construct.
/// Constructor parameters (the widest public constructor, compiled with `-parameters`) are construction
/// fields; other non-final instance fields are assigned after construction.
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE})
public @interface Composite {
  /// A frozen composite rejects input for its post-construction fields.
  boolean frozen() default false;
}
