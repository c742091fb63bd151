// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binder;

import java.util.Map;
import java.util.Objects;

import static io.github.simbo1905.binder.Binder.LOGGER;

final class CompositeBinder<T> implements Binder<T> {

  private final Class<T> type;
  private final Config config;
  private final ObjectAssembler assembler;

  CompositeBinder(Class<T> type, Config config, TypeReflector reflector, Instantiator instantiator) {
    this.type = type;
    this.config = config;
    this.assembler = new ValueBuilder(config, reflector, instantiator).assembler();
  }

  @Override
  public T fromMapping(Map<String, ?> data) {
    Objects.requireNonNull(data, "data must not be null");
    LOGGER.fine(() -> "Binding " + type.getSimpleName() + " from keys " + data.keySet());
    return type.cast(assembler.instantiate(type, data));
  }

  @Override
  public Class<T> type() {
    return type;
  }

  @Override
  public Config config() {
    return config;
  }

  @Override
  public String toString() {
    return "CompositeBinder{" + type.getName() + "}";
  }
}
