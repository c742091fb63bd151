// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binder;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static io.github.simbo1905.binder.Binder.LOGGER;

/// Rebuilds lists, sets, maps and tuples element by element. Raw data of the wrong shape is returned
/// unchanged so that type checking can report it against the field.
final class CollectionBuilder {

  private final ValueBuilder builder;

  CollectionBuilder(ValueBuilder builder) {
    this.builder = builder;
  }

  Object build(TypeExpr.CollectionNode node, Object value) {
    if (node instanceof TypeExpr.MapNode map) {
      if (!(value instanceof Map<?, ?> raw)) {
        return value;
      }
      final Map<Object, Object> result = Companion.newMap(map.container());
      raw.forEach((key, item) -> result.put(key, builder.build(map.value(), item)));
      return result;
    }
    if (node instanceof TypeExpr.TupleNode tuple) {
      if (!Companion.isSequenceLike(value)) {
        return value;
      }
      return toContainer(tuple, buildTuple(tuple, Companion.elementsOf(value)));
    }
    if (!Companion.isIterableLike(value)) {
      return value;
    }
    final TypeExpr element = node instanceof TypeExpr.ListNode list ? list.element() : ((TypeExpr.SetNode) node).element();
    final Collection<Object> result = Companion.newCollection(node.container());
    for (Object item : Companion.elementsOf(value)) {
      result.add(builder.build(element, item));
    }
    return result;
  }

  /// Copy the elements of a value into a fresh declared container without building them. Any iterable or
  /// array feeds a list, set or tuple. A map is fed by another map or by a sequence of key/value pairs.
  Object cast(TypeExpr.CollectionNode node, Object value) {
    if (node instanceof TypeExpr.MapNode map) {
      final Map<Object, Object> result = Companion.newMap(map.container());
      if (value instanceof Map<?, ?> raw) {
        result.putAll(raw);
        return result;
      }
      for (Object pair : Companion.elementsOf(value)) {
        putPair(map, result, pair);
      }
      return result;
    }
    if (node instanceof TypeExpr.TupleNode tuple) {
      return toContainer(tuple, Companion.elementsOf(value));
    }
    final Collection<Object> result = Companion.newCollection(node.container());
    result.addAll(Companion.elementsOf(value));
    return result;
  }

  private static void putPair(TypeExpr.MapNode map, Map<Object, Object> result, Object pair) {
    if (pair instanceof Map.Entry<?, ?> entry) {
      result.put(entry.getKey(), entry.getValue());
      return;
    }
    if (Companion.isSequenceLike(pair)) {
      final List<Object> items = Companion.elementsOf(pair);
      if (items.size() == 2) {
        result.put(items.get(0), items.get(1));
        return;
      }
    }
    throw new IllegalArgumentException("Can not cast " + Companion.typeName(pair) + " to an entry of "
        + map.toTreeString());
  }

  /// Variadic tuples build every item against one type. Fixed tuples pair types with positions and pad the
  /// shorter side: an item without a type is kept as it is, a type without an item is built from null.
  private List<Object> buildTuple(TypeExpr.TupleNode tuple, List<Object> items) {
    final List<Object> built = new ArrayList<>(items.size());
    if (items.isEmpty()) {
      return built;
    }
    final List<TypeExpr> types = tuple.elements();
    if (tuple.variadic()) {
      items.forEach(item -> built.add(builder.build(types.get(0), item)));
      return built;
    }
    if (items.size() != types.size()) {
      LOGGER.finer(() -> "Tuple " + tuple.toTreeString() + " given " + items.size() + " items");
    }
    for (int i = 0; i < Math.max(items.size(), types.size()); i++) {
      final Object item = i < items.size() ? items.get(i) : null;
      built.add(i < types.size() ? builder.build(types.get(i), item) : item);
    }
    return built;
  }

  /// An array of the declared component type when every item fits, else an `Object[]`; or an unmodifiable list
  private static Object toContainer(TypeExpr.TupleNode tuple, List<Object> items) {
    final Class<?> container = tuple.container();
    if (!container.isArray()) {
      return Collections.unmodifiableList(new ArrayList<>(items));
    }
    final Class<?> component = container.getComponentType();
    final boolean fits = items.stream().allMatch(item -> Companion.isAssignable(component, item));
    final Object array = Array.newInstance(fits ? component : Object.class, items.size());
    for (int i = 0; i < items.size(); i++) {
      Array.set(array, i, items.get(i));
    }
    return array;
  }
}
