// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binder;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.annotation.Annotation;
import java.lang.reflect.*;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static io.github.simbo1905.binder.Binder.LOGGER;

/// Sealed tree describing the target type of a field. Built once per composite type by the
/// [TypeReflector] and walked by the [ValueBuilder] for every value.
/// Composite nodes are leaves of this tree: the fields of a nested composite are reflected on demand,
/// which is what lets self referential records work without infinite recursion.
sealed interface TypeExpr permits
    TypeExpr.LeafNode, TypeExpr.CompositeNode, TypeExpr.OptionalNode, TypeExpr.UnionNode, TypeExpr.CollectionNode {

  /// The type of `null`, a member of every nullable union
  LeafNode NULL = new LeafNode(Void.class);

  /// Accepts anything, used for raw collection types and wildcards
  LeafNode ANY = new LeafNode(Object.class);

  /// Recursive descent over a declared Java type plus the annotations found on the declaring
  /// record component, parameter or field.
  /// @param type the generic type as declared
  /// @param annotations runtime annotations of the declaration site
  /// @param forwardReferences resolves a `@ForwardRef` name to a class
  static TypeExpr analyzeType(Type type,
                              Collection<Annotation> annotations,
                              Function<String, Class<?>> forwardReferences) {
    final var result = analyzeTypeInner(type, annotations, forwardReferences);
    LOGGER.finer(() -> "Got TypeExpr: " + result.toTreeString() + " for " + type.getTypeName());
    return result;
  }

  private static @NotNull TypeExpr analyzeTypeInner(Type type,
                                                    Collection<Annotation> annotations,
                                                    Function<String, Class<?>> forwardReferences) {
    TypeExpr result = null;
    for (Annotation annotation : annotations) {
      if (annotation instanceof ForwardRef ref) {
        result = analyzeDeclared(forwardReferences.apply(ref.value()));
      } else if (annotation instanceof OneOf oneOf) {
        result = union(Object.class, Arrays.stream(oneOf.value()).map(TypeExpr::analyzeClass).toList());
      } else if (annotation instanceof TupleOf tupleOf) {
        result = tuple(tupleOf, rawClass(type));
      }
    }
    if (result == null) {
      result = analyzeDeclared(type);
    }
    final boolean nullable = annotations.stream()
        .anyMatch(a -> "Nullable".equals(a.annotationType().getSimpleName()));
    if (nullable && !result.isNullable()) {
      result = new OptionalNode(result, false);
    }
    return result;
  }

  /// Analyze a declared type that carries no annotations.
  static TypeExpr analyzeDeclared(Type type) {
    if (type instanceof Class<?> clazz) {
      return analyzeClass(clazz);
    }
    if (type instanceof ParameterizedType paramType) {
      final Class<?> rawClass = (Class<?>) paramType.getRawType();
      final Type[] typeArgs = paramType.getActualTypeArguments();
      if (rawClass == Optional.class) {
        return new OptionalNode(analyzeDeclared(typeArgs[0]), true);
      }
      if (Map.class.isAssignableFrom(rawClass) && typeArgs.length == 2) {
        return new MapNode(analyzeDeclared(typeArgs[0]), analyzeDeclared(typeArgs[1]), rawClass);
      }
      if (Set.class.isAssignableFrom(rawClass) && typeArgs.length == 1) {
        return new SetNode(analyzeDeclared(typeArgs[0]), rawClass);
      }
      if (Iterable.class.isAssignableFrom(rawClass) && typeArgs.length == 1) {
        return new ListNode(analyzeDeclared(typeArgs[0]), rawClass);
      }
      // a generic composite such as Box<T> is still a composite
      return analyzeClass(rawClass);
    }
    if (type instanceof GenericArrayType genericArrayType) {
      final Type componentType = genericArrayType.getGenericComponentType();
      final Class<?> arrayClass = Array.newInstance(rawClass(componentType), 0).getClass();
      return new TupleNode(List.of(analyzeDeclared(componentType)), true, arrayClass);
    }
    if (type instanceof WildcardType wildcardType) {
      return analyzeDeclared(wildcardType.getUpperBounds()[0]);
    }
    if (type instanceof TypeVariable<?> typeVariable) {
      return analyzeDeclared(typeVariable.getBounds()[0]);
    }
    throw new IllegalArgumentException("Unsupported type: " + type + " of class " + type.getClass());
  }

  static TypeExpr analyzeClass(Class<?> clazz) {
    if (clazz.isArray()) {
      return new TupleNode(List.of(analyzeClass(clazz.getComponentType())), true, clazz);
    }
    if (clazz == Optional.class) {
      return new OptionalNode(ANY, true);
    }
    if (Map.class.isAssignableFrom(clazz)) {
      return new MapNode(ANY, ANY, clazz);
    }
    if (Set.class.isAssignableFrom(clazz)) {
      return new SetNode(ANY, clazz);
    }
    if (Collection.class.isAssignableFrom(clazz)) {
      return new ListNode(ANY, clazz);
    }
    if (Companion.isComposite(clazz)) {
      return new CompositeNode(clazz);
    }
    if (clazz.isSealed()) {
      return union(clazz, Arrays.stream(clazz.getPermittedSubclasses()).map(TypeExpr::analyzeClass).toList());
    }
    return clazz == Void.class ? NULL : new LeafNode(clazz);
  }

  /// Two members with one of them null is always an optional.
  private static TypeExpr union(Class<?> declared, List<TypeExpr> members) {
    if (members.size() == 2 && members.contains(NULL)) {
      return new OptionalNode(members.get(0).equals(NULL) ? members.get(1) : members.get(0), false);
    }
    return new UnionNode(declared, members);
  }

  private static TypeExpr tuple(TupleOf tupleOf, Class<?> container) {
    if (!container.isArray() && !container.isAssignableFrom(List.class)) {
      throw new IllegalArgumentException("@TupleOf needs a List or array field but found " + container.getName());
    }
    final List<TypeExpr> elements = Arrays.stream(tupleOf.value()).map(TypeExpr::analyzeClass).toList();
    return new TupleNode(elements, tupleOf.variadic(), container);
  }

  private static Class<?> rawClass(Type type) {
    if (type instanceof Class<?> cls) {
      return cls;
    }
    if (type instanceof ParameterizedType pt) {
      return (Class<?>) pt.getRawType();
    }
    if (type instanceof GenericArrayType gat) {
      return Array.newInstance(rawClass(gat.getGenericComponentType()), 0).getClass();
    }
    if (type instanceof WildcardType wt) {
      return rawClass(wt.getUpperBounds()[0]);
    }
    if (type instanceof TypeVariable<?> tv) {
      return rawClass(tv.getBounds()[0]);
    }
    throw new IllegalArgumentException("Cannot determine raw class for type: " + type);
  }

  /// Structural instance check: does the value, including its elements, match this type?
  boolean conforms(Object value);

  /// Readable form used in logs and error messages, e.g. `List<Integer>` or `Circle | Square`
  String toTreeString();

  /// The class a value must be an instance of, or null when no single class describes the type
  @Nullable Class<?> targetClass();

  /// Whether null short-circuits building
  default boolean isNullable() {
    return false;
  }

  /// The value that null input becomes
  default Object nullValue() {
    return null;
  }

  /// Leaf node for concrete types that pass through unchanged
  record LeafNode(Class<?> javaType) implements TypeExpr {
    public LeafNode {
      Objects.requireNonNull(javaType, "Java type cannot be null");
    }

    @Override
    public boolean conforms(Object value) {
      if (javaType == Object.class) {
        return true;
      }
      if (javaType == Void.class) {
        return value == null;
      }
      return Companion.box(javaType).isInstance(value);
    }

    @Override
    public String toTreeString() {
      return javaType == Void.class ? "null" : javaType.getSimpleName();
    }

    @Override
    public Class<?> targetClass() {
      return Companion.box(javaType);
    }
  }

  /// Leaf node for a nested record or `@Composite` class
  record CompositeNode(Class<?> javaType) implements TypeExpr {
    public CompositeNode {
      Objects.requireNonNull(javaType, "Java type cannot be null");
    }

    @Override
    public boolean conforms(Object value) {
      return javaType.isInstance(value);
    }

    @Override
    public String toTreeString() {
      return javaType.getSimpleName();
    }

    @Override
    public Class<?> targetClass() {
      return javaType;
    }
  }

  /// A two member union of a type and null. When `javaOptional` is set the value is carried in a
  /// `java.util.Optional` rather than as a nullable reference.
  record OptionalNode(TypeExpr wrapped, boolean javaOptional) implements TypeExpr {
    public OptionalNode {
      Objects.requireNonNull(wrapped, "Optional wrapped type cannot be null");
    }

    /// @return the wrapped type followed by the null type
    List<TypeExpr> members() {
      return List.of(wrapped, NULL);
    }

    @Override
    public boolean conforms(Object value) {
      if (javaOptional) {
        return value instanceof Optional<?> optional && (optional.isEmpty() || wrapped.conforms(optional.get()));
      }
      return value == null || wrapped.conforms(value);
    }

    @Override
    public String toTreeString() {
      return javaOptional ? "Optional<" + wrapped.toTreeString() + ">" : wrapped.toTreeString() + " | null";
    }

    @Override
    public Class<?> targetClass() {
      return javaOptional ? Optional.class : null;
    }

    @Override
    public boolean isNullable() {
      return true;
    }

    @Override
    public Object nullValue() {
      return javaOptional ? Optional.empty() : null;
    }
  }

  /// A sum type: a sealed interface or class with its permitted subclasses, or an `Object`
  /// field with `@OneOf` members. Members keep declaration order.
  record UnionNode(Class<?> declared, List<TypeExpr> members) implements TypeExpr {
    public UnionNode {
      Objects.requireNonNull(declared, "Union declared type cannot be null");
      members = List.copyOf(members);
      if (members.isEmpty()) {
        throw new IllegalArgumentException("Union must have at least one member: " + declared);
      }
    }

    @Override
    public boolean conforms(Object value) {
      return members.stream().anyMatch(member -> member.conforms(value));
    }

    @Override
    public String toTreeString() {
      return members.stream().map(TypeExpr::toTreeString).collect(Collectors.joining(" | "));
    }

    @Override
    public Class<?> targetClass() {
      return declared == Object.class ? null : declared;
    }

    @Override
    public boolean isNullable() {
      return members.contains(NULL);
    }
  }

  /// Container nodes rebuilt element by element by the [CollectionBuilder]
  sealed interface CollectionNode extends TypeExpr permits ListNode, SetNode, MapNode, TupleNode {
    Class<?> container();

    @Override
    default Class<?> targetClass() {
      return container();
    }
  }

  /// A sequence such as `List<T>` or `Collection<T>`
  record ListNode(TypeExpr element, Class<?> container) implements CollectionNode {
    public ListNode {
      Objects.requireNonNull(element, "List element type cannot be null");
      Objects.requireNonNull(container, "List container cannot be null");
    }

    @Override
    public boolean conforms(Object value) {
      return container.isInstance(value) && value instanceof Collection<?> items && items.stream().allMatch(element::conforms);
    }

    @Override
    public String toTreeString() {
      return container.getSimpleName() + "<" + element.toTreeString() + ">";
    }
  }

  /// A set such as `Set<T>`
  record SetNode(TypeExpr element, Class<?> container) implements CollectionNode {
    public SetNode {
      Objects.requireNonNull(element, "Set element type cannot be null");
      Objects.requireNonNull(container, "Set container cannot be null");
    }

    @Override
    public boolean conforms(Object value) {
      return container.isInstance(value) && value instanceof Collection<?> items && items.stream().allMatch(element::conforms);
    }

    @Override
    public String toTreeString() {
      return container.getSimpleName() + "<" + element.toTreeString() + ">";
    }
  }

  /// A mapping such as `Map<K, V>`; keys are checked but never converted
  record MapNode(TypeExpr key, TypeExpr value, Class<?> container) implements CollectionNode {
    public MapNode {
      Objects.requireNonNull(key, "Map key type cannot be null");
      Objects.requireNonNull(value, "Map value type cannot be null");
      Objects.requireNonNull(container, "Map container cannot be null");
    }

    @Override
    public boolean conforms(Object candidate) {
      return container.isInstance(candidate) && ((Map<?, ?>) candidate).entrySet().stream()
          .allMatch(entry -> key.conforms(entry.getKey()) && value.conforms(entry.getValue()));
    }

    @Override
    public String toTreeString() {
      return container.getSimpleName() + "<" + key.toTreeString() + ", " + value.toTreeString() + ">";
    }
  }

  /// A tuple. Variadic tuples have a single element type applied to every position; Java arrays
  /// are variadic tuples. Fixed tuples pair element types with positions.
  record TupleNode(List<TypeExpr> elements, boolean variadic, Class<?> container) implements CollectionNode {
    public TupleNode {
      elements = List.copyOf(elements);
      Objects.requireNonNull(container, "Tuple container cannot be null");
      if (variadic && elements.size() != 1) {
        throw new IllegalArgumentException("A variadic tuple has exactly one element type but got " + elements.size());
      }
    }

    @Override
    public boolean conforms(Object value) {
      if (!container.isInstance(value)) {
        return false;
      }
      final List<Object> items = Companion.elementsOf(value);
      if (variadic) {
        return items.stream().allMatch(elements.get(0)::conforms);
      }
      return items.size() == elements.size()
          && IntStream.range(0, items.size()).allMatch(i -> elements.get(i).conforms(items.get(i)));
    }

    @Override
    public String toTreeString() {
      if (variadic && container.isArray()) {
        return elements.get(0).toTreeString() + "[]";
      }
      final String inner = elements.stream().map(TypeExpr::toTreeString).collect(Collectors.joining(", "));
      return "Tuple<" + inner + (variadic ? ", ...>" : ">");
    }
  }
}
