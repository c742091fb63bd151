// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binder;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import javax.annotation.Nullable;
import java.util.*;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BinderTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  public record Person(String name, int age) {
  }

  public record Address(String city) {
  }

  public record Customer(String name, Address address) {
  }

  public record Order(long id, Customer customer) {
  }

  public static final class EmptyTags implements Supplier<List<String>> {
    @Override
    public List<String> get() {
      return new ArrayList<>();
    }
  }

  public record WithDefaults(String s,
                             @DefaultValue("7") int i,
                             @Nullable String n,
                             @DefaultFactory(EmptyTags.class) List<String> tags) {
  }

  public record WithOptional(Optional<String> nick) {
  }

  public enum Color {RED, GREEN}

  public record WithEnum(Color color) {
  }

  public record TreeNode(String label, List<TreeNode> children) {
  }

  public record Positive(int n) {
    public Positive {
      if (n < 0) {
        throw new IllegalArgumentException("negative: " + n);
      }
    }
  }

  @Test
  void bindsFlatRecord() {
    final Person person = Binder.fromMapping(Person.class, Map.of("name", "Ann", "age", 30));
    assertThat(person).isEqualTo(new Person("Ann", 30));
  }

  @Test
  void binderIsReusable() {
    final Binder<Person> binder = Binder.forClass(Person.class);
    assertThat(binder.type()).isEqualTo(Person.class);
    assertThat(binder.config()).isEqualTo(Config.DEFAULT);
    assertThat(binder.fromMapping(Map.of("name", "a", "age", 1))).isEqualTo(new Person("a", 1));
    assertThat(binder.fromMapping(Map.of("name", "b", "age", 2))).isEqualTo(new Person("b", 2));
  }

  @Test
  void ignoresExtraKeysByDefault() {
    final Person person = Binder.fromMapping(Person.class, Map.of("name", "Ann", "age", 30, "extra", true));
    assertThat(person).isEqualTo(new Person("Ann", 30));
  }

  @Test
  void missingFieldWithoutDefault() {
    assertThatThrownBy(() -> Binder.fromMapping(Person.class, Map.of("name", "Ann")))
        .isInstanceOf(MissingValueException.class)
        .hasMessage("missing value for field \"age\"")
        .extracting(e -> ((MissingValueException) e).fieldPath())
        .isEqualTo("age");
  }

  @Test
  void wrongType() {
    assertThatThrownBy(() -> Binder.fromMapping(Person.class, Map.of("name", "Ann", "age", "thirty")))
        .isInstanceOf(WrongTypeException.class)
        .hasMessage("wrong value type for field \"age\" - should be \"int\" instead of value \"thirty\" of type \"String\"");
  }

  @Test
  void wrongTypeIsABindingException() {
    assertThatThrownBy(() -> Binder.fromMapping(Person.class, Map.of("name", 1, "age", 1)))
        .isInstanceOf(BindingException.class)
        .isInstanceOf(FieldBindingException.class);
  }

  @Test
  void defaultsFillAbsentFields() {
    final WithDefaults result = Binder.fromMapping(WithDefaults.class, Map.of("s", "x"));
    assertThat(result.s()).isEqualTo("x");
    assertThat(result.i()).isEqualTo(7);
    assertThat(result.n()).isNull();
    assertThat(result.tags()).isEmpty();
  }

  @Test
  void suppliedValuesWinOverDefaults() {
    final WithDefaults result = Binder.fromMapping(WithDefaults.class,
        Map.of("s", "x", "i", 1, "n", "y", "tags", List.of("t")));
    assertThat(result).isEqualTo(new WithDefaults("x", 1, "y", List.of("t")));
  }

  @Test
  void defaultFactoryCreatesFreshValues() {
    final WithDefaults first = Binder.fromMapping(WithDefaults.class, Map.of("s", "x"));
    final WithDefaults second = Binder.fromMapping(WithDefaults.class, Map.of("s", "x"));
    assertThat(first.tags()).isNotSameAs(second.tags());
  }

  @Test
  void explicitNullForNullableField() {
    final Map<String, Object> data = new HashMap<>();
    data.put("s", "x");
    data.put("n", null);
    assertThat(Binder.fromMapping(WithDefaults.class, data).n()).isNull();
  }

  @Test
  void explicitNullForNonNullableField() {
    final Map<String, Object> data = new HashMap<>();
    data.put("s", null);
    assertThatThrownBy(() -> Binder.fromMapping(WithDefaults.class, data))
        .isInstanceOf(WrongTypeException.class)
        .hasMessageContaining("field \"s\"");
  }

  @Test
  void javaOptionalFields() {
    assertThat(Binder.fromMapping(WithOptional.class, Map.of()).nick()).isEmpty();
    assertThat(Binder.fromMapping(WithOptional.class, Map.of("nick", "bob")).nick()).contains("bob");
    assertThat(Binder.fromMapping(WithOptional.class, Map.of("nick", Optional.of("bob"))).nick()).contains("bob");
    final Map<String, Object> data = new HashMap<>();
    data.put("nick", null);
    assertThat(Binder.fromMapping(WithOptional.class, data).nick()).isEmpty();
  }

  @Test
  void nestedComposites() {
    final Order order = Binder.fromMapping(Order.class, Map.of(
        "id", 1L,
        "customer", Map.of("name", "Ann", "address", Map.of("city", "Leeds"))));
    assertThat(order).isEqualTo(new Order(1L, new Customer("Ann", new Address("Leeds"))));
  }

  @Test
  void nestedErrorsCarryTheFullPath() {
    assertThatThrownBy(() -> Binder.fromMapping(Order.class, Map.of(
        "id", 1L,
        "customer", Map.of("name", "Ann", "address", Map.of("city", 1)))))
        .isInstanceOf(WrongTypeException.class)
        .hasMessage("wrong value type for field \"customer.address.city\" - should be \"String\" instead of value \"1\" of type \"Integer\"");
  }

  @Test
  void nestedMissingValueCarriesTheFullPath() {
    assertThatThrownBy(() -> Binder.fromMapping(Customer.class, Map.of("name", "Ann", "address", Map.of())))
        .isInstanceOf(MissingValueException.class)
        .extracting(e -> ((FieldBindingException) e).fieldPath())
        .isEqualTo("address.city");
  }

  @Test
  void alreadyBuiltCompositePassesThrough() {
    final Address address = new Address("York");
    final Customer customer = Binder.fromMapping(Customer.class, Map.of("name", "Ann", "address", address));
    assertThat(customer.address()).isSameAs(address);
  }

  @Test
  void enumValuesPassThrough() {
    assertThat(Binder.fromMapping(WithEnum.class, Map.of("color", Color.GREEN)).color()).isEqualTo(Color.GREEN);
    assertThatThrownBy(() -> Binder.fromMapping(WithEnum.class, Map.of("color", "GREEN")))
        .isInstanceOf(WrongTypeException.class);
  }

  @Test
  void selfReferentialRecords() {
    final TreeNode tree = Binder.fromMapping(TreeNode.class, Map.of(
        "label", "root",
        "children", List.of(
            Map.of("label", "left", "children", List.of()),
            Map.of("label", "right", "children", List.of(Map.of("label", "leaf", "children", List.of()))))));
    assertThat(tree.children()).extracting(TreeNode::label).containsExactly("left", "right");
    assertThat(tree.children().get(1).children().get(0).label()).isEqualTo("leaf");
  }

  @Test
  void constructorExceptionsPropagate() {
    assertThatThrownBy(() -> Binder.fromMapping(Positive.class, Map.of("n", -1)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("negative: -1");
  }

  @Test
  void onlyCompositesCanBeBound() {
    assertThatThrownBy(() -> Binder.forClass(String.class))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
