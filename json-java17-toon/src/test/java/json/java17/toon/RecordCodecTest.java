package json.java17.toon;

import json.java17.JsonNumber;
import json.java17.JsonString;
import json.java17.JsonValue;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordCodecTest extends ToonTestBase {

    enum Role { ADMIN, USER }

    record User(String name, int age) {
    }

    record Address(String city, Optional<String> zip) {
    }

    record Account(long id, Role role, List<String> tags, Address address, boolean active,
                   BigDecimal balance, Map<String, Integer> limits) {
    }

    record Team(String name, List<User> members) {
    }

    record Numbers(short s, byte b, float f, double d, char c, BigInteger big, Long boxed) {
    }

    @Test
    void testSimpleRecordRoundTrip() {
        final var codec = RecordCodec.of(User.class);
        final String text = Toon.encode(new User("Alice", 30), codec, EncodeOptions.defaults());
        assertThat(text).isEqualTo("name: Alice\nage: 30");
        assertThat(Toon.decode(text, codec, DecodeOptions.defaults())).isEqualTo(new User("Alice", 30));
    }

    @Test
    void testNestedRecordsEnumsCollectionsAndMaps() {
        final var codec = RecordCodec.of(Account.class);
        final var account = new Account(7L, Role.ADMIN, List.of("ops", "dev"),
                new Address("London", Optional.of("N1")), true, new BigDecimal("10.50"), Map.of("daily", 100));
        final String text = Toon.encode(account, codec, EncodeOptions.defaults());
        assertThat(text).isEqualTo("""
                id: 7
                role: ADMIN
                tags[2]: ops,dev
                address:
                  city: London
                  zip: N1
                active: true
                balance: 10.50
                limits:
                  daily: 100""");
        assertThat(Toon.decode(text, codec, DecodeOptions.defaults())).isEqualTo(account);
    }

    @Test
    void testEmptyOptionalIsOmitted() {
        final var codec = RecordCodec.of(Address.class);
        final String text = Toon.encode(new Address("Paris", Optional.empty()), codec, EncodeOptions.defaults());
        assertThat(text).isEqualTo("city: Paris");
        assertThat(Toon.decode(text, codec, DecodeOptions.defaults())).isEqualTo(new Address("Paris", Optional.empty()));
    }

    @Test
    void testListOfRecordsIsTabular() {
        final var codec = RecordCodec.of(Team.class);
        final var team = new Team("core", List.of(new User("Ada", 36), new User("Alan", 41)));
        final String text = Toon.encode(team, codec, EncodeOptions.defaults());
        assertThat(text).isEqualTo("name: core\nmembers[2]{name,age}:\n  Ada,36\n  Alan,41");
        assertThat(Toon.decode(text, codec, DecodeOptions.defaults())).isEqualTo(team);
    }

    @Test
    void testNumericAndCharacterComponents() {
        final var codec = RecordCodec.of(Numbers.class);
        final var numbers = new Numbers((short) -3, (byte) 7, 1.5f, 2.25, 'x', new BigInteger("98765432109876543210"), null);
        final JsonValue tree = codec.toTree(numbers);
        assertThat(tree.get("c")).isEqualTo(JsonString.of("x"));
        assertThat(tree.get("big")).isEqualTo(JsonNumber.of(new BigInteger("98765432109876543210")));
        final String text = Toon.encode(numbers, codec, EncodeOptions.defaults());
        assertThat(Toon.decode(text, codec, DecodeOptions.defaults())).isEqualTo(numbers);
    }

    @Test
    void testMissingPrimitiveMemberFailsAsDeserialization() {
        final var codec = RecordCodec.of(User.class);
        assertThatThrownBy(() -> Toon.decode("name: Bob", codec, DecodeOptions.defaults()))
                .isInstanceOf(ToonException.class)
                .hasMessageContaining("User is missing member \"age\"")
                .satisfies(e -> {
                    final var ex = (ToonException) e;
                    assertThat(ex.kind()).isEqualTo(ToonException.Kind.DESERIALIZATION);
                    assertThat(ex.getCause()).isInstanceOf(IllegalArgumentException.class);
                });
    }

    @Test
    void testWrongMemberTypeFailsAsDeserialization() {
        final var codec = RecordCodec.of(User.class);
        assertThatThrownBy(() -> Toon.decode("name: Bob\nage: old", codec, DecodeOptions.defaults()))
                .isInstanceOf(ToonException.class)
                .hasMessageContaining("User.age")
                .satisfies(e -> assertThat(((ToonException) e).kind()).isEqualTo(ToonException.Kind.DESERIALIZATION));
    }

    @Test
    void testParseErrorsPassThroughUnchanged() {
        final var codec = RecordCodec.of(User.class);
        assertThatThrownBy(() -> Toon.decode("items[3]: a,b", codec, DecodeOptions.defaults()))
                .isInstanceOf(ToonException.class)
                .satisfies(e -> assertThat(((ToonException) e).kind()).isEqualTo(ToonException.Kind.LENGTH_MISMATCH));
    }

    @Test
    void testFunctionCodecFailureIsSerializationError() {
        final TreeCodec<String> failing = TreeCodec.of(
                s -> {
                    throw new IllegalStateException("cannot convert " + s);
                },
                JsonValue::string);
        assertThatThrownBy(() -> Toon.encode("x", failing, EncodeOptions.defaults()))
                .isInstanceOf(ToonException.class)
                .hasMessage("Serialization error: cannot convert x")
                .satisfies(e -> assertThat(((ToonException) e).kind()).isEqualTo(ToonException.Kind.SERIALIZATION));
    }

    @Test
    void testFunctionCodecRoundTrip() {
        final TreeCodec<String> upper = TreeCodec.of(JsonString::of, v -> v.string().toUpperCase());
        final String text = Toon.encode("hello", upper, EncodeOptions.defaults());
        assertThat(text).isEqualTo("hello");
        assertThat(Toon.decode(text, upper, DecodeOptions.defaults())).isEqualTo("HELLO");
    }
}
