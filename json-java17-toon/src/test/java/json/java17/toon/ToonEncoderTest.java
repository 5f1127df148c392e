package json.java17.toon;

import json.java17.JsonArray;
import json.java17.JsonNull;
import json.java17.JsonNumber;
import json.java17.JsonObject;
import json.java17.JsonString;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Exact output of {@link Toon#encode} for each layout.
class ToonEncoderTest extends ToonTestBase {

    // ========== Objects ==========

    @Test
    void testFlatObject() {
        assertThat(Toon.encode(obj("id", 123, "name", "Ada", "active", true, "score", null)))
                .isEqualTo("id: 123\nname: Ada\nactive: true\nscore: null");
    }

    @Test
    void testNestedObject() {
        final var value = obj("user", obj("id", 1, "profile", obj("city", "London")));
        assertThat(Toon.encode(value)).isEqualTo("user:\n  id: 1\n  profile:\n    city: London");
    }

    @Test
    void testEmptyObjects() {
        assertThat(Toon.encode(obj())).isEmpty();
        assertThat(Toon.encode(obj("meta", obj(), "id", 1))).isEqualTo("meta:\nid: 1");
    }

    @Test
    void testKeysAreQuotedWhenAmbiguous() {
        final var value = obj("first name", "Ada", "a:b", 1, "", 2, "123", 3, "true", 4);
        assertThat(Toon.encode(value))
                .isEqualTo("first name: Ada\n\"a:b\": 1\n\"\": 2\n\"123\": 3\n\"true\": 4");
    }

    // ========== Primitive arrays ==========

    @Test
    void testPrimitiveArray() {
        assertThat(Toon.encode(obj("tags", List.of("admin", "ops", "dev"))))
                .isEqualTo("tags[3]: admin,ops,dev");
    }

    @Test
    void testMixedPrimitiveArray() {
        assertThat(Toon.encode(obj("values", List.of(1, "hello", true, 2.5))))
                .isEqualTo("values[4]: 1,hello,true,2.5");
        assertThat(Toon.encode(tree(Arrays.asList(1, null, "x"))))
                .isEqualTo("[3]: 1,null,x");
    }

    @Test
    void testEmptyArray() {
        assertThat(Toon.encode(obj("items", List.of()))).isEqualTo("items[0]:");
        assertThat(Toon.encode(JsonArray.of(List.of()))).isEqualTo("[0]:");
    }

    @Test
    void testValuesThatWouldMisreadAreQuoted() {
        final var value = obj("tags", List.of("a,b", "true", "42", "", " pad", "-", "ok"));
        assertThat(Toon.encode(value))
                .isEqualTo("tags[7]: \"a,b\",\"true\",\"42\",\"\",\" pad\",\"-\",ok");
    }

    // ========== Tabular arrays ==========

    @Test
    void testTabularArray() {
        final var value = obj("users", List.of(
                obj("id", 1, "name", "Alice", "role", "admin"),
                obj("id", 2, "name", "Bob", "role", "user")));
        assertThat(ArrayShape.classify((JsonArray) value.get("users"))).isEqualTo(ArrayShape.TABULAR);
        assertThat(Toon.encode(value)).isEqualTo("users[2]{id,name,role}:\n  1,Alice,admin\n  2,Bob,user");
    }

    @Test
    void testTabularCellsAreQuotedLikeValues() {
        final var value = obj("rows", List.of(obj("name", "a,b", "note", "x y"), obj("name", "", "note", "null")));
        assertThat(Toon.encode(value)).isEqualTo("rows[2]{name,note}:\n  \"a,b\",x y\n  \"\",\"null\"");
    }

    @Test
    void testTabularFieldNamesAreQuotedForHeader() {
        final var value = obj("rows", List.of(obj("a,b", 1, "c d", 2)));
        assertThat(Toon.encode(value)).isEqualTo("rows[1]{\"a,b\",c d}:\n  1,2");
    }

    @Test
    void testDifferentKeyOrderIsNotTabular() {
        final var value = obj("items", List.of(obj("a", 1, "b", 2), obj("b", 3, "a", 4)));
        assertThat(Toon.encode(value)).isEqualTo("items[2]:\n  - a: 1\n    b: 2\n  - b: 3\n    a: 4");
    }

    // ========== Nested arrays ==========

    @Test
    void testNonUniformObjectsUseListItems() {
        final var value = obj("items", List.of(obj("id", 1, "name", "First"), obj("id", 2)));
        assertThat(Toon.encode(value)).isEqualTo("items[2]:\n  - id: 1\n    name: First\n  - id: 2");
    }

    @Test
    void testMixedArray() {
        final var value = obj("mixed", List.of(1, obj("a", 1), "text", List.of("x", "y")));
        assertThat(Toon.encode(value)).isEqualTo("mixed[4]:\n  - 1\n  - a: 1\n  - text\n  - [2]: x,y");
    }

    @Test
    void testArrayOfArrays() {
        final var value = obj("pairs", List.of(List.of(1, 2), List.of(3, 4), List.of()));
        assertThat(Toon.encode(value)).isEqualTo("pairs[3]:\n  - [2]: 1,2\n  - [2]: 3,4\n  - [0]:");
    }

    @Test
    void testEmptyObjectListItem() {
        assertThat(Toon.encode(obj("items", List.of(obj(), obj("a", 1)))))
                .isEqualTo("items[2]:\n  -\n  - a: 1");
    }

    @Test
    void testListItemWithNestedFirstEntry() {
        final var value = obj("items", List.of(obj("meta", obj("a", 1), "id", 2)));
        assertThat(Toon.encode(value)).isEqualTo("items[1]:\n  - meta:\n      a: 1\n    id: 2");
    }

    @Test
    void testListItemWithTabularFirstEntry() {
        final var value = obj("groups", List.of(
                obj("members", List.of(obj("x", 1), obj("x", 2)), "name", "g"),
                5));
        assertThat(Toon.encode(value))
                .isEqualTo("groups[2]:\n  - members[2]{x}:\n      1\n      2\n    name: g\n  - 5");
    }

    @Test
    void testListItemWithArrayEntries() {
        final var value = obj("items", List.of(obj("tags", List.of("a", "b"), "nums", List.of())));
        assertThat(Toon.encode(value)).isEqualTo("items[1]:\n  - tags[2]: a,b\n    nums[0]:");
    }

    // ========== Root values ==========

    @Test
    void testRootArrays() {
        assertThat(Toon.encode(tree(List.of("a", "b", "c")))).isEqualTo("[3]: a,b,c");
        assertThat(Toon.encode(tree(List.of(obj("id", 1, "name", "Alice"), obj("id", 2, "name", "Bob")))))
                .isEqualTo("[2]{id,name}:\n  1,Alice\n  2,Bob");
        assertThat(Toon.encode(tree(List.of(1, "hello", true)))).isEqualTo("[3]: 1,hello,true");
    }

    @Test
    void testRootScalars() {
        assertThat(Toon.encode(JsonString.of("hello"))).isEqualTo("hello");
        assertThat(Toon.encode(JsonString.of("true"))).isEqualTo("\"true\"");
        assertThat(Toon.encode(JsonNumber.of(42L))).isEqualTo("42");
        assertThat(Toon.encode(JsonNull.of())).isEqualTo("null");
    }

    // ========== Options ==========

    @Test
    void testPipeDelimiter() {
        final var opts = EncodeOptions.defaults().withDelimiter(Delimiter.PIPE);
        assertThat(Toon.encode(obj("tags", List.of("a", "b", "c")), opts)).isEqualTo("tags[3|]: a|b|c");
        assertThat(Toon.encode(obj("rows", List.of(obj("a", 1, "b", "x,y"))), opts))
                .isEqualTo("rows[1|]{a|b}:\n  1|x,y");
    }

    @Test
    void testTabDelimiter() {
        final var opts = EncodeOptions.defaults().withDelimiter(Delimiter.TAB);
        assertThat(Toon.encode(obj("tags", List.of("a", "b", "c")), opts)).isEqualTo("tags[3\t]: a\tb\tc");
    }

    @Test
    void testLengthMarker() {
        final var opts = EncodeOptions.defaults().withLengthMarker('#');
        assertThat(Toon.encode(obj("tags", List.of("a", "b", "c")), opts)).isEqualTo("tags[#3]: a,b,c");
        assertThat(Toon.encode(obj("items", List.of()), opts)).isEqualTo("items[#0]:");
    }

    @Test
    void testIndentWidth() {
        final var opts = EncodeOptions.defaults().withSpaces(4);
        assertThat(Toon.encode(obj("a", obj("b", obj("c", 1))), opts)).isEqualTo("a:\n    b:\n        c: 1");
    }

    // ========== Numbers ==========

    @Test
    void testNumberLexicalFormIsKept() {
        final var value = obj("a", JsonNumber.of("1.50"), "b", JsonNumber.of("1E+3"),
                "c", JsonNumber.of(new BigDecimal("123456789012345678901234567890.5")));
        assertThat(Toon.encode(value)).isEqualTo("a: 1.50\nb: 1E+3\nc: 123456789012345678901234567890.5");
    }

    @Test
    void testNumberThatWouldNotScanIsWrittenPlain() {
        assertThat(Toon.encode(obj("n", JsonNumber.of(".5")))).isEqualTo("n: 0.5");
    }

    @Test
    void testNonFiniteAndNegativeZeroAreNormalized() {
        final var value = obj("nan", JsonNumber.of(Double.NaN), "inf", JsonNumber.of(Double.POSITIVE_INFINITY),
                "negZero", JsonNumber.of(-0.0));
        assertThat(Toon.encode(value)).isEqualTo("nan: null\ninf: null\nnegZero: 0");
    }

    // ========== Typed entry points ==========

    @Test
    void testEncodeObjectRejectsOtherRoots() {
        assertThat(Toon.encodeObject(obj("a", 1), EncodeOptions.defaults())).isEqualTo("a: 1");
        assertThatThrownBy(() -> Toon.encodeObject(tree(List.of(1)), EncodeOptions.defaults()))
                .isInstanceOf(ToonException.class)
                .hasMessage("Type mismatch: expected object, found array")
                .satisfies(e -> assertThat(((ToonException) e).kind()).isEqualTo(ToonException.Kind.TYPE_MISMATCH));
    }

    @Test
    void testEncodeArrayRejectsOtherRoots() {
        assertThat(Toon.encodeArray(tree(List.of(1, 2)), EncodeOptions.defaults())).isEqualTo("[2]: 1,2");
        assertThatThrownBy(() -> Toon.encodeArray(JsonString.of("x"), EncodeOptions.defaults()))
                .isInstanceOf(ToonException.class)
                .hasMessage("Type mismatch: expected array, found string");
    }

    @Test
    void testDepthCeiling() {
        JsonObject deep = JsonObject.of(Map.of());
        for (int i = 1; i < Validation.MAX_DEPTH; i++) {
            deep = JsonObject.of(Map.of("k", deep));
        }
        final JsonObject atLimit = deep;
        assertThat(Toon.encode(atLimit)).startsWith("k:\n  k:");

        final JsonObject overLimit = JsonObject.of(Map.of("k", atLimit));
        assertThatThrownBy(() -> Toon.encode(overLimit))
                .isInstanceOf(ToonException.class)
                .hasMessageContaining("Maximum nesting depth of 256 exceeded")
                .satisfies(e -> assertThat(((ToonException) e).kind())
                        .isEqualTo(ToonException.Kind.INVALID_STRUCTURE));
    }
}
