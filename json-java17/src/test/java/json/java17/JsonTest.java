package json.java17;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonTest {

    private static final Logger LOG = Logger.getLogger(JsonTest.class.getName());

    @Test
    void testFromUntypedBuildsTree() {
        LOG.info(() -> "TEST: testFromUntypedBuildsTree");
        final Map<String, Object> src = new LinkedHashMap<>();
        src.put("name", "Ada");
        src.put("age", 36);
        src.put("score", 9.5);
        src.put("active", true);
        src.put("tags", List.of("math", "code"));
        src.put("nothing", null);

        final JsonValue json = Json.fromUntyped(src);

        assertThat(json).isInstanceOf(JsonObject.class);
        assertThat(json.get("name").string()).isEqualTo("Ada");
        assertThat(json.get("age").toLong()).isEqualTo(36L);
        assertThat(json.get("score").toDouble()).isEqualTo(9.5);
        assertThat(json.get("active").bool()).isTrue();
        assertThat(json.get("tags").element(1).string()).isEqualTo("code");
        assertThat(json.get("nothing")).isEqualTo(JsonNull.of());
        assertThat(json.members().keySet()).containsExactly("name", "age", "score", "active", "tags", "nothing");
    }

    @Test
    void testToUntypedRestoresPlainJava() {
        LOG.info(() -> "TEST: testToUntypedRestoresPlainJava");
        final JsonValue json = Json.fromUntyped(Map.of("list", Arrays.asList(1, "two", null, false)));
        final Object untyped = Json.toUntyped(json);
        assertThat(untyped).isEqualTo(Map.of("list", Arrays.asList(1L, "two", null, false)));
    }

    @Test
    void testFromUntypedRejectsUnknownTypes() {
        LOG.info(() -> "TEST: testFromUntypedRejectsUnknownTypes");
        assertThatThrownBy(() -> Json.fromUntyped(new Object()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Json.fromUntyped(Map.of(1, "x")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not a String");
    }

    @Test
    void testToStringIsCompactJson() {
        LOG.info(() -> "TEST: testToStringIsCompactJson");
        final Map<String, Object> src = new LinkedHashMap<>();
        src.put("a", List.of(1, new BigDecimal("2.50"), "x\"y\n"));
        src.put("b", null);
        assertThat(Json.fromUntyped(src).toString()).isEqualTo("{\"a\":[1,2.50,\"x\\\"y\\n\"],\"b\":null}");
        assertThat(JsonString.of("\u0001").toString()).isEqualTo("\"\\u0001\"");
    }

    @Test
    void testAccessorsRejectWrongVariant() {
        LOG.info(() -> "TEST: testAccessorsRejectWrongVariant");
        final JsonValue s = JsonString.of("x");
        assertThatThrownBy(s::bool).isInstanceOf(JsonAssertionException.class)
                .hasMessageContaining("JsonString is not a JsonBoolean");
        assertThatThrownBy(() -> JsonObject.of(Map.of()).get("missing"))
                .isInstanceOf(JsonAssertionException.class)
                .hasMessageContaining("\"missing\" does not exist");
        assertThatThrownBy(() -> JsonArray.of(List.of()).element(0))
                .isInstanceOf(JsonAssertionException.class)
                .hasMessageContaining("out of bounds");
        assertThat(JsonObject.of(Map.of()).getOrAbsent("missing")).isEmpty();
    }

    @Test
    void testStructuralEquality() {
        LOG.info(() -> "TEST: testStructuralEquality");
        final JsonValue a = Json.fromUntyped(Map.of("x", List.of(1, 2)));
        final JsonValue b = JsonObject.of(Map.of("x", JsonArray.of(List.of(JsonNumber.of(1L), JsonNumber.of(2L)))));
        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(JsonBoolean.of(true)).isSameAs(JsonBoolean.of(true));
    }
}
