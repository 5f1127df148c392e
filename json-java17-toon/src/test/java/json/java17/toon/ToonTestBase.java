package json.java17.toon;

import json.java17.Json;
import json.java17.JsonValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;

import java.lang.reflect.Method;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/// Base class for codec tests.
/// - Emits an INFO banner per test.
/// - Small builders for ordered trees.
public class ToonTestBase extends ToonLoggingConfig {

    static final Logger LOG = Logger.getLogger("json.java17.toon");

    @BeforeEach
    void announce(TestInfo testInfo) {
        final String cls = testInfo.getTestClass().map(Class::getSimpleName).orElse("UnknownTest");
        final String name = testInfo.getTestMethod().map(Method::getName)
                .orElseGet(testInfo::getDisplayName);
        LOG.info(() -> "TEST: " + cls + "#" + name);
    }

    /// {@return an object tree from alternating keys and plain Java values, keeping order}
    static JsonValue obj(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("expected key/value pairs");
        }
        final Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return Json.fromUntyped(map);
    }

    /// {@return `value` as a tree, converting maps, lists and scalars}
    static JsonValue tree(Object value) {
        return value instanceof JsonValue jv ? jv : Json.fromUntyped(value);
    }
}
