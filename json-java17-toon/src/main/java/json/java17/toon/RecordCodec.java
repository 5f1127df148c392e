package json.java17.toon;

import json.java17.Json;
import json.java17.JsonArray;
import json.java17.JsonBoolean;
import json.java17.JsonNull;
import json.java17.JsonNumber;
import json.java17.JsonObject;
import json.java17.JsonString;
import json.java17.JsonValue;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Constructor;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.lang.reflect.WildcardType;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// A {@link TreeCodec} for records, mapping each record to an object whose members
/// follow the record components in declaration order.
///
/// Supported component types: `String`, `boolean`, `char`, the numeric primitives and
/// their boxes, `BigInteger`, `BigDecimal`, enums (by name), nested records, `List`
/// and other `Collection`s, `Map<String, ?>` and `Optional`. An empty `Optional`
/// component is left out of the object; a missing member decodes to `null`, an empty
/// `Optional`, or fails for a primitive component.
///
/// ```java
/// record User(int id, String name, List<String> tags) {}
/// String text = Toon.encode(user, RecordCodec.of(User.class), EncodeOptions.defaults());
/// ```
public final class RecordCodec<T extends Record> implements TreeCodec<T> {

    private static final Logger LOG = Logger.getLogger(RecordCodec.class.getName());

    private final Class<T> type;
    private final Map<Class<?>, RecordShape> shapes = new ConcurrentHashMap<>();

    /// Constructor and accessors of one record type, in component order.
    private record RecordShape(RecordComponent[] components, MethodHandle constructor, MethodHandle[] accessors) {
    }

    private RecordCodec(Class<T> type) {
        this.type = type;
    }

    public static <T extends Record> RecordCodec<T> of(Class<T> type) {
        Objects.requireNonNull(type, "type must not be null");
        return new RecordCodec<>(type);
    }

    @Override
    public JsonValue toTree(T value) {
        Objects.requireNonNull(value, "value must not be null");
        return toJson(value);
    }

    @Override
    public T fromTree(JsonValue tree) {
        Objects.requireNonNull(tree, "tree must not be null");
        return type.cast(fromJson(tree, type));
    }

    // ========== Java to tree ==========

    private JsonValue toJson(Object value) {
        if (value == null) {
            return JsonNull.of();
        }
        if (value instanceof Record r) {
            final RecordShape shape = shape(r.getClass());
            final Map<String, JsonValue> members = new LinkedHashMap<>();
            for (int i = 0; i < shape.components().length; i++) {
                Object v = invoke(shape.accessors()[i], r);
                if (v instanceof Optional<?> optional) {
                    if (optional.isEmpty()) {
                        continue;
                    }
                    v = optional.get();
                }
                members.put(shape.components()[i].getName(), toJson(v));
            }
            return JsonObject.of(members);
        }
        if (value instanceof Optional<?> optional) {
            return optional.isPresent() ? toJson(optional.get()) : JsonNull.of();
        }
        if (value instanceof Enum<?> e) {
            return JsonString.of(e.name());
        }
        if (value instanceof Character c) {
            return JsonString.of(c.toString());
        }
        if (value instanceof Map<?, ?> map) {
            final Map<String, JsonValue> members = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                if (!(e.getKey() instanceof String key)) {
                    throw new IllegalArgumentException("Map key " + e.getKey() + " is not a String");
                }
                members.put(key, toJson(e.getValue()));
            }
            return JsonObject.of(members);
        }
        if (value instanceof Collection<?> collection) {
            final List<JsonValue> elements = new ArrayList<>(collection.size());
            for (Object element : collection) {
                elements.add(toJson(element));
            }
            return JsonArray.of(elements);
        }
        // strings, booleans and numbers
        return Json.fromUntyped(value);
    }

    // ========== Tree to Java ==========

    private Object fromJson(JsonValue json, Type target) {
        final Class<?> raw = rawClass(target);
        if (raw == Optional.class) {
            return json instanceof JsonNull ? Optional.empty() : Optional.of(fromJson(json, typeArgument(target, 0)));
        }
        if (json instanceof JsonNull) {
            if (raw.isPrimitive()) {
                throw new IllegalArgumentException("null for primitive " + raw.getName());
            }
            return null;
        }
        if (raw == String.class) {
            return json.string();
        }
        if (raw == boolean.class || raw == Boolean.class) {
            return json.bool();
        }
        if (raw == int.class || raw == Integer.class) {
            return Math.toIntExact(json.toLong());
        }
        if (raw == long.class || raw == Long.class) {
            return json.toLong();
        }
        if (raw == short.class || raw == Short.class) {
            return narrow(json.toLong(), Short.MIN_VALUE, Short.MAX_VALUE).shortValue();
        }
        if (raw == byte.class || raw == Byte.class) {
            return narrow(json.toLong(), Byte.MIN_VALUE, Byte.MAX_VALUE).byteValue();
        }
        if (raw == double.class || raw == Double.class) {
            return json.toDouble();
        }
        if (raw == float.class || raw == Float.class) {
            return (float) json.toDouble();
        }
        if (raw == char.class || raw == Character.class) {
            final String s = json.string();
            if (s.length() != 1) {
                throw new IllegalArgumentException("expected a single character but got \"" + s + "\"");
            }
            return s.charAt(0);
        }
        if (raw == BigDecimal.class) {
            return new BigDecimal(number(json).toString());
        }
        if (raw == BigInteger.class) {
            return new BigDecimal(number(json).toString()).toBigIntegerExact();
        }
        if (raw.isEnum()) {
            return enumValue(raw, json.string());
        }
        if (raw.isRecord()) {
            return record(raw, json);
        }
        if (Map.class.isAssignableFrom(raw)) {
            final Type valueType = typeArgument(target, 1);
            final Map<String, Object> map = new LinkedHashMap<>();
            json.members().forEach((k, v) -> map.put(k, fromJson(v, valueType)));
            return Collections.unmodifiableMap(map);
        }
        if (Collection.class.isAssignableFrom(raw)) {
            final Type elementType = typeArgument(target, 0);
            final List<Object> list = new ArrayList<>(json.elements().size());
            for (JsonValue element : json.elements()) {
                list.add(fromJson(element, elementType));
            }
            return Collections.unmodifiableList(list);
        }
        if (raw == Object.class) {
            return Json.toUntyped(json);
        }
        throw new IllegalArgumentException("Unsupported type " + target.getTypeName());
    }

    private Object record(Class<?> raw, JsonValue json) {
        if (!(json instanceof JsonObject obj)) {
            throw new IllegalArgumentException(raw.getSimpleName() + " expects an object but got " + json);
        }
        final RecordShape shape = shape(raw);
        final RecordComponent[] components = shape.components();
        final Object[] args = new Object[components.length];
        for (int i = 0; i < components.length; i++) {
            final RecordComponent c = components[i];
            final JsonValue member = obj.members().get(c.getName());
            if (member == null) {
                if (c.getType() == Optional.class) {
                    args[i] = Optional.empty();
                } else if (c.getType().isPrimitive()) {
                    throw new IllegalArgumentException(
                            raw.getSimpleName() + " is missing member \"" + c.getName() + "\"");
                }
                continue;
            }
            try {
                args[i] = fromJson(member, c.getGenericType());
            } catch (RuntimeException ex) {
                throw new IllegalArgumentException(
                        raw.getSimpleName() + "." + c.getName() + ": " + ex.getMessage(), ex);
            }
        }
        try {
            return shape.constructor().invokeWithArguments(args);
        } catch (RuntimeException ex) {
            throw ex;
        } catch (Throwable t) {
            throw new IllegalArgumentException("Cannot construct " + raw.getName() + ": " + t.getMessage(), t);
        }
    }

    private RecordShape shape(Class<?> recordType) {
        return shapes.computeIfAbsent(recordType, RecordCodec::inspect);
    }

    private static RecordShape inspect(Class<?> recordType) {
        LOG.finer(() -> "Inspecting record " + recordType.getName());
        final RecordComponent[] components = recordType.getRecordComponents();
        final Class<?>[] parameterTypes = Arrays.stream(components)
                .map(RecordComponent::getType)
                .toArray(Class<?>[]::new);
        try {
            final Constructor<?> constructor = recordType.getDeclaredConstructor(parameterTypes);
            constructor.setAccessible(true);
            final MethodHandles.Lookup lookup = MethodHandles.lookup();
            final MethodHandle[] accessors = new MethodHandle[components.length];
            for (int i = 0; i < components.length; i++) {
                final var accessor = components[i].getAccessor();
                accessor.setAccessible(true);
                accessors[i] = lookup.unreflect(accessor);
            }
            return new RecordShape(components, lookup.unreflectConstructor(constructor), accessors);
        } catch (ReflectiveOperationException | RuntimeException ex) {
            throw new IllegalArgumentException("Cannot access record " + recordType.getName(), ex);
        }
    }

    private static Object invoke(MethodHandle accessor, Object target) {
        try {
            return accessor.invoke(target);
        } catch (RuntimeException | Error ex) {
            throw ex;
        } catch (Throwable t) {
            throw new IllegalArgumentException(t.getMessage(), t);
        }
    }

    private static JsonNumber number(JsonValue json) {
        if (json instanceof JsonNumber n) {
            return n;
        }
        throw new IllegalArgumentException("expected a number but got " + json);
    }

    private static Long narrow(long value, long min, long max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(value + " is out of range");
        }
        return value;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Object enumValue(Class<?> enumType, String name) {
        return Enum.valueOf((Class) enumType, name);
    }

    private static Class<?> rawClass(Type type) {
        if (type instanceof Class<?> c) {
            return c;
        }
        if (type instanceof ParameterizedType p) {
            return (Class<?>) p.getRawType();
        }
        if (type instanceof WildcardType w) {
            return rawClass(w.getUpperBounds()[0]);
        }
        throw new IllegalArgumentException("Unsupported type " + type.getTypeName());
    }

    private static Type typeArgument(Type type, int index) {
        if (type instanceof ParameterizedType p && p.getActualTypeArguments().length > index) {
            return p.getActualTypeArguments()[index];
        }
        return Object.class;
    }
}
