package com.flowgraph.checkpoint.serde;

import org.msgpack.core.MessageBufferPacker;
import org.msgpack.core.MessageFormat;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessageUnpacker;

import java.io.IOException;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * MessagePack-based serializer for graph state.
 *
 * <p>Scalars, strings, byte arrays, lists and maps are written as native MessagePack
 * values. Everything that needs its Java type back on decode (enums, sets, records,
 * plain objects and registered types) is written as a two-entry map whose first key
 * is {@code "__type__"}. Maps decode with their insertion order preserved. Record
 * components and object fields are coerced to their declared types on decode, so an
 * {@code int} counter or a {@code Set} component survives a round trip even though
 * MessagePack only knows "integer" and "array". Declared type arguments are followed
 * into collections and maps, so a {@code List<Long>} component comes back holding longs.
 */
public class MsgPackSerializer implements ReflectionSerializer {
    private static final String TYPE_KEY = "__type__";
    private static final String VALUE_KEY = "value";
    private static final String FIELDS_KEY = "fields";
    private static final String SET_TYPE = "java.util.Set";

    private final Map<Class<?>, Function<Object, ?>> encoders = new ConcurrentHashMap<>();
    private final Map<Class<?>, Function<Object, ?>> decoders = new ConcurrentHashMap<>();
    private final Map<Class<?>, RecordInfo> recordInfoCache = new ConcurrentHashMap<>();
    private final Map<String, Class<?>> classCache = new ConcurrentHashMap<>();

    /**
     * Reflection data for one record type, resolved once.
     */
    private static final class RecordInfo {
        final RecordComponent[] components;
        final Constructor<?> constructor;

        RecordInfo(RecordComponent[] components, Constructor<?> constructor) {
            this.components = components;
            this.constructor = constructor;
        }
    }

    /**
     * Create a serializer with the built-in date/time, UUID and big-number types registered.
     */
    public MsgPackSerializer() {
        registerType(UUID.class, UUID::toString, value -> UUID.fromString((String) value));
        registerType(Date.class, Date::getTime, value -> new Date(((Number) value).longValue()));
        registerType(Instant.class, Instant::toString, value -> Instant.parse((String) value));
        registerType(LocalDate.class, LocalDate::toString, value -> LocalDate.parse((String) value));
        registerType(LocalTime.class, LocalTime::toString, value -> LocalTime.parse((String) value));
        registerType(LocalDateTime.class, LocalDateTime::toString, value -> LocalDateTime.parse((String) value));
        registerType(BigDecimal.class, BigDecimal::toString, value -> new BigDecimal((String) value));
        registerType(BigInteger.class, BigInteger::toString, value -> new BigInteger((String) value));
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> void registerType(Class<T> type, Function<? super T, ?> encoder, Function<Object, ? extends T> decoder) {
        if (type == null || encoder == null || decoder == null) {
            throw new IllegalArgumentException("Type, encoder and decoder are required");
        }
        encoders.put(type, (Function<Object, ?>) encoder);
        decoders.put(type, (Function<Object, ?>) decoder);
    }

    @Override
    public byte[] serialize(Object value) {
        try (MessageBufferPacker packer = MessagePack.newDefaultBufferPacker()) {
            pack(value, packer);
            return packer.toByteArray();
        } catch (IOException e) {
            throw new SerializationException("Failed to serialize " + describe(value), e);
        }
    }

    @Override
    public Object deserialize(byte[] data) {
        if (data == null) {
            throw new SerializationException("Cannot deserialize null data");
        }
        try (MessageUnpacker unpacker = MessagePack.newDefaultUnpacker(data)) {
            return unpack(unpacker);
        } catch (IOException e) {
            throw new SerializationException("Failed to deserialize " + data.length + " bytes", e);
        }
    }

    private void pack(Object value, MessageBufferPacker packer) throws IOException {
        if (value == null) {
            packer.packNil();
            return;
        }

        Class<?> type = value.getClass();
        Function<Object, ?> encoder = encoders.get(type);
        if (encoder != null) {
            packTyped(type.getName(), VALUE_KEY, packer);
            pack(encoder.apply(value), packer);
            return;
        }

        if (value instanceof String) {
            packer.packString((String) value);
        } else if (value instanceof Integer) {
            packer.packInt((Integer) value);
        } else if (value instanceof Long) {
            packer.packLong((Long) value);
        } else if (value instanceof Short) {
            packer.packShort((Short) value);
        } else if (value instanceof Byte) {
            packer.packByte((Byte) value);
        } else if (value instanceof Double) {
            packer.packDouble((Double) value);
        } else if (value instanceof Float) {
            packer.packFloat((Float) value);
        } else if (value instanceof Boolean) {
            packer.packBoolean((Boolean) value);
        } else if (value instanceof Character) {
            packer.packString(value.toString());
        } else if (value instanceof byte[]) {
            byte[] bytes = (byte[]) value;
            packer.packBinaryHeader(bytes.length);
            packer.writePayload(bytes);
        } else if (value instanceof Set) {
            packTyped(SET_TYPE, VALUE_KEY, packer);
            packCollection((Set<?>) value, packer);
        } else if (value instanceof Collection) {
            packCollection((Collection<?>) value, packer);
        } else if (value instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) value;
            packer.packMapHeader(map.size());
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                pack(entry.getKey(), packer);
                pack(entry.getValue(), packer);
            }
        } else if (value instanceof Enum<?>) {
            Enum<?> constant = (Enum<?>) value;
            packTyped(constant.getDeclaringClass().getName(), VALUE_KEY, packer);
            packer.packString(constant.name());
        } else if (type.isRecord()) {
            packRecord(value, packer);
        } else {
            packObject(value, packer);
        }
    }

    private void packTyped(String typeName, String payloadKey, MessageBufferPacker packer) throws IOException {
        packer.packMapHeader(2);
        packer.packString(TYPE_KEY);
        packer.packString(typeName);
        packer.packString(payloadKey);
    }

    private void packCollection(Collection<?> values, MessageBufferPacker packer) throws IOException {
        packer.packArrayHeader(values.size());
        for (Object item : values) {
            pack(item, packer);
        }
    }

    private void packRecord(Object record, MessageBufferPacker packer) throws IOException {
        RecordInfo info = recordInfo(record.getClass());
        packTyped(record.getClass().getName(), FIELDS_KEY, packer);
        packer.packMapHeader(info.components.length);
        for (RecordComponent component : info.components) {
            packer.packString(component.getName());
            try {
                pack(component.getAccessor().invoke(record), packer);
            } catch (ReflectiveOperationException e) {
                throw new SerializationException(
                        "Failed to read record component " + record.getClass().getName() + "." + component.getName(), e);
            }
        }
    }

    private void packObject(Object value, MessageBufferPacker packer) throws IOException {
        List<Field> fields = persistentFields(value.getClass());
        packTyped(value.getClass().getName(), FIELDS_KEY, packer);
        packer.packMapHeader(fields.size());
        for (Field field : fields) {
            packer.packString(field.getName());
            try {
                field.setAccessible(true);
                pack(field.get(value), packer);
            } catch (IllegalAccessException e) {
                throw new SerializationException(
                        "Failed to read field " + value.getClass().getName() + "." + field.getName(), e);
            }
        }
    }

    private List<Field> persistentFields(Class<?> type) {
        List<Field> fields = new ArrayList<>();
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            for (Field field : current.getDeclaredFields()) {
                int modifiers = field.getModifiers();
                if (!Modifier.isStatic(modifiers) && !Modifier.isTransient(modifiers) && !field.isSynthetic()) {
                    fields.add(field);
                }
            }
        }
        return fields;
    }

    private Object unpack(MessageUnpacker unpacker) throws IOException {
        if (!unpacker.hasNext()) {
            throw new SerializationException("Unexpected end of data");
        }
        if (unpacker.tryUnpackNil()) {
            return null;
        }

        MessageFormat format = unpacker.getNextFormat();
        switch (format.getValueType()) {
            case STRING:
                return unpacker.unpackString();
            case INTEGER:
                return unpackInteger(format, unpacker);
            case FLOAT:
                return unpacker.unpackDouble();
            case BOOLEAN:
                return unpacker.unpackBoolean();
            case BINARY:
                byte[] bytes = new byte[unpacker.unpackBinaryHeader()];
                unpacker.readPayload(bytes);
                return bytes;
            case ARRAY:
                int size = unpacker.unpackArrayHeader();
                List<Object> list = new ArrayList<>(size);
                for (int i = 0; i < size; i++) {
                    list.add(unpack(unpacker));
                }
                return list;
            case MAP:
                return unpackMap(unpacker);
            default:
                throw new SerializationException("Unsupported MessagePack format: " + format);
        }
    }

    private Object unpackInteger(MessageFormat format, MessageUnpacker unpacker) throws IOException {
        if (format == MessageFormat.UINT64) {
            BigInteger big = unpacker.unpackBigInteger();
            return big.bitLength() < 64 ? (Object) big.longValue() : big;
        }
        long value = unpacker.unpackLong();
        if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
            return (int) value;
        }
        return value;
    }

    private Object unpackMap(MessageUnpacker unpacker) throws IOException {
        int size = unpacker.unpackMapHeader();
        Map<Object, Object> map = new LinkedHashMap<>();
        if (size == 0) {
            return map;
        }

        Object firstKey = unpack(unpacker);
        if (size == 2 && TYPE_KEY.equals(firstKey)) {
            String typeName = (String) unpack(unpacker);
            String payloadKey = (String) unpack(unpacker);
            return unpackTyped(typeName, payloadKey, unpacker);
        }

        map.put(firstKey, unpack(unpacker));
        for (int i = 1; i < size; i++) {
            Object key = unpack(unpacker);
            map.put(key, unpack(unpacker));
        }
        return map;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private Object unpackTyped(String typeName, String payloadKey, MessageUnpacker unpacker) throws IOException {
        if (SET_TYPE.equals(typeName)) {
            return new LinkedHashSet<>((List<?>) unpack(unpacker));
        }

        Class<?> type = resolveClass(typeName);
        if (type == null) {
            // Unknown type on this classpath: hand back the raw shape.
            Map<Object, Object> raw = new LinkedHashMap<>();
            raw.put(TYPE_KEY, typeName);
            raw.put(payloadKey, unpack(unpacker));
            return raw;
        }

        try {
            if (VALUE_KEY.equals(payloadKey)) {
                Object payload = unpack(unpacker);
                Function<Object, ?> decoder = decoders.get(type);
                if (decoder != null) {
                    return decoder.apply(payload);
                }
                if (type.isEnum()) {
                    return Enum.valueOf((Class<Enum>) type, (String) payload);
                }
                throw new SerializationException("No decoder registered for " + typeName);
            }
            if (FIELDS_KEY.equals(payloadKey)) {
                return type.isRecord() ? unpackRecord(type, unpacker) : unpackObject(type, unpacker);
            }
        } catch (ReflectiveOperationException | IllegalArgumentException e) {
            throw new SerializationException("Failed to deserialize object of type " + typeName, e);
        }
        throw new SerializationException("Unknown payload key '" + payloadKey + "' for type " + typeName);
    }

    private Class<?> resolveClass(String typeName) {
        Class<?> cached = classCache.get(typeName);
        if (cached != null) {
            return cached;
        }
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = MsgPackSerializer.class.getClassLoader();
        }
        try {
            Class<?> type = Class.forName(typeName, false, loader);
            classCache.put(typeName, type);
            return type;
        } catch (ClassNotFoundException e) {
            return null;
        }
    }

    private RecordInfo recordInfo(Class<?> recordClass) {
        return recordInfoCache.computeIfAbsent(recordClass, cls -> {
            RecordComponent[] components = cls.getRecordComponents();
            Class<?>[] parameterTypes = new Class<?>[components.length];
            for (int i = 0; i < components.length; i++) {
                parameterTypes[i] = components[i].getType();
                components[i].getAccessor().setAccessible(true);
            }
            try {
                Constructor<?> constructor = cls.getDeclaredConstructor(parameterTypes);
                constructor.setAccessible(true);
                return new RecordInfo(components, constructor);
            } catch (NoSuchMethodException e) {
                throw new SerializationException("No canonical constructor for record " + cls.getName(), e);
            }
        });
    }

    private Object unpackRecord(Class<?> recordClass, MessageUnpacker unpacker)
            throws IOException, ReflectiveOperationException {
        RecordInfo info = recordInfo(recordClass);

        int fieldCount = unpacker.unpackMapHeader();
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < fieldCount; i++) {
            String name = (String) unpack(unpacker);
            values.put(name, unpack(unpacker));
        }

        Object[] arguments = new Object[info.components.length];
        for (int i = 0; i < info.components.length; i++) {
            RecordComponent component = info.components[i];
            arguments[i] = coerce(values.get(component.getName()), component.getGenericType());
        }
        return info.constructor.newInstance(arguments);
    }

    private Object unpackObject(Class<?> type, MessageUnpacker unpacker)
            throws IOException, ReflectiveOperationException {
        Constructor<?> constructor;
        try {
            constructor = type.getDeclaredConstructor();
            constructor.setAccessible(true);
        } catch (NoSuchMethodException e) {
            throw new SerializationException(
                    "Class " + type.getName() + " needs a no-arg constructor to be deserialized", e);
        }
        Object instance = constructor.newInstance();

        int fieldCount = unpacker.unpackMapHeader();
        for (int i = 0; i < fieldCount; i++) {
            String name = (String) unpack(unpacker);
            Object value = unpack(unpacker);
            Field field = findField(type, name);
            if (field != null) {
                field.setAccessible(true);
                field.set(instance, coerce(value, field.getGenericType()));
            }
        }
        return instance;
    }

    private Field findField(Class<?> type, String name) {
        for (Class<?> current = type; current != null; current = current.getSuperclass()) {
            try {
                return current.getDeclaredField(name);
            } catch (NoSuchFieldException e) {
                // keep looking in the superclass
            }
        }
        return null;
    }

    /**
     * Adapt a decoded value to the declared type of the slot it is written into.
     *
     * @param value Decoded value
     * @param declared Declared generic type of the record component, field or element
     * @return The value, converted where MessagePack lost the Java type
     */
    private Object coerce(Object value, Type declared) {
        Class<?> target = rawClass(declared);
        if (value == null) {
            return target.isPrimitive() ? defaultValue(target) : null;
        }
        if (value instanceof Collection && isCollectionTarget(target)) {
            Type element = typeArgument(declared, 0);
            Collection<Object> copy = Set.class.isAssignableFrom(target) ? new LinkedHashSet<>() : new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                copy.add(coerce(item, element));
            }
            return copy;
        }
        if (value instanceof Map && target == Map.class) {
            Type keyType = typeArgument(declared, 0);
            Type valueType = typeArgument(declared, 1);
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                copy.put(coerce(entry.getKey(), keyType), coerce(entry.getValue(), valueType));
            }
            return copy;
        }
        Class<?> boxed = box(target);
        if (boxed.isInstance(value)) {
            return value;
        }
        if (value instanceof Number) {
            Number number = (Number) value;
            if (boxed == Long.class) {
                return number.longValue();
            } else if (boxed == Integer.class) {
                return number.intValue();
            } else if (boxed == Double.class) {
                return number.doubleValue();
            } else if (boxed == Float.class) {
                return number.floatValue();
            } else if (boxed == Short.class) {
                return number.shortValue();
            } else if (boxed == Byte.class) {
                return number.byteValue();
            } else if (boxed == BigInteger.class) {
                return BigInteger.valueOf(number.longValue());
            }
        }
        if (boxed == Character.class && value instanceof String && ((String) value).length() == 1) {
            return ((String) value).charAt(0);
        }
        return value;
    }

    private static boolean isCollectionTarget(Class<?> target) {
        return target == Collection.class || target == List.class || target == Set.class
                || target == Iterable.class;
    }

    private static Class<?> rawClass(Type type) {
        if (type instanceof Class) {
            return (Class<?>) type;
        }
        if (type instanceof ParameterizedType) {
            return rawClass(((ParameterizedType) type).getRawType());
        }
        if (type instanceof WildcardType) {
            return rawClass(((WildcardType) type).getUpperBounds()[0]);
        }
        if (type instanceof TypeVariable) {
            return rawClass(((TypeVariable<?>) type).getBounds()[0]);
        }
        return Object.class;
    }

    private static Type typeArgument(Type type, int index) {
        if (type instanceof ParameterizedType) {
            Type[] arguments = ((ParameterizedType) type).getActualTypeArguments();
            if (index < arguments.length) {
                return arguments[index];
            }
        }
        return Object.class;
    }

    private static Object defaultValue(Class<?> primitive) {
        if (primitive == boolean.class) {
            return false;
        } else if (primitive == char.class) {
            return '\0';
        } else if (primitive == long.class) {
            return 0L;
        } else if (primitive == double.class) {
            return 0d;
        } else if (primitive == float.class) {
            return 0f;
        } else if (primitive == short.class) {
            return (short) 0;
        } else if (primitive == byte.class) {
            return (byte) 0;
        }
        return 0;
    }

    private static Class<?> box(Class<?> type) {
        if (!type.isPrimitive()) {
            return type;
        }
        if (type == int.class) {
            return Integer.class;
        } else if (type == long.class) {
            return Long.class;
        } else if (type == double.class) {
            return Double.class;
        } else if (type == float.class) {
            return Float.class;
        } else if (type == boolean.class) {
            return Boolean.class;
        } else if (type == short.class) {
            return Short.class;
        } else if (type == byte.class) {
            return Byte.class;
        } else if (type == char.class) {
            return Character.class;
        }
        return Void.class;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
