package com.ryuqq.kindstore.core.codec;

import com.ryuqq.kindstore.core.key.Key;
import com.ryuqq.kindstore.core.model.Model;
import com.ryuqq.kindstore.core.model.ModelRegistry;
import org.msgpack.core.ExtensionTypeHeader;
import org.msgpack.core.MessageBufferPacker;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessagePackException;
import org.msgpack.core.MessagePacker;
import org.msgpack.core.MessageUnpacker;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MessagePack serialization step backed by msgpack-core.
 *
 * <p>Strings are written as {@code str} and byte arrays as {@code bin}, so both survive a
 * round trip with their Java types. Values MessagePack cannot represent natively use
 * extension types:</p>
 * <ul>
 *   <li>{@link #EXT_MODEL} - an entity as a map of model name, key and flattened wire data</li>
 *   <li>{@link #EXT_DATETIME} - ZonedDateTime as [epoch seconds, nanos], read back in UTC</li>
 *   <li>{@link #EXT_KEY} - Key as [namespace, flat path]</li>
 * </ul>
 *
 * <p>The caching adapter uses this codec for cached entity payloads as well.</p>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public final class MsgpackCodec implements ValueCodec {

    public static final byte EXT_MODEL = 0;
    public static final byte EXT_DATETIME = 1;
    public static final byte EXT_KEY = 2;

    @Override
    public Object encode(Object value) {
        return pack(value);
    }

    @Override
    public Object decode(Object value) {
        if (!(value instanceof byte[] bytes)) {
            throw new IllegalArgumentException(
                "Value of type " + value.getClass().getSimpleName() + " is not msgpack data.");
        }
        return unpack(bytes);
    }

    /**
     * Serializes a value.
     *
     * @param value the value (nullable)
     * @return msgpack bytes
     * @throws IllegalArgumentException if the value has an unsupported type
     */
    public static byte[] pack(Object value) {
        try (MessageBufferPacker packer = MessagePack.newDefaultBufferPacker()) {
            write(packer, value);
            return packer.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Deserializes a value.
     *
     * @param data msgpack bytes
     * @return the value
     * @throws IllegalArgumentException on malformed data or an unknown extension code
     */
    public static Object unpack(byte[] data) {
        try (MessageUnpacker unpacker = MessagePack.newDefaultUnpacker(data)) {
            return read(unpacker);
        } catch (IOException | MessagePackException e) {
            throw new IllegalArgumentException("Invalid msgpack data.", e);
        }
    }

    private static void write(MessagePacker packer, Object value) throws IOException {
        if (value == null) {
            packer.packNil();
        } else if (value instanceof Boolean b) {
            packer.packBoolean(b);
        } else if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            packer.packLong(((Number) value).longValue());
        } else if (value instanceof Double || value instanceof Float) {
            packer.packDouble(((Number) value).doubleValue());
        } else if (value instanceof String s) {
            packer.packString(s);
        } else if (value instanceof byte[] bytes) {
            packer.packBinaryHeader(bytes.length);
            packer.writePayload(bytes);
        } else if (value instanceof ZonedDateTime dt) {
            Instant instant = dt.toInstant();
            writeExtension(packer, EXT_DATETIME, List.of(instant.getEpochSecond(), (long) instant.getNano()));
        } else if (value instanceof Key key) {
            writeExtension(packer, EXT_KEY, keyToList(key));
        } else if (value instanceof Model entity) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("kind", entity.schema().modelName());
            payload.put("key", entity.getKey());
            payload.put("data", entity.toEntityData());
            writeExtension(packer, EXT_MODEL, payload);
        } else if (value instanceof Map<?, ?> map) {
            packer.packMapHeader(map.size());
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                write(packer, entry.getKey());
                write(packer, entry.getValue());
            }
        } else if (value instanceof Collection<?> collection) {
            packer.packArrayHeader(collection.size());
            for (Object element : collection) {
                write(packer, element);
            }
        } else {
            throw new IllegalArgumentException(
                "Value of type " + value.getClass().getSimpleName() + " cannot be serialized.");
        }
    }

    private static void writeExtension(MessagePacker packer, byte code, Object payload) throws IOException {
        byte[] bytes = pack(payload);
        packer.packExtensionTypeHeader(code, bytes.length);
        packer.writePayload(bytes);
    }

    private static Object read(MessageUnpacker unpacker) throws IOException {
        switch (unpacker.getNextFormat().getValueType()) {
            case NIL:
                unpacker.unpackNil();
                return null;
            case BOOLEAN:
                return unpacker.unpackBoolean();
            case INTEGER:
                return unpacker.unpackLong();
            case FLOAT:
                return unpacker.unpackDouble();
            case STRING:
                return unpacker.unpackString();
            case BINARY:
                return unpacker.readPayload(unpacker.unpackBinaryHeader());
            case ARRAY: {
                int size = unpacker.unpackArrayHeader();
                List<Object> list = new ArrayList<>(size);
                for (int i = 0; i < size; i++) {
                    list.add(read(unpacker));
                }
                return list;
            }
            case MAP: {
                int size = unpacker.unpackMapHeader();
                Map<Object, Object> map = new LinkedHashMap<>();
                for (int i = 0; i < size; i++) {
                    Object k = read(unpacker);
                    map.put(k, read(unpacker));
                }
                return map;
            }
            case EXTENSION: {
                ExtensionTypeHeader header = unpacker.unpackExtensionTypeHeader();
                byte[] payload = unpacker.readPayload(header.getLength());
                return readExtension(header.getType(), payload);
            }
            default:
                throw new IllegalArgumentException("Unsupported msgpack value.");
        }
    }

    private static Object readExtension(byte code, byte[] payload) {
        switch (code) {
            case EXT_MODEL: {
                Map<?, ?> value = asMap(unpack(payload));
                Map<String, Object> data = new LinkedHashMap<>();
                for (Map.Entry<?, ?> field : asMap(value.get("data")).entrySet()) {
                    data.put((String) field.getKey(), field.getValue());
                }
                return ModelRegistry.lookup((String) value.get("kind")).load((Key) value.get("key"), data);
            }
            case EXT_DATETIME: {
                List<?> value = asList(unpack(payload));
                Instant instant = Instant.ofEpochSecond((Long) value.get(0), (Long) value.get(1));
                return instant.atZone(ZoneOffset.UTC);
            }
            case EXT_KEY: {
                List<?> value = asList(unpack(payload));
                return Key.fromPath((String) value.get(0), asList(value.get(1)));
            }
            default:
                throw new IllegalArgumentException("Invalid extension code " + code + ".");
        }
    }

    private static Map<?, ?> asMap(Object value) {
        if (value instanceof Map<?, ?> map) {
            return map;
        }
        throw new IllegalArgumentException("Malformed msgpack extension payload: expected a map.");
    }

    private static List<?> asList(Object value) {
        if (value instanceof List<?> list) {
            return list;
        }
        throw new IllegalArgumentException("Malformed msgpack extension payload: expected an array.");
    }

    private static List<Object> keyToList(Key key) {
        List<Object> value = new ArrayList<>(2);
        value.add(key.getNamespace());
        value.add(key.path());
        return value;
    }
}
