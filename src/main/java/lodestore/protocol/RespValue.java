package lodestore.protocol;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single RESP value. Shared by the codec, the command handlers and the append-only file.
 * <p>
 * The hierarchy is closed: the constructor is private, so the nested classes below are the only
 * variants. Each variant carries only its own payload and is immutable.
 */
public abstract class RespValue {

    private static final SimpleString OK = new SimpleString("OK");
    private static final BulkString NULL_BULK = new BulkString(null);
    private static final Array NULL_ARRAY = new Array(null);

    private RespValue() { }

    public abstract RespType getType();

    // --- FACTORIES ---

    public static SimpleString simpleString(String text) {
        return new SimpleString(text);
    }

    public static SimpleString ok() {
        return OK;
    }

    public static SimpleError error(String message) {
        return new SimpleError(message);
    }

    public static IntegerValue integer(long value) {
        return new IntegerValue(value);
    }

    public static BulkString bulkString(byte[] bytes) {
        if (bytes == null) return NULL_BULK;
        return new BulkString(bytes.clone());
    }

    public static BulkString bulkString(String s) {
        if (s == null) return NULL_BULK;
        return new BulkString(s.getBytes(StandardCharsets.UTF_8));
    }

    public static BulkString nullBulkString() {
        return NULL_BULK;
    }

    public static Array array(List<? extends RespValue> elements) {
        if (elements == null) return NULL_ARRAY;
        List<RespValue> copy = new ArrayList<>(elements.size());
        for (RespValue element : elements) {
            copy.add(Objects.requireNonNull(element, "array element"));
        }
        return new Array(Collections.unmodifiableList(copy));
    }

    public static Array array(RespValue... elements) {
        return array(Arrays.asList(elements));
    }

    public static Array nullArray() {
        return NULL_ARRAY;
    }

    /**
     * Builds a command array of bulk strings, e.g. {@code command("SET", "k", "v")}.
     */
    public static Array command(String... parts) {
        List<RespValue> elements = new ArrayList<>(parts.length);
        for (String part : parts) {
            elements.add(bulkString(part));
        }
        return new Array(Collections.unmodifiableList(elements));
    }

    // --- VARIANTS ---

    public static final class SimpleString extends RespValue {
        private final String text;

        private SimpleString(String text) {
            this.text = Objects.requireNonNull(text, "text");
        }

        public String getText() {
            return text;
        }

        @Override
        public RespType getType() {
            return RespType.SIMPLE_STRING;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof SimpleString && ((SimpleString) o).text.equals(text);
        }

        @Override
        public int hashCode() {
            return text.hashCode();
        }

        @Override
        public String toString() {
            return "+" + text;
        }
    }

    public static final class SimpleError extends RespValue {
        private final String message;

        private SimpleError(String message) {
            this.message = Objects.requireNonNull(message, "message");
        }

        public String getMessage() {
            return message;
        }

        @Override
        public RespType getType() {
            return RespType.ERROR;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof SimpleError && ((SimpleError) o).message.equals(message);
        }

        @Override
        public int hashCode() {
            return 31 * message.hashCode() + 1;
        }

        @Override
        public String toString() {
            return "-" + message;
        }
    }

    public static final class IntegerValue extends RespValue {
        private final long value;

        private IntegerValue(long value) {
            this.value = value;
        }

        public long getValue() {
            return value;
        }

        @Override
        public RespType getType() {
            return RespType.INTEGER;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof IntegerValue && ((IntegerValue) o).value == value;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(value);
        }

        @Override
        public String toString() {
            return ":" + value;
        }
    }

    public static final class BulkString extends RespValue {
        private final byte[] bytes; // null for the null bulk string

        private BulkString(byte[] bytes) {
            this.bytes = bytes;
        }

        public boolean isNull() {
            return bytes == null;
        }

        /** Returns a copy of the payload, or null for the null bulk string. */
        public byte[] getBytes() {
            return bytes == null ? null : bytes.clone();
        }

        public String asString() {
            return bytes == null ? null : new String(bytes, StandardCharsets.UTF_8);
        }

        byte[] rawBytes() {
            return bytes;
        }

        @Override
        public RespType getType() {
            return RespType.BULK_STRING;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BulkString && Arrays.equals(((BulkString) o).bytes, bytes);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(bytes);
        }

        @Override
        public String toString() {
            return bytes == null ? "(nil)" : "\"" + asString() + "\"";
        }
    }

    public static final class Array extends RespValue {
        private final List<RespValue> elements; // null for the null array

        private Array(List<RespValue> elements) {
            this.elements = elements;
        }

        public boolean isNull() {
            return elements == null;
        }

        /** Elements in wire order. Empty for the null array. */
        public List<RespValue> getElements() {
            return elements == null ? Collections.<RespValue>emptyList() : elements;
        }

        public int size() {
            return elements == null ? 0 : elements.size();
        }

        public RespValue get(int index) {
            return getElements().get(index);
        }

        @Override
        public RespType getType() {
            return RespType.ARRAY;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Array && Objects.equals(((Array) o).elements, elements);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(elements) + 7;
        }

        @Override
        public String toString() {
            return elements == null ? "(nil array)" : elements.toString();
        }
    }
}
