package lodestore.protocol;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * RESP wire constants and the encoder from {@link RespValue} to bytes.
 */
public final class Resp {
    public static final char ARRAY = '*';
    public static final char BULK_STRING = '$';
    public static final char SIMPLE_STRING = '+';
    public static final char ERROR = '-';
    public static final char INTEGER = ':';

    static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] NULL_BULK = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] NULL_ARRAY = "*-1\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] EMPTY = new byte[0];

    private Resp() { }

    // --- SERIALIZATION ---

    /**
     * Encodes a value to its wire bytes. Never throws: a null value encodes to zero bytes.
     * CR and LF inside simple string and error text are written as spaces.
     */
    public static byte[] encode(RespValue value) {
        if (value == null) return EMPTY;
        ByteArrayOutputStream bos = new ByteArrayOutputStream(64);
        write(bos, value);
        return bos.toByteArray();
    }

    public static void encode(RespValue value, OutputStream out) throws IOException {
        out.write(encode(value));
    }

    private static void write(ByteArrayOutputStream bos, RespValue value) {
        switch (value.getType()) {
            case SIMPLE_STRING:
                line(bos, value.getType().getMarker(), ((RespValue.SimpleString) value).getText());
                break;
            case ERROR:
                line(bos, value.getType().getMarker(), ((RespValue.SimpleError) value).getMessage());
                break;
            case INTEGER:
                line(bos, value.getType().getMarker(), Long.toString(((RespValue.IntegerValue) value).getValue()));
                break;
            case BULK_STRING:
                writeBulk(bos, ((RespValue.BulkString) value).rawBytes());
                break;
            case ARRAY:
                RespValue.Array array = (RespValue.Array) value;
                if (array.isNull()) {
                    bos.write(NULL_ARRAY, 0, NULL_ARRAY.length);
                    break;
                }
                header(bos, ARRAY, array.size());
                for (RespValue element : array.getElements()) {
                    write(bos, element);
                }
                break;
            default:
                // unknown variant: nothing on the wire
                break;
        }
    }

    private static void writeBulk(ByteArrayOutputStream bos, byte[] b) {
        if (b == null) {
            bos.write(NULL_BULK, 0, NULL_BULK.length);
            return;
        }
        header(bos, BULK_STRING, b.length);
        bos.write(b, 0, b.length);
        bos.write(CRLF, 0, 2);
    }

    private static void header(ByteArrayOutputStream bos, char marker, long length) {
        line(bos, marker, Long.toString(length));
    }

    // A line value cannot carry CR or LF; they are written as spaces so one value stays one reply
    private static void line(ByteArrayOutputStream bos, char marker, String text) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == '\r' || bytes[i] == '\n') bytes[i] = ' ';
        }
        bos.write(marker);
        bos.write(bytes, 0, bytes.length);
        bos.write(CRLF, 0, 2);
    }
}
