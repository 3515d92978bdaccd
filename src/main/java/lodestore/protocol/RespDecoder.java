package lodestore.protocol;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Blocking RESP decoder over an {@link InputStream}.
 * <p>
 * Reads byte by byte up to each CRLF and never reads past the end of the value it returns, so the
 * same stream can be handed to a new decoder (or to anything else) between values. Buffering is the
 * caller's job.
 * <p>
 * Request mode, the default, only accepts arrays and bulk strings, which is everything a client
 * or the append-only file may legally send. Reply mode additionally accepts simple strings, errors
 * and integers.
 */
public class RespDecoder {

    /** Same default as Redis' proto-max-bulk-len. */
    public static final long DEFAULT_MAX_BULK_LENGTH = 512L * 1024 * 1024;

    /** Arrays nested deeper than this are rejected. A top-level array is depth 1. */
    public static final int MAX_NESTING_DEPTH = 32;

    private static final int MAX_LENGTH_DIGITS = 20;
    private static final int MAX_SIMPLE_LINE = 64 * 1024;
    private static final int PAYLOAD_CHUNK = 64 * 1024;

    private final InputStream in;
    private final long maxBulkLength;
    private final boolean acceptReplies;

    public RespDecoder(InputStream in) {
        this(in, DEFAULT_MAX_BULK_LENGTH);
    }

    public RespDecoder(InputStream in, long maxBulkLength) {
        this(in, maxBulkLength, false);
    }

    private RespDecoder(InputStream in, long maxBulkLength, boolean acceptReplies) {
        this.in = in;
        this.maxBulkLength = maxBulkLength;
        this.acceptReplies = acceptReplies;
    }

    public static RespDecoder forReplies(InputStream in) {
        return new RespDecoder(in, DEFAULT_MAX_BULK_LENGTH, true);
    }

    /**
     * Reads the next complete value.
     *
     * @return the value, or null if the stream ended cleanly before a value started
     * @throws ProtocolException on malformed framing
     * @throws EOFException if the stream ended in the middle of a value
     */
    public RespValue readValue() throws IOException {
        int marker = in.read();
        if (marker == -1) return null;
        return readValue(marker, 0);
    }

    private RespValue readValue(int marker, int depth) throws IOException {
        switch (marker) {
            case Resp.ARRAY:
                return readArray(depth + 1);
            case Resp.BULK_STRING:
                return readBulkString();
            case Resp.SIMPLE_STRING:
                if (acceptReplies) return RespValue.simpleString(readText());
                break;
            case Resp.ERROR:
                if (acceptReplies) return RespValue.error(readText());
                break;
            case Resp.INTEGER:
                if (acceptReplies) return RespValue.integer(readLong("integer"));
                break;
            default:
                break;
        }
        throw new ProtocolException("Protocol error: unexpected type marker '" + printable(marker) + "'");
    }

    private RespValue readArray(int depth) throws IOException {
        if (depth > MAX_NESTING_DEPTH) {
            throw new ProtocolException("Protocol error: arrays nested deeper than " + MAX_NESTING_DEPTH);
        }
        long count = readLong("multibulk length");
        if (count < 0) return RespValue.nullArray();
        if (count > maxBulkLength || count > Integer.MAX_VALUE) {
            throw new ProtocolException("Protocol error: invalid multibulk length " + count);
        }

        List<RespValue> elements = new ArrayList<>((int) Math.min(count, 1024));
        for (long i = 0; i < count; i++) {
            int marker = in.read();
            if (marker == -1) throw new EOFException("Unexpected end of stream in Array");
            elements.add(readValue(marker, depth));
        }
        return RespValue.array(elements);
    }

    private RespValue readBulkString() throws IOException {
        long len = readLong("bulk length");
        if (len < 0) return RespValue.nullBulkString();
        if (len > maxBulkLength || len > Integer.MAX_VALUE - 2) {
            throw new ProtocolException("Protocol error: invalid bulk length " + len);
        }

        byte[] bytes = readPayload((int) len);
        int cr = in.read();
        int lf = in.read();
        if (cr == -1 || lf == -1) throw new EOFException("Unexpected end of stream in BulkString");
        if (cr != '\r' || lf != '\n') throw new ProtocolException("Protocol error: expected CRLF after BulkString");

        return RespValue.bulkString(bytes);
    }

    // Grows with the bytes actually received, so a large declared length costs nothing until the data arrives
    private byte[] readPayload(int len) throws IOException {
        if (len <= PAYLOAD_CHUNK) {
            byte[] bytes = new byte[len];
            readFully(bytes, len);
            return bytes;
        }
        ByteArrayOutputStream payload = new ByteArrayOutputStream(PAYLOAD_CHUNK);
        byte[] chunk = new byte[PAYLOAD_CHUNK];
        int remaining = len;
        while (remaining > 0) {
            int n = Math.min(remaining, PAYLOAD_CHUNK);
            readFully(chunk, n);
            payload.write(chunk, 0, n);
            remaining -= n;
        }
        return payload.toByteArray();
    }

    private void readFully(byte[] bytes, int len) throws IOException {
        int read = 0;
        while (read < len) {
            int r = in.read(bytes, read, len - read);
            if (r == -1) throw new EOFException("Unexpected end of stream in BulkString");
            read += r;
        }
    }

    private long readLong(String what) throws IOException {
        String line = readLine(MAX_LENGTH_DIGITS, what);
        if (line.isEmpty()) throw new ProtocolException("Protocol error: empty " + what);
        try {
            return Long.parseLong(line);
        } catch (NumberFormatException e) {
            throw new ProtocolException("Protocol error: invalid " + what + " '" + line + "'", e);
        }
    }

    private String readText() throws IOException {
        return readLine(MAX_SIMPLE_LINE, "line");
    }

    // Line content up to the first CR, which must be followed by LF.
    private String readLine(int maxLength, String what) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(16);
        int b;
        while ((b = in.read()) != -1) {
            if (b == '\r') {
                int lf = in.read();
                if (lf == -1) break;
                if (lf != '\n') throw new ProtocolException("Protocol error: expected LF after CR");
                return new String(buffer.toByteArray(), StandardCharsets.UTF_8);
            }
            if (buffer.size() >= maxLength) {
                throw new ProtocolException("Protocol error: " + what + " too long");
            }
            buffer.write(b);
        }
        throw new EOFException("Unexpected end of stream in " + what);
    }

    private static String printable(int b) {
        if (b >= 0x20 && b < 0x7f) return String.valueOf((char) b);
        return String.format("\\x%02x", b);
    }
}
