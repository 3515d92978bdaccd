package lodestore.network;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufInputStream;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import lodestore.protocol.ProtocolException;
import lodestore.protocol.RespDecoder;
import lodestore.protocol.RespValue;

import java.io.EOFException;
import java.util.List;

/**
 * Netty decoder for RESP requests.
 * <p>
 * A small state machine walks the frame headers as bytes arrive, remembering how far it got, and
 * skips over bulk payloads by their declared length. Only once a whole frame is buffered is it
 * handed to the blocking {@link RespDecoder}, so live traffic and AOF replay share one parser and
 * each byte is looked at a bounded number of times however the frame is fragmented.
 * <p>
 * Anything the scanner cannot make sense of is left to {@link RespDecoder} to reject. After a
 * protocol error the stream cannot be resynchronised; all further input is discarded and the
 * error is passed down the pipeline, where the connection is closed.
 */
public class NettyRespDecoder extends ByteToMessageDecoder {

    private enum State {
        READ_HEADER,  // at a type marker, waiting for its length line
        SKIP_BULK,    // length known, waiting for payload + CRLF
        PARSE         // frame complete, or the scanner gave up; run the full parser
    }

    // A length line is a marker, at most 20 digits and CRLF
    private static final int MAX_HEADER_LENGTH = 23;

    private final long maxBulkLength;
    private boolean failed = false;

    private State state = State.READ_HEADER;
    private int scanned = 0; // bytes of the current frame already walked
    private long bulkLength = 0;
    // Elements still expected by each open array, innermost last
    private final long[] remaining = new long[RespDecoder.MAX_NESTING_DEPTH];
    private int depth = 0;

    private long framesParsed = 0;

    public NettyRespDecoder() {
        this(RespDecoder.DEFAULT_MAX_BULK_LENGTH);
    }

    public NettyRespDecoder(long maxBulkLength) {
        this.maxBulkLength = maxBulkLength;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        if (failed) {
            in.skipBytes(in.readableBytes());
            return;
        }

        while (in.isReadable()) {
            if (state != State.PARSE && !scan(in)) {
                return;
            }

            int start = in.readerIndex();
            RespValue value;
            try {
                framesParsed++;
                value = new RespDecoder(new ByteBufInputStream(in), maxBulkLength).readValue();
            } catch (EOFException e) {
                // Only reachable when the scanner gave up early; wait for more bytes
                in.readerIndex(start);
                return;
            } catch (ProtocolException e) {
                failed = true;
                in.skipBytes(in.readableBytes());
                throw e;
            }
            reset();
            if (value == null) return;
            out.add(value);
        }
    }

    /**
     * Advances over the buffered part of the current frame.
     *
     * @return true when the frame is complete or should be handed to the parser as is
     */
    private boolean scan(ByteBuf in) {
        while (true) {
            int pos = in.readerIndex() + scanned;

            if (state == State.SKIP_BULK) {
                if (in.writerIndex() - pos < bulkLength + 2) return false;
                scanned += (int) bulkLength + 2;
                if (elementDone()) return true;
                continue;
            }

            if (pos >= in.writerIndex()) return false;
            int searchEnd = Math.min(in.writerIndex(), pos + MAX_HEADER_LENGTH);
            int lf = in.indexOf(pos, searchEnd, (byte) '\n');
            if (lf < 0) {
                if (searchEnd - pos >= MAX_HEADER_LENGTH) return giveUp();
                return false;
            }
            if (lf - pos < 3 || in.getByte(lf - 1) != '\r') return giveUp();

            long length = parseLength(in, pos + 1, lf - 1);
            if (length == Long.MIN_VALUE || length > maxBulkLength || length > Integer.MAX_VALUE - 2) return giveUp();
            scanned = lf + 1 - in.readerIndex();

            byte marker = in.getByte(pos);
            if (marker == '$') {
                if (length < 0) {
                    if (elementDone()) return true;
                    continue;
                }
                bulkLength = length;
                state = State.SKIP_BULK;
            } else if (marker == '*') {
                if (length <= 0) {
                    if (elementDone()) return true;
                    continue;
                }
                if (depth == remaining.length) return giveUp();
                remaining[depth++] = length;
            } else {
                return giveUp();
            }
        }
    }

    // One element finished; close every array it completes. True when the whole frame is done.
    private boolean elementDone() {
        state = State.READ_HEADER;
        while (depth > 0) {
            if (--remaining[depth - 1] > 0) return false;
            depth--;
        }
        state = State.PARSE;
        return true;
    }

    private boolean giveUp() {
        state = State.PARSE;
        return true;
    }

    private void reset() {
        state = State.READ_HEADER;
        scanned = 0;
        bulkLength = 0;
        depth = 0;
    }

    // Signed decimal between from (inclusive) and to (exclusive), or Long.MIN_VALUE if malformed
    private static long parseLength(ByteBuf in, int from, int to) {
        boolean negative = in.getByte(from) == '-';
        int i = negative ? from + 1 : from;
        if (i >= to) return Long.MIN_VALUE;
        long value = 0;
        for (; i < to; i++) {
            byte b = in.getByte(i);
            if (b < '0' || b > '9' || value > (Long.MAX_VALUE - 9) / 10) return Long.MIN_VALUE;
            value = value * 10 + (b - '0');
        }
        return negative ? -value : value;
    }

    /** Number of times the full parser has run on this connection. */
    long framesParsed() {
        return framesParsed;
    }
}
