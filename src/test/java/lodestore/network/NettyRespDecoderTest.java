package lodestore.network;

import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.DecoderException;
import lodestore.protocol.ProtocolException;
import lodestore.protocol.RespDecoder;
import lodestore.protocol.RespValue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class NettyRespDecoderTest {

    private NettyRespDecoder decoder;
    private EmbeddedChannel channel;

    @BeforeEach
    public void setup() {
        decoder = new NettyRespDecoder();
        channel = new EmbeddedChannel(decoder);
    }

    @AfterEach
    public void teardown() {
        channel.finishAndReleaseAll();
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private void send(byte[] data, int from, int length) {
        channel.writeInbound(Unpooled.copiedBuffer(data, from, length));
    }

    private void send(String s) {
        byte[] data = bytes(s);
        send(data, 0, data.length);
    }

    @Test
    public void testLargeBulkInSmallChunksIsParsedOnce() {
        byte[] payload = new byte[4 * 1024 * 1024];
        for (int i = 0; i < payload.length; i++) {
            payload[i] = (byte) i;
        }
        ByteArrayOutputStream frame = new ByteArrayOutputStream();
        frame.writeBytes(bytes("*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$" + payload.length + "\r\n"));
        frame.writeBytes(payload);
        frame.writeBytes(bytes("\r\n"));
        byte[] request = frame.toByteArray();

        int chunk = 16 * 1024;
        for (int at = 0; at < request.length; at += chunk) {
            send(request, at, Math.min(chunk, request.length - at));
        }

        RespValue.Array decoded = channel.readInbound();
        assertNotNull(decoded);
        assertEquals(3, decoded.size());
        assertTrue(Arrays.equals(payload, ((RespValue.BulkString) decoded.get(2)).getBytes()));
        assertNull(channel.readInbound());
        assertEquals(1, decoder.framesParsed());
    }

    @Test
    public void testByteAtATimeIsParsedOnce() {
        String request = "*2\r\n$3\r\nGET\r\n$5\r\nhello\r\n";
        for (char c : request.toCharArray()) {
            send(String.valueOf(c));
        }
        assertEquals(RespValue.command("GET", "hello"), channel.readInbound());
        assertEquals(1, decoder.framesParsed());
    }

    @Test
    public void testNestedArraysAndNullsThroughScanner() {
        String request = "*3\r\n*2\r\n$1\r\na\r\n*0\r\n$-1\r\n*-1\r\n";
        for (char c : request.toCharArray()) {
            send(String.valueOf(c));
        }
        RespValue expected = RespValue.array(
                RespValue.array(RespValue.bulkString("a"), RespValue.array(Arrays.<RespValue>asList())),
                RespValue.nullBulkString(),
                RespValue.nullArray());
        assertEquals(expected, channel.readInbound());
        assertEquals(1, decoder.framesParsed());
    }

    @Test
    public void testPipelinedFramesInOneRead() {
        send("*1\r\n$4\r\nPING\r\n*2\r\n$3\r\nGET\r\n$1\r\nk\r\n");
        assertEquals(RespValue.command("PING"), channel.readInbound());
        assertEquals(RespValue.command("GET", "k"), channel.readInbound());
        assertNull(channel.readInbound());
    }

    @Test
    public void testNestingAtLimitIsDecoded() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < RespDecoder.MAX_NESTING_DEPTH; i++) sb.append("*1\r\n");
        sb.append("$1\r\na\r\n");
        send(sb.toString());
        assertNotNull(channel.readInbound());
    }

    @Test
    public void testDeepNestingFailsWithProtocolError() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 200_000; i++) sb.append("*1\r\n");
        DecoderException e = assertThrows(DecoderException.class, () -> send(sb.toString()));
        assertTrue(e.getCause() instanceof ProtocolException);

        // Nothing after the error is decoded
        send("*1\r\n$4\r\nPING\r\n");
        assertNull(channel.readInbound());
    }
}
