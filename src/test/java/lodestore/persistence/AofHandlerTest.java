package lodestore.persistence;

import lodestore.protocol.ProtocolException;
import lodestore.protocol.Resp;
import lodestore.protocol.RespValue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.EOFException;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AofHandlerTest {

    @TempDir
    File tempDir;

    private AofHandler handler;

    @AfterEach
    public void teardown() throws IOException {
        if (handler != null) {
            handler.close();
        }
    }

    private static void write(File file, String content) throws IOException {
        try (FileOutputStream out = new FileOutputStream(file)) {
            out.write(content.getBytes(StandardCharsets.UTF_8));
        }
    }

    @Test
    public void testLogThenReplayInOrder() throws IOException {
        File file = new File(tempDir, "append.aof");
        handler = new AofHandler(file);
        handler.log(RespValue.command("SET", "k", "v1"));
        handler.log(RespValue.command("HSET", "h", "f", "v"));
        handler.log(RespValue.command("SET", "k", "v2"));

        List<RespValue> replayed = new ArrayList<>();
        assertEquals(3, handler.replay(replayed::add));

        assertEquals(RespValue.command("SET", "k", "v1"), replayed.get(0));
        assertEquals(RespValue.command("HSET", "h", "f", "v"), replayed.get(1));
        assertEquals(RespValue.command("SET", "k", "v2"), replayed.get(2));
    }

    @Test
    public void testFileHoldsRequestsExactlyAsEncoded() throws IOException {
        File file = new File(tempDir, "append.aof");
        handler = new AofHandler(file);
        RespValue request = RespValue.command("SET", "k", "v");
        handler.log(request);
        handler.flush();

        assertArrayEquals(Resp.encode(request), Files.readAllBytes(file.toPath()));
    }

    @Test
    public void testAlwaysPolicyWritesThrough() throws IOException {
        File file = new File(tempDir, "always.aof");
        handler = new AofHandler(file, FsyncPolicy.ALWAYS, 60_000);
        handler.log(RespValue.command("SET", "a", "1"));

        // No explicit flush: the record must already be in the file
        assertEquals("*3\r\n$3\r\nSET\r\n$1\r\na\r\n$1\r\n1\r\n",
                new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8));
    }

    @Test
    public void testBackgroundFlush() throws Exception {
        File file = new File(tempDir, "bg.aof");
        handler = new AofHandler(file, FsyncPolicy.NO, 20);
        handler.log(RespValue.command("SET", "a", "1"));

        long deadline = System.currentTimeMillis() + 5000;
        while (file.length() == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(file.length() > 0, "background flush never ran");
    }

    @Test
    public void testReopenAppends() throws IOException {
        File file = new File(tempDir, "append.aof");
        AofHandler first = new AofHandler(file);
        first.log(RespValue.command("SET", "a", "1"));
        first.close();

        handler = new AofHandler(file);
        handler.log(RespValue.command("SET", "b", "2"));

        List<RespValue> replayed = new ArrayList<>();
        assertEquals(2, handler.replay(replayed::add));
        assertEquals(RespValue.command("SET", "a", "1"), replayed.get(0));
        assertEquals(RespValue.command("SET", "b", "2"), replayed.get(1));
    }

    @Test
    public void testEmptyFileReplaysNothing() throws IOException {
        handler = new AofHandler(new File(tempDir, "empty.aof"));
        List<RespValue> replayed = new ArrayList<>();
        assertEquals(0, handler.replay(replayed::add));
        assertTrue(replayed.isEmpty());
    }

    @Test
    public void testMissingFileReplaysNothing() throws IOException {
        File file = new File(tempDir, "gone.aof");
        handler = new AofHandler(file);
        handler.close();
        assertTrue(file.delete());

        assertEquals(0, handler.replay(v -> fail("nothing to replay")));
    }

    @Test
    public void testTruncatedTailIsFatalAfterPrefix() throws IOException {
        File file = new File(tempDir, "truncated.aof");
        write(file, "*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$1\r\nv\r\n*3\r\n$3\r\nSET\r\n$1\r\nj");
        handler = new AofHandler(file);

        List<RespValue> replayed = new ArrayList<>();
        assertThrows(EOFException.class, () -> handler.replay(replayed::add));
        assertEquals(1, replayed.size());
        assertEquals(RespValue.command("SET", "k", "v"), replayed.get(0));
    }

    @Test
    public void testCorruptRecordIsFatal() throws IOException {
        File file = new File(tempDir, "corrupt.aof");
        write(file, "*1\r\n$4\r\nPING\r\n+OK\r\n");
        handler = new AofHandler(file);

        List<RespValue> replayed = new ArrayList<>();
        assertThrows(ProtocolException.class, () -> handler.replay(replayed::add));
        assertEquals(1, replayed.size());
    }

    @Test
    public void testLogAfterCloseFails() throws IOException {
        handler = new AofHandler(new File(tempDir, "closed.aof"));
        handler.close();

        IOException e = assertThrows(IOException.class, () -> handler.log(RespValue.command("SET", "k", "v")));
        assertTrue(e.getMessage().startsWith("AOF is closed"));
        // Second close is a no-op
        handler.close();
    }

    @Test
    public void testConcurrentAppendsNeverInterleave() throws Exception {
        File file = new File(tempDir, "concurrent.aof");
        handler = new AofHandler(file, FsyncPolicy.NO, 5);
        int threads = 8;
        int perThread = 200;

        List<Thread> workers = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            final int id = t;
            Thread w = new Thread(() -> {
                for (int i = 0; i < perThread; i++) {
                    try {
                        handler.log(RespValue.command("SET", "k" + id, "value-" + i));
                    } catch (IOException e) {
                        throw new RuntimeException(e);
                    }
                }
            });
            workers.add(w);
            w.start();
        }
        for (Thread w : workers) w.join();

        List<RespValue> replayed = new ArrayList<>();
        assertEquals(threads * perThread, handler.replay(replayed::add));
        for (RespValue value : replayed) {
            assertEquals(3, ((RespValue.Array) value).size());
        }
    }
}
