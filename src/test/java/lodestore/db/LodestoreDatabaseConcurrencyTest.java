package lodestore.db;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.ArrayList;
import java.util.List;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class LodestoreDatabaseConcurrencyTest {

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    public void testConcurrentHashWritersLoseNothing() throws Exception {
        LodestoreDatabase db = new LodestoreDatabase();
        int threadCount = 8;
        int perThread = 500;
        ExecutorService es = Executors.newFixedThreadPool(threadCount);
        CountDownLatch latch = new CountDownLatch(1);

        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threadCount; t++) {
            final int id = t;
            futures.add(es.submit(() -> {
                latch.await();
                for (int i = 0; i < perThread; i++) {
                    db.setHashField("h", "f" + id + "_" + i, bytes("v" + i));
                    db.setString("k" + id + "_" + i, bytes("v" + i));
                }
                return null;
            }));
        }

        latch.countDown(); // Go!
        for (Future<?> f : futures) f.get(10, TimeUnit.SECONDS);
        es.shutdown();

        assertEquals(threadCount * perThread, db.getAllHashFields("h").size());
        assertEquals(threadCount * perThread, db.stringCount());
    }

    @Test
    public void testReadersSeeConsistentSnapshotsWhileWriting() throws Exception {
        LodestoreDatabase db = new LodestoreDatabase();
        db.setHashField("h", "seed", bytes("0"));

        Thread writer = new Thread(() -> {
            for (int i = 0; i < 2000; i++) {
                db.setHashField("h", "f" + i, bytes(String.valueOf(i)));
            }
        });

        List<Throwable> failures = new ArrayList<>();
        Thread reader = new Thread(() -> {
            try {
                for (int i = 0; i < 2000; i++) {
                    // Iterating a snapshot must never throw ConcurrentModificationException
                    Map<String, byte[]> snapshot = db.getAllHashFields("h");
                    int n = 0;
                    for (Map.Entry<String, byte[]> e : snapshot.entrySet()) {
                        assertNotNull(e.getValue());
                        n++;
                    }
                    assertEquals(snapshot.size(), n);
                }
            } catch (Throwable t) {
                synchronized (failures) {
                    failures.add(t);
                }
            }
        });

        writer.start();
        reader.start();
        writer.join();
        reader.join();

        assertTrue(failures.isEmpty(), () -> "reader failed: " + failures);
        assertEquals(2001, db.getAllHashFields("h").size());
    }
}
