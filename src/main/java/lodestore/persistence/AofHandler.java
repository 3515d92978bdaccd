package lodestore.persistence;

import lodestore.protocol.Resp;
import lodestore.protocol.RespDecoder;
import lodestore.protocol.RespValue;
import lodestore.utils.Log;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Append-only file of write commands, stored exactly as clients sent them.
 * <p>
 * Appends, flushes and replay all synchronize on this handler, so two encodings never interleave
 * and a flush never sees half an append. A background task flushes the buffer (and, unless the
 * policy is {@link FsyncPolicy#NO}, fsyncs it) at a fixed interval until {@link #close()}.
 */
public class AofHandler implements Closeable {
    private final File file;
    private final FsyncPolicy fsyncPolicy;
    private final FileOutputStream fileOut;
    private final OutputStream outStream;
    private final ScheduledExecutorService flusher;
    private boolean closed = false;

    public AofHandler(File file) throws IOException {
        this(file, FsyncPolicy.EVERYSEC, 1000);
    }

    public AofHandler(File file, FsyncPolicy fsyncPolicy, long flushIntervalMillis) throws IOException {
        this.file = file;
        this.fsyncPolicy = fsyncPolicy;
        this.fileOut = new FileOutputStream(file, true);
        this.outStream = new BufferedOutputStream(fileOut);

        this.flusher = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "AOF-Flusher");
            t.setDaemon(true);
            return t;
        });
        this.flusher.scheduleAtFixedRate(this::backgroundFlush, flushIntervalMillis, flushIntervalMillis, TimeUnit.MILLISECONDS);
    }

    public File getFile() {
        return file;
    }

    public FsyncPolicy getFsyncPolicy() {
        return fsyncPolicy;
    }

    /**
     * Appends one request. With {@link FsyncPolicy#ALWAYS} the record is on disk when this returns.
     */
    public synchronized void log(RespValue request) throws IOException {
        if (closed) throw new IOException("AOF is closed: " + file);
        outStream.write(Resp.encode(request));
        if (fsyncPolicy == FsyncPolicy.ALWAYS) {
            flush();
        }
    }

    /**
     * Pushes buffered bytes to the file and, unless the policy is {@link FsyncPolicy#NO}, to disk.
     */
    public synchronized void flush() throws IOException {
        if (closed) return;
        outStream.flush();
        if (fsyncPolicy != FsyncPolicy.NO) {
            fileOut.getFD().sync();
        }
    }

    private void backgroundFlush() {
        try {
            flush();
        } catch (IOException e) {
            Log.error("AOF flush failed: " + e.getMessage());
        }
    }

    /**
     * Decodes every record from the start of the file and hands it to {@code commandExecutor}.
     * A missing or empty file replays nothing.
     *
     * @return number of records replayed
     * @throws lodestore.protocol.ProtocolException if a record is malformed
     * @throws java.io.EOFException if the last record is cut short
     */
    public synchronized long replay(Consumer<RespValue> commandExecutor) throws IOException {
        if (!closed) {
            outStream.flush();
        }
        if (!file.exists()) return 0;

        Log.info("Replaying AOF " + file + "...");
        long count = 0;
        try (InputStream in = new BufferedInputStream(new FileInputStream(file))) {
            RespDecoder decoder = new RespDecoder(in);
            RespValue request;
            while ((request = decoder.readValue()) != null) {
                commandExecutor.accept(request);
                count++;
            }
        } catch (IOException e) {
            Log.error("AOF replay stopped after " + count + " records: " + e.getMessage());
            throw e;
        }
        return count;
    }

    @Override
    public void close() throws IOException {
        flusher.shutdown();
        try {
            if (!flusher.awaitTermination(2, TimeUnit.SECONDS)) {
                flusher.shutdownNow();
            }
        } catch (InterruptedException e) {
            flusher.shutdownNow();
            Thread.currentThread().interrupt();
        }
        synchronized (this) {
            if (closed) return;
            try {
                flush();
            } finally {
                closed = true;
                outStream.close();
            }
        }
    }
}
