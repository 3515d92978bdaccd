package lodestore;

import lodestore.commands.CommandDispatcher;
import lodestore.commands.CommandRegistry;
import lodestore.db.LodestoreDatabase;
import lodestore.network.LodestoreServer;
import lodestore.persistence.AofHandler;
import lodestore.server.RequestProcessor;
import lodestore.utils.Log;

import java.io.File;
import java.io.IOException;
import java.util.Locale;

/**
 * Process entry point: config, keyspace, AOF replay, then the network listener.
 */
public class Lodestore {
    public static final String VERSION = "0.1.0";

    private final Config config;
    private final LodestoreDatabase db = new LodestoreDatabase();
    private AofHandler aofHandler;
    private RequestProcessor processor;
    private LodestoreServer server;

    public Lodestore(Config config) {
        this.config = config;
    }

    /**
     * Opens the AOF and replays it. No client is accepted until this returns.
     */
    public RequestProcessor init() throws IOException {
        CommandRegistry registry = CommandRegistry.createDefault();
        CommandDispatcher dispatcher = new CommandDispatcher(registry, db);
        Log.info("Registered commands: " + registry.names());

        if (config.appendOnly) {
            aofHandler = new AofHandler(new File(config.appendFilename), config.fsyncPolicy(), config.flushIntervalMillis);
            Log.info("AOF enabled: " + aofHandler.getFile() + " (appendfsync " + aofHandler.getFsyncPolicy().name().toLowerCase(Locale.ROOT) + ")");
        } else {
            Log.warn("AOF disabled, data will not survive a restart");
        }

        processor = new RequestProcessor(dispatcher, aofHandler);
        processor.replayLog();
        Log.info("Keyspace loaded: " + db.stringCount() + " strings, " + db.hashCount() + " hashes");
        return processor;
    }

    public int start() throws InterruptedException {
        server = new LodestoreServer(processor, config.maxBulkLength);
        return server.start(config.port);
    }

    public void awaitTermination() throws InterruptedException {
        server.awaitTermination();
    }

    public void shutdown() {
        Log.info("Shutting down...");
        if (server != null) {
            server.stop();
        }
        if (aofHandler != null) {
            try {
                aofHandler.close();
            } catch (IOException e) {
                Log.error("Failed to close AOF: " + e.getMessage());
            }
        }
    }

    public LodestoreDatabase getDatabase() {
        return db;
    }

    public static void main(String[] args) throws Exception {
        Log.info("--- LODESTORE v" + VERSION + " ---");

        Config config;
        try {
            config = Config.load(args.length > 0 ? args[0] : Config.DEFAULT_FILE);
        } catch (IllegalArgumentException e) {
            Log.error(e.getMessage());
            System.exit(1);
            return;
        }
        Log.setDebug(config.debug);

        Lodestore lodestore = new Lodestore(config);
        try {
            lodestore.init();
        } catch (IOException e) {
            Log.error("Startup aborted, AOF could not be loaded: " + e.getMessage());
            lodestore.shutdown();
            System.exit(1);
            return;
        }

        try {
            lodestore.start();
        } catch (Exception e) {
            Log.error("Startup aborted, could not listen on port " + config.port + ": " + e.getMessage());
            lodestore.shutdown();
            System.exit(1);
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(lodestore::shutdown, "shutdown"));
        lodestore.awaitTermination();
    }
}
