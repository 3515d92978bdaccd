package lodestore.server;

import lodestore.commands.CommandDispatcher;
import lodestore.commands.CommandContainer;
import lodestore.persistence.AofHandler;
import lodestore.protocol.RespType;
import lodestore.protocol.RespValue;
import lodestore.utils.Log;

import java.io.IOException;
import java.util.List;

/**
 * What a connection calls for each decoded request, and what startup calls to rebuild the
 * keyspace from the AOF. Holds no per-connection state, so any number of connections may
 * share one instance.
 */
public class RequestProcessor {
    private final CommandDispatcher dispatcher;
    private final WriteSequencer writeSequencer;

    public RequestProcessor(CommandDispatcher dispatcher, AofHandler aofHandler) {
        this.dispatcher = dispatcher;
        this.writeSequencer = new WriteSequencer(dispatcher, aofHandler);
    }

    /**
     * Runs one client request and returns its reply. Never throws for bad requests.
     */
    public RespValue process(RespValue request) {
        List<byte[]> args = CommandDispatcher.arguments(request);
        if (args == null) {
            Log.debug("Invalid request: " + request);
            return CommandDispatcher.invalidRequest();
        }

        CommandContainer container = dispatcher.getRegistry().get(CommandDispatcher.commandName(args));
        if (container == null) {
            Log.debug("Unknown command: " + CommandDispatcher.commandName(args));
            return CommandDispatcher.unknownCommand(args);
        }

        if (container.isWrite()) {
            return writeSequencer.executeWrite(request);
        }
        return dispatcher.dispatch(request);
    }

    /**
     * Replays the AOF through the dispatcher without logging anything again. Must run before
     * any client is served.
     *
     * @return number of records replayed
     */
    public long replayLog() throws IOException {
        AofHandler aofHandler = writeSequencer.getAofHandler();
        if (aofHandler == null) return 0;

        long start = System.currentTimeMillis();
        long count = aofHandler.replay(request -> {
            RespValue reply = dispatcher.dispatch(request);
            if (reply.getType() == RespType.ERROR) {
                Log.warn("AOF record " + request + " failed on replay: " + ((RespValue.SimpleError) reply).getMessage());
            }
        });
        Log.info("AOF replayed " + count + " records in " + (System.currentTimeMillis() - start) + " ms");
        return count;
    }
}
