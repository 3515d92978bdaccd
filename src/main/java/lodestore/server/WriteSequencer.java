package lodestore.server;

import lodestore.commands.CommandDispatcher;
import lodestore.commands.CommandRegistry;
import lodestore.persistence.AofHandler;
import lodestore.protocol.RespValue;
import lodestore.utils.Log;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Coordinates all write commands so that AOF order and memory order are identical.
 * <p>
 * Each write appends to the AOF and then applies to memory, both under one sequencer lock. A write
 * is therefore never visible before it is logged, and no two writes can be logged in one order and
 * applied in the other, so replaying the AOF reproduces the live state exactly. Reads never take
 * this lock; they only wait on the map lock for the duration of the in-memory update.
 */
public class WriteSequencer {
    private final CommandDispatcher dispatcher;
    private final AofHandler aofHandler; // null when appendonly is off
    private final ReentrantLock writeLock = new ReentrantLock();

    public WriteSequencer(CommandDispatcher dispatcher, AofHandler aofHandler) {
        this.dispatcher = dispatcher;
        this.aofHandler = aofHandler;
    }

    /**
     * Logs the request if it names a write command.
     *
     * @return true if the request was appended
     */
    public boolean logIfWriteCommand(RespValue request) throws IOException {
        if (aofHandler == null) return false;
        List<byte[]> args = CommandDispatcher.arguments(request);
        if (args == null) return false;
        CommandRegistry registry = dispatcher.getRegistry();
        if (!registry.isWriteCommand(CommandDispatcher.commandName(args))) return false;

        aofHandler.log(request);
        return true;
    }

    /**
     * Executes a request. A write that cannot be logged is not applied.
     */
    public RespValue executeWrite(RespValue request) {
        writeLock.lock();
        try {
            try {
                logIfWriteCommand(request);
            } catch (IOException e) {
                Log.error("AOF write failed, command not applied: " + e.getMessage());
                return RespValue.error("ERR AOF write failed: " + e.getMessage());
            }
            return dispatcher.dispatch(request);
        } finally {
            writeLock.unlock();
        }
    }

    public AofHandler getAofHandler() {
        return aofHandler;
    }
}
