package lodestore.commands;

import lodestore.db.LodestoreDatabase;
import lodestore.protocol.RespType;
import lodestore.protocol.RespValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Resolves a request array to a command and runs it against the database.
 * <p>
 * Dispatch never throws for bad requests. A request that is not a non-empty array of bulk strings,
 * or that names an unknown command, gets an error reply and nothing runs.
 */
public class CommandDispatcher {
    private final CommandRegistry registry;
    private final LodestoreDatabase db;

    public CommandDispatcher(CommandRegistry registry, LodestoreDatabase db) {
        this.registry = registry;
        this.db = db;
    }

    public RespValue dispatch(RespValue request) {
        List<byte[]> args = arguments(request);
        if (args == null) {
            return invalidRequest();
        }
        CommandContainer container = registry.get(commandName(args));
        if (container == null) {
            return unknownCommand(args);
        }
        return container.execute(db, args);
    }

    public CommandRegistry getRegistry() {
        return registry;
    }

    public LodestoreDatabase getDatabase() {
        return db;
    }

    /**
     * Flattens a request into its bulk string payloads, command name first.
     *
     * @return the payloads, or null if the request is not a non-null, non-empty array of non-null bulk strings
     */
    public static List<byte[]> arguments(RespValue request) {
        if (request == null || request.getType() != RespType.ARRAY) return null;
        RespValue.Array array = (RespValue.Array) request;
        if (array.isNull() || array.size() == 0) return null;

        List<byte[]> args = new ArrayList<>(array.size());
        for (RespValue element : array.getElements()) {
            if (element.getType() != RespType.BULK_STRING) return null;
            RespValue.BulkString bulk = (RespValue.BulkString) element;
            if (bulk.isNull()) return null;
            args.add(bulk.getBytes());
        }
        return Collections.unmodifiableList(args);
    }

    public static String commandName(List<byte[]> args) {
        return CommandSupport.name(args).toUpperCase(Locale.ROOT);
    }

    public static RespValue invalidRequest() {
        return RespValue.error("ERR Protocol error: expected a non-empty array of bulk strings");
    }

    public static RespValue unknownCommand(List<byte[]> args) {
        return RespValue.error("ERR unknown command '" + CommandSupport.printable(CommandSupport.name(args)) + "'");
    }
}
