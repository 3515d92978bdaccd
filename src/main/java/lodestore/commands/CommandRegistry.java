package lodestore.commands;

import lodestore.commands.connection.PingCommand;
import lodestore.commands.hash.HGetAllCommand;
import lodestore.commands.hash.HGetCommand;
import lodestore.commands.hash.HSetCommand;
import lodestore.commands.string.GetCommand;
import lodestore.commands.string.SetCommand;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Command table keyed by upper-case command name. Populated before the server starts
 * and read-only afterwards.
 */
public class CommandRegistry {
    private final Map<String, CommandContainer> commands = new HashMap<>();

    public static CommandRegistry createDefault() {
        CommandRegistry registry = new CommandRegistry();

        // Connection
        registry.register("PING", new PingCommand(), CommandMetadata.of(CommandMetadata.FLAG_FAST));

        // String
        registry.register("SET", new SetCommand(), CommandMetadata.of(CommandMetadata.FLAG_WRITE));
        registry.register("GET", new GetCommand(), CommandMetadata.of(CommandMetadata.FLAG_READONLY, CommandMetadata.FLAG_FAST));

        // Hash
        registry.register("HSET", new HSetCommand(), CommandMetadata.of(CommandMetadata.FLAG_WRITE, CommandMetadata.FLAG_FAST));
        registry.register("HGET", new HGetCommand(), CommandMetadata.of(CommandMetadata.FLAG_READONLY, CommandMetadata.FLAG_FAST));
        registry.register("HGETALL", new HGetAllCommand(), CommandMetadata.of(CommandMetadata.FLAG_READONLY));

        return registry;
    }

    public void register(String name, Command command, CommandMetadata metadata) {
        String canonical = name.toUpperCase(Locale.ROOT);
        commands.put(canonical, new CommandContainer(canonical, command, metadata));
    }

    /** @return the command, or null if no command has that name */
    public CommandContainer get(String name) {
        return commands.get(name.toUpperCase(Locale.ROOT));
    }

    public boolean isWriteCommand(String name) {
        CommandContainer container = get(name);
        return container != null && container.isWrite();
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(commands.keySet());
    }
}
