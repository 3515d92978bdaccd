package lodestore.commands;

import lodestore.db.LodestoreDatabase;
import lodestore.protocol.RespValue;

import java.util.List;

/**
 * A registered command: its canonical upper-case name, the implementation and its flags.
 */
public class CommandContainer {
    private final String name;
    private final Command command;
    private final CommandMetadata metadata;

    public CommandContainer(String name, Command command, CommandMetadata metadata) {
        this.name = name;
        this.command = command;
        this.metadata = metadata;
    }

    public RespValue execute(LodestoreDatabase db, List<byte[]> args) {
        return command.execute(db, args);
    }

    /** True for commands that are appended to the AOF before they run. */
    public boolean isWrite() {
        return metadata.isWrite();
    }

    public String getName() {
        return name;
    }

    public CommandMetadata getMetadata() {
        return metadata;
    }
}
