package lodestore.commands;

import lodestore.db.LodestoreDatabase;
import lodestore.protocol.RespValue;
import java.util.List;

public interface Command {
    // Executes the command logic and returns the reply.
    // args.get(0) is the command name as the client sent it; the rest are positional arguments.
    // Bad input is answered with an error reply, never thrown.
    RespValue execute(LodestoreDatabase db, List<byte[]> args);
}
