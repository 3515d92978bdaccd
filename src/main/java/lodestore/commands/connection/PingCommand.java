package lodestore.commands.connection;

import lodestore.commands.Command;
import lodestore.commands.CommandSupport;
import lodestore.db.LodestoreDatabase;
import lodestore.protocol.RespValue;
import java.util.List;

public class PingCommand implements Command {
    private static final RespValue PONG = RespValue.simpleString("PONG");

    @Override
    public RespValue execute(LodestoreDatabase db, List<byte[]> args) {
        if (args.size() > 2) {
            return CommandSupport.wrongNumberOfArguments(args);
        }
        if (args.size() == 2) {
            return RespValue.bulkString(args.get(1));
        }
        return PONG;
    }
}
